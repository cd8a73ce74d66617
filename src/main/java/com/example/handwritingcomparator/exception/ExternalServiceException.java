package com.example.handwritingcomparator.exception;

/**
 * The AI vision collaborator failed or timed out. Recoverable: the comparison completes without it.
 */
public class ExternalServiceException extends ComparisonException {

    public ExternalServiceException(String message) {
        super(message);
    }

    public ExternalServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
