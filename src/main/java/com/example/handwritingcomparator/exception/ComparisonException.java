package com.example.handwritingcomparator.exception;

/**
 * Root of the comparison engine's failure taxonomy.
 */
public abstract class ComparisonException extends RuntimeException {

    protected ComparisonException(String message) {
        super(message);
    }

    protected ComparisonException(String message, Throwable cause) {
        super(message, cause);
    }
}
