package com.example.handwritingcomparator.exception;

/**
 * Raised when an input payload cannot be decoded into an image. Fatal for the request.
 */
public class ImageDecodeException extends ComparisonException {

    public ImageDecodeException(String message) {
        super(message);
    }

    public ImageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
