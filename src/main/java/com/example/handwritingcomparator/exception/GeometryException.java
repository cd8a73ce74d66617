package com.example.handwritingcomparator.exception;

/**
 * Degenerate crop or transform dimensions. The caller has to re-request with corrected coordinates.
 */
public class GeometryException extends ComparisonException {

    public GeometryException(String message) {
        super(message);
    }
}
