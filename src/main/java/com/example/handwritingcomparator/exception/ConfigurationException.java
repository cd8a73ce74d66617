package com.example.handwritingcomparator.exception;

/**
 * Invalid preprocessing settings, weight or threshold table, or a scoring call without any sub-scores.
 */
public class ConfigurationException extends ComparisonException {

    public ConfigurationException(String message) {
        super(message);
    }
}
