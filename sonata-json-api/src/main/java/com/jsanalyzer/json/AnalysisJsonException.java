package com.jsanalyzer.json;

/**
 * Exception thrown when a report or configuration cannot be converted to or from JSON.
 */
public class AnalysisJsonException extends RuntimeException {

    public AnalysisJsonException(String message) {
        super(message);
    }

    public AnalysisJsonException(String message, Throwable cause) {
        super(message, cause);
    }

    public AnalysisJsonException(Throwable cause) {
        super(cause);
    }
}
