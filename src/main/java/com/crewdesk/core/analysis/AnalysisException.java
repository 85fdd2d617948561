package com.crewdesk.core.analysis;

/**
 * The analysis backend call failed (nonzero exit, timeout, or could not start).
 * Unparseable output is not an error; it falls back to a single sub-task.
 */
public class AnalysisException extends RuntimeException {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
