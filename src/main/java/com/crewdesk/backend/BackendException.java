package com.crewdesk.backend;

/**
 * Thrown when a backend invocation cannot be started or is interrupted.
 * A process that runs and exits nonzero is reported through {@link BackendResult} instead.
 */
public class BackendException extends RuntimeException {

    public BackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
