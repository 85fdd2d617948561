package com.crewdesk.core.persistence;

/**
 * Thrown when a checkpoint slot cannot be written.
 */
public class CheckpointException extends RuntimeException {

    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
