package com.crewdesk.core.queue;

/**
 * Thrown when a queue mutation would break queue invariants or cannot be persisted.
 */
public class QueueStateException extends RuntimeException {

    public QueueStateException(String message) {
        super(message);
    }

    public QueueStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
