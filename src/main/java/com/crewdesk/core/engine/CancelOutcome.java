package com.crewdesk.core.engine;

public enum CancelOutcome {
    CANCELLED,
    NOT_FOUND,
    /** Only queued tasks and tasks awaiting confirmation can be cancelled. */
    NOT_CANCELLABLE
}
