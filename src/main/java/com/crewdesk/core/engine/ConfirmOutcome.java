package com.crewdesk.core.engine;

public enum ConfirmOutcome {
    /** Confirmation accepted; team assembly and launch are under way. */
    DISPATCHING,
    NOT_FOUND,
    /** The task exists but is not waiting for confirmation. */
    NOT_CONFIRMING
}
