package com.crewdesk.backend;

/**
 * Abstraction over whatever performs specialist work: an agent CLI subprocess
 * or a chat model. Implementations are synchronous and must honour
 * {@link BackendRequest#timeout()}; interrupting the calling thread aborts the invocation.
 */
public interface ExecutionBackend {

    /**
     * Runs one invocation to completion or timeout.
     *
     * @throws BackendException if the invocation cannot be started or is interrupted
     */
    BackendResult execute(BackendRequest request);

    /** Short name for logs and health output (e.g. "cli:claude"). */
    String name();

    /** Whether the backend looks usable right now. Used by the health check only. */
    boolean isAvailable();
}
