package com.crewdesk.backend;

/**
 * Outcome of a backend invocation.
 *
 * @param exitCode  process exit code; -1 when killed on timeout
 * @param stdout    captured standard output (partial when timed out)
 * @param stderr    captured standard error
 * @param timedOut  true if the invocation was killed on its timeout
 * @param elapsedMs wall-clock time in milliseconds
 */
public record BackendResult(
    int exitCode,
    String stdout,
    String stderr,
    boolean timedOut,
    long elapsedMs
) {

    public boolean succeeded() {
        return exitCode == 0 && !timedOut;
    }

    public static BackendResult timeout(String partialStdout, String stderr, long elapsedMs) {
        return new BackendResult(-1, partialStdout, stderr, true, elapsedMs);
    }
}
