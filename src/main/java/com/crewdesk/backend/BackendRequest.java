package com.crewdesk.backend;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * One execution-backend invocation.
 *
 * @param prompt       the user prompt
 * @param systemPrompt appended system instructions, may be null
 * @param model        model alias understood by the backend, may be null for the backend default
 * @param timeout      wall-clock limit; the invocation is killed when it elapses
 * @param workingDir   working directory, may be null
 * @param env          extra environment variables layered over the filtered process environment
 */
public record BackendRequest(
    String prompt,
    String systemPrompt,
    String model,
    Duration timeout,
    Path workingDir,
    Map<String, String> env
) {

    public BackendRequest {
        env = env == null ? Map.of() : Map.copyOf(env);
    }

    public static BackendRequest of(String prompt, String model, Duration timeout) {
        return new BackendRequest(prompt, null, model, timeout, null, Map.of());
    }
}
