package com.crewdesk.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;

/**
 * Outcome of a single specialist, written to the checkpoint store on every transition.
 *
 * @param id          specialist id (sanitized role), also the result file name
 * @param skillPlugin plugin of the skill the specialist ran
 * @param skillName   skill the specialist ran
 * @param agentName   specialist role
 * @param status      running, completed or failed
 * @param result      captured output, kept even on failure
 * @param error       failure reason, null unless failed
 * @param exitCode    backend exit code, null while running
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubtaskResult(
    String id,
    String skillPlugin,
    String skillName,
    String agentName,
    SubtaskStatus status,
    String result,
    String error,
    Integer exitCode
) implements Serializable {

    public static SubtaskResult running(String id, SpecialistSpec spec) {
        return new SubtaskResult(id, spec.skillPlugin(), spec.skillName(), spec.role(),
                SubtaskStatus.RUNNING, null, null, null);
    }

    public static SubtaskResult completed(String id, SpecialistSpec spec, String result, int exitCode) {
        return new SubtaskResult(id, spec.skillPlugin(), spec.skillName(), spec.role(),
                SubtaskStatus.COMPLETED, result, null, exitCode);
    }

    public static SubtaskResult failed(String id, SpecialistSpec spec, String partialResult,
                                       String error, Integer exitCode) {
        return new SubtaskResult(id, spec.skillPlugin(), spec.skillName(), spec.role(),
                SubtaskStatus.FAILED, partialResult, error, exitCode);
    }

    /**
     * This result as failed with {@code error}, keeping any output captured so far.
     */
    public SubtaskResult halted(String error) {
        return new SubtaskResult(id, skillPlugin, skillName, agentName, SubtaskStatus.FAILED, result, error, exitCode);
    }
}
