package com.crewdesk.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.util.List;

/**
 * Terminal outcome of a task, written exactly once to the final slot.
 *
 * @param taskId            the task
 * @param status            completed iff every sub-task completed
 * @param subtasks          every specialist's outcome, including partial output of failures
 * @param synthesizedResult joined output of completed specialists
 * @param reason            human-readable failure reason, null on success
 * @param estimatedCostUsd  estimate the team was launched under, null if never launched
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DispatchResult(
    String taskId,
    DispatchStatus status,
    List<SubtaskResult> subtasks,
    String synthesizedResult,
    String reason,
    Double estimatedCostUsd
) implements Serializable {

    public static final String STUCK_PREFIX = "stuck: ";

    public DispatchResult {
        subtasks = subtasks == null ? List.of() : List.copyOf(subtasks);
    }

    public static DispatchResult failed(String taskId, String reason) {
        return new DispatchResult(taskId, DispatchStatus.FAILED, List.of(), null, reason, null);
    }

    public static DispatchResult stuck(String taskId, String detail) {
        return failed(taskId, STUCK_PREFIX + detail);
    }

    /**
     * A stuck result carrying the sub-task results written so far. Specialists
     * still running when the task was halted are reported failed.
     */
    public static DispatchResult stuck(String taskId, String detail, List<SubtaskResult> subtasks) {
        List<SubtaskResult> settled = subtasks.stream()
                .map(s -> s.status() == SubtaskStatus.RUNNING ? s.halted("Halted: task stuck") : s)
                .toList();
        return new DispatchResult(taskId, DispatchStatus.FAILED, settled, null, STUCK_PREFIX + detail, null);
    }

    @JsonIgnore
    public boolean isStuck() {
        return reason != null && reason.startsWith(STUCK_PREFIX);
    }
}
