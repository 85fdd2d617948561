package com.crewdesk.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A lifecycle event emitted by the dispatch pipeline, used for SSE streaming,
 * the status relay and CLI output.
 *
 * @param eventType event type (e.g. "task.queued", "subtask.completed", "task.stuck")
 * @param taskId    the task this event belongs to (nullable for process-level events)
 * @param subtaskId the specialist/sub-task this event relates to (nullable for task-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record CrewdeskEvent(
    String eventType,
    String taskId,
    String subtaskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static CrewdeskEvent of(String eventType, String taskId, Map<String, Object> payload) {
        return new CrewdeskEvent(eventType, taskId, null, payload, Instant.now());
    }

    public static CrewdeskEvent of(String eventType, String taskId, String subtaskId, Map<String, Object> payload) {
        return new CrewdeskEvent(eventType, taskId, subtaskId, payload, Instant.now());
    }
}
