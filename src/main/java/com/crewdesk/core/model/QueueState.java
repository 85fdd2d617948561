package com.crewdesk.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Persisted queue snapshot. {@code active} is non-null iff a task is progressing.
 */
public record QueueState(
    TaskRequest active,
    List<TaskRequest> pending
) implements Serializable {

    public QueueState {
        pending = pending == null ? List.of() : List.copyOf(pending);
    }

    public static QueueState empty() {
        return new QueueState(null, List.of());
    }
}
