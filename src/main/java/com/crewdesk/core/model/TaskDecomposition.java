package com.crewdesk.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Structured breakdown of a task, produced once by the analyzer and editable
 * before confirmation.
 */
public record TaskDecomposition(
    List<Subtask> subtasks,
    List<String> domains,
    Complexity estimatedComplexity
) implements Serializable {

    public TaskDecomposition {
        subtasks = subtasks == null ? List.of() : List.copyOf(subtasks);
        domains = domains == null ? List.of() : List.copyOf(domains);
        if (estimatedComplexity == null) {
            estimatedComplexity = Complexity.MEDIUM;
        }
    }
}
