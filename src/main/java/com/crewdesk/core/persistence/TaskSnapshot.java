package com.crewdesk.core.persistence;

import com.crewdesk.core.model.DispatchResult;
import com.crewdesk.core.model.SubtaskResult;
import com.crewdesk.core.model.TaskDecomposition;
import com.crewdesk.core.model.TaskRequest;

import java.util.List;

/**
 * Every checkpoint slot of one task. Absent slots are null; results may be empty.
 */
public record TaskSnapshot(
    TaskRequest request,
    TaskDecomposition decomposition,
    List<SubtaskResult> subtaskResults,
    DispatchResult finalResult
) {

    public TaskSnapshot {
        subtaskResults = subtaskResults == null ? List.of() : List.copyOf(subtaskResults);
    }

    public boolean hasFinal() {
        return finalResult != null;
    }

    public boolean hasDecomposition() {
        return decomposition != null;
    }
}
