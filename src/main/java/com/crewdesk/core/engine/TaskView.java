package com.crewdesk.core.engine;

import com.crewdesk.core.model.DispatchResult;
import com.crewdesk.core.model.SubtaskResult;
import com.crewdesk.core.model.TaskDecomposition;
import com.crewdesk.core.model.TaskState;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Read model of one task: its lifecycle state plus whatever checkpoints exist.
 *
 * @param position 0 active, n waiting, -1 not in the queue
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskView(
    String id,
    String text,
    long createdAt,
    TaskState state,
    int position,
    TaskDecomposition decomposition,
    List<SubtaskResult> subtaskResults,
    DispatchResult result
) {

    public TaskView {
        subtaskResults = subtaskResults == null ? List.of() : List.copyOf(subtaskResults);
    }
}
