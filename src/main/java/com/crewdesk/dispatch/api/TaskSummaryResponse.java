package com.crewdesk.dispatch.api;

import com.crewdesk.core.engine.TaskView;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One row of GET /api/v1/tasks.
 */
public record TaskSummaryResponse(
    String id,
    String text,
    String status,
    int position,
    @JsonProperty("created_at") long createdAt
) {

    static TaskSummaryResponse from(TaskView view) {
        return new TaskSummaryResponse(view.id(), view.text(), view.state().wireName(),
                view.position(), view.createdAt());
    }
}
