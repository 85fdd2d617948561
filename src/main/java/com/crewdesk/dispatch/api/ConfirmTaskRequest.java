package com.crewdesk.dispatch.api;

import com.crewdesk.core.model.TaskDecomposition;

/**
 * Optional body for POST /api/v1/tasks/{id}/confirm.
 *
 * @param decomposition edited decomposition replacing the analysed one; nullable
 */
public record ConfirmTaskRequest(TaskDecomposition decomposition) {}
