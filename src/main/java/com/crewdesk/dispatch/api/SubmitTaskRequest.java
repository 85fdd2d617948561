package com.crewdesk.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/tasks.
 *
 * @param text free-text description of the work
 */
public record SubmitTaskRequest(String text) {}
