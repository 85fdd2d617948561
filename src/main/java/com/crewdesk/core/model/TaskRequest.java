package com.crewdesk.core.model;

import java.io.Serializable;

/**
 * A submitted business task.
 *
 * @param id        unique task identifier
 * @param text      the operator's free-text request
 * @param createdAt submission time in epoch milliseconds
 */
public record TaskRequest(
    String id,
    String text,
    long createdAt
) implements Serializable {}
