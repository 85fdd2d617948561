package com.crewdesk.core.model;

import java.io.Serializable;

/**
 * One unit of work produced by task decomposition.
 *
 * @param description what the specialist should do
 * @param domain      business domain (e.g. "sales", "customer-support")
 */
public record Subtask(
    String description,
    String domain
) implements Serializable {}
