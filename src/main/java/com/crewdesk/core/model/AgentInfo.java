package com.crewdesk.core.model;

import java.io.Serializable;

/**
 * Observability snapshot of a running specialist. Transient, never persisted.
 */
public record AgentInfo(
    String id,
    String name,
    AgentStatus status,
    String taskId,
    String subtaskId,
    String lastAction,
    long lastSeen,
    String error
) implements Serializable {}
