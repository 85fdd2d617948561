package com.crewdesk.core.model;

import java.io.Serializable;

public record AgentLogEntry(String message, long timestamp) implements Serializable {}
