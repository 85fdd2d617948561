package com.crewdesk.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AgentStatus {
    ACTIVE,
    IDLE,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
