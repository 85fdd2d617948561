package com.crewdesk.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Estimated complexity of a decomposed task. Drives the per-agent token estimate.
 */
public enum Complexity {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse; unknown or missing values resolve to {@code null}.
     */
    @JsonCreator
    public static Complexity fromWire(String value) {
        if (value == null) return null;
        for (Complexity c : values()) {
            if (c.name().equalsIgnoreCase(value.trim())) return c;
        }
        return null;
    }
}
