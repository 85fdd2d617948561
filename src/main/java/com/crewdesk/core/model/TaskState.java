package com.crewdesk.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Task lifecycle:
 * queued → analyzing → confirming → dispatching → in_progress → review → done,
 * with failed reachable from analyzing, dispatching and in_progress, and
 * cancelled reachable from queued and confirming.
 */
public enum TaskState {
    QUEUED,
    ANALYZING,
    CONFIRMING,
    DISPATCHING,
    IN_PROGRESS,
    REVIEW,
    DONE,
    FAILED,
    CANCELLED;

    public boolean canTransitionTo(TaskState next) {
        return allowedNext().contains(next);
    }

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }

    private Set<TaskState> allowedNext() {
        return switch (this) {
            case QUEUED -> EnumSet.of(ANALYZING, CANCELLED);
            case ANALYZING -> EnumSet.of(CONFIRMING, FAILED);
            case CONFIRMING -> EnumSet.of(DISPATCHING, CANCELLED);
            case DISPATCHING -> EnumSet.of(IN_PROGRESS, FAILED);
            case IN_PROGRESS -> EnumSet.of(REVIEW, FAILED);
            case REVIEW -> EnumSet.of(DONE);
            case DONE, FAILED, CANCELLED -> EnumSet.noneOf(TaskState.class);
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
