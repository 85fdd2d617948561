package com.crewdesk.core.events;

import java.util.EnumSet;
import java.util.Set;

/**
 * Coarse routing key for {@link CrewdeskEvent}s, taken from the event type prefix
 * ({@code task.completed} is {@link #TASK}, {@code subtask.failed} is {@link #SUBTASK}).
 */
public enum EventChannel {
    /** Queue position and lifecycle transitions of a task. */
    TASK("task"),
    /** Specialist start and settlement. */
    SUBTASK("subtask"),
    /** Lead completion and checkpoint-file progress while a team runs. */
    TEAM("team"),
    /** Agent-state changes. */
    AGENT("agent"),
    /** Delivery reports of the status relay. */
    RELAY("relay"),
    OTHER("");

    private final String prefix;

    EventChannel(String prefix) {
        this.prefix = prefix;
    }

    public static EventChannel forType(String eventType) {
        if (eventType != null) {
            int dot = eventType.indexOf('.');
            String head = dot < 0 ? eventType : eventType.substring(0, dot);
            for (EventChannel channel : values()) {
                if (channel != OTHER && channel.prefix.equals(head)) {
                    return channel;
                }
            }
        }
        return OTHER;
    }

    public static Set<EventChannel> all() {
        return EnumSet.allOf(EventChannel.class);
    }

    public static Set<EventChannel> allExcept(EventChannel excluded) {
        return EnumSet.complementOf(EnumSet.of(excluded));
    }
}
