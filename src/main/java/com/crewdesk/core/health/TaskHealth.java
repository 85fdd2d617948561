package com.crewdesk.core.health;

/**
 * Point-in-time health of one monitored task.
 *
 * @param monitored false if the task is not being monitored
 * @param stuck     true once the task has been idle for its whole timeout
 * @param elapsedMs time since monitoring started
 * @param idleMs    time since the last recorded progress
 */
public record TaskHealth(boolean monitored, boolean stuck, long elapsedMs, long idleMs) {

    public static TaskHealth unmonitored() {
        return new TaskHealth(false, false, 0, 0);
    }
}
