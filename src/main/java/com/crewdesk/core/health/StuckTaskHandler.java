package com.crewdesk.core.health;

import java.time.Duration;

/**
 * Invoked once when a monitored task has shown no progress for its whole timeout.
 */
@FunctionalInterface
public interface StuckTaskHandler {

    void onStuck(String taskId, Duration idle);
}
