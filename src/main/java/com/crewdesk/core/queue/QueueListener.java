package com.crewdesk.core.queue;

import com.crewdesk.core.model.TaskRequest;

/**
 * Callbacks fired synchronously by {@link TaskQueue} after each persisted mutation.
 * Implementations must not block; hand long work to an executor.
 */
public interface QueueListener {

    default void onQueued(TaskRequest task, int position) {}

    /** The task became active. */
    default void onStarted(TaskRequest task) {}

    default void onCompleted(TaskRequest task) {}

    default void onCancelled(TaskRequest task) {}
}
