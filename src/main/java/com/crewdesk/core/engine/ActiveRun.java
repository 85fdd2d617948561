package com.crewdesk.core.engine;

import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The single task currently owning the pipeline, from activation until it
 * leaves the active slot. Holds the future of whichever phase is running so
 * the stuck path can interrupt it.
 */
final class ActiveRun {

    private final String taskId;
    private final AtomicBoolean terminated = new AtomicBoolean(false);
    private volatile Future<?> phase;

    ActiveRun(String taskId) {
        this.taskId = taskId;
    }

    String taskId() {
        return taskId;
    }

    void attach(Future<?> future) {
        this.phase = future;
    }

    /**
     * Claims the right to end this run. Exactly one caller wins.
     */
    boolean terminate() {
        return terminated.compareAndSet(false, true);
    }

    boolean isTerminated() {
        return terminated.get();
    }

    void interrupt() {
        Future<?> current = phase;
        if (current != null) {
            current.cancel(true);
        }
    }
}
