package com.crewdesk.core.queue;

import com.crewdesk.core.config.CrewdeskProperties;
import com.crewdesk.core.model.QueueState;
import com.crewdesk.core.model.TaskRequest;
import com.crewdesk.core.persistence.JsonFiles;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Serial FIFO task queue. At most one task is active; the rest wait in order.
 * <p>
 * Every mutation persists the full snapshot to {@code queue.json} before it
 * returns, and listener callbacks run after the snapshot is on disk.
 */
@Service
public class TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(TaskQueue.class);

    private final Path queueFile;
    private final List<QueueListener> listeners = new CopyOnWriteArrayList<>();

    private TaskRequest active;
    private final List<TaskRequest> pending = new ArrayList<>();

    @Autowired
    public TaskQueue(CrewdeskProperties properties) {
        this(properties.homePath().resolve("queue.json"));
    }

    public TaskQueue(Path queueFile) {
        this.queueFile = queueFile;
    }

    public void addListener(QueueListener listener) {
        listeners.add(listener);
    }

    /**
     * Adds a task. With no active task it becomes active immediately and the
     * start callback fires before this method returns.
     *
     * @return 0 if the task became active, otherwise its 1-based position in the waiting list
     */
    public int enqueue(TaskRequest task) {
        int position;
        boolean started;
        synchronized (this) {
            if (indexOf(task.id()) != -1) {
                throw new QueueStateException("Task already queued: " + task.id());
            }
            if (active == null) {
                active = task;
                position = 0;
                started = true;
            } else {
                pending.add(task);
                position = pending.size();
                started = false;
            }
            persist();
        }
        if (started) {
            log.info("Task {} activated", task.id());
            fire(l -> l.onStarted(task));
        } else {
            log.info("Task {} queued at position {}", task.id(), position);
            fire(l -> l.onQueued(task, position));
        }
        return position;
    }

    /**
     * Promotes the head of the waiting list. No-op when nothing is waiting.
     * Callers complete the active task first.
     */
    public Optional<TaskRequest> dequeue() {
        TaskRequest next;
        synchronized (this) {
            if (active != null) {
                throw new QueueStateException("Cannot dequeue while task " + active.id() + " is active");
            }
            if (pending.isEmpty()) {
                return Optional.empty();
            }
            next = pending.remove(0);
            active = next;
            persist();
        }
        log.info("Task {} activated from queue", next.id());
        fire(l -> l.onStarted(next));
        return Optional.of(next);
    }

    /**
     * Removes the task whether active or waiting. Cancelling the active task
     * does not promote the next one.
     *
     * @return false if the task is unknown
     */
    public boolean cancel(String taskId) {
        TaskRequest cancelled;
        synchronized (this) {
            if (active != null && active.id().equals(taskId)) {
                cancelled = active;
                active = null;
            } else {
                int idx = pendingIndex(taskId);
                if (idx == -1) {
                    return false;
                }
                cancelled = pending.remove(idx);
            }
            persist();
        }
        log.info("Task {} cancelled", taskId);
        fire(l -> l.onCancelled(cancelled));
        return true;
    }

    /**
     * Clears the active slot. No-op when nothing is active.
     */
    public void completeActive() {
        TaskRequest completed;
        synchronized (this) {
            if (active == null) {
                return;
            }
            completed = active;
            active = null;
            persist();
        }
        log.info("Task {} left the active slot", completed.id());
        fire(l -> l.onCompleted(completed));
    }

    /**
     * @return 0 for the active task, n for the n-th waiting task, -1 if unknown
     */
    public synchronized int getPosition(String taskId) {
        return indexOf(taskId);
    }

    public synchronized Optional<TaskRequest> getActive() {
        return Optional.ofNullable(active);
    }

    public synchronized List<TaskRequest> getPending() {
        return List.copyOf(pending);
    }

    public synchronized QueueState snapshot() {
        return new QueueState(active, pending);
    }

    /**
     * Restores the persisted snapshot. A missing or corrupt file starts empty.
     * Listeners are not notified.
     */
    @PostConstruct
    public synchronized void load() {
        QueueState state = JsonFiles.read(queueFile, QueueState.class).orElse(QueueState.empty());
        active = state.active();
        pending.clear();
        pending.addAll(state.pending());
        log.info("Loaded queue: active={}, pending={}", active == null ? "none" : active.id(), pending.size());
    }

    private int indexOf(String taskId) {
        if (active != null && active.id().equals(taskId)) {
            return 0;
        }
        int idx = pendingIndex(taskId);
        return idx == -1 ? -1 : idx + 1;
    }

    private int pendingIndex(String taskId) {
        for (int i = 0; i < pending.size(); i++) {
            if (pending.get(i).id().equals(taskId)) {
                return i;
            }
        }
        return -1;
    }

    private void persist() {
        try {
            JsonFiles.write(queueFile, new QueueState(active, pending));
        } catch (IOException e) {
            throw new QueueStateException("Failed to persist queue to " + queueFile, e);
        }
    }

    private void fire(Consumer<QueueListener> callback) {
        for (QueueListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (Exception e) {
                log.warn("Queue listener threw: {}", e.getMessage(), e);
            }
        }
    }
}
