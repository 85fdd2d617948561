package com.crewdesk.core.health;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Inactivity watchdog. A monitored task that records no progress for its
 * timeout is flagged stuck and every registered {@link StuckTaskHandler} fires once.
 * <p>
 * Each {@link #startMonitoring} creates a fresh entry; a timer belonging to an
 * older entry for the same task finds itself superseded and does nothing.
 */
@Component
public class HealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);

    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final Map<String, Entry> monitors = new ConcurrentHashMap<>();
    private final List<StuckTaskHandler> handlers = new CopyOnWriteArrayList<>();

    private static final class Entry {
        final String taskId;
        final long startedAt;
        final long timeoutMs;
        long lastProgress;
        boolean stuck;
        ScheduledFuture<?> timer;

        Entry(String taskId, long now, long timeoutMs) {
            this.taskId = taskId;
            this.startedAt = now;
            this.lastProgress = now;
            this.timeoutMs = timeoutMs;
        }
    }

    public HealthMonitor() {
        this(Clock.systemUTC());
    }

    public HealthMonitor(Clock clock) {
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "crewdesk-health");
            t.setDaemon(true);
            return t;
        });
    }

    public void addStuckHandler(StuckTaskHandler handler) {
        handlers.add(handler);
    }

    /**
     * Starts (or restarts) monitoring. Any previous monitor for the task is discarded.
     */
    public void startMonitoring(String taskId, Duration timeout) {
        Entry entry = new Entry(taskId, clock.millis(), timeout.toMillis());
        synchronized (entry) {
            Entry previous = monitors.put(taskId, entry);
            if (previous != null) {
                cancelTimer(previous);
            }
            arm(entry, entry.timeoutMs);
        }
        log.debug("Monitoring task {} with {}s inactivity timeout", taskId, timeout.toSeconds());
    }

    /**
     * Resets the inactivity clock. Ignored for unmonitored or already-stuck tasks.
     */
    public void recordProgress(String taskId) {
        Entry entry = monitors.get(taskId);
        if (entry == null) return;
        synchronized (entry) {
            if (entry.stuck || monitors.get(taskId) != entry) return;
            entry.lastProgress = clock.millis();
            cancelTimer(entry);
            arm(entry, entry.timeoutMs);
        }
    }

    public void stopMonitoring(String taskId) {
        Entry entry = monitors.remove(taskId);
        if (entry != null) {
            synchronized (entry) {
                cancelTimer(entry);
            }
            log.debug("Stopped monitoring task {}", taskId);
        }
    }

    public TaskHealth checkHealth(String taskId) {
        Entry entry = monitors.get(taskId);
        if (entry == null) return TaskHealth.unmonitored();
        synchronized (entry) {
            long now = clock.millis();
            long idle = now - entry.lastProgress;
            return new TaskHealth(true, entry.stuck || idle >= entry.timeoutMs, now - entry.startedAt, idle);
        }
    }

    public List<String> getStuckTasks() {
        List<String> stuck = new ArrayList<>();
        for (String taskId : monitors.keySet()) {
            if (checkHealth(taskId).stuck()) {
                stuck.add(taskId);
            }
        }
        return stuck;
    }

    public boolean isMonitoring(String taskId) {
        return monitors.containsKey(taskId);
    }

    /**
     * Runs on the scheduler thread. Re-arms when progress arrived after this
     * timer was scheduled; otherwise flags the task and fires the handlers.
     */
    private void onTimer(Entry entry) {
        Duration idle;
        synchronized (entry) {
            if (entry.stuck || monitors.get(entry.taskId) != entry) return;
            long idleMs = clock.millis() - entry.lastProgress;
            if (idleMs < entry.timeoutMs) {
                arm(entry, entry.timeoutMs - idleMs);
                return;
            }
            entry.stuck = true;
            idle = Duration.ofMillis(idleMs);
        }
        log.warn("Task {} stuck: no progress for {}s", entry.taskId, idle.toSeconds());
        for (StuckTaskHandler handler : handlers) {
            try {
                handler.onStuck(entry.taskId, idle);
            } catch (Exception e) {
                log.error("Stuck handler failed for task {}: {}", entry.taskId, e.getMessage(), e);
            }
        }
    }

    private void arm(Entry entry, long delayMs) {
        entry.timer = scheduler.schedule(() -> onTimer(entry), Math.max(delayMs, 0), TimeUnit.MILLISECONDS);
    }

    private static void cancelTimer(Entry entry) {
        if (entry.timer != null) {
            entry.timer.cancel(false);
        }
    }

    @PreDestroy
    public void dispose() {
        monitors.values().forEach(HealthMonitor::cancelTimer);
        monitors.clear();
        scheduler.shutdownNow();
    }
}
