package com.crewdesk.launcher;

import com.crewdesk.core.agents.AgentStateTracker;
import com.crewdesk.core.events.CrewdeskEvent;
import com.crewdesk.core.events.EventBus;
import com.crewdesk.core.health.HealthMonitor;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Polls a task directory while its team runs and reports files that appear or
 * change under {@code results/}, {@code checkpoints/} and {@code final.json}.
 * <p>
 * Each change publishes a {@code team.progress} event, counts as progress for
 * the {@link HealthMonitor}, and is logged against the owning agent when the
 * file name identifies one. This runs independently of backend invocations
 * returning, so a specialist writing checkpoints keeps its task alive.
 */
@Component
public class TeamMonitor {

    private static final Logger log = LoggerFactory.getLogger(TeamMonitor.class);

    private static final List<String> WATCHED = List.of("results", "checkpoints", "final.json");

    private final EventBus eventBus;
    private final HealthMonitor healthMonitor;
    private final AgentStateTracker agentState;
    private final ScheduledExecutorService scheduler;

    @Autowired
    public TeamMonitor(EventBus eventBus, HealthMonitor healthMonitor, AgentStateTracker agentState) {
        this.eventBus = eventBus;
        this.healthMonitor = healthMonitor;
        this.agentState = agentState;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "crewdesk-team-monitor");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Handle for one watched task. Closing it takes a last poll and stops watching.
     */
    public final class Watch implements AutoCloseable {
        private final String taskId;
        private final Path taskDir;
        private Map<String, String> snapshot;
        private ScheduledFuture<?> poller;

        private Watch(String taskId, Path taskDir) {
            this.taskId = taskId;
            this.taskDir = taskDir;
            this.snapshot = snapshotFiles(taskDir);
        }

        synchronized List<FileChange> poll() {
            Map<String, String> current = snapshotFiles(taskDir);
            List<FileChange> changes = detectChanges(snapshot, current);
            snapshot = current;
            for (FileChange change : changes) {
                report(taskId, change);
            }
            return changes;
        }

        @Override
        public void close() {
            if (poller != null) {
                poller.cancel(false);
            }
            try {
                poll();
            } catch (RuntimeException e) {
                log.debug("Final poll for task {} failed: {}", taskId, e.getMessage());
            }
        }
    }

    public Watch watch(String taskId, Path taskDir, long pollMillis) {
        Watch watch = new Watch(taskId, taskDir);
        watch.poller = scheduler.scheduleWithFixedDelay(() -> {
            try {
                watch.poll();
            } catch (RuntimeException e) {
                log.warn("Polling task {} failed: {}", taskId, e.getMessage());
            }
        }, pollMillis, pollMillis, TimeUnit.MILLISECONDS);
        log.debug("Watching {} every {}ms", taskDir, pollMillis);
        return watch;
    }

    private void report(String taskId, FileChange change) {
        log.debug("Task {} {} {}", taskId, change.change(), change.path());
        healthMonitor.recordProgress(taskId);
        String specialist = specialistFor(change.path());
        eventBus.publish(CrewdeskEvent.of("team.progress", taskId, specialist,
                Map.of("file", change.path(), "change", change.change())));
        if (specialist != null) {
            agentState.addLog(taskId + "-" + specialist, change.change() + " " + change.path());
        }
    }

    /**
     * {@code results/{id}.json} and {@code checkpoints/{id}-progress.json} belong to specialist {@code id}.
     */
    static String specialistFor(String relativePath) {
        String name = relativePath.substring(relativePath.lastIndexOf('/') + 1);
        if (relativePath.startsWith("results/") && name.endsWith(".json")) {
            return name.substring(0, name.length() - ".json".length());
        }
        if (relativePath.startsWith("checkpoints/") && name.endsWith("-progress.json")) {
            return name.substring(0, name.length() - "-progress.json".length());
        }
        return null;
    }

    /**
     * Relative path to a last-modified/size fingerprint for every watched file.
     */
    static Map<String, String> snapshotFiles(Path taskDir) {
        Map<String, String> files = new HashMap<>();
        for (String watched : WATCHED) {
            Path root = taskDir.resolve(watched);
            if (!Files.exists(root)) continue;
            try (Stream<Path> walk = Files.walk(root)) {
                walk.filter(Files::isRegularFile)
                        .filter(p -> !p.getFileName().toString().endsWith(".tmp"))
                        .forEach(p -> files.put(
                                taskDir.relativize(p).toString().replace('\\', '/'),
                                fingerprint(p)));
            } catch (IOException e) {
                log.debug("Could not walk {}: {}", root, e.getMessage());
            }
        }
        return files;
    }

    static List<FileChange> detectChanges(Map<String, String> before, Map<String, String> after) {
        List<FileChange> changes = new ArrayList<>();
        for (var entry : after.entrySet()) {
            String previous = before.get(entry.getKey());
            if (previous == null) {
                changes.add(new FileChange(entry.getKey(), "created"));
            } else if (!previous.equals(entry.getValue())) {
                changes.add(new FileChange(entry.getKey(), "modified"));
            }
        }
        changes.sort((a, b) -> a.path().compareTo(b.path()));
        return changes;
    }

    private static String fingerprint(Path p) {
        try {
            return Files.getLastModifiedTime(p).toMillis() + ":" + Files.size(p);
        } catch (IOException e) {
            return "0:0";
        }
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }
}
