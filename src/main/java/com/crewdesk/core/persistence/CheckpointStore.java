package com.crewdesk.core.persistence;

import com.crewdesk.core.config.CrewdeskProperties;
import com.crewdesk.core.model.DispatchResult;
import com.crewdesk.core.model.SubtaskResult;
import com.crewdesk.core.model.TaskDecomposition;
import com.crewdesk.core.model.TaskRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * File-backed checkpoint store. One directory per task under {@code {home}/tasks}:
 * <pre>
 *   request.json
 *   decomposition.json
 *   prompts/{specialist}.txt, prompts/lead.txt
 *   results/{specialist}.json
 *   checkpoints/*
 *   final.json
 * </pre>
 * Writes are last-write-wins per slot; reads are best-effort and never throw.
 */
@Service
public class CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);

    static final String REQUEST = "request.json";
    static final String DECOMPOSITION = "decomposition.json";
    static final String FINAL = "final.json";
    static final String RESULTS_DIR = "results";
    static final String PROMPTS_DIR = "prompts";
    static final String CHECKPOINTS_DIR = "checkpoints";

    private final Path tasksRoot;

    @Autowired
    public CheckpointStore(CrewdeskProperties properties) {
        this(properties.homePath().resolve("tasks"));
    }

    public CheckpointStore(Path tasksRoot) {
        this.tasksRoot = tasksRoot;
    }

    public Path taskDir(String taskId) {
        return tasksRoot.resolve(taskId);
    }

    public Path promptsDir(String taskId) {
        return taskDir(taskId).resolve(PROMPTS_DIR);
    }

    public Path resultsDir(String taskId) {
        return taskDir(taskId).resolve(RESULTS_DIR);
    }

    public Path checkpointsDir(String taskId) {
        return taskDir(taskId).resolve(CHECKPOINTS_DIR);
    }

    // -- writes --

    public void saveRequest(TaskRequest request) {
        writeSlot(taskDir(request.id()).resolve(REQUEST), request);
    }

    public void saveDecomposition(String taskId, TaskDecomposition decomposition) {
        writeSlot(taskDir(taskId).resolve(DECOMPOSITION), decomposition);
    }

    public void saveSubtaskResult(String taskId, SubtaskResult result) {
        writeSlot(resultsDir(taskId).resolve(result.id() + ".json"), result);
    }

    public void saveCheckpoint(String taskId, String name, Object payload) {
        writeSlot(checkpointsDir(taskId).resolve(name + ".json"), payload);
    }

    public Path savePrompt(String taskId, String name, String prompt) {
        Path file = promptsDir(taskId).resolve(name + ".txt");
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, prompt, StandardCharsets.UTF_8);
            return file;
        } catch (IOException e) {
            throw new CheckpointException("Failed to write prompt " + file, e);
        }
    }

    /**
     * Unconditional final write. Prefer {@link #saveFinalOnce} on terminal paths.
     */
    public void saveFinal(String taskId, DispatchResult result) {
        writeSlot(taskDir(taskId).resolve(FINAL), result);
    }

    /**
     * Writes the final slot only if it does not exist yet.
     *
     * @return true if this call wrote the slot
     */
    public synchronized boolean saveFinalOnce(String taskId, DispatchResult result) {
        Path file = taskDir(taskId).resolve(FINAL);
        if (Files.exists(file)) {
            log.debug("Final result for {} already written; keeping existing", taskId);
            return false;
        }
        writeSlot(file, result);
        return true;
    }

    // -- reads --

    public Optional<TaskRequest> loadRequest(String taskId) {
        return JsonFiles.read(taskDir(taskId).resolve(REQUEST), TaskRequest.class);
    }

    public Optional<TaskDecomposition> loadDecomposition(String taskId) {
        return JsonFiles.read(taskDir(taskId).resolve(DECOMPOSITION), TaskDecomposition.class);
    }

    public Optional<DispatchResult> loadFinal(String taskId) {
        return JsonFiles.read(taskDir(taskId).resolve(FINAL), DispatchResult.class);
    }

    public List<SubtaskResult> loadSubtaskResults(String taskId) {
        Path dir = resultsDir(taskId);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<SubtaskResult> results = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(f -> f.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .forEach(f -> JsonFiles.read(f, SubtaskResult.class).ifPresent(results::add));
        } catch (IOException e) {
            log.warn("Unable to list results for task {}: {}", taskId, e.getMessage());
        }
        return results;
    }

    /**
     * Loads every slot of a task; empty when the task directory does not exist.
     */
    public Optional<TaskSnapshot> loadTask(String taskId) {
        if (!Files.isDirectory(taskDir(taskId))) {
            return Optional.empty();
        }
        return Optional.of(new TaskSnapshot(
                loadRequest(taskId).orElse(null),
                loadDecomposition(taskId).orElse(null),
                loadSubtaskResults(taskId),
                loadFinal(taskId).orElse(null)));
    }

    public List<String> listTasks() {
        if (!Files.isDirectory(tasksRoot)) {
            return List.of();
        }
        try (Stream<Path> dirs = Files.list(tasksRoot)) {
            return dirs.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .sorted()
                    .toList();
        } catch (IOException e) {
            log.warn("Unable to list tasks under {}: {}", tasksRoot, e.getMessage());
            return List.of();
        }
    }

    /**
     * Deletes task directories created before {@code now - maxAge}. Age comes from
     * the request's creation time, or the directory's modification time without one.
     *
     * @return number of task directories removed
     */
    public int cleanupOlderThan(Duration maxAge) {
        Instant cutoff = Instant.now().minus(maxAge);
        int removed = 0;
        for (String taskId : listTasks()) {
            Instant created = loadRequest(taskId)
                    .map(r -> Instant.ofEpochMilli(r.createdAt()))
                    .orElseGet(() -> lastModified(taskDir(taskId)));
            if (created.isBefore(cutoff)) {
                try {
                    deleteRecursively(taskDir(taskId));
                    removed++;
                } catch (IOException e) {
                    log.warn("Failed to remove expired task {}: {}", taskId, e.getMessage());
                }
            }
        }
        if (removed > 0) {
            log.info("Removed {} task director{} older than {} days",
                    removed, removed == 1 ? "y" : "ies", maxAge.toDays());
        }
        return removed;
    }

    private void writeSlot(Path file, Object value) {
        try {
            JsonFiles.write(file, value);
        } catch (IOException e) {
            throw new CheckpointException("Failed to write checkpoint " + file, e);
        }
    }

    private static Instant lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path).toInstant();
        } catch (IOException e) {
            return Instant.now();
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        }
    }
}
