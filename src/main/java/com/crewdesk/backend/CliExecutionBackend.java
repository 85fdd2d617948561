package com.crewdesk.backend;

import com.crewdesk.core.config.CrewdeskProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs each invocation as an agent CLI subprocess
 * ({@code claude -p <prompt> --output-format json ...}).
 * <p>
 * Output is redirected to temp files so a chatty process can never block on a
 * full pipe. On timeout or interruption the process tree is destroyed.
 */
public class CliExecutionBackend implements ExecutionBackend {

    private static final Logger log = LoggerFactory.getLogger(CliExecutionBackend.class);

    private final String command;
    private final List<String> extraArgs;

    public CliExecutionBackend(CrewdeskProperties properties) {
        this(properties.getBackend().getCommand(), properties.getBackend().getExtraArgs());
    }

    public CliExecutionBackend(String command, List<String> extraArgs) {
        this.command = command;
        this.extraArgs = extraArgs == null ? List.of() : List.copyOf(extraArgs);
    }

    @Override
    public BackendResult execute(BackendRequest request) {
        List<String> cmd = buildCommand(request);
        log.debug("Launching {} (model={}, timeout={}s)", command, request.model(), request.timeout().toSeconds());

        Path stdoutFile = null;
        Path stderrFile = null;
        Process process = null;
        long start = System.currentTimeMillis();
        try {
            stdoutFile = Files.createTempFile("crewdesk-out", ".log");
            stderrFile = Files.createTempFile("crewdesk-err", ".log");

            ProcessBuilder pb = new ProcessBuilder(cmd)
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(stderrFile.toFile())
                    .redirectInput(ProcessBuilder.Redirect.from(nullDevice()));
            if (request.workingDir() != null) {
                pb.directory(request.workingDir().toFile());
            }
            Map<String, String> env = pb.environment();
            Map<String, String> safe = SafeEnvironment.filter(Map.copyOf(env));
            env.clear();
            env.putAll(safe);
            env.putAll(request.env());

            process = pb.start();
            boolean finished = process.waitFor(request.timeout().toMillis(), TimeUnit.MILLISECONDS);
            long elapsed = System.currentTimeMillis() - start;

            if (!finished) {
                destroy(process);
                log.warn("{} timed out after {}s", command, request.timeout().toSeconds());
                return BackendResult.timeout(read(stdoutFile), read(stderrFile), elapsed);
            }
            int exit = process.exitValue();
            log.debug("{} exited with {} in {}ms", command, exit, elapsed);
            return new BackendResult(exit, read(stdoutFile), read(stderrFile), false, elapsed);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) destroy(process);
            throw new BackendException(command + " interrupted", e);
        } catch (IOException e) {
            throw new BackendException("Failed to launch " + command + ": " + e.getMessage(), e);
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    List<String> buildCommand(BackendRequest request) {
        List<String> cmd = new ArrayList<>();
        cmd.add(command);
        cmd.add("-p");
        cmd.add(request.prompt());
        cmd.add("--dangerously-skip-permissions");
        cmd.add("--output-format");
        cmd.add("json");
        if (request.model() != null && !request.model().isBlank()) {
            cmd.add("--model");
            cmd.add(request.model());
        }
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            cmd.add("--append-system-prompt");
            cmd.add(request.systemPrompt());
        }
        cmd.addAll(extraArgs);
        return cmd;
    }

    @Override
    public String name() {
        return "cli:" + command;
    }

    @Override
    public boolean isAvailable() {
        if (command.contains(File.separator)) {
            return Files.isExecutable(Path.of(command));
        }
        String path = System.getenv("PATH");
        if (path == null) return false;
        for (String dir : path.split(File.pathSeparator)) {
            if (!dir.isEmpty() && Files.isExecutable(Path.of(dir, command))) {
                return true;
            }
        }
        return false;
    }

    private static void destroy(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    // Output cut mid-character or with stray bytes is replaced, not discarded.
    private static String read(Path file) {
        try {
            return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Could not read output file {}", file);
            return "";
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) return;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete temp file {}", file);
        }
    }

    private static File nullDevice() {
        return new File(System.getProperty("os.name").toLowerCase().startsWith("windows") ? "NUL" : "/dev/null");
    }
}
