package com.crewdesk.dispatch.cli;

import com.crewdesk.core.engine.DispatchEngine;
import com.crewdesk.core.engine.TaskView;
import com.crewdesk.core.model.Subtask;
import com.crewdesk.core.model.SubtaskResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * CLI command: crewdesk status [task-id]
 * <p>
 * Without an id, lists every task on disk. With an id, prints its state,
 * decomposition and specialist outcomes; {@code --watch} follows the task's
 * event stream on a running server instead.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show task status")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", arity = "0..1", description = "Task ID")
    private String taskId;

    @Option(names = {"--watch", "-w"}, description = "Watch for live updates via SSE")
    private boolean watch;

    @Option(names = {"--port"}, description = "Server port for watch mode (default: ${DEFAULT-VALUE})",
            defaultValue = "8080")
    private int port;

    private final DispatchEngine engine;

    public StatusCommand(DispatchEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        if (taskId == null) {
            listTasks();
            return;
        }
        if (watch) {
            runWatchMode();
            return;
        }

        ConsoleOutput.printBanner();
        Optional<TaskView> found = engine.getTask(taskId);
        if (found.isEmpty()) {
            ConsoleOutput.error("Task not found: " + taskId);
            return;
        }
        TaskView task = found.get();

        System.out.println();
        System.out.println("TASK " + task.id());
        System.out.println("Request: " + task.text());
        ConsoleOutput.state(task.state());
        if (task.position() > 0) {
            ConsoleOutput.info("Queue position: " + task.position());
        }

        if (task.decomposition() != null) {
            System.out.println();
            ConsoleOutput.info("Complexity: " + task.decomposition().estimatedComplexity().wireName());
            List<Subtask> subtasks = task.decomposition().subtasks();
            for (int i = 0; i < subtasks.size(); i++) {
                System.out.printf("  %d. [%s] %s%n", i + 1, subtasks.get(i).domain(), subtasks.get(i).description());
            }
        }

        if (!task.subtaskResults().isEmpty()) {
            System.out.println();
            for (SubtaskResult result : task.subtaskResults()) {
                ConsoleOutput.subtask(result);
            }
        }

        if (task.result() != null) {
            ConsoleOutput.result(task.result());
        }
    }

    private void listTasks() {
        ConsoleOutput.printBanner();
        List<TaskView> tasks = engine.listTasks();
        if (tasks.isEmpty()) {
            ConsoleOutput.info("No tasks found.");
            return;
        }
        System.out.printf("  %-38s %-12s %s%n", "TASK", "STATUS", "TEXT");
        System.out.println("  " + "-".repeat(80));
        for (TaskView task : tasks) {
            System.out.printf("  %-38s %-12s %s%n", task.id(), task.state().wireName(),
                    QueueCommand.truncate(task.text(), 30));
        }
    }

    private void runWatchMode() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Watching task " + taskId + " (connecting to localhost:" + port + ")...");
        System.out.println();

        URI uri = URI.create("http://localhost:" + port + "/api/v1/tasks/" + taskId + "/events");

        try {
            HttpClient client = HttpClient.newBuilder()
                    .connectTimeout(Duration.ofSeconds(5))
                    .build();

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(uri)
                    .header("Accept", "text/event-stream")
                    .GET()
                    .build();

            HttpResponse<java.util.stream.Stream<String>> response = client.send(request,
                    HttpResponse.BodyHandlers.ofLines());

            if (response.statusCode() == 404) {
                ConsoleOutput.error("Task not found: " + taskId);
                return;
            }
            if (response.statusCode() != 200) {
                ConsoleOutput.error("Server returned HTTP " + response.statusCode());
                return;
            }

            final String[] currentEventType = {""};
            response.body().forEach(line -> {
                if (line.startsWith("event:")) {
                    currentEventType[0] = line.substring(6).trim();
                } else if (line.startsWith("data:")) {
                    String data = line.substring(5).trim();
                    String eventType = currentEventType[0].isEmpty() ? "message" : currentEventType[0];
                    ConsoleOutput.watchEvent(eventType, data);
                    currentEventType[0] = "";
                }
            });

            System.out.println();
            ConsoleOutput.info("Stream ended.");

        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to Crewdesk server at localhost:" + port);
            ConsoleOutput.info("Start the server first: crewdesk serve");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Watch interrupted.");
        } catch (Exception e) {
            ConsoleOutput.error("Watch failed: " + e.getMessage());
        }
    }
}
