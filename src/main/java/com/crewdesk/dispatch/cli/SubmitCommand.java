package com.crewdesk.dispatch.cli;

import com.crewdesk.core.engine.ConfirmOutcome;
import com.crewdesk.core.engine.DispatchEngine;
import com.crewdesk.core.engine.SubmitReceipt;
import com.crewdesk.core.engine.TaskView;
import com.crewdesk.core.model.Subtask;
import com.crewdesk.core.model.TaskState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * CLI command: crewdesk submit "&lt;task&gt;"
 * <p>
 * Runs the pipeline in this process. The task is analysed and its
 * decomposition printed; with {@code --yes} it is confirmed straight away
 * and the command waits for the team to finish. Without {@code --yes} the
 * task stays awaiting confirmation and a later {@code crewdesk serve}
 * picks it up.
 */
@Command(name = "submit", mixinStandardHelpOptions = true, description = "Submit a task")
@Component
public class SubmitCommand implements Callable<Integer> {

    private static final long POLL_MILLIS = 500;

    @Parameters(arity = "1..*", description = "Free-text task description")
    private List<String> words;

    @Option(names = {"--yes", "-y"}, description = "Confirm the decomposition and wait for the result")
    private boolean autoConfirm;

    @Option(names = {"--wait-seconds"}, defaultValue = "1800",
            description = "Give up waiting after this many seconds (default: ${DEFAULT-VALUE})")
    private long waitSeconds;

    private final DispatchEngine engine;

    public SubmitCommand(DispatchEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() throws InterruptedException {
        ConsoleOutput.printBanner();

        SubmitReceipt receipt;
        try {
            receipt = engine.submit(String.join(" ", words));
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
        ConsoleOutput.success("Task " + receipt.id() + " submitted");
        if (receipt.position() > 0) {
            ConsoleOutput.info("Queued at position " + receipt.position() + " behind the active task.");
            return 0;
        }

        ConsoleOutput.info("Analysing request...");
        long deadline = System.currentTimeMillis() + waitSeconds * 1000L;
        Optional<TaskView> analysed = await(receipt.id(), s -> s == TaskState.CONFIRMING || s.isTerminal(), deadline);
        if (analysed.isEmpty()) {
            ConsoleOutput.error("Timed out waiting for analysis");
            return 1;
        }
        TaskView task = analysed.get();
        if (task.state().isTerminal()) {
            return finish(task);
        }

        List<Subtask> subtasks = task.decomposition().subtasks();
        ConsoleOutput.info(subtasks.size() + " sub-task(s), complexity "
                + task.decomposition().estimatedComplexity().wireName() + ":");
        for (int i = 0; i < subtasks.size(); i++) {
            System.out.printf("  %d. [%s] %s%n", i + 1, subtasks.get(i).domain(), subtasks.get(i).description());
        }

        if (!autoConfirm) {
            ConsoleOutput.info("Awaiting confirmation. Start 'crewdesk serve' and POST /api/v1/tasks/"
                    + receipt.id() + "/confirm, or resubmit with --yes.");
            return 0;
        }

        if (engine.confirm(receipt.id(), null) != ConfirmOutcome.DISPATCHING) {
            ConsoleOutput.error("Task is no longer awaiting confirmation");
            return 1;
        }
        ConsoleOutput.info("Team dispatched. Waiting for specialists...");
        Optional<TaskView> done = await(receipt.id(), TaskState::isTerminal, deadline);
        if (done.isEmpty()) {
            ConsoleOutput.error("Timed out waiting for the team");
            return 1;
        }
        return finish(done.get());
    }

    private Optional<TaskView> await(String taskId, Predicate<TaskState> reached, long deadline)
            throws InterruptedException {
        while (System.currentTimeMillis() < deadline) {
            Optional<TaskView> task = engine.getTask(taskId);
            if (task.isPresent() && reached.test(task.get().state())) {
                return task;
            }
            Thread.sleep(POLL_MILLIS);
        }
        return Optional.empty();
    }

    private static int finish(TaskView task) {
        task.subtaskResults().forEach(ConsoleOutput::subtask);
        if (task.result() != null) {
            ConsoleOutput.result(task.result());
        } else {
            ConsoleOutput.state(task.state());
        }
        return task.state() == TaskState.DONE ? 0 : 1;
    }
}
