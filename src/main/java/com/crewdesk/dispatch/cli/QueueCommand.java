package com.crewdesk.dispatch.cli;

import com.crewdesk.core.engine.DispatchEngine;
import com.crewdesk.core.model.QueueState;
import com.crewdesk.core.model.TaskRequest;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: crewdesk queue
 * <p>
 * Shows the active task and the waiting list as persisted on disk.
 */
@Command(name = "queue", mixinStandardHelpOptions = true, description = "Show the task queue")
@Component
public class QueueCommand implements Runnable {

    private final DispatchEngine engine;

    public QueueCommand(DispatchEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        QueueState state = engine.queueSnapshot();

        if (state.active() == null) {
            ConsoleOutput.info("No active task");
        } else {
            ConsoleOutput.success("Active: " + line(state.active()));
        }
        if (state.pending().isEmpty()) {
            ConsoleOutput.info("Nothing waiting");
            return;
        }
        System.out.println();
        System.out.printf("  %-4s %-38s %s%n", "POS", "TASK", "TEXT");
        System.out.println("  " + "-".repeat(72));
        int position = 1;
        for (TaskRequest task : state.pending()) {
            System.out.printf("  %-4d %-38s %s%n", position++, task.id(), truncate(task.text(), 40));
        }
    }

    private static String line(TaskRequest task) {
        return task.id() + " " + truncate(task.text(), 40);
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
