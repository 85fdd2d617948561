package com.crewdesk.dispatch.cli;

import com.crewdesk.core.model.DispatchResult;
import com.crewdesk.core.model.DispatchStatus;
import com.crewdesk.core.model.SubtaskResult;
import com.crewdesk.core.model.SubtaskStatus;
import com.crewdesk.core.model.TaskState;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Crewdesk CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) CREWDESK v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [CREWDESK]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void state(TaskState state) {
        String color = switch (state) {
            case DONE -> "fg(green)";
            case FAILED, CANCELLED -> "fg(red)";
            default -> "fg(yellow)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "Status: @|" + color + " " + state.wireName() + "|@"));
    }

    public static void subtask(SubtaskResult result) {
        String status = result.status() == SubtaskStatus.COMPLETED ? "@|fg(green) done|@"
                : result.status() == SubtaskStatus.FAILED ? "@|fg(red) failed|@"
                : "@|fg(yellow) running|@";
        String skill = result.skillPlugin().isEmpty() ? result.agentName()
                : result.skillPlugin() + "/" + result.skillName();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(blue) [" + result.id() + "]|@ " + status + " " + skill
                        + (result.error() != null ? " - " + result.error() : "")));
    }

    public static void result(DispatchResult result) {
        System.out.println("──────────────────────────────────");
        if (result.status() == DispatchStatus.COMPLETED) {
            success("Task completed");
        } else {
            error("Task failed: " + result.reason());
        }
        if (result.estimatedCostUsd() != null) {
            info(String.format(java.util.Locale.US, "Estimated cost: $%.2f", result.estimatedCostUsd()));
        }
        if (result.synthesizedResult() != null && !result.synthesizedResult().isBlank()) {
            System.out.println();
            System.out.println(result.synthesizedResult());
        }
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "task.queued", "task.started", "task.analyzing" -> "@|fg(cyan) [TASK]|@";
            case "task.awaiting_confirmation", "task.confirmed" -> "@|bold,fg(yellow) [CONFIRM]|@";
            case "subtask.started", "subtask.completed", "subtask.failed" -> "@|fg(blue) [SPECIALIST]|@";
            case "team.progress", "team.lead_completed" -> "@|fg(magenta) [TEAM]|@";
            case "task.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "task.failed", "task.stuck" -> "@|fg(red),bold [FAILED]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }
}
