package com.crewdesk.launcher;

import com.crewdesk.core.model.SpecialistSpec;
import com.crewdesk.core.model.TaskRequest;
import com.crewdesk.core.model.TeamSpec;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Builds the prompt files written under {@code prompts/} before a team runs.
 */
@Component
public class PromptBuilder {

    public String specialistPrompt(TaskRequest task, SpecialistSpec spec, String specialistId,
                                   Path taskDir, String skillSummary) {
        String summaryBlock = skillSummary == null || skillSummary.isBlank()
                ? ""
                : "\n\nSkill instructions:\n" + skillSummary;
        String plugin = spec.skillPlugin().isEmpty()
                ? "none (general assistance)"
                : spec.skillPlugin() + " / " + spec.skillName();
        String contextKeys = spec.contextKeys().isEmpty() ? "none" : String.join(", ", spec.contextKeys());

        return """
                You are a specialist agent working on a business task.

                Task ID: %s
                Task: %s
                Your role: %s
                Plugin: %s%s

                Your task directory: %s
                Write your results to: %s

                Instructions:
                1. Focus ONLY on your assigned role: %s
                2. Write intermediate progress to %s
                3. Write your final result as a JSON file with: { "status": "completed", "result": "...", "agentName": "%s" }
                4. If you encounter an error, write: { "status": "failed", "error": "...", "agentName": "%s" }
                5. Do NOT attempt tasks outside your assigned role.

                Context keys: %s""".formatted(
                task.id(),
                task.text(),
                spec.role(),
                plugin, summaryBlock,
                taskDir,
                taskDir.resolve("results").resolve(specialistId + ".json"),
                spec.role(),
                taskDir.resolve("checkpoints").resolve(specialistId + "-progress.json"),
                spec.role(),
                spec.role(),
                contextKeys);
    }

    public String leadPrompt(TeamSpec spec, TaskRequest task, Path taskDir) {
        String specialistList = IntStream.range(0, spec.specialists().size())
                .mapToObj(i -> {
                    SpecialistSpec s = spec.specialists().get(i);
                    return "  %d. %s (%s/%s)".formatted(i + 1, s.role(), s.skillPlugin(), s.skillName());
                })
                .collect(Collectors.joining("\n"));

        return """
                You are the team lead coordinating specialists for task %s.

                Task: %s

                %s

                Specialists that will run in parallel after your coordination phase:
                %s

                Task directory: %s
                Budget: ~%s tokens (~$%s)

                Your job in this coordination phase:
                1. Review the task and prepare any shared context the specialists will need.
                2. Write coordination notes to %s
                3. Do NOT implement any specialist tasks yourself.
                4. Keep this phase brief. Specialists will run immediately after.""".formatted(
                task.id(),
                task.text(),
                spec.leadPrompt(),
                specialistList,
                taskDir,
                String.format(Locale.US, "%,d", spec.estimatedCost().estimatedTokens()),
                String.format(Locale.US, "%.2f", spec.estimatedCost().estimatedCostUsd()),
                taskDir.resolve("checkpoints").resolve("lead-notes.json"));
    }

    /**
     * Single-invocation prompt used when team mode is off.
     */
    public String sequentialPrompt(TaskRequest task, SpecialistSpec spec, String skillSummary) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are acting as a ").append(spec.role()).append(" specialist.\n");
        if (!spec.skillPlugin().isEmpty()) {
            sb.append("Use the ").append(spec.skillPlugin()).append('/').append(spec.skillName())
                    .append(" skill to complete this task.\n");
        }
        if (skillSummary != null && !skillSummary.isBlank()) {
            sb.append("\nSkill instructions:\n").append(skillSummary).append('\n');
        }
        sb.append("\nTask: ").append(task.text());
        return sb.toString();
    }
}
