package com.crewdesk.launcher;

import com.crewdesk.backend.BackendException;
import com.crewdesk.backend.BackendRequest;
import com.crewdesk.backend.BackendResult;
import com.crewdesk.backend.CliEnvelope;
import com.crewdesk.backend.ExecutionBackend;
import com.crewdesk.core.config.CrewdeskProperties;
import com.crewdesk.core.events.CrewdeskEvent;
import com.crewdesk.core.events.EventBus;
import com.crewdesk.core.model.DispatchResult;
import com.crewdesk.core.model.DispatchStatus;
import com.crewdesk.core.model.SpecialistSpec;
import com.crewdesk.core.model.SubtaskResult;
import com.crewdesk.core.model.SubtaskStatus;
import com.crewdesk.core.model.TaskRequest;
import com.crewdesk.core.model.TeamSpec;
import com.crewdesk.core.persistence.CheckpointStore;
import com.crewdesk.skills.SkillRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Single-agent mode: each specialist's skill runs as one invocation, one after
 * another, with no lead phase. Uses the same checkpoint layout as a team run.
 */
@Component
public class SequentialFallbackRunner {

    private static final Logger log = LoggerFactory.getLogger(SequentialFallbackRunner.class);

    private final ExecutionBackend backend;
    private final CheckpointStore checkpointStore;
    private final SkillRegistry skillRegistry;
    private final PromptBuilder promptBuilder;
    private final EventBus eventBus;
    private final CrewdeskProperties properties;

    public SequentialFallbackRunner(ExecutionBackend backend, CheckpointStore checkpointStore,
                                    SkillRegistry skillRegistry, PromptBuilder promptBuilder,
                                    EventBus eventBus, CrewdeskProperties properties) {
        this.backend = backend;
        this.checkpointStore = checkpointStore;
        this.skillRegistry = skillRegistry;
        this.promptBuilder = promptBuilder;
        this.eventBus = eventBus;
        this.properties = properties;
    }

    /**
     * Runs every specialist in order. Does not write the final slot.
     */
    DispatchResult run(TeamSpec spec, TaskRequest task, List<String> ids, long deadline) {
        log.info("Running {} skill(s) sequentially for task {}", spec.specialists().size(), task.id());
        List<SubtaskResult> results = new ArrayList<>();

        for (int i = 0; i < spec.specialists().size(); i++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new BackendException("Sequential run for task " + task.id() + " interrupted", null);
            }
            SpecialistSpec s = spec.specialists().get(i);
            String id = ids.get(i);
            checkpointStore.saveSubtaskResult(task.id(), SubtaskResult.running(id, s));
            eventBus.publish(CrewdeskEvent.of("subtask.started", task.id(), id, Map.of("agentName", s.role())));

            long remaining = deadline - System.currentTimeMillis();
            SubtaskResult result;
            if (remaining <= 0) {
                result = SubtaskResult.failed(id, s, null, "Team deadline reached before specialist started", null);
            } else {
                String summary = s.skillPlugin().isEmpty()
                        ? ""
                        : skillRegistry.instructionSummary(s.skillPlugin(), s.skillName(),
                                TeamLauncher.SKILL_SUMMARY_TOKENS);
                String prompt = promptBuilder.sequentialPrompt(task, s, summary);
                checkpointStore.savePrompt(task.id(), id, prompt);
                long timeoutMs = Math.min(properties.getSpecialistTimeoutSeconds() * 1000L, remaining);
                result = invoke(s, id, prompt, timeoutMs);
            }

            checkpointStore.saveSubtaskResult(task.id(), result);
            boolean ok = result.status() == SubtaskStatus.COMPLETED;
            eventBus.publish(CrewdeskEvent.of(ok ? "subtask.completed" : "subtask.failed", task.id(), id,
                    Map.of("agentName", s.role())));
            results.add(result);
        }

        boolean allCompleted = results.stream().allMatch(r -> r.status() == SubtaskStatus.COMPLETED);
        String synthesized = results.stream()
                .filter(r -> r.result() != null && !r.result().isBlank())
                .map(r -> "## " + heading(r) + "\n\n" + r.result())
                .collect(Collectors.joining("\n\n---\n\n"));
        return new DispatchResult(task.id(),
                allCompleted ? DispatchStatus.COMPLETED : DispatchStatus.FAILED,
                results,
                synthesized.isEmpty() ? null : synthesized,
                allCompleted ? null : TeamLauncher.failureReason(results),
                null);
    }

    private SubtaskResult invoke(SpecialistSpec s, String id, String prompt, long timeoutMs) {
        BackendResult br;
        try {
            br = backend.execute(new BackendRequest(prompt, null, properties.getBackend().getTeamModel(),
                    Duration.ofMillis(timeoutMs), null, Map.of()));
        } catch (BackendException e) {
            if (Thread.currentThread().isInterrupted()) throw e;
            return SubtaskResult.failed(id, s, null, e.getMessage(), null);
        }
        String output = CliEnvelope.extractText(br.stdout()).trim();
        if (br.timedOut()) {
            return SubtaskResult.failed(id, s, output.isEmpty() ? null : output,
                    "Specialist timed out after " + Math.max(1, timeoutMs / 1000) + "s", br.exitCode());
        }
        if (br.exitCode() != 0) {
            return SubtaskResult.failed(id, s, output.isEmpty() ? null : output,
                    "CLI exited with code " + br.exitCode(), br.exitCode());
        }
        if (output.isEmpty()) {
            return SubtaskResult.failed(id, s, null, "Empty response", br.exitCode());
        }
        return SubtaskResult.completed(id, s, output, br.exitCode());
    }

    private static String heading(SubtaskResult r) {
        return r.skillPlugin() == null || r.skillPlugin().isEmpty()
                ? r.agentName()
                : r.skillPlugin() + "/" + r.skillName();
    }
}
