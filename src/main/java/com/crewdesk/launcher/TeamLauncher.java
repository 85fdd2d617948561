package com.crewdesk.launcher;

import com.crewdesk.backend.BackendException;
import com.crewdesk.backend.BackendRequest;
import com.crewdesk.backend.BackendResult;
import com.crewdesk.backend.CliEnvelope;
import com.crewdesk.backend.ExecutionBackend;
import com.crewdesk.core.agents.AgentStateTracker;
import com.crewdesk.core.agents.AgentUpdate;
import com.crewdesk.core.config.CrewdeskProperties;
import com.crewdesk.core.events.CrewdeskEvent;
import com.crewdesk.core.events.EventBus;
import com.crewdesk.core.logging.MdcContext;
import com.crewdesk.core.metrics.CrewdeskMetrics;
import com.crewdesk.core.model.AgentInfo;
import com.crewdesk.core.model.AgentStatus;
import com.crewdesk.core.model.DispatchResult;
import com.crewdesk.core.model.DispatchStatus;
import com.crewdesk.core.model.SpecialistSpec;
import com.crewdesk.core.model.SubtaskResult;
import com.crewdesk.core.model.SubtaskStatus;
import com.crewdesk.core.model.TaskRequest;
import com.crewdesk.core.model.TeamSpec;
import com.crewdesk.core.persistence.CheckpointStore;
import com.crewdesk.skills.SkillRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Runs a confirmed team against the execution backend.
 * <ol>
 *   <li>Writes one prompt per specialist and a lead prompt under {@code prompts/}.</li>
 *   <li>Runs the lead to completion and records it in {@code checkpoints/lead-coordination.json}.</li>
 *   <li>Runs every specialist concurrently, each under its own timeout and never past the team deadline.</li>
 *   <li>Writes each {@link SubtaskResult} as it settles, then the {@link DispatchResult} once.</li>
 * </ol>
 * One specialist failing never affects the others. Interrupting the calling
 * thread cancels every running invocation and raises {@link BackendException}.
 * <p>
 * With team mode off the skills run one after another through {@link SequentialFallbackRunner}.
 */
@Component
public class TeamLauncher {

    private static final Logger log = LoggerFactory.getLogger(TeamLauncher.class);

    static final int SKILL_SUMMARY_TOKENS = 2000;
    static final String NON_ZERO_EXIT = "Process exited with non-zero code";
    static final Map<String, String> TEAM_ENV = Map.of(
            "CLAUDE_CODE_EXPERIMENTAL_AGENT_TEAMS", "1",
            "CLAUDECODE", "");

    private final ExecutionBackend backend;
    private final CheckpointStore checkpointStore;
    private final SkillRegistry skillRegistry;
    private final AgentStateTracker agentState;
    private final TeamMonitor teamMonitor;
    private final PromptBuilder promptBuilder;
    private final SequentialFallbackRunner fallbackRunner;
    private final EventBus eventBus;
    private final CrewdeskMetrics metrics;
    private final CrewdeskProperties properties;
    private final ExecutorService specialistPool;

    @Autowired
    public TeamLauncher(ExecutionBackend backend, CheckpointStore checkpointStore, SkillRegistry skillRegistry,
                        AgentStateTracker agentState, TeamMonitor teamMonitor, PromptBuilder promptBuilder,
                        SequentialFallbackRunner fallbackRunner, EventBus eventBus, CrewdeskMetrics metrics,
                        CrewdeskProperties properties) {
        this.backend = backend;
        this.checkpointStore = checkpointStore;
        this.skillRegistry = skillRegistry;
        this.agentState = agentState;
        this.teamMonitor = teamMonitor;
        this.promptBuilder = promptBuilder;
        this.fallbackRunner = fallbackRunner;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
        AtomicInteger counter = new AtomicInteger();
        this.specialistPool = Executors.newFixedThreadPool(
                Math.max(1, properties.getMaxSpecialists()),
                r -> {
                    Thread t = new Thread(r, "crewdesk-specialist-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
    }

    /**
     * Runs the team to completion and returns its terminal result. If another
     * path already wrote the final slot, that stored result is returned instead.
     */
    public DispatchResult launch(TeamSpec spec, TaskRequest task) {
        Path taskDir = checkpointStore.taskDir(task.id());
        long deadline = System.currentTimeMillis() + properties.getTotalTimeoutSeconds() * 1000L;
        List<String> ids = SpecialistIds.assign(spec.specialists());

        try (TeamMonitor.Watch watch = teamMonitor.watch(task.id(), taskDir,
                properties.getTeam().getMonitorPollMillis())) {
            DispatchResult result = properties.isTeamMode()
                    ? runTeam(spec, task, ids, taskDir, deadline, watch)
                    : fallbackRunner.run(spec, task, ids, deadline);
            result = withCost(result, spec.estimatedCost().estimatedCostUsd());

            if (!checkpointStore.saveFinalOnce(task.id(), result)) {
                log.warn("Final result for task {} was already written; discarding team result", task.id());
                return checkpointStore.loadFinal(task.id()).orElse(result);
            }
            log.info("Team for task {} finished: {}", task.id(), result.status().wireName());
            return result;
        }
    }

    private DispatchResult runTeam(TeamSpec spec, TaskRequest task, List<String> ids, Path taskDir, long deadline,
                                   TeamMonitor.Watch watch) {
        Map<String, String> prompts = new LinkedHashMap<>();
        for (int i = 0; i < spec.specialists().size(); i++) {
            SpecialistSpec s = spec.specialists().get(i);
            String summary = s.skillPlugin().isEmpty()
                    ? ""
                    : skillRegistry.instructionSummary(s.skillPlugin(), s.skillName(), SKILL_SUMMARY_TOKENS);
            String prompt = promptBuilder.specialistPrompt(task, s, ids.get(i), taskDir, summary);
            checkpointStore.savePrompt(task.id(), ids.get(i), prompt);
            prompts.put(ids.get(i), prompt);
        }
        String leadPrompt = promptBuilder.leadPrompt(spec, task, taskDir);
        checkpointStore.savePrompt(task.id(), "lead", leadPrompt);

        for (int i = 0; i < spec.specialists().size(); i++) {
            SpecialistSpec s = spec.specialists().get(i);
            String id = ids.get(i);
            eventBus.publish(CrewdeskEvent.of("subtask.started", task.id(), id,
                    Map.of("agentName", s.role())));
            AgentInfo agent = agentState.upsertAgent(AgentUpdate.of(agentId(task, id))
                    .name(s.role()).status(AgentStatus.ACTIVE).taskId(task.id()).subtaskId(id)
                    .lastAction("queued").build());
            eventBus.publish(CrewdeskEvent.of("agent.connected", task.id(), id, Map.of("agent", agent)));
        }

        runLead(task, leadPrompt, deadline, watch);

        List<Future<SubtaskResult>> futures = new ArrayList<>();
        for (int i = 0; i < spec.specialists().size(); i++) {
            SpecialistSpec s = spec.specialists().get(i);
            String id = ids.get(i);
            String prompt = prompts.get(id);
            futures.add(specialistPool.submit(() -> runSpecialist(task, s, id, prompt, deadline)));
        }

        List<SubtaskResult> results = new ArrayList<>();
        try {
            for (int i = 0; i < futures.size(); i++) {
                results.add(await(futures.get(i), spec.specialists().get(i), ids.get(i)));
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new BackendException("Team run for task " + task.id() + " interrupted", e);
        }
        return compose(task.id(), results);
    }

    /**
     * Runs the lead and records how it went. The lead writes nothing the monitor
     * sees while it works, so its start and end are checkpointed and polled
     * straight away, and its timeout stays inside the inactivity window.
     * A lead that fails or cannot be launched is recorded; specialists still run.
     */
    private void runLead(TaskRequest task, String leadPrompt, long deadline, TeamMonitor.Watch watch) {
        long timeoutMs = leadTimeoutMillis(deadline);
        checkpointStore.saveCheckpoint(task.id(), "lead-started", Map.of(
                "startedAt", System.currentTimeMillis(),
                "timeoutMs", timeoutMs));
        watch.poll();

        Map<String, Object> record = new LinkedHashMap<>();
        record.put("action", "coordination");
        BackendResult lead = null;
        try {
            lead = backend.execute(new BackendRequest(leadPrompt, null,
                    properties.getBackend().getTeamModel(), Duration.ofMillis(timeoutMs), null, TEAM_ENV));
            record.put("detail", lead.succeeded()
                    ? "Lead coordination phase completed"
                    : lead.timedOut() ? "Lead coordination phase timed out" : "Lead coordination phase failed");
            record.put("stdout", lead.stdout());
            record.put("code", lead.exitCode());
        } catch (BackendException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw e;
            }
            record.put("detail", "Lead coordination phase could not run");
            record.put("error", e.getMessage());
            record.put("code", null);
        }
        checkpointStore.saveCheckpoint(task.id(), "lead-coordination", record);
        watch.poll();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("exitCode", lead != null ? lead.exitCode() : null);
        payload.put("timedOut", lead != null && lead.timedOut());
        eventBus.publish(CrewdeskEvent.of("team.lead_completed", task.id(), payload));
        if (lead == null) {
            log.warn("Lead for task {} could not run ({}); continuing with specialists", task.id(), record.get("error"));
        } else if (!lead.succeeded()) {
            log.warn("Lead for task {} did not succeed (exit {}, timedOut={}); continuing with specialists",
                    task.id(), lead.exitCode(), lead.timedOut());
        }
    }

    /**
     * min(specialist timeout, time left before the team deadline, four fifths of
     * the inactivity window), at least one millisecond.
     */
    long leadTimeoutMillis(long deadline) {
        long inactivityCap = properties.getInactivityTimeoutSeconds() * 1000L * 4 / 5;
        long timeoutMs = Math.min(properties.getSpecialistTimeoutSeconds() * 1000L,
                Math.min(remaining(deadline), inactivityCap));
        return Math.max(timeoutMs, 1);
    }

    SubtaskResult runSpecialist(TaskRequest task, SpecialistSpec spec, String id, String prompt, long deadline) {
        MdcContext.setSpecialist(task.id(), id, spec.skillPlugin() + "/" + spec.skillName());
        String agentId = agentId(task, id);
        try {
            checkpointStore.saveSubtaskResult(task.id(), SubtaskResult.running(id, spec));
            agentState.upsertAgent(AgentUpdate.of(agentId).lastAction("running").build());
            agentState.addLog(agentId, "started");

            long remaining = remaining(deadline);
            SubtaskResult result;
            long start = System.currentTimeMillis();
            if (remaining <= 0) {
                result = SubtaskResult.failed(id, spec, null, "Team deadline reached before specialist started", null);
            } else {
                long timeoutMs = Math.min(properties.getSpecialistTimeoutSeconds() * 1000L, remaining);
                BackendResult br = backend.execute(new BackendRequest(prompt, null,
                        properties.getBackend().getTeamModel(), Duration.ofMillis(timeoutMs), null, TEAM_ENV));
                result = toSubtaskResult(id, spec, br, timeoutMs);
            }
            metrics.recordSpecialistExecution(spec.skillPlugin(), result.status().wireName(),
                    System.currentTimeMillis() - start);
            settle(task, id, spec, result);
            return result;
        } catch (BackendException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw e;
            }
            SubtaskResult failed = SubtaskResult.failed(id, spec, null, e.getMessage(), null);
            settle(task, id, spec, failed);
            return failed;
        } finally {
            MdcContext.clear();
        }
    }

    static SubtaskResult toSubtaskResult(String id, SpecialistSpec spec, BackendResult br, long timeoutMs) {
        String output = CliEnvelope.extractText(br.stdout());
        if (br.timedOut()) {
            return SubtaskResult.failed(id, spec, output.isEmpty() ? null : output,
                    "Specialist timed out after " + Math.max(1, timeoutMs / 1000) + "s", br.exitCode());
        }
        if (br.exitCode() != 0) {
            String error = br.stderr() != null && !br.stderr().isBlank() ? br.stderr().trim() : NON_ZERO_EXIT;
            return SubtaskResult.failed(id, spec, output.isEmpty() ? null : output, error, br.exitCode());
        }
        return SubtaskResult.completed(id, spec, output, br.exitCode());
    }

    private void settle(TaskRequest task, String id, SpecialistSpec spec, SubtaskResult result) {
        checkpointStore.saveSubtaskResult(task.id(), result);
        boolean ok = result.status() == SubtaskStatus.COMPLETED;
        AgentInfo agent = agentState.upsertAgent(AgentUpdate.of(agentId(task, id))
                .status(ok ? AgentStatus.IDLE : AgentStatus.ERROR)
                .lastAction(ok ? "completed" : "failed")
                .error(ok ? null : result.error())
                .build());
        agentState.addLog(agentId(task, id), ok ? "completed" : "failed: " + result.error());
        eventBus.publish(CrewdeskEvent.of("agent.status_changed", task.id(), id, Map.of("agent", agent)));
        eventBus.publish(CrewdeskEvent.of(ok ? "subtask.completed" : "subtask.failed", task.id(), id,
                ok ? Map.of("agentName", spec.role())
                   : Map.of("agentName", spec.role(), "error", String.valueOf(result.error()))));
        log.info("Specialist {} {}", id, result.status().wireName());
    }

    private SubtaskResult await(Future<SubtaskResult> future, SpecialistSpec spec, String id)
            throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Specialist {} crashed: {}", id, cause.getMessage(), cause);
            return SubtaskResult.failed(id, spec, null, String.valueOf(cause.getMessage()), null);
        }
    }

    /**
     * Completed iff every specialist completed. The synthesized result joins the
     * output of completed specialists with blank lines.
     */
    static DispatchResult compose(String taskId, List<SubtaskResult> results) {
        boolean allCompleted = !results.isEmpty()
                && results.stream().allMatch(r -> r.status() == SubtaskStatus.COMPLETED);
        String synthesized = results.stream()
                .filter(r -> r.status() == SubtaskStatus.COMPLETED && r.result() != null)
                .map(SubtaskResult::result)
                .collect(Collectors.joining("\n\n"));
        String reason = allCompleted ? null : failureReason(results);
        return new DispatchResult(taskId,
                allCompleted ? DispatchStatus.COMPLETED : DispatchStatus.FAILED,
                results, synthesized, reason, null);
    }

    static String failureReason(List<SubtaskResult> results) {
        List<String> failed = results.stream()
                .filter(r -> r.status() != SubtaskStatus.COMPLETED)
                .map(r -> r.agentName() + ": " + r.error())
                .toList();
        if (failed.isEmpty()) return "No specialists ran";
        return failed.size() + " of " + results.size() + " specialist(s) failed (" + String.join("; ", failed) + ")";
    }

    private static DispatchResult withCost(DispatchResult r, double costUsd) {
        return new DispatchResult(r.taskId(), r.status(), r.subtasks(), r.synthesizedResult(), r.reason(), costUsd);
    }

    private static String agentId(TaskRequest task, String specialistId) {
        return task.id() + "-" + specialistId;
    }

    private static long remaining(long deadline) {
        return deadline - System.currentTimeMillis();
    }

    @PreDestroy
    public void shutdown() {
        specialistPool.shutdownNow();
    }
}
