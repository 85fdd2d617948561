package com.crewdesk.core.engine;

import com.crewdesk.backend.BackendException;
import com.crewdesk.context.BusinessContextLoader;
import com.crewdesk.core.agents.AgentStateTracker;
import com.crewdesk.core.analysis.AnalysisException;
import com.crewdesk.core.analysis.TaskAnalyzer;
import com.crewdesk.core.config.CrewdeskProperties;
import com.crewdesk.core.events.CrewdeskEvent;
import com.crewdesk.core.events.EventBus;
import com.crewdesk.core.health.HealthMonitor;
import com.crewdesk.core.logging.MdcContext;
import com.crewdesk.core.matching.SkillMatcher;
import com.crewdesk.core.metrics.CrewdeskMetrics;
import com.crewdesk.core.model.AgentInfo;
import com.crewdesk.core.model.DispatchResult;
import com.crewdesk.core.model.DispatchStatus;
import com.crewdesk.core.model.QueueState;
import com.crewdesk.core.model.SkillMatch;
import com.crewdesk.core.model.SpecialistSpec;
import com.crewdesk.core.model.TaskDecomposition;
import com.crewdesk.core.model.TaskRequest;
import com.crewdesk.core.model.TaskState;
import com.crewdesk.core.model.TeamSpec;
import com.crewdesk.core.persistence.CheckpointStore;
import com.crewdesk.core.persistence.SpendLedger;
import com.crewdesk.core.persistence.TaskSnapshot;
import com.crewdesk.core.queue.QueueListener;
import com.crewdesk.core.queue.TaskQueue;
import com.crewdesk.core.team.BudgetDecision;
import com.crewdesk.core.team.BudgetGuard;
import com.crewdesk.core.team.TeamAssembler;
import com.crewdesk.launcher.TeamLauncher;
import com.crewdesk.skills.SkillRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Owns the task pipeline: submit, analyse, await confirmation, assemble and
 * budget-check the team, launch it, and advance the queue.
 * <p>
 * Exactly one task holds the {@link ActiveRun} at a time. Phases run on a
 * single pipeline thread; the stuck path runs on the health monitor's thread
 * and races the launch phase through {@link ActiveRun#terminate()}. Queue
 * advancement and the confirm/cancel gates are serialized on this engine.
 */
@Service
public class DispatchEngine implements QueueListener {

    private static final Logger log = LoggerFactory.getLogger(DispatchEngine.class);

    static final String LEAD_ROLE = "lead";
    static final String RESTART_REASON = "interrupted by restart";
    private static final String CANCELLED_CHECKPOINT = "cancelled";

    private final TaskQueue queue;
    private final CheckpointStore checkpointStore;
    private final TaskAnalyzer analyzer;
    private final SkillMatcher matcher;
    private final SkillRegistry skillRegistry;
    private final TeamAssembler assembler;
    private final BudgetGuard budgetGuard;
    private final SpendLedger spendLedger;
    private final TeamLauncher launcher;
    private final HealthMonitor healthMonitor;
    private final AgentStateTracker agentState;
    private final BusinessContextLoader contextLoader;
    private final EventBus eventBus;
    private final CrewdeskMetrics metrics;
    private final CrewdeskProperties properties;

    private final TaskBoard board = new TaskBoard();
    private final AtomicReference<ActiveRun> activeRun = new AtomicReference<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final ExecutorService pipeline;

    public DispatchEngine(TaskQueue queue, CheckpointStore checkpointStore, TaskAnalyzer analyzer,
                          SkillMatcher matcher, SkillRegistry skillRegistry, TeamAssembler assembler,
                          BudgetGuard budgetGuard, SpendLedger spendLedger, TeamLauncher launcher,
                          HealthMonitor healthMonitor, AgentStateTracker agentState,
                          BusinessContextLoader contextLoader, EventBus eventBus,
                          CrewdeskMetrics metrics, CrewdeskProperties properties) {
        this.queue = queue;
        this.checkpointStore = checkpointStore;
        this.analyzer = analyzer;
        this.matcher = matcher;
        this.skillRegistry = skillRegistry;
        this.assembler = assembler;
        this.budgetGuard = budgetGuard;
        this.spendLedger = spendLedger;
        this.launcher = launcher;
        this.healthMonitor = healthMonitor;
        this.agentState = agentState;
        this.contextLoader = contextLoader;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
        this.pipeline = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "crewdesk-pipeline");
            t.setDaemon(true);
            return t;
        });
        queue.addListener(this);
        healthMonitor.addStuckHandler(this::onStuck);
    }

    /**
     * Prunes expired task directories, then reconciles the persisted queue
     * with the checkpoints on disk and resumes processing. Idempotent.
     */
    public synchronized void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        int removed = checkpointStore.cleanupOlderThan(Duration.ofDays(properties.getRetention().getMaxAgeDays()));
        if (removed > 0) {
            log.info("Retention cleanup removed {} task(s)", removed);
        }
        queue.getPending().forEach(t -> board.put(t.id(), TaskState.QUEUED));

        Optional<TaskRequest> active = queue.getActive();
        if (active.isPresent()) {
            recover(active.get());
        } else {
            queue.dequeue();
        }
    }

    public boolean isStarted() {
        return started.get();
    }

    /**
     * Persists and queues a new task. Starts the engine if it is not running yet.
     *
     * @throws IllegalArgumentException if the text is blank
     */
    public SubmitReceipt submit(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Task text must not be blank");
        }
        start();
        TaskRequest task = new TaskRequest(UUID.randomUUID().toString(), text.trim(), System.currentTimeMillis());
        checkpointStore.saveRequest(task);
        board.put(task.id(), TaskState.QUEUED);
        publish("task.queued", task.id(), Map.of("text", task.text()));

        int position;
        synchronized (this) {
            position = queue.enqueue(task);
        }
        log.info("Submitted task {} at position {}", task.id(), position);
        return new SubmitReceipt(task.id(), task.text(), position, task.createdAt());
    }

    /**
     * Confirms the decomposition of the task awaiting confirmation and starts
     * the dispatch phase.
     *
     * @param edited replacement decomposition, or null to keep the analysed one
     */
    public synchronized ConfirmOutcome confirm(String taskId, TaskDecomposition edited) {
        if (!exists(taskId)) {
            return ConfirmOutcome.NOT_FOUND;
        }
        ActiveRun run = activeRun.get();
        if (run == null || !run.taskId().equals(taskId) || run.isTerminated()
                || !board.transition(taskId, TaskState.DISPATCHING)) {
            return ConfirmOutcome.NOT_CONFIRMING;
        }
        if (edited != null) {
            checkpointStore.saveDecomposition(taskId, edited);
        }
        publish("task.confirmed", taskId, Map.of("edited", edited != null));
        TaskRequest task = checkpointStore.loadRequest(taskId)
                .orElseThrow(() -> new IllegalStateException("Request checkpoint missing for " + taskId));
        schedule(run, () -> dispatchPhase(run, task));
        return ConfirmOutcome.DISPATCHING;
    }

    /**
     * Cancels a queued task or the task awaiting confirmation. Running work is
     * never cancelled here; the health monitor halts stuck teams.
     */
    public synchronized CancelOutcome cancel(String taskId) {
        int position = queue.getPosition(taskId);
        if (position > 0) {
            if (!board.transition(taskId, TaskState.CANCELLED) || !queue.cancel(taskId)) {
                return CancelOutcome.NOT_CANCELLABLE;
            }
            markCancelled(taskId);
            return CancelOutcome.CANCELLED;
        }
        if (position == 0) {
            ActiveRun run = activeRun.get();
            if (run == null || !run.taskId().equals(taskId) || !board.transition(taskId, TaskState.CANCELLED)) {
                return CancelOutcome.NOT_CANCELLABLE;
            }
            run.terminate();
            run.interrupt();
            activeRun.compareAndSet(run, null);
            queue.cancel(taskId);
            markCancelled(taskId);
            queue.dequeue();
            return CancelOutcome.CANCELLED;
        }
        return exists(taskId) ? CancelOutcome.NOT_CANCELLABLE : CancelOutcome.NOT_FOUND;
    }

    public Optional<TaskView> getTask(String taskId) {
        return checkpointStore.loadTask(taskId)
                .filter(s -> s.request() != null)
                .map(this::view);
    }

    public List<TaskView> listTasks() {
        return checkpointStore.listTasks().stream()
                .map(checkpointStore::loadTask)
                .flatMap(Optional::stream)
                .filter(s -> s.request() != null)
                .map(this::view)
                .sorted(Comparator.comparingLong(TaskView::createdAt))
                .toList();
    }

    public QueueState queueSnapshot() {
        return queue.snapshot();
    }

    // -- queue callbacks --------------------------------------------------

    @Override
    public synchronized void onStarted(TaskRequest task) {
        ActiveRun run = claim(task.id());
        board.put(task.id(), board.get(task.id()).orElse(TaskState.QUEUED));
        publish("task.started", task.id(), Map.of());
        schedule(run, () -> analyzePhase(run, task));
    }

    @Override
    public void onQueued(TaskRequest task, int position) {
        eventBus.publish(CrewdeskEvent.of("queue.position", task.id(), Map.of("position", position)));
    }

    // -- phases -----------------------------------------------------------

    private void analyzePhase(ActiveRun run, TaskRequest task) {
        if (run.isTerminated() || !board.transition(task.id(), TaskState.ANALYZING)) {
            return;
        }
        publish("task.analyzing", task.id(), Map.of());

        TaskDecomposition decomposition;
        try {
            decomposition = analyzer.analyze(task.text());
        } catch (AnalysisException e) {
            fail(run, "Analysis failed: " + e.getMessage(), null);
            return;
        }
        if (run.isTerminated()) {
            return;
        }
        checkpointStore.saveDecomposition(task.id(), decomposition);

        TeamPlan plan = planTeam(decomposition);
        board.transition(task.id(), TaskState.CONFIRMING);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("decomposition", decomposition);
        payload.put("matches", plan.matches());
        payload.put("specialists", roles(plan.team()));
        payload.put("estimatedCost", plan.team().estimatedCost());
        publish("task.awaiting_confirmation", task.id(), payload);
        log.info("Task {} analysed into {} sub-task(s); awaiting confirmation",
                task.id(), decomposition.subtasks().size());
    }

    private void dispatchPhase(ActiveRun run, TaskRequest task) {
        String taskId = task.id();
        Optional<TaskDecomposition> decomposition = checkpointStore.loadDecomposition(taskId);
        if (decomposition.isEmpty()) {
            fail(run, "No decomposition to dispatch", null);
            return;
        }

        TeamSpec team = planTeam(decomposition.get()).team();
        double cost = team.estimatedCost().estimatedCostUsd();
        checkpointStore.saveCheckpoint(taskId, "team", team);
        publish("task.team_assembled", taskId, Map.of(
                "specialists", roles(team),
                "teamSize", team.teamSize(),
                "estimatedCostUsd", cost));

        BudgetDecision decision = budgetGuard.check(team.estimatedCost());
        if (!decision.allowed()) {
            log.warn("Task {} rejected by budget guard: {}", taskId, decision.reason());
            metrics.recordBudgetRejection(decision.scope());
            fail(run, decision.reason(), cost);
            return;
        }
        spendLedger.commit(cost);
        metrics.recordEstimatedCost(cost);
        metrics.recordTeamSize(team.specialists().size());
        retireAgentsOtherThan(taskId);

        board.transition(taskId, TaskState.IN_PROGRESS);
        publish("task.in_progress", taskId, Map.of("estimatedCostUsd", cost));
        healthMonitor.startMonitoring(taskId, Duration.ofSeconds(properties.getInactivityTimeoutSeconds()));

        DispatchResult result;
        try {
            result = launcher.launch(team, task);
        } catch (BackendException e) {
            if (run.isTerminated()) {
                log.info("Team for task {} halted: {}", taskId, e.getMessage());
                agentState.clearForTask(taskId);
                return;
            }
            fail(run, "Team launch failed: " + e.getMessage(), cost);
            return;
        } finally {
            healthMonitor.stopMonitoring(taskId);
        }
        if (run.isTerminated()) {
            // halted while the team was settling; drop agent updates made after the halt
            agentState.clearForTask(taskId);
            return;
        }
        complete(run, result);
    }

    // -- terminal paths ---------------------------------------------------

    private void complete(ActiveRun run, DispatchResult result) {
        if (!run.terminate()) {
            return;
        }
        settle(run.taskId(), result, "task.completed");
        release(run);
    }

    private void fail(ActiveRun run, String reason, Double estimatedCostUsd) {
        if (!run.terminate()) {
            return;
        }
        String taskId = run.taskId();
        DispatchResult result = new DispatchResult(taskId, DispatchStatus.FAILED, List.of(), null, reason, estimatedCostUsd);
        if (!checkpointStore.saveFinalOnce(taskId, result)) {
            result = checkpointStore.loadFinal(taskId).orElse(result);
        }
        settle(taskId, result, "task.completed");
        release(run);
    }

    /**
     * Health monitor callback: force-writes a stuck result, interrupts the
     * team and frees the active slot.
     */
    void onStuck(String taskId, Duration idle) {
        ActiveRun run = activeRun.get();
        if (run == null || !run.taskId().equals(taskId) || !run.terminate()) {
            return;
        }
        MdcContext.setTask(taskId);
        try {
            DispatchResult stuck = DispatchResult.stuck(taskId, "no progress for " + idle.toSeconds() + "s",
                    checkpointStore.loadSubtaskResults(taskId));
            boolean written = checkpointStore.saveFinalOnce(taskId, stuck);
            run.interrupt();
            if (written) {
                metrics.recordStuckTask();
            }
            DispatchResult outcome = written ? stuck : checkpointStore.loadFinal(taskId).orElse(stuck);
            settle(taskId, outcome, outcome.isStuck() ? "task.stuck" : "task.completed");
            release(run);
        } finally {
            MdcContext.clear();
        }
    }

    private void settle(String taskId, DispatchResult result, String successEvent) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", result.status().wireName());
        if (result.reason() != null) {
            payload.put("reason", result.reason());
        }
        if (result.status() == DispatchStatus.COMPLETED) {
            board.transition(taskId, TaskState.REVIEW);
            board.transition(taskId, TaskState.DONE);
            publish(successEvent, taskId, payload);
        } else {
            board.transition(taskId, TaskState.FAILED);
            publish(result.isStuck() ? "task.stuck" : "task.failed", taskId, payload);
        }
        metrics.recordTaskResult(result.status().wireName());
        agentState.clearForTask(taskId);
        log.info("Task {} finished: {}{}", taskId, result.status().wireName(),
                result.reason() != null ? " (" + result.reason() + ")" : "");
    }

    private synchronized void release(ActiveRun run) {
        activeRun.compareAndSet(run, null);
        queue.completeActive();
        queue.dequeue();
    }

    // -- recovery ---------------------------------------------------------

    private void recover(TaskRequest task) {
        TaskSnapshot snapshot = checkpointStore.loadTask(task.id())
                .orElse(new TaskSnapshot(task, null, List.of(), null));
        if (snapshot.hasFinal()) {
            log.info("Recovered task {} already finished; advancing queue", task.id());
            board.put(task.id(), terminalState(snapshot.finalResult()));
            queue.completeActive();
            queue.dequeue();
            return;
        }
        if (!snapshot.subtaskResults().isEmpty()) {
            log.warn("Recovered task {} was mid-execution; marking failed", task.id());
            DispatchResult failed = new DispatchResult(task.id(), DispatchStatus.FAILED,
                    snapshot.subtaskResults(), null, RESTART_REASON, null);
            checkpointStore.saveFinalOnce(task.id(), failed);
            board.put(task.id(), TaskState.FAILED);
            metrics.recordTaskResult(DispatchStatus.FAILED.wireName());
            publish("task.failed", task.id(), Map.of("status", "failed", "reason", RESTART_REASON));
            queue.completeActive();
            queue.dequeue();
            return;
        }

        ActiveRun run = claim(task.id());
        if (snapshot.hasDecomposition()) {
            log.info("Recovered task {} awaiting confirmation", task.id());
            board.put(task.id(), TaskState.CONFIRMING);
            publish("task.awaiting_confirmation", task.id(), Map.of("decomposition", snapshot.decomposition()));
        } else {
            log.info("Recovered task {} had not been analysed; re-analysing", task.id());
            board.put(task.id(), TaskState.QUEUED);
            schedule(run, () -> analyzePhase(run, task));
        }
    }

    // -- helpers ----------------------------------------------------------

    private ActiveRun claim(String taskId) {
        ActiveRun run = new ActiveRun(taskId);
        if (!activeRun.compareAndSet(null, run)) {
            throw new IllegalStateException("Cannot start task " + taskId
                    + " while task " + activeRun.get().taskId() + " is active");
        }
        return run;
    }

    private void schedule(ActiveRun run, Runnable phase) {
        run.attach(pipeline.submit(() -> {
            MdcContext.setTask(run.taskId());
            try {
                phase.run();
            } catch (RuntimeException e) {
                log.error("Pipeline phase for task {} failed", run.taskId(), e);
                fail(run, "Unexpected error: " + e.getMessage(), null);
            } finally {
                MdcContext.clear();
            }
        }));
    }

    private TeamPlan planTeam(TaskDecomposition decomposition) {
        List<SkillMatch> matches = matcher.match(decomposition.subtasks(), skillRegistry);
        TeamSpec team = assembler.assemble(matches, contextLoader.loadContext(LEAD_ROLE),
                decomposition.estimatedComplexity());
        return new TeamPlan(matches, team);
    }

    private void retireAgentsOtherThan(String taskId) {
        Set<String> previous = agentState.getAll().stream()
                .map(AgentInfo::taskId)
                .filter(id -> id != null && !id.equals(taskId))
                .collect(Collectors.toSet());
        previous.forEach(agentState::clearForTask);
    }

    private void markCancelled(String taskId) {
        agentState.clearForTask(taskId);
        checkpointStore.saveCheckpoint(taskId, CANCELLED_CHECKPOINT, Map.of("cancelledAt", System.currentTimeMillis()));
        publish("task.cancelled", taskId, Map.of());
        log.info("Task {} cancelled", taskId);
    }

    private boolean exists(String taskId) {
        return board.get(taskId).isPresent() || checkpointStore.loadRequest(taskId).isPresent();
    }

    private TaskView view(TaskSnapshot snapshot) {
        TaskRequest request = snapshot.request();
        int position = queue.getPosition(request.id());
        TaskState state = board.get(request.id()).orElseGet(() -> derive(snapshot, position));
        return new TaskView(request.id(), request.text(), request.createdAt(), state, position,
                snapshot.decomposition(), snapshot.subtaskResults(), snapshot.finalResult());
    }

    private TaskState derive(TaskSnapshot snapshot, int position) {
        if (snapshot.hasFinal()) {
            return terminalState(snapshot.finalResult());
        }
        String taskId = snapshot.request().id();
        if (Files.exists(checkpointStore.checkpointsDir(taskId).resolve(CANCELLED_CHECKPOINT + ".json"))) {
            return TaskState.CANCELLED;
        }
        if (position > 0) {
            return TaskState.QUEUED;
        }
        return snapshot.hasDecomposition() ? TaskState.CONFIRMING : TaskState.QUEUED;
    }

    private static TaskState terminalState(DispatchResult result) {
        return result.status() == DispatchStatus.COMPLETED ? TaskState.DONE : TaskState.FAILED;
    }

    private static List<String> roles(TeamSpec team) {
        return team.specialists().stream().map(SpecialistSpec::role).toList();
    }

    private void publish(String type, String taskId, Map<String, Object> payload) {
        eventBus.publish(CrewdeskEvent.of(type, taskId, payload));
    }

    @PreDestroy
    public void shutdown() {
        pipeline.shutdownNow();
    }

    private record TeamPlan(List<SkillMatch> matches, TeamSpec team) {
    }
}
