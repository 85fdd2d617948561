package com.crewdesk.launcher;

import com.crewdesk.backend.BackendException;
import com.crewdesk.backend.BackendRequest;
import com.crewdesk.backend.BackendResult;
import com.crewdesk.backend.ExecutionBackend;
import com.crewdesk.core.agents.AgentStateTracker;
import com.crewdesk.core.config.CrewdeskProperties;
import com.crewdesk.core.events.CrewdeskEvent;
import com.crewdesk.core.events.EventBus;
import com.crewdesk.core.health.HealthMonitor;
import com.crewdesk.core.metrics.CrewdeskMetrics;
import com.crewdesk.core.model.AgentStatus;
import com.crewdesk.core.model.CostEstimate;
import com.crewdesk.core.model.DispatchResult;
import com.crewdesk.core.model.DispatchStatus;
import com.crewdesk.core.model.SpecialistSpec;
import com.crewdesk.core.model.SubtaskResult;
import com.crewdesk.core.model.SubtaskStatus;
import com.crewdesk.core.model.TaskRequest;
import com.crewdesk.core.model.TeamSpec;
import com.crewdesk.core.persistence.CheckpointStore;
import com.crewdesk.skills.SkillRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TeamLauncherTest {

    @TempDir
    Path tasksRoot;

    private CrewdeskProperties properties;
    private CheckpointStore store;
    private EventBus eventBus;
    private AgentStateTracker agentState;
    private HealthMonitor healthMonitor;
    private TeamMonitor teamMonitor;
    private SimpleMeterRegistry registry;
    private ScriptedBackend backend;
    private TeamLauncher launcher;
    private final List<CrewdeskEvent> events = new CopyOnWriteArrayList<>();

    private static final TaskRequest TASK = new TaskRequest("t1", "Prepare the spring promotion", 1L);
    private static final SpecialistSpec WRITER = new SpecialistSpec("Writer", "marketing", "copy", List.of());
    private static final SpecialistSpec ANALYST = new SpecialistSpec("Analyst", "data", "report", List.of());

    /** Answers by prompt; counts lead invocations separately. */
    static final class ScriptedBackend implements ExecutionBackend {
        final Map<String, Function<BackendRequest, BackendResult>> byRole = new ConcurrentHashMap<>();
        final List<BackendRequest> requests = new CopyOnWriteArrayList<>();
        volatile BackendResult leadResult = new BackendResult(0, "lead ok", "", false, 5);
        volatile Function<BackendRequest, BackendResult> leadBehaviour;

        @Override
        public BackendResult execute(BackendRequest request) {
            requests.add(request);
            if (request.prompt().startsWith("You are the team lead")) {
                Function<BackendRequest, BackendResult> behaviour = leadBehaviour;
                return behaviour != null ? behaviour.apply(request) : leadResult;
            }
            for (var entry : byRole.entrySet()) {
                if (request.prompt().contains("Your role: " + entry.getKey())
                        || request.prompt().contains("acting as a " + entry.getKey())) {
                    return entry.getValue().apply(request);
                }
            }
            return new BackendResult(0, "default", "", false, 1);
        }

        @Override
        public String name() {
            return "scripted";
        }

        @Override
        public boolean isAvailable() {
            return true;
        }

        long leadCalls() {
            return requests.stream().filter(r -> r.prompt().startsWith("You are the team lead")).count();
        }
    }

    @BeforeEach
    void setUp() {
        properties = new CrewdeskProperties();
        properties.getTeam().setMonitorPollMillis(50);
        store = new CheckpointStore(tasksRoot);
        eventBus = new EventBus();
        eventBus.subscribeAll(events::add);
        agentState = new AgentStateTracker();
        healthMonitor = new HealthMonitor();
        teamMonitor = new TeamMonitor(eventBus, healthMonitor, agentState);
        registry = new SimpleMeterRegistry();
        backend = new ScriptedBackend();

        SkillRegistry skills = mock(SkillRegistry.class);
        when(skills.instructionSummary(anyString(), anyString(), anyInt())).thenReturn("Follow the brand voice.");
        PromptBuilder prompts = new PromptBuilder();
        var fallback = new SequentialFallbackRunner(backend, store, skills, prompts, eventBus, properties);
        launcher = new TeamLauncher(backend, store, skills, agentState, teamMonitor, prompts, fallback,
                eventBus, new CrewdeskMetrics(registry), properties);
    }

    @AfterEach
    void tearDown() {
        launcher.shutdown();
        teamMonitor.shutdown();
        healthMonitor.dispose();
    }

    private static TeamSpec team(SpecialistSpec... specialists) {
        return new TeamSpec("You are the team lead coordinating a task.", List.of(specialists),
                new CostEstimate(156_000, 0.94, new CostEstimate.Breakdown(2_000, 150_000, 4_000)));
    }

    private List<String> eventTypes() {
        return events.stream().map(CrewdeskEvent::eventType).toList();
    }

    @Nested
    @DisplayName("team mode")
    class TeamMode {

        @Test
        @DisplayName("all specialists completing yields a completed result with joined output")
        void allComplete() {
            backend.byRole.put("Writer", r -> new BackendResult(0, "Headline copy", "", false, 10));
            backend.byRole.put("Analyst", r -> new BackendResult(0, "{\"result\":\"Sales up 4%\"}", "", false, 10));

            DispatchResult result = launcher.launch(team(WRITER, ANALYST), TASK);

            assertEquals(DispatchStatus.COMPLETED, result.status());
            assertEquals("Headline copy\n\nSales up 4%", result.synthesizedResult());
            assertNull(result.reason());
            assertEquals(0.94, result.estimatedCostUsd());
            assertEquals(result, store.loadFinal("t1").orElseThrow());
            assertEquals(1, backend.leadCalls());
        }

        @Test
        @DisplayName("one failing specialist fails the task without affecting the other")
        void partialFailure() {
            backend.byRole.put("Writer", r -> new BackendResult(0, "Headline copy", "", false, 10));
            backend.byRole.put("Analyst", r -> new BackendResult(1, "", "quota exhausted", false, 10));

            DispatchResult result = launcher.launch(team(WRITER, ANALYST), TASK);

            assertEquals(DispatchStatus.FAILED, result.status());
            assertEquals(2, result.subtasks().size());
            assertEquals("Headline copy", result.synthesizedResult());
            assertTrue(result.reason().contains("1 of 2 specialist(s) failed"));
            assertTrue(result.reason().contains("Analyst: quota exhausted"));

            Map<String, SubtaskResult> stored = store.loadSubtaskResults("t1").stream()
                    .collect(Collectors.toMap(SubtaskResult::id, r -> r));
            assertEquals(SubtaskStatus.COMPLETED, stored.get("writer").status());
            assertEquals(SubtaskStatus.FAILED, stored.get("analyst").status());
            assertEquals(1, stored.get("analyst").exitCode());

            assertTrue(eventTypes().contains("subtask.completed"));
            assertTrue(eventTypes().contains("subtask.failed"));
            assertEquals(AgentStatus.ERROR, agentState.get("t1-analyst").orElseThrow().status());
            assertEquals(AgentStatus.IDLE, agentState.get("t1-writer").orElseThrow().status());
        }

        @Test
        @DisplayName("writes prompts, the lead record and specialist results into the task directory")
        void checkpointLayout() throws Exception {
            backend.byRole.put("Writer", r -> new BackendResult(0, "copy", "", false, 10));

            launcher.launch(team(WRITER), TASK);

            Path dir = tasksRoot.resolve("t1");
            assertTrue(Files.exists(dir.resolve("prompts/lead.txt")));
            String writerPrompt = Files.readString(dir.resolve("prompts/writer.txt"));
            assertTrue(writerPrompt.contains("Task: Prepare the spring promotion"));
            assertTrue(writerPrompt.contains("Follow the brand voice."));
            assertTrue(Files.exists(dir.resolve("checkpoints/lead-coordination.json")));
            assertTrue(Files.exists(dir.resolve("results/writer.json")));
            assertTrue(Files.exists(dir.resolve("final.json")));
        }

        @Test
        @DisplayName("a failed lead does not stop the specialists")
        void leadFailure() {
            backend.leadResult = new BackendResult(2, "", "lead broke", false, 5);
            backend.byRole.put("Writer", r -> new BackendResult(0, "copy", "", false, 10));

            DispatchResult result = launcher.launch(team(WRITER), TASK);

            assertEquals(DispatchStatus.COMPLETED, result.status());
            assertTrue(eventTypes().contains("team.lead_completed"));
        }

        @Test
        @DisplayName("a lead that cannot be launched is recorded and the specialists still run")
        void leadCannotLaunch() throws Exception {
            backend.leadBehaviour = r -> {
                throw new BackendException("Failed to launch claude: No such file or directory", null);
            };
            backend.byRole.put("Writer", r -> new BackendResult(0, "copy", "", false, 10));

            DispatchResult result = launcher.launch(team(WRITER), TASK);

            assertEquals(DispatchStatus.COMPLETED, result.status());
            assertEquals(1, result.subtasks().size());
            assertEquals(SubtaskStatus.COMPLETED, result.subtasks().get(0).status());
            assertEquals(AgentStatus.IDLE, agentState.get("t1-writer").orElseThrow().status());
            assertTrue(eventTypes().contains("team.lead_completed"));

            String record = Files.readString(tasksRoot.resolve("t1/checkpoints/lead-coordination.json"));
            assertTrue(record.contains("Lead coordination phase could not run"), record);
            assertTrue(record.contains("No such file or directory"), record);
        }

        @Test
        @DisplayName("a lead running to its timeout keeps the task alive for the specialists")
        void slowLeadStaysHealthy() throws Exception {
            properties.getHealth().setInactivityTimeoutSeconds(1);
            properties.getTeam().setSpecialistTimeoutSeconds(1);
            properties.getTeam().setTotalTimeoutSeconds(10);
            List<String> stuck = new CopyOnWriteArrayList<>();
            healthMonitor.addStuckHandler((taskId, idle) -> stuck.add(taskId));
            backend.leadBehaviour = r -> {
                try {
                    Thread.sleep(r.timeout().toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return BackendResult.timeout("", "", r.timeout().toMillis());
            };
            backend.byRole.put("Writer", r -> new BackendResult(0, "copy", "", false, 10));

            healthMonitor.startMonitoring("t1", Duration.ofSeconds(1));
            DispatchResult result = launcher.launch(team(WRITER), TASK);
            healthMonitor.stopMonitoring("t1");

            assertEquals(DispatchStatus.COMPLETED, result.status());
            assertEquals("copy", result.synthesizedResult());
            assertTrue(stuck.isEmpty(), "stuck: " + stuck);
            assertTrue(Files.exists(tasksRoot.resolve("t1/checkpoints/lead-started.json")));
            long leadTimeout = backend.requests.stream()
                    .filter(r -> r.prompt().startsWith("You are the team lead"))
                    .findFirst().orElseThrow().timeout().toMillis();
            assertTrue(leadTimeout < 1000, "lead timeout " + leadTimeout);
        }

        @Test
        @DisplayName("the lead timeout stays below the inactivity window")
        void leadTimeoutBounds() {
            long farDeadline = System.currentTimeMillis() + 3_600_000L;
            assertEquals(240_000, launcher.leadTimeoutMillis(farDeadline));

            properties.getHealth().setInactivityTimeoutSeconds(3_600);
            assertEquals(300_000, launcher.leadTimeoutMillis(farDeadline));
            assertEquals(1, launcher.leadTimeoutMillis(System.currentTimeMillis() - 1));
        }

        @Test
        @DisplayName("a timed-out specialist keeps its partial output")
        void specialistTimeout() {
            backend.byRole.put("Writer", r -> BackendResult.timeout("half a draft", "", 300_000));

            DispatchResult result = launcher.launch(team(WRITER), TASK);

            SubtaskResult writer = result.subtasks().get(0);
            assertEquals(SubtaskStatus.FAILED, writer.status());
            assertEquals("half a draft", writer.result());
            assertTrue(writer.error().startsWith("Specialist timed out after"));
        }

        @Test
        @DisplayName("specialist runs are timed per plugin and status")
        void metrics() {
            backend.byRole.put("Writer", r -> new BackendResult(0, "copy", "", false, 10));
            launcher.launch(team(WRITER), TASK);

            assertEquals(1, registry.get("crewdesk.specialist.duration")
                    .tag("plugin", "marketing").tag("status", "completed").timer().count());
        }

        @Test
        @DisplayName("an already written final result wins over the team result")
        void finalAlreadyWritten() {
            store.saveFinalOnce("t1", DispatchResult.stuck("t1", "no progress for 300s"));
            backend.byRole.put("Writer", r -> new BackendResult(0, "copy", "", false, 10));

            DispatchResult result = launcher.launch(team(WRITER), TASK);

            assertTrue(result.isStuck());
            assertTrue(store.loadFinal("t1").orElseThrow().isStuck());
        }
    }

    @Nested
    @DisplayName("sequential mode")
    class SequentialMode {

        @BeforeEach
        void sequential() {
            properties.getTeam().setTeamMode(false);
        }

        @Test
        @DisplayName("runs each skill in order without a lead and joins results under headings")
        void runsInOrder() {
            backend.byRole.put("Writer", r -> new BackendResult(0, "copy", "", false, 10));
            backend.byRole.put("Analyst", r -> new BackendResult(0, "numbers", "", false, 10));

            DispatchResult result = launcher.launch(team(WRITER, ANALYST), TASK);

            assertEquals(DispatchStatus.COMPLETED, result.status());
            assertEquals(0, backend.leadCalls());
            assertEquals("## marketing/copy\n\ncopy\n\n---\n\n## data/report\n\nnumbers", result.synthesizedResult());
            assertTrue(backend.requests.get(0).prompt().contains("acting as a Writer"));
        }

        @Test
        @DisplayName("an empty response counts as a failure")
        void emptyResponse() {
            backend.byRole.put("Writer", r -> new BackendResult(0, "   ", "", false, 10));

            DispatchResult result = launcher.launch(team(WRITER), TASK);

            assertEquals(DispatchStatus.FAILED, result.status());
            assertEquals("Empty response", result.subtasks().get(0).error());
            assertNull(result.synthesizedResult());
        }
    }

    @Test
    @DisplayName("compose requires every specialist to complete")
    void compose() {
        DispatchResult empty = TeamLauncher.compose("t1", List.of());
        assertEquals(DispatchStatus.FAILED, empty.status());
        assertEquals("No specialists ran", empty.reason());
    }

    @Test
    @DisplayName("specialist ids are file-safe and unique")
    void specialistIds() {
        List<String> ids = SpecialistIds.assign(List.of(
                new SpecialistSpec("Marketing: Copy", "marketing", "copy", List.of()),
                new SpecialistSpec("Writer", "", "", List.of()),
                new SpecialistSpec("writer", "", "", List.of())));

        assertEquals(List.of("marketing-copy", "writer", "writer-2"), ids);
    }
}
