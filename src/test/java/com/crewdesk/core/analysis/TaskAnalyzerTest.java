package com.crewdesk.core.analysis;

import com.crewdesk.backend.BackendException;
import com.crewdesk.backend.BackendRequest;
import com.crewdesk.backend.BackendResult;
import com.crewdesk.backend.ExecutionBackend;
import com.crewdesk.core.config.CrewdeskProperties;
import com.crewdesk.core.metrics.CrewdeskMetrics;
import com.crewdesk.core.model.Complexity;
import com.crewdesk.core.model.Subtask;
import com.crewdesk.core.model.TaskDecomposition;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class TaskAnalyzerTest {

    private static final String TEXT = "Draft a response to a customer complaint about late delivery";

    private ExecutionBackend backend;
    private SimpleMeterRegistry registry;
    private TaskAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        backend = mock(ExecutionBackend.class);
        when(backend.name()).thenReturn("mock");
        registry = new SimpleMeterRegistry();
        analyzer = new TaskAnalyzer(backend, new CrewdeskProperties(), new CrewdeskMetrics(registry));
    }

    private void backendReturns(BackendResult result) {
        when(backend.execute(any(BackendRequest.class))).thenReturn(result);
    }

    @Nested
    @DisplayName("analyze")
    class Analyze {

        @Test
        @DisplayName("parses a well-formed decomposition and records the duration")
        void wellFormed() {
            backendReturns(new BackendResult(0, """
                    {"subtasks":[{"description":"Draft apology","domain":"customer-support"},
                                 {"description":"Offer discount","domain":"sales"}],
                     "domains":["customer-support","sales"],
                     "estimatedComplexity":"medium"}""", "", false, 1200));

            TaskDecomposition d = analyzer.analyze(TEXT);

            assertEquals(2, d.subtasks().size());
            assertEquals(new Subtask("Draft apology", "customer-support"), d.subtasks().get(0));
            assertEquals(List.of("customer-support", "sales"), d.domains());
            assertEquals(Complexity.MEDIUM, d.estimatedComplexity());
            assertEquals(1, registry.get("crewdesk.analysis.duration").timer().count());
        }

        @Test
        @DisplayName("sends the decomposition system prompt with the analyzer model and timeout")
        void requestShape() {
            backendReturns(new BackendResult(0, "{}", "", false, 5));
            analyzer.analyze(TEXT);

            var captor = ArgumentCaptor.forClass(BackendRequest.class);
            verify(backend, times(1)).execute(captor.capture());
            BackendRequest sent = captor.getValue();
            assertEquals(TEXT, sent.prompt());
            assertEquals(TaskAnalyzer.SYSTEM_PROMPT, sent.systemPrompt());
            assertEquals("sonnet", sent.model());
            assertEquals(Duration.ofSeconds(60), sent.timeout());
        }

        @Test
        @DisplayName("unwraps the CLI JSON envelope before parsing")
        void envelope() {
            backendReturns(new BackendResult(0,
                    "{\"type\":\"result\",\"result\":\"{\\\"subtasks\\\":[{\\\"description\\\":\\\"Plan\\\",\\\"domain\\\":\\\"finance\\\"}],\\\"estimatedComplexity\\\":\\\"low\\\"}\"}",
                    "", false, 10));

            TaskDecomposition d = analyzer.analyze(TEXT);

            assertEquals("finance", d.subtasks().get(0).domain());
            assertEquals(Complexity.LOW, d.estimatedComplexity());
        }

        @Test
        @DisplayName("a nonzero exit raises AnalysisException and is not retried")
        void nonzeroExit() {
            backendReturns(new BackendResult(1, "", "auth required", false, 10));

            var e = assertThrows(AnalysisException.class, () -> analyzer.analyze(TEXT));
            assertTrue(e.getMessage().contains("auth required"));
            verify(backend, times(1)).execute(any());
        }

        @Test
        @DisplayName("a timeout raises AnalysisException")
        void timeout() {
            backendReturns(BackendResult.timeout("", "", 60_000));
            var e = assertThrows(AnalysisException.class, () -> analyzer.analyze(TEXT));
            assertTrue(e.getMessage().contains("timed out"));
        }

        @Test
        @DisplayName("a backend that cannot start raises AnalysisException")
        void cannotStart() {
            when(backend.execute(any())).thenThrow(new BackendException("not found", null));
            assertThrows(AnalysisException.class, () -> analyzer.analyze(TEXT));
        }
    }

    @Nested
    @DisplayName("parseDecomposition")
    class Parse {

        @Test
        @DisplayName("non-JSON output falls back to one productivity sub-task with low complexity")
        void nonJson() {
            TaskDecomposition d = analyzer.parseDecomposition("I cannot help with that.", TEXT);

            assertEquals(List.of(new Subtask(TEXT, "productivity")), d.subtasks());
            assertEquals(List.of("productivity"), d.domains());
            assertEquals(Complexity.LOW, d.estimatedComplexity());
        }

        @Test
        @DisplayName("markdown fences are stripped")
        void fences() {
            TaskDecomposition d = analyzer.parseDecomposition("""
                    ```json
                    {"subtasks":[{"description":"Review contract","domain":"legal"}],"domains":["legal"],"estimatedComplexity":"high"}
                    ```""", TEXT);

            assertEquals("legal", d.subtasks().get(0).domain());
            assertEquals(Complexity.HIGH, d.estimatedComplexity());
        }

        @Test
        @DisplayName("JSON embedded in prose is extracted")
        void embedded() {
            TaskDecomposition d = analyzer.parseDecomposition(
                    "Here you go: {\"subtasks\":[{\"description\":\"Pull numbers\",\"domain\":\"data\"}]} hope it helps", TEXT);
            assertEquals("data", d.subtasks().get(0).domain());
        }

        @Test
        @DisplayName("missing fields get defaults")
        void defaults() {
            TaskDecomposition d = analyzer.parseDecomposition(
                    "{\"subtasks\":[{\"description\":\"A\",\"domain\":\"sales\"},{\"description\":\"B\"},{\"description\":\"C\",\"domain\":\"sales\"}]}",
                    TEXT);

            assertEquals("productivity", d.subtasks().get(1).domain());
            assertEquals(List.of("sales", "productivity"), d.domains());
            assertEquals(Complexity.MEDIUM, d.estimatedComplexity());
        }

        @Test
        @DisplayName("an empty subtasks array yields a single sub-task for the whole request")
        void emptySubtasks() {
            TaskDecomposition d = analyzer.parseDecomposition("{\"subtasks\":[],\"estimatedComplexity\":\"low\"}", TEXT);
            assertEquals(1, d.subtasks().size());
            assertEquals(TEXT, d.subtasks().get(0).description());
        }

        @Test
        @DisplayName("an unknown complexity defaults to medium")
        void unknownComplexity() {
            TaskDecomposition d = analyzer.parseDecomposition(
                    "{\"subtasks\":[{\"description\":\"A\",\"domain\":\"sales\"}],\"estimatedComplexity\":\"epic\"}", TEXT);
            assertEquals(Complexity.MEDIUM, d.estimatedComplexity());
        }
    }
}
