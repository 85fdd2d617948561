package com.crewdesk.dispatch.api;

import com.crewdesk.core.engine.CancelOutcome;
import com.crewdesk.core.engine.ConfirmOutcome;
import com.crewdesk.core.engine.DispatchEngine;
import com.crewdesk.core.engine.SubmitReceipt;
import com.crewdesk.core.engine.TaskView;
import com.crewdesk.core.model.Complexity;
import com.crewdesk.core.model.Subtask;
import com.crewdesk.core.model.TaskDecomposition;
import com.crewdesk.core.model.TaskState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TaskController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class TaskControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private DispatchEngine engine;

    @MockitoBean
    private SseStreamingService sseStreamingService;

    private static TaskView view(String id, TaskState state, int position, TaskDecomposition decomposition) {
        return new TaskView(id, "Draft the launch email", 1_700_000_000_000L, state, position,
                decomposition, List.of(), null);
    }

    // ── POST /api/v1/tasks ───────────────────────────────────────────

    @Test
    @DisplayName("POST /tasks returns 201 with id and queue position")
    void submitTask() throws Exception {
        when(engine.submit("Draft the launch email"))
                .thenReturn(new SubmitReceipt("t-1", "Draft the launch email", 2, 1_700_000_000_000L));

        mockMvc.perform(post("/api/v1/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"text":"Draft the launch email"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("t-1"))
                .andExpect(jsonPath("$.position").value(2))
                .andExpect(jsonPath("$.text").value("Draft the launch email"));
    }

    @Test
    @DisplayName("POST /tasks with blank text returns 400 and queues nothing")
    void submitBlankText() throws Exception {
        mockMvc.perform(post("/api/v1/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"text":"   "}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("text")));

        verify(engine, never()).submit(anyString());
    }

    @Test
    @DisplayName("POST /tasks without a body returns 400")
    void submitMissingBody() throws Exception {
        mockMvc.perform(post("/api/v1/tasks").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isBadRequest());
    }

    // ── GET /api/v1/tasks ────────────────────────────────────────────

    @Test
    @DisplayName("GET /tasks lists summaries with lowercase states")
    void listTasks() throws Exception {
        when(engine.listTasks()).thenReturn(List.of(
                view("t-1", TaskState.IN_PROGRESS, 0, null),
                view("t-2", TaskState.QUEUED, 1, null)));

        mockMvc.perform(get("/api/v1/tasks"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tasks", hasSize(2)))
                .andExpect(jsonPath("$.tasks[0].status").value("in_progress"))
                .andExpect(jsonPath("$.tasks[1].position").value(1))
                .andExpect(jsonPath("$.tasks[1].created_at").value(1_700_000_000_000L));
    }

    // ── GET /api/v1/tasks/{id} ───────────────────────────────────────

    @Test
    @DisplayName("GET /tasks/{id} returns 404 for unknown task")
    void getTaskNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/tasks/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Task not found"));
    }

    @Test
    @DisplayName("GET /tasks/{id} returns state and decomposition")
    void getTask() throws Exception {
        var decomposition = new TaskDecomposition(
                List.of(new Subtask("Write the copy", "writing")), List.of("writing"), Complexity.LOW);
        when(engine.getTask("t-1")).thenReturn(Optional.of(view("t-1", TaskState.CONFIRMING, 0, decomposition)));

        mockMvc.perform(get("/api/v1/tasks/t-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("t-1"))
                .andExpect(jsonPath("$.state").value("confirming"))
                .andExpect(jsonPath("$.decomposition.subtasks[0].domain").value("writing"))
                .andExpect(jsonPath("$.decomposition.estimatedComplexity").value("low"));
    }

    // ── POST /api/v1/tasks/{id}/confirm ──────────────────────────────

    @Test
    @DisplayName("POST /tasks/{id}/confirm without body dispatches the analysed plan")
    void confirmWithoutBody() throws Exception {
        when(engine.confirm("t-1", null)).thenReturn(ConfirmOutcome.DISPATCHING);

        mockMvc.perform(post("/api/v1/tasks/t-1/confirm"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("dispatching"));

        verify(engine).confirm(eq("t-1"), isNull());
    }

    @Test
    @DisplayName("POST /tasks/{id}/confirm passes an edited decomposition through")
    void confirmWithEdits() throws Exception {
        when(engine.confirm(eq("t-1"), any())).thenReturn(ConfirmOutcome.DISPATCHING);

        mockMvc.perform(post("/api/v1/tasks/t-1/confirm")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"decomposition":{
                                  "subtasks":[{"description":"Research competitors","domain":"research"},
                                              {"description":"Write the brief","domain":"writing"}],
                                  "domains":["research","writing"],
                                  "estimatedComplexity":"high"}}
                                """))
                .andExpect(status().isOk());

        ArgumentCaptor<TaskDecomposition> captor = ArgumentCaptor.forClass(TaskDecomposition.class);
        verify(engine).confirm(eq("t-1"), captor.capture());
        assertEquals(2, captor.getValue().subtasks().size());
        assertEquals("research", captor.getValue().subtasks().get(0).domain());
        assertEquals(Complexity.HIGH, captor.getValue().estimatedComplexity());
    }

    @Test
    @DisplayName("POST /tasks/{id}/confirm returns 409 when the task is not awaiting confirmation")
    void confirmConflict() throws Exception {
        when(engine.confirm("t-1", null)).thenReturn(ConfirmOutcome.NOT_CONFIRMING);

        mockMvc.perform(post("/api/v1/tasks/t-1/confirm"))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("POST /tasks/{id}/confirm returns 404 for unknown task")
    void confirmNotFound() throws Exception {
        when(engine.confirm("missing", null)).thenReturn(ConfirmOutcome.NOT_FOUND);

        mockMvc.perform(post("/api/v1/tasks/missing/confirm"))
                .andExpect(status().isNotFound());
    }

    // ── DELETE /api/v1/tasks/{id} ────────────────────────────────────

    @Test
    @DisplayName("DELETE /tasks/{id} cancels a waiting task")
    void cancelTask() throws Exception {
        when(engine.cancel("t-2")).thenReturn(CancelOutcome.CANCELLED);

        mockMvc.perform(delete("/api/v1/tasks/t-2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("cancelled"));
    }

    @Test
    @DisplayName("DELETE /tasks/{id} returns 409 once the task is running")
    void cancelRunningTask() throws Exception {
        when(engine.cancel("t-1")).thenReturn(CancelOutcome.NOT_CANCELLABLE);

        mockMvc.perform(delete("/api/v1/tasks/t-1"))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("DELETE /tasks/{id} returns 404 for unknown task")
    void cancelNotFound() throws Exception {
        when(engine.cancel("missing")).thenReturn(CancelOutcome.NOT_FOUND);

        mockMvc.perform(delete("/api/v1/tasks/missing"))
                .andExpect(status().isNotFound());
    }

    // ── GET /api/v1/tasks/{id}/events ────────────────────────────────

    @Test
    @DisplayName("GET /tasks/{id}/events returns 404 for unknown task")
    void eventsNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/tasks/missing/events"))
                .andExpect(status().isNotFound());

        verify(sseStreamingService, never()).createEmitter(anyString());
    }

    @Test
    @DisplayName("GET /tasks/{id}/events opens an emitter for a known task")
    void eventsForKnownTask() throws Exception {
        when(engine.getTask("t-1")).thenReturn(Optional.of(view("t-1", TaskState.IN_PROGRESS, 0, null)));
        when(sseStreamingService.createEmitter("t-1")).thenReturn(new SseEmitter(0L));

        mockMvc.perform(get("/api/v1/tasks/t-1/events"))
                .andExpect(status().isOk());

        verify(sseStreamingService).createEmitter("t-1");
    }
}
