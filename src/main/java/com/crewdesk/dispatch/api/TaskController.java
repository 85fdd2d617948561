package com.crewdesk.dispatch.api;

import com.crewdesk.core.engine.CancelOutcome;
import com.crewdesk.core.engine.ConfirmOutcome;
import com.crewdesk.core.engine.DispatchEngine;
import com.crewdesk.core.engine.SubmitReceipt;
import com.crewdesk.core.engine.TaskView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

/**
 * REST controller for the task lifecycle: submit, inspect, confirm, cancel, stream.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private final DispatchEngine engine;
    private final SseStreamingService sseStreamingService;

    public TaskController(DispatchEngine engine, SseStreamingService sseStreamingService) {
        this.engine = engine;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/tasks: persist and queue a task. 201 with the queue position.
     */
    @PostMapping
    public ResponseEntity<?> submit(@RequestBody(required = false) SubmitTaskRequest request) {
        if (request == null || request.text() == null || request.text().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Missing required field: text"));
        }
        SubmitReceipt receipt = engine.submit(request.text());
        log.info("Accepted task {} at position {}", receipt.id(), receipt.position());
        return ResponseEntity.status(HttpStatus.CREATED).body(receipt);
    }

    @GetMapping
    public ResponseEntity<Map<String, List<TaskSummaryResponse>>> list() {
        List<TaskSummaryResponse> tasks = engine.listTasks().stream()
                .map(TaskSummaryResponse::from)
                .toList();
        return ResponseEntity.ok(Map.of("tasks", tasks));
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> get(@PathVariable String id) {
        return engine.getTask(id)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> notFound());
    }

    /**
     * POST /api/v1/tasks/{id}/confirm: approve the decomposition, optionally
     * replacing it, and dispatch the team.
     */
    @PostMapping("/{id}/confirm")
    public ResponseEntity<Map<String, String>> confirm(@PathVariable String id,
                                                       @RequestBody(required = false) ConfirmTaskRequest request) {
        ConfirmOutcome outcome = engine.confirm(id, request != null ? request.decomposition() : null);
        return switch (outcome) {
            case NOT_FOUND -> notFound();
            case NOT_CONFIRMING -> ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "Task is not awaiting confirmation"));
            case DISPATCHING -> ResponseEntity.ok(Map.of("id", id, "status", "dispatching"));
        };
    }

    /**
     * DELETE /api/v1/tasks/{id}: cancel a queued task or one awaiting confirmation.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> cancel(@PathVariable String id) {
        CancelOutcome outcome = engine.cancel(id);
        return switch (outcome) {
            case NOT_FOUND -> notFound();
            case NOT_CANCELLABLE -> ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "Task can no longer be cancelled"));
            case CANCELLED -> ResponseEntity.ok(Map.of("id", id, "status", "cancelled"));
        };
    }

    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> events(@PathVariable String id) {
        if (engine.getTask(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(id));
    }

    private static ResponseEntity<Map<String, String>> notFound() {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Task not found"));
    }
}
