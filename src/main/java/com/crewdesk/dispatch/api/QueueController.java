package com.crewdesk.dispatch.api;

import com.crewdesk.core.engine.DispatchEngine;
import com.crewdesk.core.model.QueueState;
import com.crewdesk.core.model.TaskRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/queue")
public class QueueController {

    private final DispatchEngine engine;

    public QueueController(DispatchEngine engine) {
        this.engine = engine;
    }

    @GetMapping
    public Map<String, Object> queue() {
        QueueState state = engine.queueSnapshot();
        List<Map<String, String>> pending = state.pending().stream().map(QueueController::entry).toList();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("active", state.active() != null ? entry(state.active()) : null);
        body.put("pending", pending);
        body.put("length", pending.size());
        return body;
    }

    private static Map<String, String> entry(TaskRequest task) {
        return Map.of("id", task.id(), "text", task.text());
    }
}
