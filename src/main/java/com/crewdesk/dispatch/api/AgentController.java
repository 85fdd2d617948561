package com.crewdesk.dispatch.api;

import com.crewdesk.core.agents.AgentStateTracker;
import com.crewdesk.core.model.AgentInfo;
import com.crewdesk.core.model.AgentLogEntry;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Read-only view of specialist agents and their recent log lines.
 */
@RestController
@RequestMapping("/api/v1/agents")
public class AgentController {

    private final AgentStateTracker agentState;

    public AgentController(AgentStateTracker agentState) {
        this.agentState = agentState;
    }

    /**
     * GET /api/v1/agents[?taskId=]: all tracked agents, optionally for one task.
     */
    @GetMapping
    public Map<String, List<AgentInfo>> agents(@RequestParam(required = false) String taskId) {
        List<AgentInfo> agents = taskId != null ? agentState.getByTaskId(taskId) : agentState.getAll();
        return Map.of("agents", agents);
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> agent(@PathVariable String id) {
        return agentState.get(id)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Agent not found")));
    }

    /**
     * GET /api/v1/agents/{id}/logs?limit=N: newest N entries, oldest first.
     */
    @GetMapping("/{id}/logs")
    public ResponseEntity<?> logs(@PathVariable String id, @RequestParam(defaultValue = "50") int limit) {
        if (agentState.get(id).isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Agent not found"));
        }
        List<AgentLogEntry> logs = agentState.getLogs(id);
        int from = Math.max(0, logs.size() - Math.max(limit, 0));
        return ResponseEntity.ok(Map.of("id", id, "logs", logs.subList(from, logs.size())));
    }
}
