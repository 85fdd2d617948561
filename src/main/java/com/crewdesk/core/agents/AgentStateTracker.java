package com.crewdesk.core.agents;

import com.crewdesk.core.model.AgentInfo;
import com.crewdesk.core.model.AgentLogEntry;
import com.crewdesk.core.model.AgentStatus;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory view of running specialists, for observability only. Nothing here
 * is persisted and nothing in the pipeline reads it back for decisions.
 */
@Component
public class AgentStateTracker {

    static final int MAX_LOGS_PER_AGENT = 100;

    private final Clock clock;
    private final Map<String, AgentInfo> agents = new LinkedHashMap<>();
    private final Map<String, Deque<AgentLogEntry>> logs = new LinkedHashMap<>();

    public AgentStateTracker() {
        this(Clock.systemUTC());
    }

    public AgentStateTracker(Clock clock) {
        this.clock = clock;
    }

    /**
     * Creates or merges an agent and refreshes {@code lastSeen}. A new agent
     * defaults to name "" and status idle.
     */
    public synchronized AgentInfo upsertAgent(AgentUpdate update) {
        Objects.requireNonNull(update.id(), "agent id");
        AgentInfo base = agents.getOrDefault(update.id(),
                new AgentInfo(update.id(), "", AgentStatus.IDLE, null, null, null, 0, null));

        AgentInfo merged = new AgentInfo(
                base.id(),
                pick(update.name(), base.name()),
                pick(update.status(), base.status()),
                pick(update.taskId(), base.taskId()),
                pick(update.subtaskId(), base.subtaskId()),
                pick(update.lastAction(), base.lastAction()),
                clock.millis(),
                pick(update.error(), base.error()));

        agents.put(merged.id(), merged);
        logs.computeIfAbsent(merged.id(), k -> new ArrayDeque<>());
        return merged;
    }

    public synchronized List<AgentInfo> getAll() {
        return List.copyOf(agents.values());
    }

    public synchronized Optional<AgentInfo> get(String id) {
        return Optional.ofNullable(agents.get(id));
    }

    public synchronized List<AgentInfo> getByTaskId(String taskId) {
        return agents.values().stream().filter(a -> Objects.equals(a.taskId(), taskId)).toList();
    }

    public synchronized Optional<AgentInfo> removeAgent(String id) {
        logs.remove(id);
        return Optional.ofNullable(agents.remove(id));
    }

    public synchronized void clearForTask(String taskId) {
        for (AgentInfo agent : getByTaskId(taskId)) {
            agents.remove(agent.id());
            logs.remove(agent.id());
        }
    }

    /**
     * Appends a log line, dropping the oldest past {@value #MAX_LOGS_PER_AGENT}.
     * No-op for an unknown agent.
     */
    public synchronized void addLog(String agentId, String message) {
        Deque<AgentLogEntry> entries = logs.get(agentId);
        if (entries == null) return;
        entries.addLast(new AgentLogEntry(message, clock.millis()));
        while (entries.size() > MAX_LOGS_PER_AGENT) {
            entries.removeFirst();
        }
    }

    public synchronized List<AgentLogEntry> getLogs(String agentId) {
        Deque<AgentLogEntry> entries = logs.get(agentId);
        return entries == null ? List.of() : new ArrayList<>(entries);
    }

    private static <T> T pick(T update, T existing) {
        return update != null ? update : existing;
    }
}
