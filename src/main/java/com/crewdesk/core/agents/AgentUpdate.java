package com.crewdesk.core.agents;

import com.crewdesk.core.model.AgentStatus;

/**
 * Partial agent update. Null fields leave the stored value untouched.
 */
public record AgentUpdate(
    String id,
    String name,
    AgentStatus status,
    String taskId,
    String subtaskId,
    String lastAction,
    String error
) {

    public static Builder of(String id) {
        return new Builder(id);
    }

    public static final class Builder {
        private final String id;
        private String name;
        private AgentStatus status;
        private String taskId;
        private String subtaskId;
        private String lastAction;
        private String error;

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) { this.name = name; return this; }
        public Builder status(AgentStatus status) { this.status = status; return this; }
        public Builder taskId(String taskId) { this.taskId = taskId; return this; }
        public Builder subtaskId(String subtaskId) { this.subtaskId = subtaskId; return this; }
        public Builder lastAction(String lastAction) { this.lastAction = lastAction; return this; }
        public Builder error(String error) { this.error = error; return this; }

        public AgentUpdate build() {
            return new AgentUpdate(id, name, status, taskId, subtaskId, lastAction, error);
        }
    }
}
