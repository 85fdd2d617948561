package com.crewdesk.core.engine;

import com.crewdesk.core.model.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory lifecycle state per task. Transitions outside the lifecycle graph
 * are refused and logged.
 */
class TaskBoard {

    private static final Logger log = LoggerFactory.getLogger(TaskBoard.class);

    private final Map<String, TaskState> states = new ConcurrentHashMap<>();

    void put(String taskId, TaskState state) {
        states.put(taskId, state);
    }

    Optional<TaskState> get(String taskId) {
        return Optional.ofNullable(states.get(taskId));
    }

    /**
     * @return true if the task moved to {@code next}; false for unknown tasks
     */
    boolean transition(String taskId, TaskState next) {
        boolean[] moved = {false};
        states.compute(taskId, (id, current) -> {
            if (current == null) {
                return null;
            }
            if (current.canTransitionTo(next)) {
                moved[0] = true;
                return next;
            }
            log.warn("Refusing transition of task {} from {} to {}", id, current.wireName(), next.wireName());
            return current;
        });
        return moved[0];
    }
}
