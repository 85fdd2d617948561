package com.crewdesk.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Crewdesk-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(String taskId) {
        MDC.put("taskId", taskId);
    }

    public static void setSpecialist(String taskId, String specialistId, String skill) {
        MDC.put("taskId", taskId);
        MDC.put("specialistId", specialistId);
        MDC.put("skill", skill);
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("specialistId");
        MDC.remove("skill");
    }
}
