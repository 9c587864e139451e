package com.taskpilot.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Taskpilot-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(String taskId) {
        putIfPresent("taskId", taskId);
    }

    public static void setSubtask(String taskId, String subtaskId, String tddPhase) {
        putIfPresent("taskId", taskId);
        putIfPresent("subtaskId", subtaskId);
        putIfPresent("tddPhase", tddPhase);
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("subtaskId");
        MDC.remove("tddPhase");
    }

    private static void putIfPresent(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }
}
