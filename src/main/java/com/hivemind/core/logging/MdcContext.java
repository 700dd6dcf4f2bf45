package com.hivemind.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Hivemind-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(String agentId, String taskId, String projectId) {
        MDC.put("agentId", agentId);
        putIfPresent("taskId", taskId);
        putIfPresent("projectId", projectId);
    }

    public static void setLoop(String agentId, String loopId) {
        MDC.put("agentId", agentId);
        MDC.put("loopId", loopId);
    }

    public static void clear() {
        MDC.remove("agentId");
        MDC.remove("taskId");
        MDC.remove("projectId");
        MDC.remove("loopId");
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
