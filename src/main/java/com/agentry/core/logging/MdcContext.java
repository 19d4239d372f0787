package com.agentry.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Agentry-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setExecution(String executionId, String agentName) {
        MDC.put("executionId", executionId);
        MDC.put("agentName", agentName);
    }

    public static void setRecipe(String recipeName) {
        MDC.put("recipeName", recipeName);
    }

    public static void setBatch(String recipeName, int batchNumber) {
        MDC.put("recipeName", recipeName);
        MDC.put("batchNumber", String.valueOf(batchNumber));
    }

    public static void clearExecution() {
        MDC.remove("executionId");
        MDC.remove("agentName");
    }

    public static void clear() {
        MDC.remove("executionId");
        MDC.remove("agentName");
        MDC.remove("recipeName");
        MDC.remove("batchNumber");
    }
}
