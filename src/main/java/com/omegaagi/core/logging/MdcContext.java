package com.omegaagi.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Omega-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String EXECUTION_ID = "executionId";
    public static final String SECTION = "section";

    private MdcContext() {}

    public static void setExecution(String executionId) {
        MDC.put(EXECUTION_ID, executionId);
    }

    public static void setSection(String executionId, String section) {
        MDC.put(EXECUTION_ID, executionId);
        MDC.put(SECTION, section);
    }

    public static void clearSection() {
        MDC.remove(SECTION);
    }

    public static void clear() {
        MDC.remove(EXECUTION_ID);
        MDC.remove(SECTION);
    }
}
