package com.bountyscope.core.logging;

import org.slf4j.MDC;

/**
 * Manages the MDC keys used by the log pattern: {@code runId}, {@code target},
 * {@code stage} and {@code host}.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId, String target) {
        MDC.put("runId", runId);
        MDC.put("target", target);
    }

    public static void setStage(String stage) {
        MDC.put("stage", stage);
    }

    public static void setHost(String host) {
        MDC.put("host", host);
    }

    public static void clearHost() {
        MDC.remove("host");
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("target");
        MDC.remove("stage");
        MDC.remove("host");
    }
}
