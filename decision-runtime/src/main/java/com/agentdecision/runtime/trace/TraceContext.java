package com.agentdecision.runtime.trace;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Per-percept trace ids for the environment driver's log lines.
 *
 * <p>The driver owns the trace id; MDC is only ever written as a temporary
 * bridge during a log statement, never as a persistent ThreadLocal store.
 */
public final class TraceContext {

    public static final String TRACE_ID_KEY = "traceId";

    private TraceContext() {}

    public static String newTraceId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Temporarily bridges {@code traceId} → MDC for the duration of {@code logAction},
     * then removes the MDC entry. ONLY use this inside logging side-effects.
     *
     * @param traceId   the traceId to bridge into MDC
     * @param logAction the log statement to execute with MDC populated
     */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
