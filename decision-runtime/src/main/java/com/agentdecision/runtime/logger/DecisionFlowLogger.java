package com.agentdecision.runtime.logger;

import com.agentdecision.core.decision.Decision;
import com.agentdecision.runtime.trace.TraceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Observability for the per-percept decision lifecycle inside the environment
 * driver. Logs each stage without touching the decision itself.
 *
 * <p>Lifecycle stages (in order):
 * <ol>
 *   <li>{@link #PERCEPT_RECEIVED}: driver accepted the next percept</li>
 *   <li>{@link #ACTION_RESOLVED}: agent returned an action</li>
 *   <li>{@link #DECISION_FAILED}: agent returned a failure kind</li>
 * </ol>
 *
 * <p>The decision core itself never logs; only this runtime-side collaborator does.
 */
public class DecisionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(DecisionFlowLogger.class);

    public static final String PERCEPT_RECEIVED = "PERCEPT_RECEIVED";
    public static final String ACTION_RESOLVED  = "ACTION_RESOLVED";
    public static final String DECISION_FAILED  = "DECISION_FAILED";

    public void perceptReceived(String agentName, long index, Object percept, String traceId) {
        TraceContext.withMdc(traceId, () ->
            log.debug("[DecisionFlow] stage={} agent={} index={} percept={} traceId={}",
                      PERCEPT_RECEIVED, agentName, index, percept, traceId)
        );
    }

    /**
     * Logs the outcome of one {@code advance} call: INFO for an action, WARN for
     * a failure kind.
     */
    public void decided(String agentName, long index, Decision<?> decision, String traceId) {
        TraceContext.withMdc(traceId, () -> {
            if (decision.isOk()) {
                log.info("[DecisionFlow] stage={} agent={} index={} action={} traceId={}",
                         ACTION_RESOLVED, agentName, index, decision.action().orElseThrow(), traceId);
            } else {
                log.warn("[DecisionFlow] stage={} agent={} index={} error={} traceId={}",
                         DECISION_FAILED, agentName, index, decision.error().orElseThrow(), traceId);
            }
        });
    }
}
