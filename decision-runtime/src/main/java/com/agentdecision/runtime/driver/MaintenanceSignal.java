package com.agentdecision.runtime.driver;

import com.agentdecision.core.decision.DecisionError;

import java.time.Instant;

/**
 * Operator-facing notice that an agent could not decide on a percept.
 *
 * @param agentName agent that reported the failure
 * @param index     1-based position of the percept in the driver's feed
 * @param percept   the percept, rendered for display
 * @param error     failure kind reported by the agent
 * @param traceId   trace id of the step that failed
 * @param raisedAt  when the driver raised the signal
 */
public record MaintenanceSignal(
    String        agentName,
    long          index,
    String        percept,
    DecisionError error,
    String        traceId,
    Instant       raisedAt
) {}
