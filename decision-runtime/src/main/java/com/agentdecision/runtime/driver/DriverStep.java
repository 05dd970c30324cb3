package com.agentdecision.runtime.driver;

import com.agentdecision.core.decision.Decision;

/**
 * Outcome of feeding one percept to the driven agent.
 */
public record DriverStep<P, A>(
    long        index,
    P           percept,
    Decision<A> decision,
    String      traceId
) {}
