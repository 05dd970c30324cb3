package com.agentdecision.runtime.driver;

import com.agentdecision.core.decision.DecisionError;

import java.util.Map;

/**
 * Snapshot of an {@link EnvironmentDriver}'s counters.
 *
 * @param percepts percepts fed so far
 * @param actions  decisions that produced an action
 * @param failures failed decisions per failure kind; kinds never seen are absent
 */
public record DriverStats(
    long                     percepts,
    long                     actions,
    Map<DecisionError, Long> failures
) {
    public long failureCount() {
        return failures.values().stream().mapToLong(Long::longValue).sum();
    }

    public long failureCount(DecisionError error) {
        return failures.getOrDefault(error, 0L);
    }
}
