package com.agentdecision.core.decision;

/**
 * Invocation contract shared by every decision strategy.
 *
 * <p>A driver calls {@link #advance} once per received percept, strictly in
 * receipt order, without skipping, reordering or replaying percepts. The
 * substitutable part is the resolution algorithm, not this protocol:
 * <ul>
 *   <li>{@code TableDrivenAgent}: retains history, exact lookup in a decision table</li>
 *   <li>{@code SimpleReflexAgent}: no history, interpret then match a rule</li>
 * </ul>
 *
 * <p>Implementations must never throw for a lookup miss or an unmatched state;
 * they report it through {@link Decision#failed(DecisionError)}.
 *
 * @param <P> percept type
 * @param <A> action type
 */
public interface DecisionAgent<P, A> {

    /**
     * Resolve the action for the next percept.
     *
     * @param percept non-null percept, the next one received
     * @return an action or the failure kind, never {@code null}
     */
    Decision<A> advance(P percept);

    /** Short label used by drivers in logs and maintenance signals. */
    default String agentName() {
        return getClass().getSimpleName();
    }
}
