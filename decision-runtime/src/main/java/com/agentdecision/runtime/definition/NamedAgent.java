package com.agentdecision.runtime.definition;

import com.agentdecision.core.decision.Decision;
import com.agentdecision.core.decision.DecisionAgent;

/**
 * Gives a configured agent the name from its definition, for logs and
 * maintenance signals. Decisions come from {@code delegate} unchanged.
 */
public record NamedAgent<P, A>(String agentName, DecisionAgent<P, A> delegate) implements DecisionAgent<P, A> {

    @Override
    public Decision<A> advance(P percept) {
        return delegate.advance(percept);
    }
}
