package com.agentdecision.core.reflex;

import com.agentdecision.core.decision.Decision;
import com.agentdecision.core.decision.DecisionAgent;

import java.util.Objects;

/**
 * Stateless agent: interprets the current percept and matches a rule on the
 * resulting state. No percept history is consulted or retained.
 *
 * <p>Given pure {@code interpret} and {@code matchRule} functions the agent is
 * referentially transparent: the same percept always yields the same
 * {@link Decision}. Immutable and safe to share.
 *
 * @param <P> percept type
 * @param <S> interpreted state type
 * @param <A> action type
 */
public class SimpleReflexAgent<P, S, A> implements DecisionAgent<P, A> {

    private final InterpretInput<P, S> interpret;
    private final RuleMatch<S, A> matchRule;

    public SimpleReflexAgent(InterpretInput<P, S> interpret, RuleMatch<S, A> matchRule) {
        this.interpret = Objects.requireNonNull(interpret, "interpret");
        this.matchRule = Objects.requireNonNull(matchRule, "matchRule");
    }

    @Override
    public Decision<A> advance(P percept) {
        return resolve(percept, interpret, matchRule);
    }

    /**
     * Interprets {@code percept} and matches a rule on the resulting state.
     *
     * @throws IllegalStateException if {@code interpret} or {@code matchRule}
     *         breaks its contract by returning {@code null}
     */
    public static <P, S, A> Decision<A> resolve(P percept,
                                                InterpretInput<P, S> interpret,
                                                RuleMatch<S, A> matchRule) {
        Objects.requireNonNull(percept, "percept");
        S state = interpret.interpret(percept);
        if (state == null) {
            throw new IllegalStateException("interpretation is not total: no state for percept " + percept);
        }
        Decision<A> decision = matchRule.match(state);
        if (decision == null) {
            throw new IllegalStateException("rule match returned no decision for state " + state);
        }
        return decision;
    }
}
