package com.agentdecision.core.reflex;

import com.agentdecision.core.decision.Decision;
import com.agentdecision.core.decision.DecisionError;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Rule-matching step of a reflex agent: selects the action for an interpreted
 * state, or declines with {@link DecisionError#NO_APPLICABLE_RULE}.
 *
 * <p>Declining is the expected answer for indeterminate states such as
 * {@link Unrecognized}. A default action for those states exists only when the
 * caller asks for one through {@link #withFallback}.
 *
 * @param <S> state type
 * @param <A> action type
 */
@FunctionalInterface
public interface RuleMatch<S, A> {

    Decision<A> match(S state);

    /**
     * Returns a rule set that answers {@code fallback} for states accepted by
     * {@code appliesTo} that this rule set declines. Every other outcome is
     * passed through unchanged.
     */
    default RuleMatch<S, A> withFallback(Predicate<? super S> appliesTo, A fallback) {
        Objects.requireNonNull(appliesTo, "appliesTo");
        Objects.requireNonNull(fallback, "fallback");
        return state -> {
            Decision<A> decision = match(state);
            if (decision == null) {
                throw new IllegalStateException("rule match returned no decision for state " + state);
            }
            if (decision.isFailed()
                    && decision.error().orElseThrow() == DecisionError.NO_APPLICABLE_RULE
                    && appliesTo.test(state)) {
                return Decision.ok(fallback);
            }
            return decision;
        };
    }

    /** Falls back to {@code fallback} for {@link Unrecognized} states only. */
    default RuleMatch<S, A> withUnrecognizedFallback(A fallback) {
        return withFallback(state -> state instanceof Unrecognized<?>, fallback);
    }
}
