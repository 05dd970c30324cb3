package com.agentdecision.core.decision;

import com.agentdecision.core.exception.DecisionException;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Fallible outcome of one {@link DecisionAgent#advance} call: exactly one of
 * an action or a {@link DecisionError}.
 *
 * <p>Immutable value; two decisions are equal when they carry equal actions or
 * the same error kind.
 *
 * @param <A> action type
 */
public final class Decision<A> {

    private final A action;
    private final DecisionError error;

    private Decision(A action, DecisionError error) {
        this.action = action;
        this.error = error;
    }

    public static <A> Decision<A> ok(A action) {
        return new Decision<>(Objects.requireNonNull(action, "action"), null);
    }

    public static <A> Decision<A> failed(DecisionError error) {
        return new Decision<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isFailed() {
        return error != null;
    }

    public Optional<A> action() {
        return Optional.ofNullable(action);
    }

    public Optional<DecisionError> error() {
        return Optional.ofNullable(error);
    }

    /**
     * Returns the action, or {@code fallback} when this decision failed.
     * The fallback is the caller's choice; agents never apply one implicitly.
     */
    public A orElse(A fallback) {
        return isOk() ? action : fallback;
    }

    /**
     * Returns the action or escalates the failure as a {@link DecisionException}.
     */
    public A orElseThrow() {
        if (isFailed()) {
            throw new DecisionException(error);
        }
        return action;
    }

    public A orElseThrow(String agentName) {
        if (isFailed()) {
            throw new DecisionException(agentName, error);
        }
        return action;
    }

    public <B> Decision<B> map(Function<? super A, ? extends B> mapper) {
        if (isFailed()) {
            return failed(error);
        }
        return ok(mapper.apply(action));
    }

    public <R> R fold(Function<? super A, ? extends R> onAction,
                      Function<? super DecisionError, ? extends R> onError) {
        return isOk() ? onAction.apply(action) : onError.apply(error);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Decision<?> other)) return false;
        return Objects.equals(action, other.action) && error == other.error;
    }

    @Override
    public int hashCode() {
        return Objects.hash(action, error);
    }

    @Override
    public String toString() {
        return isOk() ? "Decision.ok(" + action + ")" : "Decision.failed(" + error + ")";
    }
}
