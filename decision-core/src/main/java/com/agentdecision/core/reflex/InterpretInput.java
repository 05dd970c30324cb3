package com.agentdecision.core.reflex;

/**
 * Interpretation step of a reflex agent: classifies one percept into a state.
 *
 * <p>Must be total. Every percept maps to some state; input the interpreter
 * cannot classify maps to an explicit unrecognized variant (see
 * {@link Unrecognized}) carrying the percept. Returning {@code null} or
 * throwing is a contract violation.
 *
 * @param <P> percept type
 * @param <S> state type
 */
@FunctionalInterface
public interface InterpretInput<P, S> {

    S interpret(P percept);

    /** Interpretation for agents whose rules match on the raw percept. */
    static <P> InterpretInput<P, P> identity() {
        return percept -> percept;
    }
}
