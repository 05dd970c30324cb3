package com.agentdecision.core.reflex;

/**
 * Marker for the catch-all state variant an interpreter produces for a percept
 * it cannot classify. The variant keeps the original percept so nothing is
 * silently dropped.
 *
 * <p>Implement it on a record in the domain's state hierarchy; two unrecognized
 * states are then equal iff their percepts are equal.
 *
 * @param <P> percept type
 */
public interface Unrecognized<P> {

    P percept();
}
