package com.agentdecision.core.percept;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, ordered run of percepts, the identity key of a decision table.
 *
 * <p>Two sequences are equal iff they have the same length and pairwise-equal
 * elements in order; {@link #hashCode()} follows {@link List#hashCode()}.
 *
 * @param <P> percept type, must implement {@code equals}/{@code hashCode}
 */
public final class PerceptSequence<P> {

    private static final PerceptSequence<?> EMPTY = new PerceptSequence<>(List.of());

    private final List<P> percepts;

    private PerceptSequence(List<P> percepts) {
        this.percepts = percepts;
    }

    @SuppressWarnings("unchecked")
    public static <P> PerceptSequence<P> empty() {
        return (PerceptSequence<P>) EMPTY;
    }

    @SafeVarargs
    public static <P> PerceptSequence<P> of(P... percepts) {
        return copyOf(Arrays.asList(percepts));
    }

    /**
     * @throws NullPointerException if {@code percepts} holds a null element
     */
    public static <P> PerceptSequence<P> copyOf(List<? extends P> percepts) {
        return new PerceptSequence<>(List.copyOf(percepts));
    }

    /** Returns a new sequence one percept longer; this instance is unchanged. */
    public PerceptSequence<P> append(P percept) {
        Objects.requireNonNull(percept, "percept");
        List<P> grown = new ArrayList<>(percepts.size() + 1);
        grown.addAll(percepts);
        grown.add(percept);
        return new PerceptSequence<>(Collections.unmodifiableList(grown));
    }

    public int size() {
        return percepts.size();
    }

    public boolean isEmpty() {
        return percepts.isEmpty();
    }

    /**
     * @throws IllegalStateException on an empty sequence
     */
    public P last() {
        if (percepts.isEmpty()) {
            throw new IllegalStateException("empty percept sequence has no last percept");
        }
        return percepts.get(percepts.size() - 1);
    }

    /** True when {@code other} is this sequence or an extension of it. */
    public boolean isPrefixOf(PerceptSequence<P> other) {
        return other.size() >= size() && other.percepts.subList(0, size()).equals(percepts);
    }

    /** Unmodifiable view, arrival order. */
    public List<P> percepts() {
        return percepts;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PerceptSequence<?> other)) return false;
        return percepts.equals(other.percepts);
    }

    @Override
    public int hashCode() {
        return percepts.hashCode();
    }

    @Override
    public String toString() {
        return percepts.toString();
    }
}
