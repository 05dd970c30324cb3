package com.agentdecision.core.table;

import com.agentdecision.core.percept.PerceptSequence;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable mapping from an exact {@link PerceptSequence} to an action.
 *
 * <p>Populated once through {@link #builder()} before the first decision and
 * never extended afterwards. Lookups are exact: a sequence that differs from
 * every key in length or in any element has no action.
 *
 * @param <P> percept type
 * @param <A> action type
 */
public final class DecisionTable<P, A> {

    private final Map<PerceptSequence<P>, A> entries;
    private final int horizon;

    private DecisionTable(Map<PerceptSequence<P>, A> entries) {
        this.entries = Collections.unmodifiableMap(entries);
        this.horizon = entries.keySet().stream().mapToInt(PerceptSequence::size).max().orElse(0);
    }

    public static <P, A> Builder<P, A> builder() {
        return new Builder<>();
    }

    public Optional<A> lookup(PerceptSequence<P> sequence) {
        return Optional.ofNullable(entries.get(sequence));
    }

    public boolean contains(PerceptSequence<P> sequence) {
        return entries.containsKey(sequence);
    }

    public int size() {
        return entries.size();
    }

    /** Length of the longest key, 0 for an empty table. */
    public int horizon() {
        return horizon;
    }

    /** Unmodifiable view in insertion order. */
    public Map<PerceptSequence<P>, A> entries() {
        return entries;
    }

    @Override
    public String toString() {
        return "DecisionTable{size=" + entries.size() + ", horizon=" + horizon + "}";
    }

    public static final class Builder<P, A> {

        private final Map<PerceptSequence<P>, A> entries = new LinkedHashMap<>();

        private Builder() {}

        /**
         * @throws IllegalArgumentException for an empty key or a key already present
         */
        public Builder<P, A> put(PerceptSequence<P> sequence, A action) {
            Objects.requireNonNull(sequence, "sequence");
            Objects.requireNonNull(action, "action");
            if (sequence.isEmpty()) {
                throw new IllegalArgumentException("decision table keys need at least one percept");
            }
            if (entries.putIfAbsent(sequence, action) != null) {
                throw new IllegalArgumentException("duplicate decision table key " + sequence);
            }
            return this;
        }

        public Builder<P, A> put(List<? extends P> percepts, A action) {
            return put(PerceptSequence.copyOf(percepts), action);
        }

        public DecisionTable<P, A> build() {
            return new DecisionTable<>(new LinkedHashMap<>(entries));
        }
    }
}
