package com.agentdecision.core.table;

import com.agentdecision.core.percept.PerceptSequence;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.function.Function;

/**
 * Bootstrap helpers for pre-populating a {@link DecisionTable} over a finite
 * percept alphabet.
 *
 * <p>A complete table up to horizon {@code h} over an alphabet of size
 * {@code k} holds {@code k + k^2 + ... + k^h} entries. The caller names the
 * horizon and an entry ceiling explicitly; nothing here tries to shrink the
 * table.
 */
public final class DecisionTables {

    private DecisionTables() {}

    /**
     * Number of entries in a complete table: {@code Σ_{t=1..horizon} alphabetSize^t}.
     *
     * @throws IllegalArgumentException if {@code alphabetSize < 1} or {@code horizon < 1}
     * @throws ArithmeticException if the count overflows a {@code long}
     */
    public static long entryCount(int alphabetSize, int horizon) {
        if (alphabetSize < 1) {
            throw new IllegalArgumentException("alphabet must hold at least one percept");
        }
        if (horizon < 1) {
            throw new IllegalArgumentException("horizon must be at least 1, was " + horizon);
        }
        long total = 0;
        long level = 1;
        for (int t = 1; t <= horizon; t++) {
            level = Math.multiplyExact(level, alphabetSize);
            total = Math.addExact(total, level);
        }
        return total;
    }

    /**
     * Builds a table holding every percept sequence of length 1..{@code horizon}
     * over {@code alphabet}, each mapped to {@code policy.apply(sequence)}.
     *
     * @param alphabet   distinct percepts; duplicates are ignored
     * @param horizon    longest sequence length, at least 1
     * @param maxEntries ceiling on the table size the caller accepts
     * @param policy     chooses the action for each sequence; must not return {@code null}
     * @throws IllegalArgumentException if the complete table would exceed {@code maxEntries}
     */
    public static <P, A> DecisionTable<P, A> enumerate(List<P> alphabet, int horizon, long maxEntries,
                                                       Function<PerceptSequence<P>, A> policy) {
        List<P> symbols = new ArrayList<>(new LinkedHashSet<>(alphabet));
        long required;
        try {
            required = entryCount(symbols.size(), horizon);
        } catch (ArithmeticException overflow) {
            throw new IllegalArgumentException("table for horizon " + horizon
                    + " over " + symbols.size() + " percepts overflows", overflow);
        }
        if (required > maxEntries) {
            throw new IllegalArgumentException("table for horizon " + horizon + " over "
                    + symbols.size() + " percepts needs " + required
                    + " entries, ceiling is " + maxEntries);
        }

        DecisionTable.Builder<P, A> builder = DecisionTable.builder();
        List<PerceptSequence<P>> frontier = List.of(PerceptSequence.empty());
        for (int t = 1; t <= horizon; t++) {
            List<PerceptSequence<P>> next = new ArrayList<>(frontier.size() * symbols.size());
            for (PerceptSequence<P> prefix : frontier) {
                for (P symbol : symbols) {
                    PerceptSequence<P> sequence = prefix.append(symbol);
                    builder.put(sequence, policy.apply(sequence));
                    next.add(sequence);
                }
            }
            frontier = next;
        }
        return builder.build();
    }
}
