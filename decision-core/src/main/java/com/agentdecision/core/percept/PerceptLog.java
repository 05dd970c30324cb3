package com.agentdecision.core.percept;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only record of every percept one agent instance has received.
 *
 * <p>Growth is linear in the number of percepts and unbounded: a table-driven
 * agent that runs forever keeps everything it has ever seen. Bounding that is
 * the caller's configuration choice, not this class's.
 *
 * <p>Not thread-safe. Owned by exactly one agent instance.
 */
public final class PerceptLog<P> {

    private final List<P> percepts = new ArrayList<>();

    public void append(P percept) {
        percepts.add(Objects.requireNonNull(percept, "percept"));
    }

    /** Snapshot of the current contents; later appends do not affect it. */
    public PerceptSequence<P> asSequence() {
        return PerceptSequence.copyOf(percepts);
    }

    public int size() {
        return percepts.size();
    }

    public boolean isEmpty() {
        return percepts.isEmpty();
    }
}
