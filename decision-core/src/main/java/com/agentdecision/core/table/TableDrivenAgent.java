package com.agentdecision.core.table;

import com.agentdecision.core.decision.Decision;
import com.agentdecision.core.decision.DecisionAgent;
import com.agentdecision.core.decision.DecisionError;
import com.agentdecision.core.percept.PerceptLog;
import com.agentdecision.core.percept.PerceptSequence;

import java.util.Objects;

/**
 * History-based agent: every percept is appended to the agent's
 * {@link PerceptLog} and the complete sequence is looked up in a pre-built
 * {@link DecisionTable}.
 *
 * <h3>Behaviour</h3>
 * <ul>
 *   <li>exact match → {@link Decision#ok}</li>
 *   <li>no entry    → {@link DecisionError#NO_MATCHING_HISTORY}; the percept
 *       stays in the log</li>
 * </ul>
 * There is no generalisation to unseen histories: once the history outgrows
 * the table's horizon, every further call fails.
 *
 * <p>Not thread-safe. Append and lookup form one step per call, so a single
 * driver must invoke {@link #advance} sequentially.
 */
public class TableDrivenAgent<P, A> implements DecisionAgent<P, A> {

    private final PerceptLog<P> log;
    private final DecisionTable<P, A> table;

    public TableDrivenAgent(DecisionTable<P, A> table) {
        this(table, new PerceptLog<>());
    }

    TableDrivenAgent(DecisionTable<P, A> table, PerceptLog<P> log) {
        this.table = Objects.requireNonNull(table, "table");
        this.log = Objects.requireNonNull(log, "log");
    }

    @Override
    public Decision<A> advance(P percept) {
        return resolve(percept, log, table);
    }

    /**
     * Appends {@code percept} to {@code log} and looks the resulting sequence up
     * in {@code table}. The table is never modified.
     */
    public static <P, A> Decision<A> resolve(P percept, PerceptLog<P> log, DecisionTable<P, A> table) {
        log.append(percept);
        PerceptSequence<P> history = log.asSequence();
        return table.lookup(history)
                    .map(Decision::ok)
                    .orElseGet(() -> Decision.failed(DecisionError.NO_MATCHING_HISTORY));
    }

    /** The percepts received so far, in arrival order. */
    public PerceptSequence<P> history() {
        return log.asSequence();
    }
}
