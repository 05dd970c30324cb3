package com.agentdecision.runtime.driver;

import com.agentdecision.core.decision.Decision;
import com.agentdecision.core.decision.DecisionAgent;
import com.agentdecision.core.decision.DecisionError;
import com.agentdecision.runtime.logger.DecisionFlowLogger;
import com.agentdecision.runtime.publisher.MaintenanceSignalPublisher;
import com.agentdecision.runtime.trace.TraceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Feeds percepts, strictly in receipt order, into one {@link DecisionAgent}.
 *
 * <h3>Per percept</h3>
 * <ol>
 *   <li>Assign the next index and a fresh trace id.</li>
 *   <li>Call {@link DecisionAgent#advance} exactly once.</li>
 *   <li>On failure, publish a {@link MaintenanceSignal}. The driver never
 *       substitutes an action; acting on the step is up to the caller.</li>
 * </ol>
 *
 * <p>Not thread-safe: one driver per agent, one caller at a time. Percepts are
 * never skipped, reordered or replayed.
 */
public class EnvironmentDriver<P, A> {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentDriver.class);

    private final DecisionAgent<P, A>        agent;
    private final MaintenanceSignalPublisher publisher;
    private final DecisionFlowLogger         flowLogger;
    private final Clock                      clock;

    private long index;
    private long actions;
    private final Map<DecisionError, Long> failures = new EnumMap<>(DecisionError.class);

    public EnvironmentDriver(DecisionAgent<P, A> agent,
                             MaintenanceSignalPublisher publisher,
                             DecisionFlowLogger flowLogger) {
        this(agent, publisher, flowLogger, Clock.systemUTC());
    }

    public EnvironmentDriver(DecisionAgent<P, A> agent,
                             MaintenanceSignalPublisher publisher,
                             DecisionFlowLogger flowLogger,
                             Clock clock) {
        this.agent      = Objects.requireNonNull(agent, "agent");
        this.publisher  = Objects.requireNonNull(publisher, "publisher");
        this.flowLogger = Objects.requireNonNull(flowLogger, "flowLogger");
        this.clock      = Objects.requireNonNull(clock, "clock");
    }

    public DriverStep<P, A> step(P percept) {
        Objects.requireNonNull(percept, "percept");
        long current   = index + 1;
        String traceId = TraceContext.newTraceId();
        String name    = agent.agentName();

        flowLogger.perceptReceived(name, current, percept, traceId);
        Decision<A> decision = agent.advance(percept);
        index = current;
        flowLogger.decided(name, current, decision, traceId);

        if (decision.isOk()) {
            actions++;
        } else {
            DecisionError error = decision.error().orElseThrow();
            failures.merge(error, 1L, Long::sum);
            publish(new MaintenanceSignal(name, current, String.valueOf(percept),
                                          error, traceId, clock.instant()));
        }
        return new DriverStep<>(current, percept, decision, traceId);
    }

    private void publish(MaintenanceSignal signal) {
        try {
            publisher.publish(signal);
        } catch (RuntimeException e) {
            log.error("Maintenance signal publish failed agent={} index={} error={} traceId={}",
                      signal.agentName(), signal.index(), signal.error(), signal.traceId(), e);
        }
    }

    public List<DriverStep<P, A>> run(Iterable<? extends P> percepts) {
        List<DriverStep<P, A>> steps = new ArrayList<>();
        for (P percept : percepts) {
            steps.add(step(percept));
        }
        return steps;
    }

    public DriverStats stats() {
        return new DriverStats(index, actions, Map.copyOf(failures));
    }

    public DecisionAgent<P, A> agent() {
        return agent;
    }
}
