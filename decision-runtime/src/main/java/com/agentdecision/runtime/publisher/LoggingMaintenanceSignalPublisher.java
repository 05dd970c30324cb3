package com.agentdecision.runtime.publisher;

import com.agentdecision.runtime.driver.MaintenanceSignal;
import com.agentdecision.runtime.trace.TraceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingMaintenanceSignalPublisher implements MaintenanceSignalPublisher {

    private static final Logger log = LoggerFactory.getLogger(LoggingMaintenanceSignalPublisher.class);

    @Override
    public void publish(MaintenanceSignal signal) {
        TraceContext.withMdc(signal.traceId(), () ->
            log.warn("MAINTENANCE agent={} index={} percept={} error={} reason=\"{}\" traceId={}",
                     signal.agentName(), signal.index(), signal.percept(),
                     signal.error(), signal.error().description(), signal.traceId())
        );
    }
}
