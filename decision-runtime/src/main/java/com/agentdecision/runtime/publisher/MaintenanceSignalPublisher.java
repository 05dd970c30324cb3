package com.agentdecision.runtime.publisher;

import com.agentdecision.runtime.driver.MaintenanceSignal;

/**
 * Abstraction for surfacing decision failures to an operator.
 *
 * <p>Current implementation: {@link LoggingMaintenanceSignalPublisher}, which writes
 * the signal to the application log.
 *
 * <p>The driver depends only on this interface; an indicator light, a pager or
 * a message topic plugs in here without touching the driver or the agents.
 */
public interface MaintenanceSignalPublisher {

    /**
     * Publish one maintenance signal. Implementations must not throw back into
     * the driver loop.
     *
     * @param signal the failure to surface
     */
    void publish(MaintenanceSignal signal);
}
