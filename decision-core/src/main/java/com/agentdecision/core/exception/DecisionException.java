package com.agentdecision.core.exception;

import com.agentdecision.core.decision.DecisionError;

/**
 * Raised when a caller explicitly demands an action from a failed
 * {@link com.agentdecision.core.decision.Decision}.
 *
 * <p>Agents never throw this themselves; the failure kind travels inside the
 * decision until the caller chooses to escalate it.
 */
public class DecisionException extends RuntimeException {
    private final String agentName;
    private final DecisionError error;

    public DecisionException(String agentName, DecisionError error) {
        super("[" + agentName + "] " + error + ": " + error.description());
        this.agentName = agentName;
        this.error = error;
    }

    public DecisionException(DecisionError error) {
        this("decision", error);
    }

    public String getAgentName() {
        return agentName;
    }

    public DecisionError getError() {
        return error;
    }
}
