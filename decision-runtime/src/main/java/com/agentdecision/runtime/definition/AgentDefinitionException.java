package com.agentdecision.runtime.definition;

public class AgentDefinitionException extends RuntimeException {
    private final String source;

    public AgentDefinitionException(String source, String message) {
        super("[" + source + "] " + message);
        this.source = source;
    }

    public AgentDefinitionException(String source, String message, Throwable cause) {
        super("[" + source + "] " + message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
