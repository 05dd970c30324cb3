package com.agentdecision.runtime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Feeds the percepts given on the command line, in order, to the configured
 * agent.
 *
 * <pre>
 *   java -jar decision-runtime.jar --decision.agent.definition=agents/window-table.json SUNNY RAINY
 * </pre>
 */
@SpringBootApplication
public class DecisionRuntimeApplication {

    public static void main(String[] args) {
        SpringApplication.run(DecisionRuntimeApplication.class, args);
    }
}
