package com.agentdecision.runtime.config;

import com.agentdecision.core.decision.DecisionAgent;
import com.agentdecision.runtime.definition.AgentDefinition;
import com.agentdecision.runtime.definition.AgentDefinitionLoader;
import com.agentdecision.runtime.driver.EnvironmentDriver;
import com.agentdecision.runtime.logger.DecisionFlowLogger;
import com.agentdecision.runtime.publisher.LoggingMaintenanceSignalPublisher;
import com.agentdecision.runtime.publisher.MaintenanceSignalPublisher;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class DecisionRuntimeConfig {

    /** Classpath resource holding the agent definition, unless a file path is set. */
    @Value("${decision.agent.definition:agents/window-reflex.json}")
    private String definitionResource;

    @Value("${decision.agent.definition-file:}")
    private String definitionFile;

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean
    public AgentDefinitionLoader agentDefinitionLoader(ObjectMapper objectMapper) {
        return new AgentDefinitionLoader(objectMapper);
    }

    @Bean
    public AgentDefinition agentDefinition(AgentDefinitionLoader loader) {
        if (!definitionFile.isBlank()) {
            return loader.readFile(Path.of(definitionFile));
        }
        return loader.readClasspath(definitionResource);
    }

    @Bean
    public DecisionAgent<String, String> decisionAgent(AgentDefinitionLoader loader, AgentDefinition agentDefinition) {
        return loader.createAgent(agentDefinition);
    }

    @Bean
    public MaintenanceSignalPublisher maintenanceSignalPublisher() {
        return new LoggingMaintenanceSignalPublisher();
    }

    @Bean
    public DecisionFlowLogger decisionFlowLogger() {
        return new DecisionFlowLogger();
    }

    @Bean
    public EnvironmentDriver<String, String> environmentDriver(DecisionAgent<String, String> decisionAgent,
                                                               MaintenanceSignalPublisher maintenanceSignalPublisher,
                                                               DecisionFlowLogger decisionFlowLogger) {
        return new EnvironmentDriver<>(decisionAgent, maintenanceSignalPublisher, decisionFlowLogger);
    }
}
