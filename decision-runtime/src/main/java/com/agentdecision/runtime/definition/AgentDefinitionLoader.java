package com.agentdecision.runtime.definition;

import com.agentdecision.core.decision.DecisionAgent;
import com.agentdecision.core.reflex.RuleMatch;
import com.agentdecision.core.reflex.SimpleReflexAgent;
import com.agentdecision.core.table.DecisionTable;
import com.agentdecision.core.table.TableDrivenAgent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Bootstrap collaborator: reads JSON agent definitions and builds fully
 * populated agents before the first percept arrives.
 *
 * <p>Unreadable sources, malformed JSON, missing sections and duplicate table
 * keys all surface here as an
 * {@link AgentDefinitionException}, never later on the decision path.
 */
public class AgentDefinitionLoader {

    private static final Logger log = LoggerFactory.getLogger(AgentDefinitionLoader.class);

    private final ObjectMapper objectMapper;

    public AgentDefinitionLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    // ── reading ───────────────────────────────────────────────────────────

    public AgentDefinition readClasspath(String resource) {
        ClassPathResource classPathResource = new ClassPathResource(resource);
        if (!classPathResource.exists()) {
            throw new AgentDefinitionException(resource, "agent definition not found on classpath");
        }
        try (InputStream in = classPathResource.getInputStream()) {
            return read(resource, in);
        } catch (IOException e) {
            throw new AgentDefinitionException(resource, "cannot read agent definition", e);
        }
    }

    public AgentDefinition readFile(Path file) {
        String source = file.toString();
        try (InputStream in = Files.newInputStream(file)) {
            return read(source, in);
        } catch (IOException e) {
            throw new AgentDefinitionException(source, "cannot read agent definition", e);
        }
    }

    private AgentDefinition read(String source, InputStream in) throws IOException {
        AgentDefinition definition = objectMapper.readValue(in, AgentDefinition.class);
        if (definition == null) {
            throw new AgentDefinitionException(source, "empty agent definition");
        }
        log.info("Loaded agent definition name={} strategy={} source={}",
                 definition.name(), definition.strategy(), source);
        return definition;
    }

    // ── building ──────────────────────────────────────────────────────────

    public DecisionAgent<String, String> createAgent(AgentDefinition definition) {
        Strategy strategy;
        try {
            strategy = Strategy.fromName(definition.strategy());
        } catch (IllegalArgumentException e) {
            throw new AgentDefinitionException(nameOf(definition), e.getMessage(), e);
        }
        return switch (strategy) {
            case TABLE  -> new NamedAgent<>(nameOf(definition), new TableDrivenAgent<>(createTable(definition)));
            case REFLEX -> new NamedAgent<>(nameOf(definition), createReflexAgent(definition));
        };
    }

    public DecisionTable<String, String> createTable(AgentDefinition definition) {
        String name = nameOf(definition);
        if (definition.table() == null) {
            throw new AgentDefinitionException(name, "table strategy requires a 'table' section");
        }
        DecisionTable.Builder<String, String> builder = DecisionTable.builder();
        int row = 0;
        for (AgentDefinition.TableEntry entry : definition.table()) {
            row++;
            if (entry == null || entry.percepts() == null || entry.percepts().contains(null)
                    || entry.action() == null) {
                throw new AgentDefinitionException(name, "table row " + row + " needs percepts and an action");
            }
            try {
                builder.put(entry.percepts(), entry.action());
            } catch (IllegalArgumentException e) {
                throw new AgentDefinitionException(name, "table row " + row + ": " + e.getMessage(), e);
            }
        }
        DecisionTable<String, String> table = builder.build();
        log.info("Built decision table agent={} entries={} horizon={}", name, table.size(), table.horizon());
        return table;
    }

    public SimpleReflexAgent<String, ConfiguredState, String> createReflexAgent(AgentDefinition definition) {
        String name = nameOf(definition);
        AgentDefinition.ReflexRules reflex = definition.reflex();
        if (reflex == null || reflex.rules() == null) {
            throw new AgentDefinitionException(name, "reflex strategy requires a 'reflex.rules' section");
        }
        requireNoNulls(name, "reflex.interpretation", reflex.interpretation());
        requireNoNulls(name, "reflex.rules", reflex.rules());

        RuleMatch<ConfiguredState, String> rules = new ConfiguredRules(reflex.rules());
        if (reflex.fallbackAction() != null) {
            rules = rules.withUnrecognizedFallback(reflex.fallbackAction());
            log.info("Reflex agent={} falls back to action={} for unrecognized percepts",
                     name, reflex.fallbackAction());
        }
        return new SimpleReflexAgent<>(new ConfiguredInterpreter(reflex.interpretation()), rules);
    }

    private static void requireNoNulls(String name, String section, Map<String, String> map) {
        if (map != null && (map.containsKey(null) || map.containsValue(null))) {
            throw new AgentDefinitionException(name, "'" + section + "' must not contain null entries");
        }
    }

    private static String nameOf(AgentDefinition definition) {
        return definition.name() == null || definition.name().isBlank() ? "unnamed-agent" : definition.name();
    }
}
