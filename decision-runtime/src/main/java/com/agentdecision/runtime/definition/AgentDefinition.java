package com.agentdecision.runtime.definition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * JSON shape of one agent definition.
 *
 * <pre>
 * {
 *   "name": "window-table",
 *   "strategy": "table",
 *   "table": [ { "percepts": ["SUNNY"], "action": "OPEN" } ]
 * }
 *
 * {
 *   "name": "window-reflex",
 *   "strategy": "reflex",
 *   "reflex": {
 *     "interpretation": { "SUNNY": "GOOD", "RAINY": "BAD" },
 *     "rules":          { "GOOD": "OPEN",  "BAD": "CLOSE" },
 *     "fallbackAction": null
 *   }
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentDefinition(
    @JsonProperty("name")     String           name,
    @JsonProperty("strategy") String           strategy,
    @JsonProperty("table")    List<TableEntry> table,
    @JsonProperty("reflex")   ReflexRules      reflex
) {

    /** One decision table row: an exact percept sequence and its action. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TableEntry(
        @JsonProperty("percepts") List<String> percepts,
        @JsonProperty("action")   String       action
    ) {}

    /**
     * Reflex configuration. A missing {@code interpretation} map makes every
     * percept its own state label. {@code fallbackAction}, when present, is
     * answered for unrecognized percepts instead of a failure.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ReflexRules(
        @JsonProperty("interpretation") Map<String, String> interpretation,
        @JsonProperty("rules")          Map<String, String> rules,
        @JsonProperty("fallbackAction") String              fallbackAction
    ) {}
}
