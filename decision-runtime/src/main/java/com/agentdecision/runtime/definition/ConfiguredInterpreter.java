package com.agentdecision.runtime.definition;

import com.agentdecision.core.reflex.InterpretInput;

import java.util.Map;

/**
 * Total interpretation over a configured percept → state-label map. Percepts
 * missing from the map become {@link ConfiguredState.UnknownPercept}. Without a
 * map, each percept is its own label.
 */
public class ConfiguredInterpreter implements InterpretInput<String, ConfiguredState> {

    private final Map<String, String> labels;

    public ConfiguredInterpreter(Map<String, String> labels) {
        this.labels = labels == null ? null : Map.copyOf(labels);
    }

    @Override
    public ConfiguredState interpret(String percept) {
        if (labels == null) {
            return new ConfiguredState.Label(percept);
        }
        String label = labels.get(percept);
        return label != null ? new ConfiguredState.Label(label) : new ConfiguredState.UnknownPercept(percept);
    }
}
