package com.agentdecision.runtime.definition;

import com.agentdecision.core.decision.Decision;
import com.agentdecision.core.decision.DecisionError;
import com.agentdecision.core.reflex.RuleMatch;

import java.util.Map;

/**
 * Rule matching over a configured state-label → action map. Unrecognized
 * states and labels without a rule are declined with
 * {@link DecisionError#NO_APPLICABLE_RULE}.
 */
public class ConfiguredRules implements RuleMatch<ConfiguredState, String> {

    private final Map<String, String> actions;

    public ConfiguredRules(Map<String, String> actions) {
        this.actions = Map.copyOf(actions);
    }

    @Override
    public Decision<String> match(ConfiguredState state) {
        if (state instanceof ConfiguredState.Label label && actions.containsKey(label.name())) {
            return Decision.ok(actions.get(label.name()));
        }
        return Decision.failed(DecisionError.NO_APPLICABLE_RULE);
    }
}
