package com.agentdecision.core.decision;

/**
 * Failure kinds an agent may report instead of an action.
 *
 * <p>Both kinds are recoverable: they are returned to the driver, never thrown,
 * never logged and never replaced by a default action inside the core.
 */
public enum DecisionError {

    /** Table strategy: the exact accumulated percept sequence has no table entry. */
    NO_MATCHING_HISTORY("no table entry matches the exact percept history"),

    /** Reflex strategy: the rule-matching step declined the interpreted state. */
    NO_APPLICABLE_RULE("no rule applies to the interpreted state");

    private final String description;

    DecisionError(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
