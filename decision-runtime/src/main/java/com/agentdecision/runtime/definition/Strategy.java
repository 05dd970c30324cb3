package com.agentdecision.runtime.definition;

import java.util.Locale;

/**
 * Decision strategy an agent definition selects.
 */
public enum Strategy {

    /** Exact lookup of the full percept history in a decision table. */
    TABLE,

    /** Stateless interpretation of the latest percept followed by rule matching. */
    REFLEX;

    /**
     * Case-insensitive parse.
     *
     * @throws IllegalArgumentException for a blank or unknown name
     */
    public static Strategy fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("strategy is required (table | reflex)");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown strategy '" + name + "' (table | reflex)", e);
        }
    }
}
