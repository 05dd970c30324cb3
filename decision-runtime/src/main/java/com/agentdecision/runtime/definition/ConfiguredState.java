package com.agentdecision.runtime.definition;

import com.agentdecision.core.reflex.Unrecognized;

/**
 * States produced by {@link ConfiguredInterpreter}: a configured label, or the
 * unrecognized variant carrying the raw percept.
 */
public interface ConfiguredState {

    record Label(String name) implements ConfiguredState {}

    record UnknownPercept(String percept) implements ConfiguredState, Unrecognized<String> {}
}
