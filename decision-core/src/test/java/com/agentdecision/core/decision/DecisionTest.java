package com.agentdecision.core.decision;

import com.agentdecision.core.exception.DecisionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DecisionTest {

    @Test
    @DisplayName("ok carries the action, no error")
    void ok() {
        Decision<String> d = Decision.ok("OPEN");

        assertTrue(d.isOk());
        assertEquals("OPEN", d.action().orElseThrow());
        assertTrue(d.error().isEmpty());
        assertEquals("OPEN", d.orElse("CLOSE"));
        assertEquals(Decision.ok(4), d.map(String::length));
    }

    @Test
    @DisplayName("failed carries the error kind, caller chooses fallback or escalation")
    void failed() {
        Decision<String> d = Decision.failed(DecisionError.NO_MATCHING_HISTORY);

        assertTrue(d.isFailed());
        assertTrue(d.action().isEmpty());
        assertEquals("CLOSE", d.orElse("CLOSE"));
        assertEquals(Decision.failed(DecisionError.NO_MATCHING_HISTORY), d.map(String::length));
        assertEquals("NO_MATCHING_HISTORY", d.fold(a -> a, Enum::name));

        DecisionException e = assertThrows(DecisionException.class, () -> d.orElseThrow("TableDrivenAgent"));
        assertEquals(DecisionError.NO_MATCHING_HISTORY, e.getError());
        assertEquals("TableDrivenAgent", e.getAgentName());
        assertTrue(e.getMessage().startsWith("[TableDrivenAgent]"));
    }

    @Test
    @DisplayName("value equality")
    void equality() {
        assertEquals(Decision.ok("OPEN"), Decision.ok("OPEN"));
        assertNotEquals(Decision.ok("OPEN"), Decision.ok("CLOSE"));
        assertNotEquals(Decision.failed(DecisionError.NO_MATCHING_HISTORY),
                        Decision.failed(DecisionError.NO_APPLICABLE_RULE));
        assertThrows(NullPointerException.class, () -> Decision.ok(null));
    }
}
