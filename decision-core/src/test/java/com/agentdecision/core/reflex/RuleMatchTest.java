package com.agentdecision.core.reflex;

import com.agentdecision.core.decision.Decision;
import com.agentdecision.core.decision.DecisionError;
import com.agentdecision.core.fixture.Outlook;
import com.agentdecision.core.fixture.Weather;
import com.agentdecision.core.fixture.WeatherWindow;
import com.agentdecision.core.fixture.Window;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RuleMatchTest {

    @Test
    @DisplayName("no fallback unless configured")
    void noImplicitFallback() {
        assertEquals(Decision.failed(DecisionError.NO_APPLICABLE_RULE),
            WeatherWindow.RULES.match(new Outlook.Unknown(Weather.CLOUDY)));
    }

    @Test
    @DisplayName("configured fallback applies to unrecognized states only")
    void unrecognizedFallback() {
        RuleMatch<Outlook, Window> safe = WeatherWindow.RULES.withUnrecognizedFallback(Window.CLOSE);
        SimpleReflexAgent<Weather, Outlook, Window> agent = new SimpleReflexAgent<>(WeatherWindow.INTERPRET, safe);

        assertEquals(Decision.ok(Window.CLOSE), agent.advance(Weather.CLOUDY));
        assertEquals(Decision.ok(Window.OPEN), agent.advance(Weather.SUNNY));
    }

    @Test
    @DisplayName("fallback predicate that rejects the state leaves the failure in place")
    void predicateRespected() {
        RuleMatch<Outlook, Window> rules = WeatherWindow.RULES
            .withFallback(state -> state == Outlook.Verdict.GOOD, Window.CLOSE);

        assertEquals(Decision.failed(DecisionError.NO_APPLICABLE_RULE),
            rules.match(new Outlook.Unknown(Weather.CLOUDY)));
        assertEquals(Decision.ok(Window.OPEN), rules.match(Outlook.Verdict.GOOD));
    }

    @Test
    @DisplayName("fallback over a rule set that returns null reports the broken contract")
    void nullDecisionUnderFallback() {
        RuleMatch<Outlook, Window> broken = state -> null;
        SimpleReflexAgent<Weather, Outlook, Window> agent =
            new SimpleReflexAgent<>(WeatherWindow.INTERPRET, broken.withUnrecognizedFallback(Window.CLOSE));

        assertThrows(IllegalStateException.class, () -> agent.advance(Weather.SUNNY));
        assertThrows(IllegalStateException.class, () -> agent.advance(Weather.CLOUDY));
    }
}
