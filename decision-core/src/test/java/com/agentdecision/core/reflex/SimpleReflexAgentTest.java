package com.agentdecision.core.reflex;

import com.agentdecision.core.decision.Decision;
import com.agentdecision.core.decision.DecisionError;
import com.agentdecision.core.fixture.Outlook;
import com.agentdecision.core.fixture.Weather;
import com.agentdecision.core.fixture.WeatherWindow;
import com.agentdecision.core.fixture.Window;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour of {@link SimpleReflexAgent} over the weather/window rules.
 */
class SimpleReflexAgentTest {

    private final SimpleReflexAgent<Weather, Outlook, Window> agent =
        new SimpleReflexAgent<>(WeatherWindow.INTERPRET, WeatherWindow.RULES);

    // ── advance() ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("advance() — interpret then match")
    class AdvanceTests {

        @Test
        @DisplayName("SUNNY → OPEN, RAINY → CLOSE")
        void knownWeather() {
            assertEquals(Decision.ok(Window.OPEN), agent.advance(Weather.SUNNY));
            assertEquals(Decision.ok(Window.OPEN), agent.advance(Weather.PARTLY_CLOUDY));
            assertEquals(Decision.ok(Window.CLOSE), agent.advance(Weather.RAINY));
            assertEquals(Decision.ok(Window.CLOSE), agent.advance(Weather.THUNDERSTORM));
        }

        @Test
        @DisplayName("CLOUDY → NO_APPLICABLE_RULE, never a default action")
        void cloudyDeclined() {
            assertEquals(Decision.failed(DecisionError.NO_APPLICABLE_RULE), agent.advance(Weather.CLOUDY));
        }

        @Test
        @DisplayName("repeated SUNNY on a fresh agent always OPEN")
        void referentiallyTransparent() {
            Decision<Window> first = agent.advance(Weather.SUNNY);
            for (int i = 0; i < 100; i++) {
                assertEquals(first, agent.advance(Weather.SUNNY),
                    "Reflex decision must not drift on iteration " + i);
            }
            assertEquals(Decision.ok(Window.OPEN), first);
        }

        @Test
        @DisplayName("history does not influence the next decision")
        void noHistory() {
            SimpleReflexAgent<Weather, Outlook, Window> other =
                new SimpleReflexAgent<>(WeatherWindow.INTERPRET, WeatherWindow.RULES);
            for (Weather w : Weather.values()) {
                agent.advance(w);
            }
            for (Weather w : Weather.values()) {
                assertEquals(other.advance(w), agent.advance(w));
            }
        }
    }

    // ── interpretation totality ───────────────────────────────────────────

    @Nested
    @DisplayName("interpretation — total over the percept domain")
    class InterpretationTests {

        @ParameterizedTest
        @EnumSource(Weather.class)
        @DisplayName("every percept maps to a defined state")
        void total(Weather weather) {
            Outlook outlook = assertDoesNotThrow(() -> WeatherWindow.INTERPRET.interpret(weather));
            assertNotNull(outlook);
        }

        @ParameterizedTest
        @EnumSource(Weather.class)
        @DisplayName("every percept yields an action or NO_APPLICABLE_RULE")
        void everyPerceptDecided(Weather weather) {
            Decision<Window> decision = agent.advance(weather);
            assertNotNull(decision);
            decision.error().ifPresent(e -> assertEquals(DecisionError.NO_APPLICABLE_RULE, e));
        }

        @Test
        @DisplayName("unknown states equal iff carried percepts equal")
        void unknownEquality() {
            assertEquals(new Outlook.Unknown(Weather.CLOUDY), WeatherWindow.INTERPRET.interpret(Weather.CLOUDY));
            assertNotEquals(new Outlook.Unknown(Weather.CLOUDY), new Outlook.Unknown(Weather.SUNNY));
        }

        @Test
        @DisplayName("interpreter returning null breaks the contract → IllegalStateException")
        void partialInterpreterRejected() {
            SimpleReflexAgent<Weather, Outlook, Window> partial =
                new SimpleReflexAgent<>(w -> w == Weather.CLOUDY ? null : Outlook.Verdict.GOOD, WeatherWindow.RULES);

            assertEquals(Decision.ok(Window.OPEN), partial.advance(Weather.SUNNY));
            assertThrows(IllegalStateException.class, () -> partial.advance(Weather.CLOUDY));
        }

        @Test
        @DisplayName("identity interpretation passes the percept through")
        void identity() {
            AtomicInteger calls = new AtomicInteger();
            RuleMatch<Weather, Window> sunnyOnly = w -> {
                calls.incrementAndGet();
                if (w == Weather.SUNNY) return Decision.ok(Window.OPEN);
                return Decision.failed(DecisionError.NO_APPLICABLE_RULE);
            };
            SimpleReflexAgent<Weather, Weather, Window> raw =
                new SimpleReflexAgent<>(InterpretInput.identity(), sunnyOnly);

            assertEquals(Decision.ok(Window.OPEN), raw.advance(Weather.SUNNY));
            assertTrue(raw.advance(Weather.RAINY).isFailed());
            assertEquals(2, calls.get());
        }
    }
}
