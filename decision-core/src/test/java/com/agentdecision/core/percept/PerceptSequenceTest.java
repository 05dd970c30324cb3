package com.agentdecision.core.percept;

import com.agentdecision.core.fixture.Weather;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PerceptSequenceTest {

    @Test
    @DisplayName("equal length and pairwise-equal elements → equal, same hash")
    void valueEquality() {
        PerceptSequence<Weather> a = PerceptSequence.of(Weather.SUNNY, Weather.RAINY);
        PerceptSequence<Weather> b = PerceptSequence.copyOf(List.of(Weather.SUNNY, Weather.RAINY));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    @DisplayName("order and length both matter")
    void orderAndLengthMatter() {
        PerceptSequence<Weather> sunnyRainy = PerceptSequence.of(Weather.SUNNY, Weather.RAINY);

        assertNotEquals(sunnyRainy, PerceptSequence.of(Weather.RAINY, Weather.SUNNY));
        assertNotEquals(sunnyRainy, PerceptSequence.of(Weather.SUNNY));
        assertNotEquals(sunnyRainy, PerceptSequence.of(Weather.SUNNY, Weather.RAINY, Weather.RAINY));
    }

    @Test
    @DisplayName("append returns a longer sequence, original untouched")
    void appendIsPersistent() {
        PerceptSequence<Weather> base = PerceptSequence.of(Weather.SUNNY);
        PerceptSequence<Weather> grown = base.append(Weather.CLOUDY);

        assertEquals(1, base.size());
        assertEquals(2, grown.size());
        assertEquals(Weather.CLOUDY, grown.last());
        assertTrue(base.isPrefixOf(grown));
    }

    @Test
    @DisplayName("usable as a hash key")
    void hashKey() {
        Set<PerceptSequence<Weather>> keys = new HashSet<>();
        keys.add(PerceptSequence.of(Weather.SUNNY));
        keys.add(PerceptSequence.of(Weather.SUNNY));
        keys.add(PerceptSequence.of(Weather.SUNNY, Weather.SUNNY));

        assertEquals(2, keys.size());
    }

    @Test
    @DisplayName("last() on empty sequence fails, percepts() is read-only")
    void edges() {
        assertThrows(IllegalStateException.class, () -> PerceptSequence.<Weather>empty().last());
        assertThrows(UnsupportedOperationException.class,
            () -> PerceptSequence.of(Weather.SUNNY).percepts().add(Weather.RAINY));
    }
}
