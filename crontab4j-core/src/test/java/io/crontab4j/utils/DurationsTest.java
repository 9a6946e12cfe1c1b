package io.crontab4j.utils;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DurationsTest {

    @Test
    void parseShouldSupportUnitPairs() {
        assertEquals(Duration.ofMinutes(5), Durations.parse("5 minutes"));
        assertEquals(Duration.ofHours(27), Durations.parse("1 day 3 hours"));
    }

    @Test
    void parseShouldSupportCompactAndBareSeconds() {
        assertEquals(Duration.ofSeconds(90), Durations.parse("90"));
        assertEquals(Duration.ofMinutes(5), Durations.parse("5m"));
        assertEquals(Duration.ofDays(14), Durations.parse("2w"));
    }

    @Test
    void parseShouldRejectMalformedText() {
        assertThrows(IllegalArgumentException.class, () -> Durations.parse(""));
        assertThrows(IllegalArgumentException.class, () -> Durations.parse("five minutes"));
        assertThrows(IllegalArgumentException.class, () -> Durations.parse("3 fortnights"));
        assertThrows(IllegalArgumentException.class, () -> Durations.parse("1 hour 2 hours"));
        assertThrows(IllegalArgumentException.class, () -> Durations.parse("0"));
    }
}
