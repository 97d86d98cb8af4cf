package com.media.lifecycle.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RetentionDurations Tests")
class RetentionDurationsTest {

    @Test
    @DisplayName("Should parse each supported unit")
    void parsesUnits() {
        assertEquals(Duration.ofDays(90), RetentionDurations.parse("90d"));
        assertEquals(Duration.ofHours(24), RetentionDurations.parse("24h"));
        assertEquals(Duration.ofMinutes(30), RetentionDurations.parse("30m"));
        assertEquals(Duration.ofSeconds(45), RetentionDurations.parse("45s"));
    }

    @Test
    @DisplayName("never should parse to zero")
    void neverIsZero() {
        assertEquals(Duration.ZERO, RetentionDurations.parse("never"));
        assertTrue(RetentionDurations.parse("0d").isZero());
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"90", "d", "90w", "-5d", "1.5d", " 90d", "90D", "Never", "ninety days"})
    @DisplayName("Should reject malformed strings")
    void rejectsMalformed(String value) {
        assertThrows(InvalidDurationException.class, () -> RetentionDurations.parse(value));
    }

    @ParameterizedTest
    @ValueSource(strings = {"999999999999999999d", "9999999999999999h", "999999999999999999m",
            "99999999999999999999s"})
    @DisplayName("Amounts beyond the Duration range should be rejected")
    void rejectsOutOfRange(String value) {
        InvalidDurationException e = assertThrows(InvalidDurationException.class,
                () -> RetentionDurations.parse(value));
        assertTrue(e.getMessage().contains(value));
    }
}
