package dev.univer.points.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

class ParseUtilTest {
    private static final ZoneId UTC = ZoneId.of("UTC");
    private static final ZoneId TASHKENT = ZoneId.of("Asia/Tashkent");

    @Test
    @DisplayName("canonical timestamps are read in the sheet zone and converted to UTC")
    void canonicalInZone() {
        assertThat(ParseUtil.parseTimestamp("2025-01-10 14:30:45", TASHKENT))
                .isEqualTo(Instant.parse("2025-01-10T09:30:45Z"));
    }

    @Test
    void fractionalSeconds() {
        assertThat(ParseUtil.parseTimestamp("2025-01-10 14:30:45.123456", UTC))
                .isEqualTo(Instant.parse("2025-01-10T14:30:45.123456Z"));
    }

    @Test
    void europeanAndRussianFormats() {
        Instant expected = Instant.parse("2025-01-10T14:30:45Z");
        assertThat(ParseUtil.parseTimestamp("10/01/2025 14:30:45", UTC)).isEqualTo(expected);
        assertThat(ParseUtil.parseTimestamp("10.01.2025 14:30:45", UTC)).isEqualTo(expected);
        assertThat(ParseUtil.parseTimestamp("10.01.2025 14:30", UTC)).isEqualTo(Instant.parse("2025-01-10T14:30:00Z"));
    }

    @Test
    void dateOnlyMeansStartOfDay() {
        Instant midnight = Instant.parse("2025-01-10T00:00:00Z");
        assertThat(ParseUtil.parseTimestamp("2025-01-10", UTC)).isEqualTo(midnight);
        assertThat(ParseUtil.parseTimestamp("10/01/2025", UTC)).isEqualTo(midnight);
        assertThat(ParseUtil.parseTimestamp("10.01.2025", UTC)).isEqualTo(midnight);
    }

    @Test
    void offsetKeepsItsOwnZone() {
        assertThat(ParseUtil.parseTimestamp("2025-01-10T14:30:45+05:00", UTC))
                .isEqualTo(Instant.parse("2025-01-10T09:30:45Z"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "yesterday", "2025-13-40 99:00:00", "10-01-2025"})
    @DisplayName("unparseable timestamps are absent")
    void unparseable(String raw) {
        assertThat(ParseUtil.parseTimestamp(raw, UTC)).isNull();
    }

    @Test
    void formatIsCanonical() {
        assertThat(ParseUtil.formatTimestamp(Instant.parse("2025-01-10T09:30:45.999Z"), TASHKENT))
                .isEqualTo("2025-01-10 14:30:45");
        assertThat(ParseUtil.formatTimestamp(null, UTC)).isEmpty();
    }

    @Test
    void points() {
        assertThat(ParseUtil.parsePoints("42")).isEqualTo(42);
        assertThat(ParseUtil.parsePoints(" -7 ")).isEqualTo(-7);
        assertThat(ParseUtil.parsePoints("")).isZero();
        assertThat(ParseUtil.parsePoints(null)).isZero();
        assertThat(ParseUtil.parsePoints("12.5")).isNull();
        assertThat(ParseUtil.parsePoints("abc")).isNull();
        assertThat(ParseUtil.parsePoints("99999999999")).isNull();
    }
}
