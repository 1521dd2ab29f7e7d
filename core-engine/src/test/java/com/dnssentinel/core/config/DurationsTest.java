package com.dnssentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Durations}.
 */
class DurationsTest {

    @Test
    @DisplayName("Should parse unit-suffixed and chained durations")
    void shouldParseSuffixedDurations() {
        assertThat(Durations.parse("250ms")).isEqualTo(Duration.ofMillis(250));
        assertThat(Durations.parse("30s")).isEqualTo(Duration.ofSeconds(30));
        assertThat(Durations.parse("5m")).isEqualTo(Duration.ofMinutes(5));
        assertThat(Durations.parse("1h30m")).isEqualTo(Duration.ofMinutes(90));
        assertThat(Durations.parse("7d")).isEqualTo(Duration.ofDays(7));
        assertThat(Durations.parse("0")).isZero();
    }

    @Test
    @DisplayName("Should parse ISO-8601 durations")
    void shouldParseIsoDurations() {
        assertThat(Durations.parse("PT5M")).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("Should reject malformed durations")
    void shouldRejectMalformed() {
        assertThatThrownBy(() -> Durations.parse("5 minutes")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Durations.parse("m5")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Durations.parse("")).isInstanceOf(IllegalArgumentException.class);
        assertThat(Durations.isValid("10x")).isFalse();
        assertThat(Durations.isValid(null)).isFalse();
    }

    @Test
    @DisplayName("Should fall back to the default for blank text")
    void shouldUseDefault() {
        assertThat(Durations.parseOrDefault(" ", Duration.ofMinutes(1))).isEqualTo(Duration.ofMinutes(1));
        assertThat(Durations.parseOrDefault("2h", Duration.ofMinutes(1))).isEqualTo(Duration.ofHours(2));
    }
}
