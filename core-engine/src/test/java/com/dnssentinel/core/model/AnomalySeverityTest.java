package com.dnssentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnomalySeverity}.
 */
class AnomalySeverityTest {

    @Test
    @DisplayName("Should map z-scores onto the 1/2/3/5 breakpoints")
    void shouldClassifyZScores() {
        assertThat(AnomalySeverity.fromZScore(5.0)).contains(AnomalySeverity.CRITICAL);
        assertThat(AnomalySeverity.fromZScore(4.99)).contains(AnomalySeverity.HIGH);
        assertThat(AnomalySeverity.fromZScore(3.0)).contains(AnomalySeverity.HIGH);
        assertThat(AnomalySeverity.fromZScore(2.0)).contains(AnomalySeverity.MEDIUM);
        assertThat(AnomalySeverity.fromZScore(1.0)).contains(AnomalySeverity.LOW);
        assertThat(AnomalySeverity.fromZScore(0.99)).isEmpty();
        assertThat(AnomalySeverity.fromZScore(-4)).isEmpty();
    }

    @Test
    @DisplayName("Should treat only high and critical as high severity")
    void shouldFlagHighOrAbove() {
        assertThat(AnomalySeverity.CRITICAL.isHighOrAbove()).isTrue();
        assertThat(AnomalySeverity.HIGH.isHighOrAbove()).isTrue();
        assertThat(AnomalySeverity.MEDIUM.isHighOrAbove()).isFalse();
        assertThat(AnomalySeverity.LOW.isHighOrAbove()).isFalse();
    }

    @Test
    @DisplayName("Should reject unknown severity codes")
    void shouldRejectUnknownCode() {
        assertThat(AnomalySeverity.fromCode("High")).isEqualTo(AnomalySeverity.HIGH);
        assertThatThrownBy(() -> AnomalySeverity.fromCode("severe"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
