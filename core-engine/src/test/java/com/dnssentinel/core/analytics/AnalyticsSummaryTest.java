package com.dnssentinel.core.analytics;

import com.dnssentinel.core.model.Anomaly;
import com.dnssentinel.core.model.AnomalySeverity;
import com.dnssentinel.core.model.AnomalyType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AnalyticsSummary}.
 */
class AnalyticsSummaryTest {

    @Test
    @DisplayName("Should report a healthy network when nothing was found")
    void shouldBeHealthyWithoutAnomalies() {
        AnalyticsSummary summary = AnalyticsSummary.of(List.of(), null);

        assertThat(summary.getHealthScore()).isEqualTo(100.0);
        assertThat(summary.getTrendDirection()).isEqualTo(TrendDirection.STABLE);
        assertThat(summary.getRecommendations()).containsExactly(AnalyticsSummary.RECOMMEND_HEALTHY);
    }

    @Test
    @DisplayName("Should count high and critical anomalies as high severity")
    void shouldCountHighAndCritical() {
        List<Anomaly> anomalies = List.of(
                anomaly(AnomalySeverity.LOW), anomaly(AnomalySeverity.HIGH), anomaly(AnomalySeverity.CRITICAL));

        AnalyticsSummary summary = AnalyticsSummary.of(anomalies, null);

        assertThat(summary.getTotalAnomalies()).isEqualTo(3);
        assertThat(summary.getHighSeverityCount()).isEqualTo(2);
        assertThat(summary.getHealthScore()).isEqualTo(100 - 6 - 20);
        assertThat(summary.getRecommendations())
                .containsExactly(AnalyticsSummary.RECOMMEND_INVESTIGATE, AnalyticsSummary.RECOMMEND_HIGH_SEVERITY);
    }

    @Test
    @DisplayName("Should clamp the health score at zero and warn below fifty")
    void shouldClampHealthScore() {
        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            anomalies.add(anomaly(AnomalySeverity.CRITICAL));
        }

        AnalyticsSummary summary = AnalyticsSummary.of(anomalies, null);

        assertThat(summary.getHealthScore()).isZero();
        assertThat(summary.getRecommendations()).contains(AnalyticsSummary.RECOMMEND_CONCERNING);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static int seq;

    private static Anomaly anomaly(AnomalySeverity severity) {
        return Anomaly.builder()
                .id("a-" + (seq++))
                .type(AnomalyType.VOLUME_SPIKE)
                .severity(severity)
                .score(3)
                .confidence(0.8)
                .timestamp(Instant.parse("2024-05-01T00:00:00Z"))
                .description("test")
                .build();
    }
}
