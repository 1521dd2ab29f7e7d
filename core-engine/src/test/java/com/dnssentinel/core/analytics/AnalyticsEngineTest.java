package com.dnssentinel.core.analytics;

import com.dnssentinel.core.config.AnalyticsConfig;
import com.dnssentinel.core.model.AnomalyType;
import com.dnssentinel.core.model.QueryRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static com.dnssentinel.core.analytics.StatisticalAnomalyDetectorTest.steadyTraffic;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnalyticsEngine}.
 */
class AnalyticsEngineTest {

    private static final Instant START = Instant.parse("2024-05-01T00:00:00Z");
    private static final Instant NOW = START.plus(Duration.ofDays(3));

    private AnalyticsEngine engine;

    @BeforeEach
    void setUp() {
        engine = new AnalyticsEngine(new AnalyticsConfig(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should skip detection while untrained but still analyze trends")
    void shouldProcessWhileUntrained() {
        AnalyticsResult result = engine.process(steadyTraffic(START, 24, 5));

        assertThat(result.getAnomalies()).isEmpty();
        assertThat(result.getTrendAnalysis()).isPresent();
        assertThat(result.getPrediction()).isPresent();
        assertThat(result.getProcessedAt()).isEqualTo(NOW);
        assertThat(engine.getStatus().getStatus()).isEqualTo("untrained");
    }

    @Test
    @DisplayName("Should report ready after training and detect spikes afterwards")
    void shouldDetectAfterTraining() {
        engine.train(steadyTraffic(START, 48, 5));

        AnalyticsResult result = engine.process(steadyTraffic(START.plus(Duration.ofHours(50)), 1, 50));

        assertThat(engine.isTrained()).isTrue();
        assertThat(engine.getModelInfo()).isPresent();
        assertThat(result.getAnomalies()).extracting(a -> a.getType())
                .contains(AnomalyType.VOLUME_SPIKE);
        assertThat(result.getSummary().getHighSeverityCount()).isPositive();
        assertThat(result.getSummary().getHealthScore()).isLessThan(100.0);
        assertThat(engine.getStatus().getLastTraining()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should record a too-small trend batch as an error without failing")
    void shouldDegradeOnSmallTrendBatch() {
        engine.train(steadyTraffic(START, 48, 5));

        AnalyticsResult result = engine.process(steadyTraffic(START.plus(Duration.ofHours(48)), 1, 5));

        assertThat(result.getTrendAnalysis()).isEmpty();
        assertThat(result.getPrediction()).isEmpty();
        EngineStatus status = engine.getStatus();
        assertThat(status.getStatus()).isEqualTo("degraded");
        assertThat(status.getErrors()).anySatisfy(e -> assertThat(e).contains("trend analysis"));
    }

    @Test
    @DisplayName("Should still forecast the whole batch when the trend window holds too few records")
    void shouldForecastWhenWindowedAnalysisFails() {
        List<QueryRecord> batch = new ArrayList<>(steadyTraffic(START, 6, 5));
        batch.addAll(steadyTraffic(START.plus(Duration.ofHours(48)), 1, 2));

        AnalyticsResult result = engine.process(batch);

        assertThat(result.getTrendAnalysis()).isEmpty();
        assertThat(result.getPrediction()).isPresent();
        assertThat(engine.getStatus().getErrors())
                .anySatisfy(e -> assertThat(e).contains("trend analysis"))
                .noneSatisfy(e -> assertThat(e).contains("trend prediction"));
    }

    @Test
    @DisplayName("Should return to ready once a retraining succeeds")
    void shouldClearErrorsOnRetraining() {
        engine.train(steadyTraffic(START, 48, 5));
        engine.process(steadyTraffic(START.plus(Duration.ofHours(48)), 1, 5));
        assertThat(engine.getStatus().getStatus()).isEqualTo("degraded");

        engine.train(steadyTraffic(START, 48, 5));

        EngineStatus status = engine.getStatus();
        assertThat(status.getStatus()).isEqualTo("ready");
        assertThat(status.getErrors()).isEmpty();
    }

    @Test
    @DisplayName("Should propagate insufficient training data")
    void shouldRejectSmallTrainingBatch() {
        List<QueryRecord> few = steadyTraffic(START, 1, 3);

        assertThatThrownBy(() -> engine.train(few)).isInstanceOf(InsufficientDataException.class);
        assertThat(engine.isTrained()).isFalse();
    }
}
