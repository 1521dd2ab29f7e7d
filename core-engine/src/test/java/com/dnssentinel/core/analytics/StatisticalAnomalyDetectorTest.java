package com.dnssentinel.core.analytics;

import com.dnssentinel.core.config.AnalyticsConfig.AnomalyDetectionSettings;
import com.dnssentinel.core.model.Anomaly;
import com.dnssentinel.core.model.AnomalySeverity;
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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link StatisticalAnomalyDetector}.
 */
class StatisticalAnomalyDetectorTest {

    private static final Instant START = Instant.parse("2024-05-01T00:00:00Z");
    private static final String[] CLIENTS = { "10.0.0.1", "10.0.0.2", "10.0.0.3", "10.0.0.4", "10.0.0.5" };
    private static final String[] DOMAINS = { "example.com", "google.com", "github.com", "cdn.net", "mail.org" };

    private AnomalyDetectionSettings settings;
    private StatisticalAnomalyDetector detector;

    @BeforeEach
    void setUp() {
        settings = new AnomalyDetectionSettings();
        detector = newDetector();
    }

    @Test
    @DisplayName("Should reject a training batch below the minimum and stay untrained")
    void shouldRejectSmallTrainingBatch() {
        List<QueryRecord> small = steadyTraffic(START, 1, 5);

        assertThatThrownBy(() -> detector.train(small))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("10");
        assertThat(detector.isTrained()).isFalse();
        assertThat(detector.getModelInfo()).isEmpty();
    }

    @Test
    @DisplayName("Should refuse detection before training")
    void shouldRequireTraining() {
        assertThatThrownBy(() -> detector.detectAnomalies(steadyTraffic(START, 1, 5)))
                .isInstanceOf(ModelNotTrainedException.class);
    }

    @Test
    @DisplayName("Should report a high-severity volume spike at ten times the trained rate")
    void shouldDetectVolumeSpike() {
        detector.train(steadyTraffic(START, 48, 5));

        Instant spikeHour = START.plus(Duration.ofHours(50));
        List<Anomaly> anomalies = detector.detectAnomalies(steadyTraffic(spikeHour, 1, 50));

        List<Anomaly> spikes = ofType(anomalies, AnomalyType.VOLUME_SPIKE);
        assertThat(spikes).hasSize(1);
        assertThat(spikes.get(0).getSeverity().isHighOrAbove()).isTrue();
        assertThat(spikes.get(0).getScore()).isGreaterThan(5.0);
        assertThat(spikes.get(0).getTimestamp()).isEqualTo(spikeHour);
    }

    @Test
    @DisplayName("Should stay quiet for traffic matching the baseline")
    void shouldNotFlagNormalVolume() {
        detector.train(steadyTraffic(START, 48, 5));

        List<Anomaly> anomalies = detector.detectAnomalies(steadyTraffic(START.plus(Duration.ofHours(48)), 1, 5));

        assertThat(ofType(anomalies, AnomalyType.VOLUME_SPIKE)).isEmpty();
        assertThat(ofType(anomalies, AnomalyType.UNUSUAL_DOMAIN)).isEmpty();
        assertThat(ofType(anomalies, AnomalyType.UNUSUAL_CLIENT)).isEmpty();
    }

    @Test
    @DisplayName("Should report a domain never seen in training")
    void shouldDetectNewDomain() {
        detector.train(steadyTraffic(START, 48, 5));

        Instant at = START.plus(Duration.ofHours(48));
        List<QueryRecord> batch = new ArrayList<>(steadyTraffic(at, 1, 5));
        for (int i = 0; i < 10; i++) {
            batch.add(QueryRecord.of(at.plusSeconds(i), CLIENTS[0], "c2.badhost.xyz"));
        }

        List<Anomaly> domains = ofType(detector.detectAnomalies(batch), AnomalyType.UNUSUAL_DOMAIN);

        assertThat(domains).extracting(Anomaly::getDomain).contains("c2.badhost.xyz");
        assertThat(domains.get(0).getSeverity()).isEqualTo(AnomalySeverity.HIGH);
    }

    @Test
    @DisplayName("Should score a spike against the trained deviation of a tight baseline")
    void shouldDetectSpikeAgainstTightBaseline() {
        int[] counts = new int[24];
        for (int h = 0; h < counts.length; h++) {
            counts[h] = h % 2 == 0 ? 98 : 102;
        }
        detector.train(hourlyTraffic(START, counts));

        Instant at = START.plus(Duration.ofHours(24));
        List<Anomaly> spikes = ofType(detector.detectAnomalies(hourlyTraffic(at, 115)), AnomalyType.VOLUME_SPIKE);

        assertThat(spikes).hasSize(1);
        assertThat(spikes.get(0).getSeverity()).isEqualTo(AnomalySeverity.CRITICAL);
        assertThat(spikes.get(0).getScore()).isGreaterThan(7.0);
        assertThat((Double) spikes.get(0).getMetadata().get("baseline_stddev")).isLessThan(2.1);
    }

    @Test
    @DisplayName("Should report a client never seen in training")
    void shouldDetectNewClient() {
        detector.train(steadyTraffic(START, 48, 5));

        Instant at = START.plus(Duration.ofHours(48));
        List<QueryRecord> batch = new ArrayList<>(steadyTraffic(at, 1, 5));
        for (int i = 0; i < 12; i++) {
            batch.add(QueryRecord.of(at.plusSeconds(i), "10.9.9.9", DOMAINS[i % DOMAINS.length]));
        }

        List<Anomaly> clients = ofType(detector.detectAnomalies(batch), AnomalyType.UNUSUAL_CLIENT);

        assertThat(clients).hasSize(1);
        assertThat(clients.get(0).getClient()).isEqualTo("10.9.9.9");
        assertThat(clients.get(0).getSeverity()).isEqualTo(AnomalySeverity.HIGH);
        assertThat(clients.get(0).getMetadata()).containsEntry("first_seen", true);
    }

    @Test
    @DisplayName("Should report a known domain whose share of the batch jumps")
    void shouldDetectKnownDomainShareOutlier() {
        detector.train(steadyTraffic(START, 48, 5));

        Instant at = START.plus(Duration.ofHours(48));
        List<QueryRecord> batch = new ArrayList<>(steadyTraffic(at, 1, 5));
        for (int i = 0; i < 40; i++) {
            batch.add(QueryRecord.of(at.plusSeconds(i), CLIENTS[i % CLIENTS.length], "example.com"));
        }

        List<Anomaly> domains = ofType(detector.detectAnomalies(batch), AnomalyType.UNUSUAL_DOMAIN);

        assertThat(domains).hasSize(1);
        Anomaly anomaly = domains.get(0);
        assertThat(anomaly.getDomain()).isEqualTo("example.com");
        assertThat(anomaly.getSeverity()).isEqualTo(AnomalySeverity.CRITICAL);
        assertThat(anomaly.getScore()).isGreaterThan(10.0);
        assertThat(anomaly.getMetadata()).containsEntry("training_share", 0.2)
                .doesNotContainKey("first_seen");
        assertThat(ofType(detector.detectAnomalies(batch), AnomalyType.UNUSUAL_CLIENT)).isEmpty();
    }

    @Test
    @DisplayName("Should drop every anomaly below the configured minimum confidence")
    void shouldApplyConfidenceFilter() {
        settings.setMinConfidence(0.95);
        detector = newDetector();
        detector.train(steadyTraffic(START, 48, 5));

        Instant at = START.plus(Duration.ofHours(50));
        List<QueryRecord> batch = new ArrayList<>(steadyTraffic(at, 1, 50));
        for (int i = 0; i < 12; i++) {
            batch.add(QueryRecord.of(at.plusSeconds(i), "10.9.9.9", "new-" + (i % 2) + ".example"));
        }

        List<Anomaly> anomalies = detector.detectAnomalies(batch);

        assertThat(anomalies).isNotEmpty();
        assertThat(anomalies).allSatisfy(a -> assertThat(a.getConfidence()).isGreaterThanOrEqualTo(0.95));
    }

    @Test
    @DisplayName("Should only run the enabled anomaly types")
    void shouldHonourEnabledTypes() {
        settings.setAnomalyTypes(List.of("unusual_domain"));
        detector = newDetector();
        detector.train(steadyTraffic(START, 48, 5));

        List<Anomaly> anomalies = detector.detectAnomalies(steadyTraffic(START.plus(Duration.ofHours(50)), 1, 50));

        assertThat(ofType(anomalies, AnomalyType.VOLUME_SPIKE)).isEmpty();
    }

    @Test
    @DisplayName("Should classify values against mean 50 and stddev 10")
    void shouldClassifyAgainstBaseline() {
        assertThat(StatisticalAnomalyDetector.classify(100, 50, 10)).contains(AnomalySeverity.CRITICAL);
        assertThat(StatisticalAnomalyDetector.classify(80, 50, 10)).contains(AnomalySeverity.HIGH);
        assertThat(StatisticalAnomalyDetector.classify(70, 50, 10)).contains(AnomalySeverity.MEDIUM);
        assertThat(StatisticalAnomalyDetector.classify(60, 50, 10)).contains(AnomalySeverity.LOW);
        assertThat(StatisticalAnomalyDetector.classify(55, 50, 10)).isEmpty();
    }

    @Test
    @DisplayName("Should describe the trained model")
    void shouldExposeModelInfo() {
        detector.train(steadyTraffic(START, 24, 5));

        ModelInfo info = detector.getModelInfo().orElseThrow();
        assertThat(info.getTrainingSize()).isEqualTo(120);
        assertThat(info.getTrainedAt()).isEqualTo(START.plus(Duration.ofDays(30)));
        assertThat(info.getParameters()).containsKey("baselineMean");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private StatisticalAnomalyDetector newDetector() {
        return new StatisticalAnomalyDetector(settings, ZoneOffset.UTC,
                Clock.fixed(START.plus(Duration.ofDays(30)), ZoneOffset.UTC));
    }

    /** {@code perHour} queries in each of {@code hours} consecutive hours. */
    static List<QueryRecord> steadyTraffic(Instant from, int hours, int perHour) {
        List<QueryRecord> records = new ArrayList<>();
        for (int h = 0; h < hours; h++) {
            Instant hour = from.plus(Duration.ofHours(h));
            for (int q = 0; q < perHour; q++) {
                records.add(QueryRecord.of(hour.plusSeconds(q * 60L),
                        CLIENTS[q % CLIENTS.length], DOMAINS[q % DOMAINS.length]));
            }
        }
        return records;
    }

    /** {@code counts[h]} queries in hour {@code h}, thirty seconds apart. */
    private static List<QueryRecord> hourlyTraffic(Instant from, int... counts) {
        List<QueryRecord> records = new ArrayList<>();
        for (int h = 0; h < counts.length; h++) {
            Instant hour = from.plus(Duration.ofHours(h));
            for (int q = 0; q < counts[h]; q++) {
                records.add(QueryRecord.of(hour.plusSeconds(q * 30L),
                        CLIENTS[q % CLIENTS.length], DOMAINS[q % DOMAINS.length]));
            }
        }
        return records;
    }

    private static List<Anomaly> ofType(List<Anomaly> anomalies, AnomalyType type) {
        return anomalies.stream().filter(a -> a.getType() == type).toList();
    }
}
