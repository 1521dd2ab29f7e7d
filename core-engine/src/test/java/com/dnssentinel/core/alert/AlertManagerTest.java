package com.dnssentinel.core.alert;

import com.dnssentinel.core.alert.notify.NotificationException;
import com.dnssentinel.core.alert.notify.NotificationHandler;
import com.dnssentinel.core.alert.storage.MemoryAlertStorage;
import com.dnssentinel.core.alert.storage.StorageException;
import com.dnssentinel.core.analytics.AnalyticsResult;
import com.dnssentinel.core.config.AlertConfig;
import com.dnssentinel.core.model.Anomaly;
import com.dnssentinel.core.model.AnomalySeverity;
import com.dnssentinel.core.model.AnomalyType;
import com.dnssentinel.core.model.MetricsSnapshot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertManager}.
 */
class AlertManagerTest {

    private static final Instant START = Instant.parse("2024-05-01T12:00:00Z");

    private MutableClock clock;
    private AlertConfig config;
    private AlertManager manager;
    private RecordingHandler logHandler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        config = new AlertConfig();
        config.setRules(List.of());
        logHandler = new RecordingHandler(NotificationChannel.LOG);
    }

    @AfterEach
    void tearDown() {
        if (manager != null) {
            manager.close();
        }
    }

    @Test
    @DisplayName("Should ignore data and report stopped before initialization")
    void shouldIgnoreDataWhenNotRunning() {
        manager = new AlertManager(config, clock, null);

        assertThat(manager.processData(metrics(1000), null)).isEmpty();
        assertThat(manager.getStatus().getHealth()).isEqualTo(ManagerHealth.STOPPED);
        assertThat(manager.getAlertHistory(10)).isEmpty();
    }

    @Test
    @DisplayName("Should move a resolved alert out of the active set but keep it in history")
    void shouldResolveAlert() throws NotificationException {
        start();
        Alert alert = alert("a-1");

        manager.fireAlert(alert);
        manager.resolveAlert("a-1");

        assertThat(manager.getActiveAlerts()).isEmpty();
        List<Alert> history = manager.getAlertHistory(0);
        assertThat(history).extracting(Alert::getId).containsExactly("a-1");
        assertThat(history.get(0).getStatus()).isEqualTo(AlertStatus.RESOLVED);
        assertThat(history.get(0).getResolvedAt()).isEqualTo(START);
        assertThat(logHandler.sent).containsExactly(alert);
    }

    @Test
    @DisplayName("Should throw when resolving an unknown alert")
    void shouldRejectUnknownResolve() {
        start();

        assertThatThrownBy(() -> manager.resolveAlert("missing")).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Should replace rules by ID and reject removal of unknown rules")
    void shouldManageRules() {
        start();

        manager.updateRule(thresholdRule("r1", 500, Duration.ZERO));
        manager.updateRule(thresholdRule("r1", 700, Duration.ZERO));

        assertThat(manager.getRules()).hasSize(1);
        assertThat(manager.getRules().get(0).getConditions().get(0).describe()).isEqualTo("total_queries gt 700");

        manager.removeRule("r1");
        assertThat(manager.getRules()).isEmpty();
        assertThatThrownBy(() -> manager.removeRule("r1")).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Should fire a threshold alert only when the condition holds")
    void shouldFireThresholdRule() {
        start();
        manager.updateRule(thresholdRule("volume", 500, Duration.ZERO));

        List<Alert> quiet = manager.processData(metrics(100), null);
        List<Alert> busy = manager.processData(metrics(1000), null);

        assertThat(quiet).isEmpty();
        assertThat(busy).hasSize(1);
        Alert alert = busy.get(0);
        assertThat(alert.getType()).isEqualTo(AlertType.THRESHOLD);
        assertThat(alert.getSource()).isEqualTo("rule:volume");
        assertThat(alert.getTags()).contains("rule-triggered");
        assertThat(alert.getMetadata()).containsEntry("rule_id", "volume")
                .containsEntry("triggered_conditions", List.of("total_queries gt 500"));
        assertThat(alert.getDescription()).isEqualTo("Rule 'volume' triggered: total_queries gt 500");
        assertThat(manager.getActiveAlerts()).containsExactly(alert);
        assertThat(logHandler.sent).containsExactly(alert);
        assertThat(manager.getStatus().getLastEvaluation()).isEqualTo(START);
    }

    @Test
    @DisplayName("Should not refire a rule inside its cooldown")
    void shouldEnforceCooldown() {
        start();
        manager.updateRule(thresholdRule("volume", 500, Duration.ofMinutes(10)));

        assertThat(manager.processData(metrics(1000), null)).hasSize(1);
        clock.advance(Duration.ofMinutes(5));
        assertThat(manager.processData(metrics(1000), null)).isEmpty();
        clock.advance(Duration.ofMinutes(6));
        List<Alert> again = manager.processData(metrics(1000), null);

        assertThat(again).hasSize(1);
        assertThat(again.get(0).getSuppressUntil()).isEqualTo(clock.instant().plus(Duration.ofMinutes(10)));
    }

    @Test
    @DisplayName("Should refire every cycle when cooldown enforcement is off")
    void shouldIgnoreCooldownWhenDisabled() {
        config.setCooldownEnforced(false);
        start();
        manager.updateRule(thresholdRule("volume", 500, Duration.ofMinutes(10)));

        assertThat(manager.processData(metrics(1000), null)).hasSize(1);
        assertThat(manager.processData(metrics(1000), null)).hasSize(1);
    }

    @Test
    @DisplayName("Should suppress alerts beyond the active limit without notifying")
    void shouldSuppressOverflow() throws NotificationException {
        config.setMaxActiveAlerts(1);
        start();
        Alert first = alert("a-1");
        Alert second = alert("a-2");

        manager.fireAlert(first);
        manager.fireAlert(second);

        assertThat(manager.getActiveAlerts()).containsExactly(first);
        assertThat(second.getStatus()).isEqualTo(AlertStatus.SUPPRESSED);
        assertThat(second.getNotifications()).isEmpty();
        assertThat(logHandler.sent).containsExactly(first);
        assertThat(manager.getAlertHistory(0)).hasSize(2);
    }

    @Test
    @DisplayName("Should turn only confident anomalies into ML alerts, before rule alerts")
    void shouldCreateAnomalyAlerts() {
        start();
        manager.updateRule(AlertRule.builder()
                .id("any-anomaly")
                .type(AlertType.ANOMALY)
                .severity(AlertSeverity.WARNING)
                .condition(AlertCondition.of("anomaly_volume_spike", "gte", 1))
                .build());
        AnalyticsResult result = AnalyticsResult.ofAnomalies(List.of(
                anomaly("confident", 0.9, AnomalySeverity.HIGH),
                anomaly("unsure", 0.5, AnomalySeverity.LOW)), START);

        List<Alert> alerts = manager.processData(metrics(10), result);

        assertThat(alerts).hasSize(2);
        Alert ml = alerts.get(0);
        assertThat(ml.getSource()).isEqualTo(AlertManager.ML_SOURCE);
        assertThat(ml.getTitle()).isEqualTo("ML Anomaly Detected: volume_spike");
        assertThat(ml.getSeverity()).isEqualTo(AlertSeverity.ERROR);
        assertThat(ml.getMlConfidence()).isEqualTo(0.9);
        assertThat(ml.getTags()).containsExactly("ml", "anomaly", "volume_spike");
        assertThat(ml.getMetadata()).containsEntry("anomaly_id", "confident");
        assertThat(alerts.get(1).getSource()).isEqualTo("rule:any-anomaly");
    }

    @Test
    @DisplayName("Should attempt every channel and throw the last failure")
    void shouldRecordNotificationFailures() {
        start();
        manager.updateRule(thresholdRule("volume", 500, Duration.ZERO).toBuilder()
                .channels(List.of(NotificationChannel.SLACK, NotificationChannel.LOG))
                .build());
        Alert alert = alert("a-1");
        alert.setSource("rule:volume");

        assertThatThrownBy(() -> manager.fireAlert(alert))
                .isInstanceOf(NotificationException.class)
                .hasMessageContaining("no handler registered");

        assertThat(alert.getNotifications()).extracting(NotificationRecord::getChannel)
                .containsExactly(NotificationChannel.SLACK, NotificationChannel.LOG);
        assertThat(alert.getNotifications()).extracting(NotificationRecord::isSuccess)
                .containsExactly(false, true);
        assertThat(manager.getStatus().getErrorCount()).isZero();
        assertThat(manager.getActiveAlerts()).containsExactly(alert);
    }

    @Test
    @DisplayName("Should isolate a failing rule and count the error")
    void shouldIsolateRuleFailures() {
        start();
        manager.updateRule(AlertRule.builder()
                .id("broken")
                .type(AlertType.THRESHOLD)
                .severity(AlertSeverity.WARNING)
                .condition(AlertCondition.of("total_queries", "between", 5))
                .build());
        manager.updateRule(thresholdRule("volume", 500, Duration.ZERO));

        List<Alert> alerts = manager.processData(metrics(1000), null);

        assertThat(alerts).extracting(Alert::getSource).containsExactly("rule:volume");
        ManagerStatus status = manager.getStatus();
        assertThat(status.getErrorCount()).isEqualTo(1);
        assertThat(status.getHealth()).isEqualTo(ManagerHealth.ERRORS);
    }

    @Test
    @DisplayName("Should keep every alert when fired concurrently")
    void shouldFireConcurrently() throws Exception {
        config.setMaxActiveAlerts(1000);
        start();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                int thread = t;
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 25; i++) {
                        manager.fireAlert(alert("t" + thread + "-" + i));
                    }
                    return null;
                }));
            }
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            pool.shutdownNow();
        }

        ManagerStatus status = manager.getStatus();
        assertThat(status.getActiveAlerts()).isEqualTo(200);
        assertThat(status.getTotalAlerts()).isEqualTo(200);
        assertThat(logHandler.sent).hasSize(200);
        assertThat(status.getHealth()).isEqualTo(ManagerHealth.HEALTHY);
    }

    @Test
    @DisplayName("Should fire a rule once per cooldown window under concurrent processing")
    void shouldHonourCooldownUnderConcurrentProcessing() throws Exception {
        config.setMaxActiveAlerts(1000);
        start();
        manager.updateRule(thresholdRule("volume", 500, Duration.ofMinutes(10)));

        int threads = 8;
        int rounds = 50;
        CyclicBarrier barrier = new CyclicBarrier(threads);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            for (int round = 0; round < rounds; round++) {
                List<Future<Integer>> futures = new ArrayList<>();
                for (int t = 0; t < threads; t++) {
                    futures.add(pool.submit(() -> {
                        barrier.await();
                        return manager.processData(metrics(1000), null).size();
                    }));
                }
                int fired = 0;
                for (Future<Integer> f : futures) {
                    fired += f.get();
                }
                assertThat(fired).as("alerts fired in round %d", round).isEqualTo(1);
                clock.advance(Duration.ofMinutes(11));
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(manager.getActiveAlerts()).hasSize(rounds);
        assertThat(logHandler.sent).hasSize(rounds);
    }

    @Test
    @DisplayName("Should keep a fired alert active and notified when storage fails")
    void shouldSurviveStorageFailure() throws NotificationException {
        manager = new AlertManager(config, clock, sc -> new MemoryAlertStorage(1000, Duration.ZERO, clock) {
            @Override
            public void store(Alert alert) {
                throw new StorageException("disk full");
            }
        });
        manager.initialize();
        manager.registerHandler(logHandler);
        Alert alert = alert("a-1");

        manager.fireAlert(alert);

        assertThat(manager.getActiveAlerts()).extracting(Alert::getId).containsExactly("a-1");
        assertThat(logHandler.sent).containsExactly(alert);
        assertThat(alert.getStatus()).isEqualTo(AlertStatus.FIRED);
    }

    @Test
    @DisplayName("Should reject a test notification on a channel without a handler")
    void shouldRejectTestOnMissingChannel() throws NotificationException {
        start();

        manager.testNotification(NotificationChannel.LOG);

        assertThat(logHandler.sent).singleElement()
                .satisfies(a -> assertThat(a.getType()).isEqualTo(AlertType.CONFIGURATION));
        assertThatThrownBy(() -> manager.testNotification(NotificationChannel.EMAIL))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Should flatten metrics and anomalies into the rule snapshot")
    void shouldBuildSnapshot() {
        AnalyticsResult result = AnalyticsResult.ofAnomalies(List.of(
                anomaly("x", 0.9, AnomalySeverity.CRITICAL)), START);

        Map<String, Object> snapshot = AlertManager.buildSnapshot(metrics(42), result);

        assertThat(snapshot).containsEntry("total_queries", 42L)
                .containsEntry("anomaly_count", 1)
                .containsEntry("high_severity_anomalies", 1)
                .containsEntry("anomaly_volume_spike", 1)
                .containsEntry("anomaly_unusual_domain", 0)
                .containsEntry("anomaly_types", List.of("volume_spike"))
                .containsEntry("health_score", 88.0);
    }

    @Test
    @DisplayName("Should stop on close and report stopped health")
    void shouldStopOnClose() {
        start();

        manager.close();

        assertThat(manager.isRunning()).isFalse();
        assertThat(manager.getStatus().getHealth()).isEqualTo(ManagerHealth.STOPPED);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void start() {
        manager = new AlertManager(config, clock, sc -> new MemoryAlertStorage(1000, Duration.ZERO, clock));
        manager.initialize();
        manager.registerHandler(logHandler);
    }

    private Alert alert(String id) {
        return Alert.builder()
                .id(id)
                .type(AlertType.THRESHOLD)
                .severity(AlertSeverity.WARNING)
                .title("Test " + id)
                .timestamp(clock.instant())
                .source("test")
                .build();
    }

    private static AlertRule thresholdRule(String id, int threshold, Duration cooldown) {
        return AlertRule.builder()
                .id(id)
                .type(AlertType.THRESHOLD)
                .severity(AlertSeverity.WARNING)
                .condition(AlertCondition.of("total_queries", "gt", threshold))
                .cooldown(cooldown)
                .channels(List.of(NotificationChannel.LOG))
                .build();
    }

    private MetricsSnapshot metrics(long totalQueries) {
        return MetricsSnapshot.builder()
                .totalQueries(totalQueries)
                .uniqueClients(3)
                .analysisMode("batch")
                .dataSourceType("file")
                .timestamp(clock.instant())
                .build();
    }

    private static Anomaly anomaly(String id, double confidence, AnomalySeverity severity) {
        return Anomaly.builder()
                .id(id)
                .type(AnomalyType.VOLUME_SPIKE)
                .severity(severity)
                .score(4.2)
                .confidence(confidence)
                .timestamp(START)
                .description("spike")
                .build();
    }

    private static final class RecordingHandler implements NotificationHandler {
        private final NotificationChannel channel;
        private final List<Alert> sent = Collections.synchronizedList(new ArrayList<>());

        RecordingHandler(NotificationChannel channel) {
            this.channel = channel;
        }

        @Override
        public NotificationChannel channel() {
            return channel;
        }

        @Override
        public void send(Alert alert) {
            sent.add(alert);
        }
    }

    private static final class MutableClock extends Clock {
        private volatile Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
