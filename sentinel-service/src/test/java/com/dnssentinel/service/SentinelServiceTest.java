package com.dnssentinel.service;

import com.dnssentinel.core.alert.Alert;
import com.dnssentinel.core.alert.AlertType;
import com.dnssentinel.core.config.ConditionDefinition;
import com.dnssentinel.core.config.RuleDefinition;
import com.dnssentinel.core.config.SentinelConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SentinelService}.
 */
class SentinelServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private SentinelService service;

    @AfterEach
    void tearDown() {
        if (service != null) {
            service.close();
        }
    }

    @Test
    @DisplayName("Should run one cycle from the records file and fire matching rules")
    void shouldRunSingleCycle() throws Exception {
        Path records = writeRecords(12);
        service = new SentinelService(serviceConfig(records), config(10), Clock.fixed(NOW, ZoneOffset.UTC));

        service.start();

        List<Alert> active = service.alertManager().getActiveAlerts();
        assertThat(active).singleElement()
                .satisfies(a -> assertThat(a.getType()).isEqualTo(AlertType.THRESHOLD))
                .satisfies(a -> assertThat(a.getSource()).isEqualTo("rule:busy"));
        assertThat(service.healthServer().isRunning()).isTrue();
        assertThat(service.alertManager().getStatus().getLastEvaluation()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should create no alerts when the records stay below the threshold")
    void shouldStayQuietBelowThreshold() throws Exception {
        Path records = writeRecords(5);
        service = new SentinelService(serviceConfig(records), config(10), Clock.fixed(NOW, ZoneOffset.UTC));

        service.start();

        assertThat(service.runCycle()).isEmpty();
        assertThat(service.alertManager().getActiveAlerts()).isEmpty();
    }

    @Test
    @DisplayName("Should stop the alert manager and health server on close")
    void shouldStopOnClose() throws Exception {
        service = new SentinelService(serviceConfig(writeRecords(1)), config(10), Clock.fixed(NOW, ZoneOffset.UTC));
        service.start();

        service.close();

        assertThat(service.alertManager().isRunning()).isFalse();
        assertThat(service.healthServer().isRunning()).isFalse();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ServiceConfig serviceConfig(Path records) {
        return new ServiceConfig.Builder()
                .recordsPath(records.toString())
                .healthPort(0)
                .analysisMode(ServiceConfig.MODE_ONCE)
                .build();
    }

    private static SentinelConfig config(int threshold) {
        RuleDefinition rule = new RuleDefinition();
        rule.setId("busy");
        rule.setName("Busy Network");
        rule.setType("threshold");
        rule.setConditions(List.of(new ConditionDefinition("total_queries", "gt", threshold)));

        SentinelConfig config = new SentinelConfig();
        config.getAlerts().setRules(List.of(rule));
        config.getAlerts().getStorage().setCleanupInterval("0");
        config.getAnalytics().getAnomalyDetection().setEnabled(false);
        return config;
    }

    private Path writeRecords(int count) throws Exception {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            lines.add("{\"timestamp\":\"" + NOW.minusSeconds(60L * (count - i))
                    + "\",\"client\":\"10.0.0." + (i % 3) + "\",\"domain\":\"site" + i + ".example\",\"status\":2}");
        }
        Path file = tempDir.resolve("queries.jsonl");
        Files.write(file, lines);
        return file;
    }
}
