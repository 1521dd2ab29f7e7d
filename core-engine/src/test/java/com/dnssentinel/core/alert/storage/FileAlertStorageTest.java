package com.dnssentinel.core.alert.storage;

import com.dnssentinel.core.alert.Alert;
import com.dnssentinel.core.alert.AlertSeverity;
import com.dnssentinel.core.alert.AlertStatus;
import com.dnssentinel.core.alert.AlertType;
import com.dnssentinel.core.alert.NotFoundException;
import com.dnssentinel.core.alert.NotificationChannel;
import com.dnssentinel.core.alert.NotificationRecord;
import com.dnssentinel.core.config.StorageConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.dnssentinel.core.alert.storage.MemoryAlertStorageTest.alert;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FileAlertStorage}.
 */
class FileAlertStorageTest {

    private static final Instant NOW = Instant.parse("2024-05-08T00:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should persist alerts across storage instances")
    void shouldPersistAcrossInstances() {
        Path file = tempDir.resolve("nested/alerts.json");
        FileAlertStorage first = new FileAlertStorage(file, 10, Duration.ZERO, CLOCK);
        Alert alert = Alert.builder()
                .id("a")
                .type(AlertType.THRESHOLD)
                .severity(AlertSeverity.WARNING)
                .title("Alert a")
                .timestamp(NOW)
                .metadata("rule_id", "volume")
                .tag("rule-triggered")
                .build();
        alert.addNotification(NotificationRecord.delivered(NotificationChannel.LOG, NOW));
        first.store(alert);

        FileAlertStorage second = new FileAlertStorage(file, 10, Duration.ZERO, CLOCK);
        Alert loaded = second.get("a").orElseThrow();

        assertThat(Files.exists(file)).isTrue();
        assertThat(loaded.getTimestamp()).isEqualTo(NOW);
        assertThat(loaded.getStatus()).isEqualTo(AlertStatus.FIRED);
        assertThat(loaded.getMetadata()).containsEntry("rule_id", "volume");
        assertThat(loaded.getTags()).containsExactly("rule-triggered");
        assertThat(loaded.getNotifications()).singleElement()
                .satisfies(r -> assertThat(r.isSuccess()).isTrue());
    }

    @Test
    @DisplayName("Should keep only the newest alerts at capacity")
    void shouldTrimToCapacity() {
        FileAlertStorage storage = new FileAlertStorage(tempDir.resolve("alerts.json"), 2, Duration.ZERO, CLOCK);

        storage.store(alert("old", NOW.minusSeconds(30)));
        storage.store(alert("mid", NOW.minusSeconds(20)));
        storage.store(alert("new", NOW.minusSeconds(10)));

        assertThat(storage.list(AlertFilter.all())).extracting(Alert::getId).containsExactly("new", "mid");
    }

    @Test
    @DisplayName("Should update, delete and clean up expired alerts")
    void shouldUpdateDeleteAndCleanup() {
        FileAlertStorage storage = new FileAlertStorage(tempDir.resolve("alerts.json"), 10,
                Duration.ofHours(1), CLOCK);
        Alert fresh = alert("fresh", NOW);
        storage.store(fresh);
        storage.store(alert("stale", NOW.minus(Duration.ofHours(3))));
        storage.store(alert("gone", NOW));

        fresh.markResolved(NOW);
        storage.update(fresh);
        storage.delete("gone");

        assertThat(storage.cleanup()).isEqualTo(1);
        List<Alert> remaining = storage.list(AlertFilter.all());
        assertThat(remaining).extracting(Alert::getId).containsExactly("fresh");
        assertThat(remaining.get(0).getStatus()).isEqualTo(AlertStatus.RESOLVED);
        assertThatThrownBy(() -> storage.delete("gone")).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Should fail with a storage exception on a corrupt file")
    void shouldFailOnCorruptFile() throws Exception {
        Path file = tempDir.resolve("alerts.json");
        Files.writeString(file, "{not json");
        FileAlertStorage storage = new FileAlertStorage(file, 10, Duration.ZERO, CLOCK);

        assertThatThrownBy(() -> storage.list(AlertFilter.all())).isInstanceOf(StorageException.class);
    }

    @Test
    @DisplayName("Should build backends by type and reject unknown types")
    void shouldCreateByType() {
        StorageConfig config = new StorageConfig();
        config.setType(StorageConfig.TYPE_FILE);
        config.setPath(tempDir.resolve("alerts.json").toString());

        assertThat(AlertStorages.create(config, CLOCK)).isInstanceOf(FileAlertStorage.class);

        config.setType("redis");
        assertThatThrownBy(() -> AlertStorages.create(config, CLOCK))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown storage type");
    }
}
