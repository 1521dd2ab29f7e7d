package com.dnssentinel.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ServiceConfig}.
 */
class ServiceConfigTest {

    @Test
    @DisplayName("Should apply defaults and fall back to the records path for training")
    void shouldApplyDefaults() {
        ServiceConfig config = new ServiceConfig.Builder().build();

        assertThat(config.getRecordsPath()).isEqualTo("data/queries.jsonl");
        assertThat(config.getTrainingPath()).isEqualTo("data/queries.jsonl");
        assertThat(config.getHealthPort()).isEqualTo(8080);
        assertThat(config.getDataSource()).isEqualTo("file");
        assertThat(config.isScheduled()).isTrue();
    }

    @Test
    @DisplayName("Should keep an explicit training path and once mode")
    void shouldHonourExplicitValues() {
        ServiceConfig config = new ServiceConfig.Builder()
                .recordsPath("live.jsonl")
                .trainingPath("history.jsonl")
                .analysisMode(ServiceConfig.MODE_ONCE)
                .healthPort(0)
                .build();

        assertThat(config.getTrainingPath()).isEqualTo("history.jsonl");
        assertThat(config.isScheduled()).isFalse();
        assertThat(config.toString()).contains("recordsPath='live.jsonl'");
    }

    @Test
    @DisplayName("Should reject an unknown analysis mode")
    void shouldRejectUnknownMode() {
        assertThatThrownBy(() -> new ServiceConfig.Builder().analysisMode("continuous").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("analysisMode");
    }

    @Test
    @DisplayName("Should reject an out-of-range health port")
    void shouldRejectBadPort() {
        assertThatThrownBy(() -> new ServiceConfig.Builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("healthPort");
    }

    @Test
    @DisplayName("Should reject a blank records path")
    void shouldRejectBlankRecordsPath() {
        assertThatThrownBy(() -> new ServiceConfig.Builder().recordsPath(" ").build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
