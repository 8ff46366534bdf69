package com.alertsentinel.runner;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RunnerConfig}.
 */
class RunnerConfigTest {

    @Test
    @DisplayName("Builder defaults are valid and log-only")
    void defaults() {
        RunnerConfig config = new RunnerConfig.Builder().build();

        assertThat(config.getWorkerThreads()).isEqualTo(4);
        assertThat(config.getTickInterval()).isEqualTo(Duration.ofMinutes(1));
        assertThat(config.getFetchTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getSchedulerZone()).isEqualTo(ZoneId.of("UTC"));
        assertThat(config.isNotifyOnRecovery()).isFalse();
        assertThat(config.isDetectorsEnabled()).isTrue();
        assertThat(config.isKafkaEnabled()).isFalse();
    }

    @Test
    @DisplayName("Kafka is enabled once bootstrap servers are set")
    void kafkaProperties() {
        RunnerConfig config = new RunnerConfig.Builder()
                .kafkaBootstrapServers("broker-1:9092")
                .build();

        Properties props = config.kafkaProducerProperties();

        assertThat(config.isKafkaEnabled()).isTrue();
        assertThat(props.getProperty("bootstrap.servers")).isEqualTo("broker-1:9092");
        assertThat(props.getProperty("acks")).isEqualTo("all");
        assertThat(props.getProperty("enable.idempotence")).isEqualTo("true");
    }

    @Test
    @DisplayName("Invalid values are rejected at build time")
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> new RunnerConfig.Builder().workerThreads(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("workerThreads must be >= 1");
        assertThatThrownBy(() -> new RunnerConfig.Builder().fetchTimeoutMs(0).build())
                .hasMessageContaining("fetchTimeoutMs must be >= 1");
        assertThatThrownBy(() -> new RunnerConfig.Builder().healthPort(70_000).build())
                .hasMessageContaining("healthPort must be in [1, 65535]");
        assertThatThrownBy(() -> new RunnerConfig.Builder().seriesSourceUrl(" ").build())
                .hasMessageContaining("seriesSourceUrl must not be null or blank");
    }
}
