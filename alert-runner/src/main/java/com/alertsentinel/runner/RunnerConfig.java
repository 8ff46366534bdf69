package com.alertsentinel.runner;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Properties;

/**
 * Typed, immutable configuration of the alert runner.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the runner is configurable through container env vars or a shell
 * environment.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder} in
 * tests. The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class RunnerConfig {

    // ---------------------------------------------------------------
    // Scheduling
    // ---------------------------------------------------------------
    private final int workerThreads;
    private final long tickIntervalMs;
    private final long fetchTimeoutMs;
    private final long leaseTimeoutMs;
    private final ZoneId schedulerZone;

    // ---------------------------------------------------------------
    // Detection / notification policy
    // ---------------------------------------------------------------
    private final boolean notifyOnRecovery;
    private final boolean detectorsEnabled;

    // ---------------------------------------------------------------
    // Adapters
    // ---------------------------------------------------------------
    private final String seriesSourceUrl;
    private final String kafkaBootstrapServers;
    private final String kafkaNotificationTopic;
    private final String alertsConfigPath;

    // ---------------------------------------------------------------
    // Health / Metrics
    // ---------------------------------------------------------------
    private final int healthPort;

    private RunnerConfig(Builder b) {
        this.workerThreads = b.workerThreads;
        this.tickIntervalMs = b.tickIntervalMs;
        this.fetchTimeoutMs = b.fetchTimeoutMs;
        this.leaseTimeoutMs = b.leaseTimeoutMs;
        this.schedulerZone = b.schedulerZone;
        this.notifyOnRecovery = b.notifyOnRecovery;
        this.detectorsEnabled = b.detectorsEnabled;
        this.seriesSourceUrl = b.seriesSourceUrl;
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaNotificationTopic = b.kafkaNotificationTopic;
        this.alertsConfigPath = b.alertsConfigPath;
        this.healthPort = b.healthPort;
    }

    // ---------------------------------------------------------------
    // Factory, resolved from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link RunnerConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static RunnerConfig fromEnvironment() {
        try {
            return new Builder()
                    .workerThreads(parseIntEnv("WORKER_THREADS", "4"))
                    .tickIntervalMs(parseLongEnv("TICK_INTERVAL_MS", "60000"))
                    .fetchTimeoutMs(parseLongEnv("FETCH_TIMEOUT_MS", "30000"))
                    .leaseTimeoutMs(parseLongEnv("LEASE_TIMEOUT_MS", "60000"))
                    .schedulerZone(ZoneId.of(env("SCHEDULER_ZONE", "UTC")))
                    .notifyOnRecovery(Boolean.parseBoolean(env("NOTIFY_ON_RECOVERY", "false")))
                    .detectorsEnabled(Boolean.parseBoolean(env("DETECTORS_ENABLED", "true")))
                    .seriesSourceUrl(env("SERIES_SOURCE_URL", "http://localhost:8000/api"))
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", ""))
                    .kafkaNotificationTopic(env("KAFKA_NOTIFICATION_TOPIC", "alert-notifications"))
                    .alertsConfigPath(env("ALERTS_CONFIG_PATH", ""))
                    .healthPort(parseIntEnv("HEALTH_PORT", "8080"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        } catch (DateTimeException e) {
            throw new IllegalStateException("Invalid SCHEDULER_ZONE: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Kafka properties helpers
    // ---------------------------------------------------------------

    /**
     * @return {@code true} if notifications go to Kafka rather than the log
     */
    public boolean isKafkaEnabled() {
        return !kafkaBootstrapServers.isBlank();
    }

    /**
     * Build Kafka producer {@link Properties}: string key and value,
     * acknowledged by all in-sync replicas.
     *
     * @return new Properties instance configured for production
     */
    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("key.serializer", "org.apache.kafka.common.serialization.StringSerializer");
        props.setProperty("value.serializer", "org.apache.kafka.common.serialization.StringSerializer");
        props.setProperty("acks", "all");
        props.setProperty("enable.idempotence", "true");
        props.setProperty("client.id", "alert-sentinel");
        return props;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getWorkerThreads() {
        return workerThreads;
    }

    public Duration getTickInterval() {
        return Duration.ofMillis(tickIntervalMs);
    }

    public Duration getFetchTimeout() {
        return Duration.ofMillis(fetchTimeoutMs);
    }

    public Duration getLeaseTimeout() {
        return Duration.ofMillis(leaseTimeoutMs);
    }

    public ZoneId getSchedulerZone() {
        return schedulerZone;
    }

    public boolean isNotifyOnRecovery() {
        return notifyOnRecovery;
    }

    public boolean isDetectorsEnabled() {
        return detectorsEnabled;
    }

    public String getSeriesSourceUrl() {
        return seriesSourceUrl;
    }

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaNotificationTopic() {
        return kafkaNotificationTopic;
    }

    public String getAlertsConfigPath() {
        return alertsConfigPath;
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link RunnerConfig}.
     *
     * <p>
     * {@link #build()} checks that thread counts and timeouts are positive,
     * the port is in [1, 65535] and names are not blank.
     * </p>
     */
    public static class Builder {
        private int workerThreads = 4;
        private long tickIntervalMs = 60_000;
        private long fetchTimeoutMs = 30_000;
        private long leaseTimeoutMs = 60_000;
        private ZoneId schedulerZone = ZoneId.of("UTC");
        private boolean notifyOnRecovery;
        private boolean detectorsEnabled = true;
        private String seriesSourceUrl = "http://localhost:8000/api";
        private String kafkaBootstrapServers = "";
        private String kafkaNotificationTopic = "alert-notifications";
        private String alertsConfigPath = "";
        private int healthPort = 8080;

        public Builder workerThreads(int v) {
            this.workerThreads = v;
            return this;
        }

        public Builder tickIntervalMs(long v) {
            this.tickIntervalMs = v;
            return this;
        }

        public Builder fetchTimeoutMs(long v) {
            this.fetchTimeoutMs = v;
            return this;
        }

        public Builder leaseTimeoutMs(long v) {
            this.leaseTimeoutMs = v;
            return this;
        }

        public Builder schedulerZone(ZoneId v) {
            this.schedulerZone = v;
            return this;
        }

        public Builder notifyOnRecovery(boolean v) {
            this.notifyOnRecovery = v;
            return this;
        }

        public Builder detectorsEnabled(boolean v) {
            this.detectorsEnabled = v;
            return this;
        }

        public Builder seriesSourceUrl(String v) {
            this.seriesSourceUrl = v;
            return this;
        }

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v != null ? v : "";
            return this;
        }

        public Builder kafkaNotificationTopic(String v) {
            this.kafkaNotificationTopic = v;
            return this;
        }

        public Builder alertsConfigPath(String v) {
            this.alertsConfigPath = v != null ? v : "";
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link RunnerConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public RunnerConfig build() {
            Objects.requireNonNull(schedulerZone, "schedulerZone required");
            requireNonBlank(seriesSourceUrl, "seriesSourceUrl");
            requireNonBlank(kafkaNotificationTopic, "kafkaNotificationTopic");

            if (workerThreads < 1) {
                throw new IllegalArgumentException("workerThreads must be >= 1, got: " + workerThreads);
            }
            requirePositive(tickIntervalMs, "tickIntervalMs");
            requirePositive(fetchTimeoutMs, "fetchTimeoutMs");
            requirePositive(leaseTimeoutMs, "leaseTimeoutMs");
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }

            return new RunnerConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }

        private static void requirePositive(long value, String name) {
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be >= 1, got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "RunnerConfig{" +
                "workerThreads=" + workerThreads +
                ", tickIntervalMs=" + tickIntervalMs +
                ", fetchTimeoutMs=" + fetchTimeoutMs +
                ", leaseTimeoutMs=" + leaseTimeoutMs +
                ", schedulerZone=" + schedulerZone +
                ", notifyOnRecovery=" + notifyOnRecovery +
                ", detectorsEnabled=" + detectorsEnabled +
                ", seriesSourceUrl='" + seriesSourceUrl + '\'' +
                ", kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaNotificationTopic='" + kafkaNotificationTopic + '\'' +
                ", healthPort=" + healthPort +
                '}';
    }
}
