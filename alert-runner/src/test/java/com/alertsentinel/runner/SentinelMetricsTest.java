package com.alertsentinel.runner;

import com.alertsentinel.core.detection.ThresholdConfig;
import com.alertsentinel.core.error.NotifyFailedException;
import com.alertsentinel.core.evaluation.Evaluator;
import com.alertsentinel.core.model.AlertConfiguration;
import com.alertsentinel.core.model.SeriesPoint;
import com.alertsentinel.core.notify.NotificationDispatcher;
import com.alertsentinel.core.notify.Notifier;
import com.alertsentinel.core.schedule.AlertCycleRunner;
import com.alertsentinel.core.schedule.CycleTrigger;
import com.alertsentinel.core.state.AlertStateMachine;
import com.alertsentinel.core.store.InMemoryAlertStore;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SentinelMetrics}.
 */
class SentinelMetricsTest {

    private static final Instant NOW = Instant.parse("2024-05-06T09:00:00Z");

    private final ExecutorService fetchPool = Executors.newSingleThreadExecutor();
    private final CollectorRegistry registry = new CollectorRegistry();
    private final SentinelMetrics metrics = new SentinelMetrics(registry);

    @AfterEach
    void tearDown() {
        fetchPool.shutdownNow();
    }

    @Test
    @DisplayName("Cycle outcomes are counted by status, breach and notification result")
    void countsCycles() {
        InMemoryAlertStore store = new InMemoryAlertStore();
        store.save(alert("ok"));
        store.save(alert("failing").toBuilder().destinations(Set.of("broken-hook")).build());
        Notifier notifier = (targets, alert, check) -> {
            if (alert.getId().equals("failing")) {
                throw new NotifyFailedException("webhook down");
            }
        };
        AlertCycleRunner runner = new AlertCycleRunner(store,
                new Evaluator(request -> List.of(new SeriesPoint(NOW, 50.0)), fetchPool, Duration.ofSeconds(5)),
                new AlertStateMachine(),
                new NotificationDispatcher(notifier),
                metrics,
                Clock.fixed(NOW, ZoneOffset.UTC));

        runner.run("ok", CycleTrigger.SCHEDULED);
        runner.run("failing", CycleTrigger.SCHEDULED);
        runner.run("missing", CycleTrigger.MANUAL);

        assertThat(sample("alert_cycles_total", "status", "evaluated")).isEqualTo(2.0);
        assertThat(sample("alert_cycles_total", "status", "skipped")).isEqualTo(1.0);
        assertThat(registry.getSampleValue("alert_breaches_total")).isEqualTo(2.0);
        assertThat(sample("alert_notifications_total", "result", "sent")).isEqualTo(1.0);
        assertThat(sample("alert_notifications_total", "result", "failed")).isEqualTo(1.0);
        assertThat(registry.getSampleValue("alert_cycle_duration_seconds_count")).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Degraded alerts and dropped triggers are counted")
    void countsDegradedAndDropped() {
        metrics.onDegraded("a1");
        metrics.onTriggerDropped("a1");
        metrics.onTriggerDropped("a2");

        assertThat(registry.getSampleValue("alert_degraded_total")).isEqualTo(1.0);
        assertThat(registry.getSampleValue("alert_triggers_dropped_total")).isEqualTo(2.0);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private Double sample(String name, String label, String value) {
        return registry.getSampleValue(name, new String[] {label}, new String[] {value});
    }

    private static AlertConfiguration alert(String id) {
        return AlertConfiguration.builder()
                .id(id)
                .insightRef("insight-" + id)
                .threshold(ThresholdConfig.absolute(null, 10.0))
                .subscribedUsers(Set.of("alice"))
                .build();
    }
}
