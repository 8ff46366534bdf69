package com.alertsentinel.runner;

import com.alertsentinel.core.schedule.CycleListener;
import com.alertsentinel.core.schedule.CycleOutcome;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Histogram;

import java.util.Locale;
import java.util.Objects;

/**
 * Prometheus metrics of the alert runner, fed by scheduler callbacks.
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 * <li>{@code alert_cycles_total{status}}: evaluation cycles by outcome</li>
 * <li>{@code alert_breaches_total}: evaluated cycles with a breach</li>
 * <li>{@code alert_notifications_total{result}}: dispatches, {@code sent} or {@code failed}</li>
 * <li>{@code alert_degraded_total}: degraded-alert reports</li>
 * <li>{@code alert_triggers_dropped_total}: due triggers dropped because a cycle was in flight</li>
 * <li>{@code alert_cycle_duration_seconds}: cycle latency</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class SentinelMetrics implements CycleListener {

    private final CollectorRegistry registry;
    private final Counter cycles;
    private final Counter breaches;
    private final Counter notifications;
    private final Counter degraded;
    private final Counter triggersDropped;
    private final Histogram cycleDuration;

    public SentinelMetrics(CollectorRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "CollectorRegistry must not be null");

        this.cycles = Counter.build()
                .name("alert_cycles_total")
                .help("Alert evaluation cycles by outcome")
                .labelNames("status")
                .register(registry);
        this.breaches = Counter.build()
                .name("alert_breaches_total")
                .help("Evaluated cycles whose detector reported a breach")
                .register(registry);
        this.notifications = Counter.build()
                .name("alert_notifications_total")
                .help("Notification dispatches by result")
                .labelNames("result")
                .register(registry);
        this.degraded = Counter.build()
                .name("alert_degraded_total")
                .help("Reports of alerts erroring on consecutive checks")
                .register(registry);
        this.triggersDropped = Counter.build()
                .name("alert_triggers_dropped_total")
                .help("Due triggers dropped because a cycle was still running")
                .register(registry);
        this.cycleDuration = Histogram.build()
                .name("alert_cycle_duration_seconds")
                .help("Wall time of one evaluation cycle")
                .buckets(0.01, 0.05, 0.1, 0.5, 1, 5, 15, 30, 60)
                .register(registry);
    }

    @Override
    public void onCycleCompleted(CycleOutcome outcome, long durationNanos) {
        cycles.labels(outcome.getStatus().name().toLowerCase(Locale.ROOT)).inc();
        cycleDuration.observe(durationNanos / 1_000_000_000.0);
        if (outcome.isBreached()) {
            breaches.inc();
        }
        if (outcome.isNotified()) {
            notifications.labels("sent").inc();
        } else if (outcome.isNotificationFailed()) {
            notifications.labels("failed").inc();
        }
    }

    @Override
    public void onDegraded(String alertId) {
        degraded.inc();
    }

    @Override
    public void onTriggerDropped(String alertId) {
        triggersDropped.inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
