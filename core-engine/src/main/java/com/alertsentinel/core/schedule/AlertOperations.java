package com.alertsentinel.core.schedule;

import com.alertsentinel.core.model.AlertConfiguration;
import com.alertsentinel.core.state.AlertStateMachine;
import com.alertsentinel.core.store.AlertStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Manual operator actions on a single alert.
 *
 * <p>
 * Each action waits up to the lease timeout for the alert's lease, so it
 * never interleaves with a scheduled cycle of the same alert.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertOperations {

    private static final Logger LOG = LoggerFactory.getLogger(AlertOperations.class);

    private final AlertStore store;
    private final AlertCycleRunner runner;
    private final AlertStateMachine stateMachine;
    private final AlertLeases leases;
    private final Duration leaseTimeout;
    private final Clock clock;

    public AlertOperations(AlertStore store, AlertCycleRunner runner, AlertStateMachine stateMachine,
            AlertLeases leases, Duration leaseTimeout, Clock clock) {
        this.store = Objects.requireNonNull(store, "AlertStore must not be null");
        this.runner = Objects.requireNonNull(runner, "AlertCycleRunner must not be null");
        this.stateMachine = Objects.requireNonNull(stateMachine, "AlertStateMachine must not be null");
        this.leases = Objects.requireNonNull(leases, "AlertLeases must not be null");
        this.leaseTimeout = Objects.requireNonNull(leaseTimeout, "lease timeout must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * Snooze an alert until {@code until}.
     *
     * @return the snoozed alert
     * @throws NoSuchElementException   if the alert does not exist
     * @throws IllegalArgumentException if {@code until} is not in the future
     * @throws IllegalStateException    if the lease could not be obtained in time
     */
    public AlertConfiguration snooze(String alertId, Instant until) {
        return withLease(alertId, () -> {
            AlertConfiguration snoozed = stateMachine.snooze(require(alertId), until, clock.instant());
            store.save(snoozed);
            LOG.info("Alert '{}' snoozed until {}", alertId, until);
            return snoozed;
        });
    }

    /**
     * Lift a snooze; the alert is evaluated at the next scheduler tick.
     *
     * @return the alert after the snooze was cleared; unchanged if it was not snoozed
     */
    public AlertConfiguration clearSnooze(String alertId) {
        return withLease(alertId, () -> {
            AlertConfiguration alert = require(alertId);
            AlertConfiguration cleared = stateMachine.clearSnooze(alert);
            if (cleared == alert) {
                LOG.debug("Alert '{}' is {}, nothing to clear", alertId, alert.getState());
                return alert;
            }
            store.save(cleared);
            LOG.info("Snooze of alert '{}' cleared", alertId);
            return cleared;
        });
    }

    /**
     * Run one cycle now, outside the due-set timing.
     *
     * @return the cycle outcome; {@link CycleStatus#SKIPPED} for disabled or snoozed alerts
     */
    public CycleOutcome forceCheck(String alertId) {
        return withLease(alertId, () -> {
            require(alertId);
            return runner.run(alertId, CycleTrigger.MANUAL);
        });
    }

    private AlertConfiguration require(String alertId) {
        return store.find(alertId)
                .orElseThrow(() -> new NoSuchElementException("Unknown alert: " + alertId));
    }

    private <T> T withLease(String alertId, Supplier<T> action) {
        Objects.requireNonNull(alertId, "alertId must not be null");
        if (!leases.acquire(alertId, leaseTimeout)) {
            throw new IllegalStateException("Timed out after " + leaseTimeout.toMillis()
                    + " ms waiting for lease of alert '" + alertId + "'");
        }
        try {
            return action.get();
        } finally {
            leases.release(alertId);
        }
    }
}
