package com.alertsentinel.core.schedule;

import com.alertsentinel.core.model.AlertConfiguration;
import com.alertsentinel.core.store.AlertStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically finds due alerts and runs their cycles on a worker pool.
 *
 * <h3>Per-alert exclusion</h3>
 * <p>
 * Before dispatching, the tick thread takes the alert's lease from
 * {@link AlertLeases}; the worker releases it when the cycle ends. If the
 * lease is already held, the trigger is dropped and reported, never
 * queued.
 * </p>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * {@link #start(Duration)} runs {@link #tick()} at a fixed rate on a single
 * daemon thread; {@link #close()} stops ticking. The worker executor is
 * owned by the caller.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertScheduler implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AlertScheduler.class);

    private final AlertStore store;
    private final AlertCycleRunner runner;
    private final AlertLeases leases;
    private final DuePolicy duePolicy;
    private final Executor workers;
    private final CycleListener listener;
    private final Clock clock;

    private ScheduledExecutorService ticker;

    public AlertScheduler(AlertStore store, AlertCycleRunner runner, AlertLeases leases,
            DuePolicy duePolicy, Executor workers, CycleListener listener, Clock clock) {
        this.store = Objects.requireNonNull(store, "AlertStore must not be null");
        this.runner = Objects.requireNonNull(runner, "AlertCycleRunner must not be null");
        this.leases = Objects.requireNonNull(leases, "AlertLeases must not be null");
        this.duePolicy = Objects.requireNonNull(duePolicy, "DuePolicy must not be null");
        this.workers = Objects.requireNonNull(workers, "worker executor must not be null");
        this.listener = listener != null ? listener : CycleListener.NO_OP;
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * Start ticking every {@code interval}.
     *
     * @throws IllegalStateException if already started
     */
    public synchronized void start(Duration interval) {
        if (ticker != null) {
            throw new IllegalStateException("Scheduler already started");
        }
        ticker = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "alert-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        ticker.scheduleAtFixedRate(this::safeTick, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        LOG.info("Alert scheduler started, tick interval {} ms, zone {}", interval.toMillis(), duePolicy.getZone());
    }

    /**
     * Dispatch a cycle for every due alert whose lease is free.
     *
     * @return number of cycles dispatched
     */
    public int tick() {
        Instant now = clock.instant();
        int dispatched = 0;
        for (AlertConfiguration alert : store.findAll()) {
            if (!duePolicy.isDue(alert, now)) {
                continue;
            }
            String alertId = alert.getId();
            if (!leases.tryAcquire(alertId)) {
                LOG.warn("Alert '{}' is still running, dropping due trigger", alertId);
                listener.onTriggerDropped(alertId);
                continue;
            }
            // a cycle may have finished between the snapshot and the lease
            if (!isStillDue(alertId, now)) {
                leases.release(alertId);
                LOG.debug("Alert '{}' was checked since the snapshot, skipping", alertId);
                continue;
            }
            try {
                workers.execute(() -> {
                    try {
                        runner.run(alertId, CycleTrigger.SCHEDULED);
                    } finally {
                        leases.release(alertId);
                    }
                });
                dispatched++;
            } catch (RejectedExecutionException e) {
                leases.release(alertId);
                LOG.warn("Worker pool rejected cycle of alert '{}'", alertId);
            }
        }
        LOG.debug("Tick at {} dispatched {} cycle(s)", now, dispatched);
        return dispatched;
    }

    @Override
    public synchronized void close() {
        if (ticker != null) {
            ticker.shutdownNow();
            ticker = null;
            LOG.info("Alert scheduler stopped");
        }
    }

    private boolean isStillDue(String alertId, Instant now) {
        return store.find(alertId)
                .map(latest -> duePolicy.isDue(latest, now))
                .orElse(false);
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            LOG.error("Scheduler tick failed", e);
        }
    }
}
