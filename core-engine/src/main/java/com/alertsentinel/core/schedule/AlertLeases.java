package com.alertsentinel.core.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Exclusive per-alert leases: at most one evaluation cycle or manual action
 * holds the lease of an alert id at any time.
 *
 * <p>
 * Backed by a binary {@link Semaphore} per alert id rather than a
 * reentrant lock, because the scheduler thread acquires a lease and the
 * worker that runs the cycle releases it.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertLeases {

    private static final Logger LOG = LoggerFactory.getLogger(AlertLeases.class);

    private final ConcurrentMap<String, Semaphore> leases = new ConcurrentHashMap<>();

    /**
     * Take the lease if it is free.
     *
     * @return {@code true} if the caller now holds the lease
     */
    public boolean tryAcquire(String alertId) {
        return semaphore(alertId).tryAcquire();
    }

    /**
     * Wait up to {@code timeout} for the lease.
     *
     * @return {@code true} if the caller now holds the lease
     */
    public boolean acquire(String alertId, Duration timeout) {
        try {
            return semaphore(alertId).tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for lease of alert '{}'", alertId);
            return false;
        }
    }

    /**
     * Release a lease held by the caller.
     *
     * @throws IllegalStateException if the lease is not held
     */
    public void release(String alertId) {
        Semaphore semaphore = leases.get(alertId);
        if (semaphore == null || semaphore.availablePermits() > 0) {
            throw new IllegalStateException("Lease of alert '" + alertId + "' is not held");
        }
        semaphore.release();
    }

    /**
     * @return {@code true} if a cycle or action currently holds the lease
     */
    public boolean isHeld(String alertId) {
        Semaphore semaphore = leases.get(alertId);
        return semaphore != null && semaphore.availablePermits() == 0;
    }

    private Semaphore semaphore(String alertId) {
        return leases.computeIfAbsent(alertId, id -> new Semaphore(1));
    }
}
