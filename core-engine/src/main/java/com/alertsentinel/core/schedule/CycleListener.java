package com.alertsentinel.core.schedule;

/**
 * Observer of scheduler activity. All methods default to no-ops.
 *
 * <p>
 * Called from scheduler and worker threads; implementations must be
 * thread-safe and must not block.
 * </p>
 *
 * @since 1.0.0
 */
public interface CycleListener {

    CycleListener NO_OP = new CycleListener() {
    };

    /**
     * @param outcome       how the cycle ended
     * @param durationNanos wall time of the cycle
     */
    default void onCycleCompleted(CycleOutcome outcome, long durationNanos) {
    }

    /**
     * The alert has errored on its last consecutive checks.
     */
    default void onDegraded(String alertId) {
    }

    /**
     * A due trigger was dropped because a cycle for the alert is in flight.
     */
    default void onTriggerDropped(String alertId) {
    }
}
