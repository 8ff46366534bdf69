/**
 * Scheduling of evaluation cycles.
 *
 * <p>
 * {@link com.alertsentinel.core.schedule.AlertScheduler} finds due alerts
 * with {@link com.alertsentinel.core.schedule.DuePolicy} and runs
 * {@link com.alertsentinel.core.schedule.AlertCycleRunner} on a worker pool.
 * {@link com.alertsentinel.core.schedule.AlertLeases} keep at most one cycle
 * per alert in flight, including manual actions from
 * {@link com.alertsentinel.core.schedule.AlertOperations}.
 * </p>
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.schedule;
