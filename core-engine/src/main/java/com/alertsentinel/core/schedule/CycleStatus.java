package com.alertsentinel.core.schedule;

/**
 * How an evaluation cycle ended.
 *
 * @since 1.0.0
 */
public enum CycleStatus {

    /** The alert was evaluated and one check was persisted. */
    EVALUATED,

    /** The alert was missing, disabled or snoozed; nothing was persisted. */
    SKIPPED,

    /** The cycle itself failed; only {@code lastCheckedAt} was advanced. */
    FAILED
}
