package com.alertsentinel.core.error;

/**
 * Classification of engine failures.
 *
 * <p>
 * Only {@link #INVALID_CONFIG} is fatal, and only at the configuration
 * acceptance boundary. Every other kind is recorded on an evaluation result
 * or logged, and the alert is retried on its next scheduled cycle.
 * </p>
 *
 * @since 1.0.0
 */
public enum ErrorKind {

    /** Too few usable points after windowing or preprocessing. */
    INSUFFICIENT_DATA,

    /** The series source failed or timed out. */
    SOURCE_UNAVAILABLE,

    /** Malformed alert or detector configuration. */
    INVALID_CONFIG,

    /** The notifier rejected or failed a delivery hand-off. */
    NOTIFY_FAILED,

    /** A detector failed in an unexpected way. */
    EVALUATION_FAILED
}
