package com.alertsentinel.core.model;

import java.util.Locale;

/**
 * Legacy alert condition, used together with a legacy threshold when an
 * alert has no detector configuration.
 *
 * @since 1.0.0
 */
public enum AlertCondition {

    /** Compare the current value against the bounds. */
    ABSOLUTE_VALUE,

    /** Compare the increase since the previous period against the bounds. */
    RELATIVE_INCREASE,

    /** Compare the decrease since the previous period against the bounds. */
    RELATIVE_DECREASE;

    /**
     * Parse a condition name such as {@code "relative_increase"}.
     *
     * @param value condition name, case-insensitive
     * @return the matching condition
     * @throws IllegalArgumentException if {@code value} is unknown
     */
    public static AlertCondition fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Alert condition must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown alert condition: '" + value
                    + "'. Supported: absolute_value, relative_increase, relative_decrease", e);
        }
    }
}
