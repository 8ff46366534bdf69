package com.alertsentinel.core.model;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Locale;

/**
 * How often an alert is checked, and the period the series source groups
 * points by.
 *
 * @since 1.0.0
 */
public enum CalculationInterval {

    HOURLY,
    DAILY,
    WEEKLY,
    MONTHLY;

    /**
     * Earliest instant at which the next check is due.
     *
     * <p>
     * Monthly intervals follow the calendar in {@code zone}, so a check on
     * 31 January is next due on 28 (or 29) February.
     * </p>
     *
     * @param lastCheckedAt instant of the previous check
     * @param zone          zone used for calendar arithmetic
     * @return the next due instant
     */
    public Instant nextCheckAfter(Instant lastCheckedAt, ZoneId zone) {
        return switch (this) {
            case HOURLY -> lastCheckedAt.plus(Duration.ofHours(1));
            case DAILY -> lastCheckedAt.plus(Duration.ofDays(1));
            case WEEKLY -> lastCheckedAt.plus(Duration.ofDays(7));
            case MONTHLY -> lastCheckedAt.atZone(zone).plusMonths(1).toInstant();
        };
    }

    /**
     * @return {@code true} if the skip-weekend option applies to this interval
     */
    public boolean supportsWeekendSkip() {
        return this == HOURLY || this == DAILY;
    }

    /**
     * Parse an interval name such as {@code "daily"}.
     *
     * @param value interval name, case-insensitive
     * @return the matching interval
     * @throws IllegalArgumentException if {@code value} is unknown
     */
    public static CalculationInterval fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Calculation interval must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown calculation interval: '" + value
                    + "'. Supported: hourly, daily, weekly, monthly", e);
        }
    }
}
