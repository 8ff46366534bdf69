package com.alertsentinel.core.schedule;

import com.alertsentinel.core.model.AlertConfiguration;
import com.alertsentinel.core.model.AlertState;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Decides whether an alert is due for evaluation.
 *
 * <p>
 * An alert is due when it is enabled, not inside an active snooze, not
 * suppressed by its weekend policy, and its calculation interval has elapsed
 * since the last check. Alerts that were never checked, and snoozed alerts
 * whose snooze has expired, are due immediately.
 * </p>
 *
 * <p>
 * Calendar decisions (weekends, monthly intervals) use the configured zone.
 * </p>
 *
 * @since 1.0.0
 */
public class DuePolicy {

    private final ZoneId zone;

    public DuePolicy(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public boolean isDue(AlertConfiguration alert, Instant now) {
        if (!alert.isEnabled()) {
            return false;
        }
        if (alert.getState() == AlertState.SNOOZED) {
            Instant until = alert.getSnoozedUntil();
            if (until != null && now.isBefore(until)) {
                return false;
            }
        }
        if (isWeekendSkipped(alert, now)) {
            return false;
        }
        if (alert.getState() == AlertState.SNOOZED || alert.getLastCheckedAt() == null) {
            return true;
        }
        Instant next = alert.getCalculationInterval().nextCheckAfter(alert.getLastCheckedAt(), zone);
        return !now.isBefore(next);
    }

    /**
     * @return {@code true} if {@code alert} skips weekends and {@code now} falls on one
     */
    public boolean isWeekendSkipped(AlertConfiguration alert, Instant now) {
        if (!alert.isSkipWeekend() || !alert.getCalculationInterval().supportsWeekendSkip()) {
            return false;
        }
        DayOfWeek day = now.atZone(zone).getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    public ZoneId getZone() {
        return zone;
    }
}
