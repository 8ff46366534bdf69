package com.alertsentinel.core.schedule;

import com.alertsentinel.core.model.AlertConfiguration;
import com.alertsentinel.core.model.AlertState;
import com.alertsentinel.core.model.CalculationInterval;
import com.alertsentinel.core.support.TestAlerts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DuePolicy}.
 */
class DuePolicyTest {

    private final DuePolicy policy = new DuePolicy(ZoneOffset.UTC);

    @Test
    @DisplayName("A never-checked alert is due")
    void neverCheckedIsDue() {
        assertThat(policy.isDue(TestAlerts.upperThreshold("a1", 1).build(), at("2024-05-06T09:00:00Z"))).isTrue();
    }

    @Test
    @DisplayName("Due once the interval has elapsed since the last check")
    void dueAfterInterval() {
        AlertConfiguration alert = TestAlerts.upperThreshold("a1", 1)
                .lastCheckedAt(at("2024-05-06T09:00:00Z"))
                .build();

        assertThat(policy.isDue(alert, at("2024-05-06T09:59:59Z"))).isFalse();
        assertThat(policy.isDue(alert, at("2024-05-06T10:00:00Z"))).isTrue();
    }

    @Test
    @DisplayName("Disabled alerts are never due")
    void disabledNeverDue() {
        AlertConfiguration alert = TestAlerts.upperThreshold("a1", 1).enabled(false).build();

        assertThat(policy.isDue(alert, at("2024-05-06T09:00:00Z"))).isFalse();
    }

    @Test
    @DisplayName("Daily skip-weekend alert is skipped on Saturday and Sunday and due on Monday")
    void skipsWeekend() {
        AlertConfiguration alert = TestAlerts.upperThreshold("a1", 1)
                .calculationInterval(CalculationInterval.DAILY)
                .skipWeekend(true)
                .lastCheckedAt(at("2024-05-03T09:00:00Z"))
                .build();

        assertThat(policy.isDue(alert, at("2024-05-04T09:00:00Z"))).isFalse();
        assertThat(policy.isDue(alert, at("2024-05-05T09:00:00Z"))).isFalse();
        assertThat(policy.isDue(alert, at("2024-05-06T00:00:00Z"))).isTrue();
    }

    @Test
    @DisplayName("Weekly and monthly alerts ignore skip-weekend")
    void weeklyIgnoresSkipWeekend() {
        AlertConfiguration alert = TestAlerts.upperThreshold("a1", 1)
                .calculationInterval(CalculationInterval.WEEKLY)
                .skipWeekend(true)
                .build();

        assertThat(policy.isWeekendSkipped(alert, at("2024-05-04T09:00:00Z"))).isFalse();
        assertThat(policy.isDue(alert, at("2024-05-04T09:00:00Z"))).isTrue();
    }

    @Test
    @DisplayName("Monthly alert checked on 31 January is due on 29 February")
    void monthlyCalendarArithmetic() {
        AlertConfiguration alert = TestAlerts.upperThreshold("a1", 1)
                .calculationInterval(CalculationInterval.MONTHLY)
                .lastCheckedAt(at("2024-01-31T00:00:00Z"))
                .build();

        assertThat(policy.isDue(alert, at("2024-02-28T23:59:59Z"))).isFalse();
        assertThat(policy.isDue(alert, at("2024-02-29T00:00:00Z"))).isTrue();
    }

    @Test
    @DisplayName("Snoozed alerts wait for the snooze to expire, then are due at once")
    void snoozeGatesDueness() {
        AlertConfiguration alert = TestAlerts.upperThreshold("a1", 1)
                .state(AlertState.SNOOZED)
                .snoozedUntil(at("2024-05-06T10:00:00Z"))
                .lastCheckedAt(at("2024-05-06T09:59:00Z"))
                .build();

        assertThat(policy.isDue(alert, at("2024-05-06T09:59:59Z"))).isFalse();
        assertThat(policy.isDue(alert, at("2024-05-06T10:00:00Z"))).isTrue();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Instant at(String iso) {
        return Instant.parse(iso);
    }
}
