package com.alertsentinel.core.schedule;

import com.alertsentinel.core.model.AlertCheck;
import com.alertsentinel.core.state.Transition;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of one {@link AlertCycleRunner#run(String, CycleTrigger)} call.
 *
 * @since 1.0.0
 */
public final class CycleOutcome {

    private final String alertId;
    private final CycleTrigger trigger;
    private final CycleStatus status;
    private final Transition transition;
    private final AlertCheck check;
    private final boolean notificationFailed;

    private CycleOutcome(String alertId, CycleTrigger trigger, CycleStatus status,
            Transition transition, AlertCheck check, boolean notificationFailed) {
        this.alertId = Objects.requireNonNull(alertId, "alertId must not be null");
        this.trigger = Objects.requireNonNull(trigger, "trigger must not be null");
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.transition = transition;
        this.check = check;
        this.notificationFailed = notificationFailed;
    }

    static CycleOutcome evaluated(String alertId, CycleTrigger trigger, Transition transition,
            AlertCheck check, boolean notificationFailed) {
        return new CycleOutcome(alertId, trigger, CycleStatus.EVALUATED, transition, check, notificationFailed);
    }

    static CycleOutcome skipped(String alertId, CycleTrigger trigger) {
        return new CycleOutcome(alertId, trigger, CycleStatus.SKIPPED, null, null, false);
    }

    static CycleOutcome failed(String alertId, CycleTrigger trigger) {
        return new CycleOutcome(alertId, trigger, CycleStatus.FAILED, null, null, false);
    }

    public String getAlertId() {
        return alertId;
    }

    public CycleTrigger getTrigger() {
        return trigger;
    }

    public CycleStatus getStatus() {
        return status;
    }

    public Optional<Transition> getTransition() {
        return Optional.ofNullable(transition);
    }

    public Optional<AlertCheck> getCheck() {
        return Optional.ofNullable(check);
    }

    /**
     * @return {@code true} if the check was breached
     */
    public boolean isBreached() {
        return check != null && !check.getBreaches().isEmpty() && check.getErrorMessage() == null;
    }

    /**
     * @return {@code true} if a notification was attempted and succeeded
     */
    public boolean isNotified() {
        return check != null && check.isTargetsNotified() && !notificationFailed;
    }

    public boolean isNotificationFailed() {
        return notificationFailed;
    }

    @Override
    public String toString() {
        return "CycleOutcome{" +
                "alertId='" + alertId + '\'' +
                ", trigger=" + trigger +
                ", status=" + status +
                ", transition=" + transition +
                ", notificationFailed=" + notificationFailed +
                '}';
    }
}
