package com.alertsentinel.runner;

import com.alertsentinel.core.model.AlertCheck;
import com.alertsentinel.core.model.AlertConfiguration;
import com.alertsentinel.core.model.AlertState;
import com.alertsentinel.core.model.NotificationTarget;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Notification payload published for one dispatched check.
 *
 * <pre>
 * {
 *   "alertId": "signups-anomaly",
 *   "alertName": "Signups anomaly",
 *   "state": "FIRING",
 *   "checkedAt": "2024-05-06T09:00:00Z",
 *   "breaches": ["Z-score alert: |z|=4.20 &gt;= 3.00"],
 *   "targets": ["user:alice", "destination:ops-slack"]
 * }
 * </pre>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"checkId", "alertId", "alertName", "insightRef", "state", "checkedAt",
        "calculatedValue", "rawValue", "breaches", "errorMessage", "targets"})
public final class AlertNotification {

    private final String checkId;
    private final String alertId;
    private final String alertName;
    private final String insightRef;
    private final AlertState state;
    private final Instant checkedAt;
    private final Double calculatedValue;
    private final Double rawValue;
    private final List<String> breaches;
    private final String errorMessage;
    private final List<String> targets;

    private AlertNotification(AlertConfiguration alert, AlertCheck check, Set<NotificationTarget> targets) {
        this.checkId = check.getId();
        this.alertId = alert.getId();
        this.alertName = alert.getName();
        this.insightRef = alert.getInsightRef();
        this.state = check.getState();
        this.checkedAt = check.getCreatedAt();
        this.calculatedValue = check.getCalculatedValue();
        this.rawValue = check.getRawValue();
        this.breaches = check.getBreaches();
        this.errorMessage = check.getErrorMessage();
        this.targets = targets.stream().map(NotificationTarget::toString).toList();
    }

    public static AlertNotification of(Set<NotificationTarget> targets, AlertConfiguration alert, AlertCheck check) {
        return new AlertNotification(alert, check, targets);
    }

    public String getCheckId() {
        return checkId;
    }

    public String getAlertId() {
        return alertId;
    }

    public String getAlertName() {
        return alertName;
    }

    public String getInsightRef() {
        return insightRef;
    }

    public AlertState getState() {
        return state;
    }

    public Instant getCheckedAt() {
        return checkedAt;
    }

    public Double getCalculatedValue() {
        return calculatedValue;
    }

    public Double getRawValue() {
        return rawValue;
    }

    public List<String> getBreaches() {
        return breaches;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public List<String> getTargets() {
        return targets;
    }

    @Override
    public String toString() {
        return "AlertNotification{" +
                "alertId='" + alertId + '\'' +
                ", state=" + state +
                ", checkedAt=" + checkedAt +
                ", targets=" + targets +
                '}';
    }
}
