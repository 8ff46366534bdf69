package com.alertsentinel.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * History row written once per evaluated cycle. Never modified afterwards.
 *
 * @since 1.0.0
 */
public final class AlertCheck {

    private final String id;
    private final String alertId;
    private final Instant createdAt;
    private final AlertState state;
    private final Double calculatedValue;
    private final Double rawValue;
    private final boolean targetsNotified;
    private final List<String> breaches;
    private final String errorMessage;

    private AlertCheck(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.alertId = Objects.requireNonNull(builder.alertId, "alertId must not be null");
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt must not be null");
        this.state = Objects.requireNonNull(builder.state, "state must not be null");
        this.calculatedValue = builder.calculatedValue;
        this.rawValue = builder.rawValue;
        this.targetsNotified = builder.targetsNotified;
        this.breaches = Collections.unmodifiableList(new ArrayList<>(builder.breaches));
        this.errorMessage = builder.errorMessage;
    }

    /**
     * Record the outcome of one evaluation.
     *
     * @param alertId         the evaluated alert
     * @param createdAt       cycle time
     * @param state           state after the transition
     * @param result          the evaluation result
     * @param targetsNotified whether this cycle triggered notification dispatch
     * @return the new check
     */
    public static AlertCheck of(String alertId, Instant createdAt, AlertState state,
            EvaluationResult result, boolean targetsNotified) {
        return builder()
                .alertId(alertId)
                .createdAt(createdAt)
                .state(state)
                .calculatedValue(result.getValue())
                .rawValue(result.getRawValue())
                .breaches(result.getBreaches())
                .errorMessage(result.getErrorMessage())
                .targetsNotified(targetsNotified)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String alertId;
        private Instant createdAt;
        private AlertState state;
        private Double calculatedValue;
        private Double rawValue;
        private boolean targetsNotified;
        private List<String> breaches = List.of();
        private String errorMessage;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder alertId(String alertId) {
            this.alertId = alertId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder state(AlertState state) {
            this.state = state;
            return this;
        }

        public Builder calculatedValue(Double calculatedValue) {
            this.calculatedValue = calculatedValue;
            return this;
        }

        public Builder rawValue(Double rawValue) {
            this.rawValue = rawValue;
            return this;
        }

        public Builder targetsNotified(boolean targetsNotified) {
            this.targetsNotified = targetsNotified;
            return this;
        }

        public Builder breaches(List<String> breaches) {
            this.breaches = breaches != null ? breaches : List.of();
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public AlertCheck build() {
            return new AlertCheck(this);
        }
    }

    public String getId() {
        return id;
    }

    public String getAlertId() {
        return alertId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public AlertState getState() {
        return state;
    }

    public Double getCalculatedValue() {
        return calculatedValue;
    }

    public Double getRawValue() {
        return rawValue;
    }

    public boolean isTargetsNotified() {
        return targetsNotified;
    }

    public List<String> getBreaches() {
        return breaches;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertCheck that))
            return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "AlertCheck{" +
                "id='" + id + '\'' +
                ", alertId='" + alertId + '\'' +
                ", createdAt=" + createdAt +
                ", state=" + state +
                ", calculatedValue=" + calculatedValue +
                ", rawValue=" + rawValue +
                ", targetsNotified=" + targetsNotified +
                '}';
    }
}
