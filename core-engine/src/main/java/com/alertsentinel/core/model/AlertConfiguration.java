package com.alertsentinel.core.model;

import com.alertsentinel.core.detection.DetectorConfig;
import com.alertsentinel.core.detection.DetectorType;
import com.alertsentinel.core.detection.ThresholdConfig;
import com.alertsentinel.core.error.InvalidConfigException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Configuration and cached runtime state of one alert.
 *
 * <p>
 * Instances are immutable. State changes produce a new instance through
 * {@link #toBuilder()}; the store keeps the latest one per alert id.
 * </p>
 *
 * <h3>Detector selection</h3>
 * <p>
 * When {@code detectorConfig} is present it is authoritative. Otherwise the
 * legacy {@code threshold} combined with {@code condition} is converted into
 * an equivalent threshold detector configuration. The resolved configuration
 * is available from {@link #effectiveDetectorConfig()}.
 * </p>
 *
 * <h3>Validation</h3>
 * <p>
 * {@link Builder#build()} validates the whole configuration and throws an
 * {@link InvalidConfigException} listing every problem, so an invalid alert
 * can never reach the evaluator.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertConfiguration {

    private final String id;
    private final String name;
    private final String insightRef;
    private final int seriesIndex;
    private final AlertCondition condition;
    private final ThresholdConfig threshold;
    private final DetectorConfig detectorConfig;
    private final CalculationInterval calculationInterval;
    private final boolean checkOngoingInterval;
    private final boolean skipWeekend;
    private final boolean enabled;
    private final Set<String> subscribedUsers;
    private final Set<String> destinations;
    private final Instant snoozedUntil;
    private final AlertState state;
    private final Instant lastCheckedAt;

    private final DetectorConfig effectiveDetectorConfig;

    private AlertConfiguration(Builder b) {
        this.id = b.id;
        this.name = b.name != null ? b.name : b.id;
        this.insightRef = b.insightRef;
        this.seriesIndex = b.seriesIndex;
        this.condition = b.condition;
        this.threshold = b.threshold;
        this.detectorConfig = b.detectorConfig;
        this.calculationInterval = b.calculationInterval;
        this.checkOngoingInterval = b.checkOngoingInterval;
        this.skipWeekend = b.skipWeekend;
        this.enabled = b.enabled;
        this.subscribedUsers = Collections.unmodifiableSet(new LinkedHashSet<>(b.subscribedUsers));
        this.destinations = Collections.unmodifiableSet(new LinkedHashSet<>(b.destinations));
        this.snoozedUntil = b.snoozedUntil;
        this.state = b.state;
        this.lastCheckedAt = b.lastCheckedAt;
        this.effectiveDetectorConfig = detectorConfig != null
                ? detectorConfig
                : threshold != null ? threshold.forCondition(condition) : null;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with every field of this alert
     */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .insightRef(insightRef)
                .seriesIndex(seriesIndex)
                .condition(condition)
                .threshold(threshold)
                .detectorConfig(detectorConfig)
                .calculationInterval(calculationInterval)
                .checkOngoingInterval(checkOngoingInterval)
                .skipWeekend(skipWeekend)
                .enabled(enabled)
                .subscribedUsers(subscribedUsers)
                .destinations(destinations)
                .snoozedUntil(snoozedUntil)
                .state(state)
                .lastCheckedAt(lastCheckedAt);
    }

    /**
     * @return the detector configuration evaluation runs with
     */
    public DetectorConfig effectiveDetectorConfig() {
        return effectiveDetectorConfig;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getInsightRef() {
        return insightRef;
    }

    public int getSeriesIndex() {
        return seriesIndex;
    }

    public AlertCondition getCondition() {
        return condition;
    }

    public ThresholdConfig getThreshold() {
        return threshold;
    }

    public DetectorConfig getDetectorConfig() {
        return detectorConfig;
    }

    public CalculationInterval getCalculationInterval() {
        return calculationInterval;
    }

    public boolean isCheckOngoingInterval() {
        return checkOngoingInterval;
    }

    public boolean isSkipWeekend() {
        return skipWeekend;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Set<String> getSubscribedUsers() {
        return subscribedUsers;
    }

    public Set<String> getDestinations() {
        return destinations;
    }

    public Instant getSnoozedUntil() {
        return snoozedUntil;
    }

    public AlertState getState() {
        return state;
    }

    public Instant getLastCheckedAt() {
        return lastCheckedAt;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link AlertConfiguration}.
     */
    public static class Builder {
        private String id;
        private String name;
        private String insightRef;
        private int seriesIndex;
        private AlertCondition condition = AlertCondition.ABSOLUTE_VALUE;
        private ThresholdConfig threshold;
        private DetectorConfig detectorConfig;
        private CalculationInterval calculationInterval = CalculationInterval.DAILY;
        private boolean checkOngoingInterval;
        private boolean skipWeekend;
        private boolean enabled = true;
        private Set<String> subscribedUsers = Set.of();
        private Set<String> destinations = Set.of();
        private Instant snoozedUntil;
        private AlertState state = AlertState.NOT_FIRING;
        private Instant lastCheckedAt;

        public Builder id(String v) {
            this.id = v;
            return this;
        }

        public Builder name(String v) {
            this.name = v;
            return this;
        }

        public Builder insightRef(String v) {
            this.insightRef = v;
            return this;
        }

        public Builder seriesIndex(int v) {
            this.seriesIndex = v;
            return this;
        }

        public Builder condition(AlertCondition v) {
            this.condition = v;
            return this;
        }

        public Builder threshold(ThresholdConfig v) {
            this.threshold = v;
            return this;
        }

        public Builder detectorConfig(DetectorConfig v) {
            this.detectorConfig = v;
            return this;
        }

        public Builder calculationInterval(CalculationInterval v) {
            this.calculationInterval = v;
            return this;
        }

        public Builder checkOngoingInterval(boolean v) {
            this.checkOngoingInterval = v;
            return this;
        }

        public Builder skipWeekend(boolean v) {
            this.skipWeekend = v;
            return this;
        }

        public Builder enabled(boolean v) {
            this.enabled = v;
            return this;
        }

        public Builder subscribedUsers(Set<String> v) {
            this.subscribedUsers = v != null ? v : Set.of();
            return this;
        }

        public Builder destinations(Set<String> v) {
            this.destinations = v != null ? v : Set.of();
            return this;
        }

        public Builder snoozedUntil(Instant v) {
            this.snoozedUntil = v;
            return this;
        }

        public Builder state(AlertState v) {
            this.state = v;
            return this;
        }

        public Builder lastCheckedAt(Instant v) {
            this.lastCheckedAt = v;
            return this;
        }

        /**
         * Build and validate the alert.
         *
         * @return a validated {@link AlertConfiguration}
         * @throws InvalidConfigException if any field is invalid
         */
        public AlertConfiguration build() {
            List<String> errors = new ArrayList<>();
            requireNonBlank(id, "id", errors);
            requireNonBlank(insightRef, "insightRef", errors);
            if (seriesIndex < 0) {
                errors.add("'seriesIndex' must be >= 0, got: " + seriesIndex);
            }
            if (condition == null) {
                errors.add("'condition' is required");
            }
            if (calculationInterval == null) {
                errors.add("'calculationInterval' is required");
            }
            if (state == null) {
                errors.add("'state' is required");
            } else if (state == AlertState.SNOOZED && snoozedUntil == null) {
                errors.add("a snoozed alert requires 'snoozedUntil'");
            }
            if (errors.isEmpty()) {
                validateDetection(errors);
            }
            if (!errors.isEmpty()) {
                throw InvalidConfigException.fromErrors("alert '" + id + "'", errors);
            }
            return new AlertConfiguration(this);
        }

        private void validateDetection(List<String> errors) {
            DetectorConfig effective;
            if (detectorConfig != null) {
                effective = detectorConfig;
            } else if (threshold != null) {
                effective = threshold.forCondition(condition);
            } else {
                errors.add("either 'detectorConfig' or a legacy 'threshold' is required");
                return;
            }
            try {
                effective.validate();
            } catch (InvalidConfigException e) {
                errors.add(e.getMessage());
                return;
            }
            if (checkOngoingInterval) {
                boolean upperThreshold = effective.type() == DetectorType.THRESHOLD
                        && ((ThresholdConfig) effective).getBounds().getUpper() != null
                        && !((ThresholdConfig) effective).isDecrease();
                if (!upperThreshold) {
                    errors.add("'checkOngoingInterval' is only supported for absolute value or"
                            + " relative increase thresholds with an upper bound");
                }
            }
        }

        private static void requireNonBlank(String value, String name, List<String> errors) {
            if (value == null || value.isBlank()) {
                errors.add("'" + name + "' is required");
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertConfiguration that))
            return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "AlertConfiguration{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", insightRef='" + insightRef + '\'' +
                ", detector=" + effectiveDetectorConfig +
                ", interval=" + calculationInterval +
                ", enabled=" + enabled +
                ", state=" + state +
                ", lastCheckedAt=" + lastCheckedAt +
                '}';
    }
}
