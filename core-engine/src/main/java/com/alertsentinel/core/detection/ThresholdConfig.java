package com.alertsentinel.core.detection;

import com.alertsentinel.core.model.AlertCondition;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Static bounds check on the current point.
 *
 * <p>
 * Also the payload of legacy alerts: a legacy threshold plus an
 * {@link AlertCondition} is turned into an equivalent configuration by
 * {@link #forCondition(AlertCondition)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ThresholdConfig extends DetectorConfig {

    private final Bounds bounds;
    private final BoundType boundType;
    private final SeriesTransform on;

    /** Score the negated quantity, so a drop reads as a positive change. */
    private final boolean decrease;

    @JsonCreator
    public ThresholdConfig(@JsonProperty("bounds") Bounds bounds,
            @JsonProperty("bound_type") BoundType boundType,
            @JsonProperty("on") SeriesTransform on) {
        this(bounds, boundType, on, false);
    }

    public ThresholdConfig(Bounds bounds, BoundType boundType, SeriesTransform on, boolean decrease) {
        this.bounds = bounds != null ? bounds : new Bounds(null, null);
        this.boundType = boundType != null ? boundType : BoundType.ABSOLUTE;
        this.on = on != null ? on : (this.boundType == BoundType.PERCENTAGE
                ? SeriesTransform.PCT_DELTA
                : SeriesTransform.VALUE);
        this.decrease = decrease;
    }

    /**
     * Shorthand for an absolute bounds check on raw values.
     */
    public static ThresholdConfig absolute(Double lower, Double upper) {
        return new ThresholdConfig(new Bounds(lower, upper), BoundType.ABSOLUTE, SeriesTransform.VALUE);
    }

    /**
     * Derive the configuration a legacy alert condition implies: absolute
     * values are checked as-is, relative conditions are checked against the
     * period-over-period change (a percentage change for percentage bounds).
     *
     * @param condition the legacy alert condition; must not be {@code null}
     * @return an equivalent threshold configuration
     */
    public ThresholdConfig forCondition(AlertCondition condition) {
        Objects.requireNonNull(condition, "AlertCondition must not be null");
        SeriesTransform relative = boundType == BoundType.PERCENTAGE
                ? SeriesTransform.PCT_DELTA
                : SeriesTransform.DELTA;
        return switch (condition) {
            case ABSOLUTE_VALUE -> new ThresholdConfig(bounds, boundType, SeriesTransform.VALUE, false);
            case RELATIVE_INCREASE -> new ThresholdConfig(bounds, boundType, relative, false);
            case RELATIVE_DECREASE -> new ThresholdConfig(bounds, boundType, relative, true);
        };
    }

    @Override
    public DetectorType type() {
        return DetectorType.THRESHOLD;
    }

    @Override
    public SeriesTransform getOn() {
        return on;
    }

    @Override
    public int baselineWindow() {
        return 0;
    }

    @Override
    public int minimumPoints() {
        return 1;
    }

    public Bounds getBounds() {
        return bounds;
    }

    @JsonProperty("bound_type")
    public BoundType getBoundType() {
        return boundType;
    }

    @JsonIgnore
    public boolean isDecrease() {
        return decrease;
    }

    @Override
    protected void collectErrors(List<String> errors) {
        if (bounds.getLower() == null && bounds.getUpper() == null) {
            errors.add("at least one of 'bounds.lower' or 'bounds.upper' is required");
        }
        if (bounds.getLower() != null && bounds.getUpper() != null
                && bounds.getLower() > bounds.getUpper()) {
            errors.add("'bounds.lower' (" + bounds.getLower() + ") must not exceed 'bounds.upper' ("
                    + bounds.getUpper() + ")");
        }
        if (boundType == BoundType.PERCENTAGE && on != SeriesTransform.PCT_DELTA) {
            errors.add("percentage bounds require on=pct_delta, got: " + on.key());
        }
    }

    @Override
    public String toString() {
        return "ThresholdConfig{" +
                "bounds=" + bounds +
                ", boundType=" + boundType.key() +
                ", on=" + on.key() +
                ", decrease=" + decrease +
                '}';
    }

    /**
     * Optional lower and upper limits. A missing limit is not checked.
     */
    public static final class Bounds {

        private final Double lower;
        private final Double upper;

        @JsonCreator
        public Bounds(@JsonProperty("lower") Double lower, @JsonProperty("upper") Double upper) {
            this.lower = lower;
            this.upper = upper;
        }

        public Double getLower() {
            return lower;
        }

        public Double getUpper() {
            return upper;
        }

        @Override
        public String toString() {
            return "[" + lower + ", " + upper + "]";
        }
    }
}
