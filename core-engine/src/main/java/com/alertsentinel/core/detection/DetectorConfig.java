package com.alertsentinel.core.detection;

import com.alertsentinel.core.error.InvalidConfigException;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * Closed union of detector configurations, discriminated by the
 * {@code type} property.
 *
 * <p>
 * Each variant carries only the parameters its detector needs. Instances are
 * immutable; call {@link #validate()} before handing one to an evaluator.
 * </p>
 *
 * <pre>
 * {"type": "zscore", "window": 30, "on": "delta", "z_threshold": 3.0}
 * </pre>
 *
 * @since 1.0.0
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ThresholdConfig.class, name = "threshold"),
        @JsonSubTypes.Type(value = ZScoreConfig.class, name = "zscore"),
        @JsonSubTypes.Type(value = MadConfig.class, name = "mad")
})
public abstract class DetectorConfig {

    /**
     * @return the discriminator of this variant
     */
    public abstract DetectorType type();

    /**
     * @return the series transform applied before scoring
     */
    public abstract SeriesTransform getOn();

    /**
     * @return number of points preceding the current one that form the
     *         baseline; {@code 0} for detectors without a baseline
     */
    public abstract int baselineWindow();

    /**
     * @return minimum number of usable points required to evaluate
     */
    public abstract int minimumPoints();

    /**
     * Number of raw points to request from the series source: the baseline,
     * the current point, and one extra prior point for differencing
     * transforms.
     *
     * @return raw points needed for one evaluation
     */
    public int requiredPoints() {
        return baselineWindow() + 1 + getOn().lag();
    }

    /**
     * Validate every parameter of this configuration.
     *
     * @throws InvalidConfigException listing all problems found
     */
    public final void validate() {
        List<String> errors = new ArrayList<>();
        if (getOn() == null) {
            errors.add("'on' is required");
        }
        collectErrors(errors);
        if (!errors.isEmpty()) {
            throw InvalidConfigException.fromErrors(type().key() + " detector config", errors);
        }
    }

    /**
     * Append variant-specific validation errors.
     *
     * @param errors mutable list to append to
     */
    protected abstract void collectErrors(List<String> errors);
}
