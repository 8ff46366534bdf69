package com.alertsentinel.core.detection;

import com.alertsentinel.core.model.EvaluationResult;

import java.util.List;

/**
 * Contract for all detectors.
 *
 * <p>
 * Detectors are stateless and thread-safe: one instance per
 * {@link DetectorType} serves every alert. The last element of the series is
 * the current point; the elements before it form the baseline.
 * </p>
 *
 * @param <C> the configuration variant this detector accepts
 */
public interface Detector<C extends DetectorConfig> {

    /**
     * @return the discriminator this detector is registered under
     */
    DetectorType type();

    /**
     * @return the configuration class this detector accepts
     */
    Class<C> configType();

    /**
     * Score the current point of a preprocessed series.
     *
     * @param series preprocessed series, oldest first, current point last
     * @param config detector configuration
     * @return the evaluation result, without a raw value
     * @throws com.alertsentinel.core.error.InsufficientDataException if the
     *         series is too short for the configuration
     */
    EvaluationResult evaluate(List<Double> series, C config);
}
