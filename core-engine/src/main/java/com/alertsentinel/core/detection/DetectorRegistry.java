package com.alertsentinel.core.detection;

import com.alertsentinel.core.model.EvaluationResult;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Static registry mapping each {@link DetectorType} to its detector.
 *
 * <p>
 * This is the single point of extension when adding a detector: add the
 * variant to {@link DetectorType} and {@link DetectorConfig}, then register
 * the implementation here.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorRegistry {

    private static final Map<DetectorType, Detector<?>> DETECTORS;

    static {
        Map<DetectorType, Detector<?>> detectors = new EnumMap<>(DetectorType.class);
        register(detectors, new ThresholdDetector());
        register(detectors, new ZScoreDetector());
        register(detectors, new MadDetector());
        DETECTORS = Collections.unmodifiableMap(detectors);
    }

    private DetectorRegistry() {
        // utility class, not instantiable
    }

    /**
     * Look up the detector for a type.
     *
     * @param type detector type; must not be {@code null}
     * @return the registered detector
     * @throws IllegalArgumentException if no detector is registered for {@code type}
     */
    public static Detector<?> get(DetectorType type) {
        Objects.requireNonNull(type, "DetectorType must not be null");
        Detector<?> detector = DETECTORS.get(type);
        if (detector == null) {
            throw new IllegalArgumentException("No detector registered for type: " + type.key());
        }
        return detector;
    }

    /**
     * Evaluate a preprocessed series with the detector matching
     * {@code config}.
     *
     * @param series preprocessed series, current point last
     * @param config detector configuration; must not be {@code null}
     * @return the evaluation result
     */
    public static EvaluationResult evaluate(List<Double> series, DetectorConfig config) {
        Objects.requireNonNull(config, "DetectorConfig must not be null");
        return evaluateWith(get(config.type()), series, config);
    }

    private static <C extends DetectorConfig> EvaluationResult evaluateWith(
            Detector<C> detector, List<Double> series, DetectorConfig config) {
        return detector.evaluate(series, detector.configType().cast(config));
    }

    private static void register(Map<DetectorType, Detector<?>> detectors, Detector<?> detector) {
        Detector<?> previous = detectors.put(detector.type(), detector);
        if (previous != null) {
            throw new IllegalStateException("Duplicate detector for type: " + detector.type().key());
        }
    }
}
