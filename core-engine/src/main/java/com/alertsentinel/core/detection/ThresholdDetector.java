package com.alertsentinel.core.detection;

import com.alertsentinel.core.error.InsufficientDataException;
import com.alertsentinel.core.model.EvaluationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Threshold detector.
 *
 * <p>
 * Breaches when the current point is below the lower bound or above the
 * upper bound. There is no baseline: only the last element of the series is
 * looked at. Percentage bounds are fractions and are compared against a
 * percentage-change series.
 * </p>
 *
 * @since 1.0.0
 */
public final class ThresholdDetector implements Detector<ThresholdConfig> {

    private static final Logger LOG = LoggerFactory.getLogger(ThresholdDetector.class);

    @Override
    public DetectorType type() {
        return DetectorType.THRESHOLD;
    }

    @Override
    public Class<ThresholdConfig> configType() {
        return ThresholdConfig.class;
    }

    @Override
    public EvaluationResult evaluate(List<Double> series, ThresholdConfig config) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(config, "config must not be null");

        if (series.isEmpty()) {
            throw new InsufficientDataException("No points to evaluate");
        }

        double current = series.get(series.size() - 1);
        if (config.isDecrease()) {
            current = -current;
        }

        Double lower = config.getBounds().getLower();
        Double upper = config.getBounds().getUpper();
        boolean percentage = config.getBoundType() == BoundType.PERCENTAGE;

        EvaluationResult.Builder result = EvaluationResult.builder()
                .value(current)
                .metadata("lower", lower)
                .metadata("upper", upper)
                .metadata("bound_type", config.getBoundType().key())
                .metadata("on", config.getOn().key());

        if (lower != null && current < lower) {
            result.breach(String.format(Locale.ROOT, "The %s (%s) is below the lower threshold (%s)",
                    quantity(config), format(current, percentage), format(lower, percentage)));
        }
        if (upper != null && current > upper) {
            result.breach(String.format(Locale.ROOT, "The %s (%s) is above the upper threshold (%s)",
                    quantity(config), format(current, percentage), format(upper, percentage)));
        }

        EvaluationResult built = result.build();
        LOG.debug("threshold value={} bounds={} breached={}", current, config.getBounds(), built.isBreached());
        return built;
    }

    private static String quantity(ThresholdConfig config) {
        return switch (config.getOn()) {
            case VALUE -> "value";
            case DELTA, PCT_DELTA -> config.isDecrease() ? "decrease" : "increase";
        };
    }

    private static String format(double value, boolean percentage) {
        return percentage
                ? String.format(Locale.ROOT, "%.1f%%", value * 100)
                : String.format(Locale.ROOT, "%.2f", value);
    }
}
