package com.alertsentinel.core.detection;

import com.alertsentinel.core.error.InsufficientDataException;
import com.alertsentinel.core.model.EvaluationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Template for detectors that score the current point against a trailing
 * baseline: estimate a center and a spread over the baseline, turn the
 * distance to the center into a score, and apply the configured
 * {@link Direction}.
 *
 * <h3>Degenerate baselines</h3>
 * <p>
 * A spread of exactly zero with the current point equal to the center carries
 * no signal: the result is a breach-free score of {@code 0} flagged with
 * {@code degenerate_baseline} metadata. A zero spread with any other current
 * point still yields a finite, very large score because the spread is
 * floored at {@link SeriesPreprocessor#EPSILON}.
 * </p>
 *
 * @param <C> the configuration variant
 */
abstract class BaselineDetector<C extends WindowedDetectorConfig> implements Detector<C> {

    private static final Logger LOG = LoggerFactory.getLogger(BaselineDetector.class);

    @Override
    public final EvaluationResult evaluate(List<Double> series, C config) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(config, "config must not be null");

        if (series.isEmpty()) {
            throw new InsufficientDataException("No points to evaluate");
        }
        int end = series.size();
        int start = Math.max(0, end - 1 - config.getWindow());
        List<Double> baseline = series.subList(start, end - 1);
        double current = series.get(end - 1);

        if (baseline.size() < config.getMinPoints()) {
            throw new InsufficientDataException(String.format(
                    "Baseline has %d point(s), at least %d required",
                    baseline.size(), config.getMinPoints()));
        }

        double center = center(baseline);
        double spread = spread(baseline, center);

        EvaluationResult.Builder result = EvaluationResult.builder()
                .metadata(centerName(), center)
                .metadata(spreadName(), spread)
                .metadata("window", baseline.size())
                .metadata("on", config.getOn().key());

        if (spread == 0 && current == center) {
            LOG.debug("Degenerate baseline: {}={} with zero {}, current equals center",
                    centerName(), center, spreadName());
            return result
                    .value(0.0)
                    .metadata("degenerate_baseline", true)
                    .metadata("note", "Baseline has zero " + spreadName()
                            + " and the current point equals its " + centerName())
                    .build();
        }

        double score = score(current, center, spread);
        result.value(score);

        Optional<String> breach = config.effectiveDirection()
                .breach(scoreLabel(), score, config.sensitivity());
        breach.ifPresent(message -> result.breach(breachPrefix() + message));

        LOG.debug("{} score={} center={} spread={} breached={}",
                type().key(), score, center, spread, breach.isPresent());
        return result.build();
    }

    /** Location estimate of the baseline. */
    protected abstract double center(List<Double> baseline);

    /** Dispersion estimate of the baseline around {@code center}. */
    protected abstract double spread(List<Double> baseline, double center);

    /** Score of {@code current}; the spread must be floored by implementations. */
    protected abstract double score(double current, double center, double spread);

    protected abstract String centerName();

    protected abstract String spreadName();

    protected abstract String scoreLabel();

    protected abstract String breachPrefix();
}
