package com.alertsentinel.core.detection;

import java.util.List;

/**
 * Z-score detector.
 *
 * <p>
 * Scores the current point as {@code (current - mean) / (stddev + ε)} over
 * the baseline, using the population standard deviation.
 * </p>
 *
 * @since 1.0.0
 */
public final class ZScoreDetector extends BaselineDetector<ZScoreConfig> {

    @Override
    public DetectorType type() {
        return DetectorType.ZSCORE;
    }

    @Override
    public Class<ZScoreConfig> configType() {
        return ZScoreConfig.class;
    }

    @Override
    protected double center(List<Double> baseline) {
        return Statistics.mean(baseline);
    }

    @Override
    protected double spread(List<Double> baseline, double center) {
        return Statistics.populationStdDev(baseline, center);
    }

    @Override
    protected double score(double current, double center, double spread) {
        return (current - center) / (spread + SeriesPreprocessor.EPSILON);
    }

    @Override
    protected String centerName() {
        return "mean";
    }

    @Override
    protected String spreadName() {
        return "std";
    }

    @Override
    protected String scoreLabel() {
        return "z";
    }

    @Override
    protected String breachPrefix() {
        return "Z-score alert: ";
    }
}
