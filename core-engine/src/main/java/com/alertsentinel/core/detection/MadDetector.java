package com.alertsentinel.core.detection;

import java.util.List;

/**
 * Median absolute deviation detector.
 *
 * <p>
 * Scores the current point as
 * {@code 0.6745 * (current - median) / (mad + ε)}. The constant rescales the
 * MAD so the score is comparable to a z-score on normally distributed data,
 * while staying robust to outliers inside the baseline.
 * </p>
 *
 * @since 1.0.0
 */
public final class MadDetector extends BaselineDetector<MadConfig> {

    /** Ratio between the MAD and the standard deviation of a normal distribution. */
    static final double CONSISTENCY_CONSTANT = 0.6745;

    @Override
    public DetectorType type() {
        return DetectorType.MAD;
    }

    @Override
    public Class<MadConfig> configType() {
        return MadConfig.class;
    }

    @Override
    protected double center(List<Double> baseline) {
        return Statistics.median(baseline);
    }

    @Override
    protected double spread(List<Double> baseline, double center) {
        return Statistics.medianAbsoluteDeviation(baseline, center);
    }

    @Override
    protected double score(double current, double center, double spread) {
        return CONSISTENCY_CONSTANT * (current - center) / (spread + SeriesPreprocessor.EPSILON);
    }

    @Override
    protected String centerName() {
        return "median";
    }

    @Override
    protected String spreadName() {
        return "mad";
    }

    @Override
    protected String scoreLabel() {
        return "mad_score";
    }

    @Override
    protected String breachPrefix() {
        return "MAD alert: ";
    }
}
