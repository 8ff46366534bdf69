package com.alertsentinel.core.detection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Configuration of the {@link ZScoreDetector}.
 *
 * @since 1.0.0
 */
public final class ZScoreConfig extends WindowedDetectorConfig {

    public static final double DEFAULT_Z_THRESHOLD = 3.0;

    private final double zThreshold;

    @JsonCreator
    public ZScoreConfig(@JsonProperty("window") Integer window,
            @JsonProperty("on") SeriesTransform on,
            @JsonProperty("z_threshold") Double zThreshold,
            @JsonProperty("min_points") Integer minPoints,
            @JsonProperty("two_tailed") Boolean twoTailed,
            @JsonProperty("direction") Direction direction) {
        super(window, on, minPoints, twoTailed, direction);
        this.zThreshold = zThreshold != null ? zThreshold : DEFAULT_Z_THRESHOLD;
    }

    public ZScoreConfig(int window, SeriesTransform on, double zThreshold, int minPoints, Direction direction) {
        this(window, on, zThreshold, minPoints, null, direction);
    }

    @Override
    public DetectorType type() {
        return DetectorType.ZSCORE;
    }

    @JsonProperty("z_threshold")
    public double getZThreshold() {
        return zThreshold;
    }

    @Override
    public double sensitivity() {
        return zThreshold;
    }

    @Override
    protected String sensitivityName() {
        return "z_threshold";
    }
}
