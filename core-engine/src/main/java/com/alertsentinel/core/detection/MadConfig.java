package com.alertsentinel.core.detection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Configuration of the {@link MadDetector}.
 *
 * @since 1.0.0
 */
public final class MadConfig extends WindowedDetectorConfig {

    public static final double DEFAULT_K = 3.5;

    private final double k;

    @JsonCreator
    public MadConfig(@JsonProperty("window") Integer window,
            @JsonProperty("on") SeriesTransform on,
            @JsonProperty("k") Double k,
            @JsonProperty("min_points") Integer minPoints,
            @JsonProperty("two_tailed") Boolean twoTailed,
            @JsonProperty("direction") Direction direction) {
        super(window, on, minPoints, twoTailed, direction);
        this.k = k != null ? k : DEFAULT_K;
    }

    public MadConfig(int window, SeriesTransform on, double k, int minPoints, Direction direction) {
        this(window, on, k, minPoints, null, direction);
    }

    @Override
    public DetectorType type() {
        return DetectorType.MAD;
    }

    public double getK() {
        return k;
    }

    @Override
    public double sensitivity() {
        return k;
    }

    @Override
    protected String sensitivityName() {
        return "k";
    }
}
