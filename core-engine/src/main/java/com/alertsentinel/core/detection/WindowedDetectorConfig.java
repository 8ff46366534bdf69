package com.alertsentinel.core.detection;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Shared shape of the baseline detectors: a trailing window, a transform, a
 * minimum baseline size and a directional breach policy.
 *
 * <p>
 * {@code two_tailed} is the legacy way of choosing a direction. It is only
 * consulted when {@code direction} is absent: {@code true} means
 * {@link Direction#BOTH}, {@code false} means {@link Direction#UP}.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class WindowedDetectorConfig extends DetectorConfig {

    public static final int DEFAULT_WINDOW = 30;
    public static final int DEFAULT_MIN_POINTS = 10;

    private final int window;
    private final SeriesTransform on;
    private final int minPoints;
    private final boolean twoTailed;
    private final Direction direction;

    protected WindowedDetectorConfig(Integer window, SeriesTransform on, Integer minPoints,
            Boolean twoTailed, Direction direction) {
        this.window = window != null ? window : DEFAULT_WINDOW;
        this.on = on != null ? on : SeriesTransform.VALUE;
        this.minPoints = minPoints != null ? minPoints : Math.min(DEFAULT_MIN_POINTS, this.window);
        this.twoTailed = twoTailed == null || twoTailed;
        this.direction = direction;
    }

    /**
     * @return breach sensitivity; the score magnitude that counts as a breach
     */
    public abstract double sensitivity();

    /**
     * @return the name of the sensitivity parameter, for messages
     */
    protected abstract String sensitivityName();

    /**
     * @return the explicit direction, or the one implied by {@code two_tailed}
     */
    public Direction effectiveDirection() {
        if (direction != null) {
            return direction;
        }
        return twoTailed ? Direction.BOTH : Direction.UP;
    }

    @Override
    public int baselineWindow() {
        return window;
    }

    @Override
    public int minimumPoints() {
        return minPoints;
    }

    public int getWindow() {
        return window;
    }

    @Override
    public SeriesTransform getOn() {
        return on;
    }

    @JsonProperty("min_points")
    public int getMinPoints() {
        return minPoints;
    }

    @JsonProperty("two_tailed")
    public boolean isTwoTailed() {
        return twoTailed;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public Direction getDirection() {
        return direction;
    }

    @Override
    protected void collectErrors(List<String> errors) {
        if (window < 2) {
            errors.add("'window' must be >= 2, got: " + window);
        }
        if (minPoints < 1) {
            errors.add("'min_points' must be >= 1, got: " + minPoints);
        }
        if (minPoints > window) {
            errors.add("'min_points' (" + minPoints + ") must not exceed 'window' (" + window + ")");
        }
        double sensitivity = sensitivity();
        if (!(sensitivity > 0) || Double.isInfinite(sensitivity)) {
            errors.add("'" + sensitivityName() + "' must be a finite value > 0, got: " + sensitivity);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "window=" + window +
                ", on=" + on.key() +
                ", " + sensitivityName() + "=" + sensitivity() +
                ", minPoints=" + minPoints +
                ", direction=" + effectiveDirection().key() +
                '}';
    }
}
