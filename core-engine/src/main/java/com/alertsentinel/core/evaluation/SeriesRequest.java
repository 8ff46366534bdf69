package com.alertsentinel.core.evaluation;

import com.alertsentinel.core.model.AlertConfiguration;
import com.alertsentinel.core.model.CalculationInterval;

import java.util.Objects;

/**
 * Request for the most recent points of one series of an insight.
 *
 * @since 1.0.0
 */
public final class SeriesRequest {

    private final String insightRef;
    private final int seriesIndex;
    private final CalculationInterval interval;
    private final int numPoints;
    private final boolean includeOngoing;

    public SeriesRequest(String insightRef, int seriesIndex, CalculationInterval interval,
            int numPoints, boolean includeOngoing) {
        this.insightRef = Objects.requireNonNull(insightRef, "insightRef must not be null");
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
        if (seriesIndex < 0) {
            throw new IllegalArgumentException("seriesIndex must be >= 0, got: " + seriesIndex);
        }
        if (numPoints < 1) {
            throw new IllegalArgumentException("numPoints must be >= 1, got: " + numPoints);
        }
        this.seriesIndex = seriesIndex;
        this.numPoints = numPoints;
        this.includeOngoing = includeOngoing;
    }

    /**
     * Build the request needed to evaluate {@code alert} once.
     *
     * @param alert the alert to evaluate
     * @return request sized to the alert's detector
     */
    public static SeriesRequest forAlert(AlertConfiguration alert) {
        return new SeriesRequest(
                alert.getInsightRef(),
                alert.getSeriesIndex(),
                alert.getCalculationInterval(),
                alert.effectiveDetectorConfig().requiredPoints(),
                alert.isCheckOngoingInterval());
    }

    public String getInsightRef() {
        return insightRef;
    }

    public int getSeriesIndex() {
        return seriesIndex;
    }

    public CalculationInterval getInterval() {
        return interval;
    }

    public int getNumPoints() {
        return numPoints;
    }

    public boolean isIncludeOngoing() {
        return includeOngoing;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeriesRequest that))
            return false;
        return seriesIndex == that.seriesIndex
                && numPoints == that.numPoints
                && includeOngoing == that.includeOngoing
                && insightRef.equals(that.insightRef)
                && interval == that.interval;
    }

    @Override
    public int hashCode() {
        return Objects.hash(insightRef, seriesIndex, interval, numPoints, includeOngoing);
    }

    @Override
    public String toString() {
        return "SeriesRequest{" +
                "insightRef='" + insightRef + '\'' +
                ", seriesIndex=" + seriesIndex +
                ", interval=" + interval +
                ", numPoints=" + numPoints +
                ", includeOngoing=" + includeOngoing +
                '}';
    }
}
