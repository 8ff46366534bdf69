package com.alertsentinel.core.detection;

import java.util.Arrays;
import java.util.List;

/**
 * Baseline statistics used by the score-based detectors.
 */
final class Statistics {

    private Statistics() {
        // utility class, not instantiable
    }

    static double mean(List<Double> values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    /**
     * Population standard deviation (divides by {@code n}).
     */
    static double populationStdDev(List<Double> values, double mean) {
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / values.size());
    }

    /**
     * Median; the mean of the two middle values for an even count.
     */
    static double median(List<Double> values) {
        double[] sorted = values.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1
                ? sorted[mid]
                : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    /**
     * Median absolute deviation around {@code median}.
     */
    static double medianAbsoluteDeviation(List<Double> values, double median) {
        return median(values.stream().map(v -> Math.abs(v - median)).toList());
    }
}
