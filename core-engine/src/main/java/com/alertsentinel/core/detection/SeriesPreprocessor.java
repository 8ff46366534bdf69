package com.alertsentinel.core.detection;

import com.alertsentinel.core.error.InsufficientDataException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Turns a raw series into the quantity a detector scores.
 *
 * <p>
 * Differencing transforms consume the first point, so the output is
 * {@link SeriesTransform#lag()} elements shorter than the input. For
 * {@link SeriesTransform#PCT_DELTA} the denominator is floored at
 * {@value #EPSILON} so a zero previous value does not divide by zero; the
 * sign of the change is kept in the numerator.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesPreprocessor {

    /** Floor for denominators. */
    public static final double EPSILON = 1e-9;

    private SeriesPreprocessor() {
        // utility class, not instantiable
    }

    /**
     * Apply {@code transform} to {@code values}.
     *
     * @param values    raw values, oldest first; must not be {@code null}
     * @param transform transform to apply; must not be {@code null}
     * @param minPoints minimum number of points the output must contain
     * @return unmodifiable transformed series, oldest first
     * @throws InsufficientDataException if fewer than {@code minPoints} remain
     */
    public static List<Double> transform(List<Double> values, SeriesTransform transform, int minPoints) {
        Objects.requireNonNull(values, "values must not be null");
        Objects.requireNonNull(transform, "transform must not be null");

        List<Double> out;
        switch (transform) {
            case VALUE -> out = new ArrayList<>(values);
            case DELTA -> {
                out = new ArrayList<>(Math.max(0, values.size() - 1));
                for (int i = 1; i < values.size(); i++) {
                    out.add(values.get(i) - values.get(i - 1));
                }
            }
            case PCT_DELTA -> {
                out = new ArrayList<>(Math.max(0, values.size() - 1));
                for (int i = 1; i < values.size(); i++) {
                    double previous = values.get(i - 1);
                    out.add((values.get(i) - previous) / Math.max(EPSILON, Math.abs(previous)));
                }
            }
            default -> throw new IllegalArgumentException("Unsupported transform: " + transform);
        }

        if (out.size() < minPoints) {
            throw new InsufficientDataException(String.format(
                    "Need at least %d %s point(s), got %d from %d raw point(s)",
                    minPoints, transform.key(), out.size(), values.size()));
        }
        return Collections.unmodifiableList(out);
    }
}
