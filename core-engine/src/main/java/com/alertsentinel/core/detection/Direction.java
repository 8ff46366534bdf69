package com.alertsentinel.core.detection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Which side of the baseline counts as a breach for score-based detectors.
 *
 * @since 1.0.0
 */
public enum Direction {

    UP("up"),
    DOWN("down"),
    BOTH("both");

    private final String key;

    Direction(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    /**
     * Apply the breach policy to a score.
     *
     * @param label     score name used in the message, e.g. {@code "z"}
     * @param score     the detector score
     * @param threshold positive sensitivity threshold
     * @return a breach message, or empty if the score is within bounds
     */
    public Optional<String> breach(String label, double score, double threshold) {
        return switch (this) {
            case BOTH -> Math.abs(score) >= threshold
                    ? Optional.of(String.format(Locale.ROOT, "|%s|=%.2f >= %.2f", label, Math.abs(score), threshold))
                    : Optional.empty();
            case UP -> score >= threshold
                    ? Optional.of(String.format(Locale.ROOT, "%s=%.2f >= %.2f", label, score, threshold))
                    : Optional.empty();
            case DOWN -> score <= -threshold
                    ? Optional.of(String.format(Locale.ROOT, "%s=%.2f <= -%.2f", label, score, threshold))
                    : Optional.empty();
        };
    }

    @JsonCreator
    public static Direction fromKey(String key) {
        if (key != null) {
            String normalised = key.toLowerCase(Locale.ROOT);
            for (Direction direction : values()) {
                if (direction.key.equals(normalised)) {
                    return direction;
                }
            }
        }
        throw new IllegalArgumentException("Unknown direction: '" + key + "'. Supported: up, down, both");
    }
}
