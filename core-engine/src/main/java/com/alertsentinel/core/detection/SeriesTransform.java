package com.alertsentinel.core.detection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Quantity a detector scores, derived from the raw series.
 *
 * @since 1.0.0
 */
public enum SeriesTransform {

    /** Raw values, unchanged. */
    VALUE("value", 0),

    /** Period-over-period difference {@code x[t] - x[t-1]}. */
    DELTA("delta", 1),

    /** Period-over-period relative change {@code (x[t] - x[t-1]) / |x[t-1]|}. */
    PCT_DELTA("pct_delta", 1);

    private final String key;
    private final int lag;

    SeriesTransform(String key, int lag) {
        this.key = key;
        this.lag = lag;
    }

    @JsonValue
    public String key() {
        return key;
    }

    /**
     * @return number of leading points consumed by the transform
     */
    public int lag() {
        return lag;
    }

    @JsonCreator
    public static SeriesTransform fromKey(String key) {
        if (key != null) {
            String normalised = key.toLowerCase(Locale.ROOT);
            for (SeriesTransform transform : values()) {
                if (transform.key.equals(normalised)) {
                    return transform;
                }
            }
        }
        throw new IllegalArgumentException("Unknown series transform: '" + key
                + "'. Supported: value, delta, pct_delta");
    }
}
