package com.alertsentinel.core.detection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Unit of threshold bounds. Percentage bounds are fractions ({@code 0.2}
 * means 20%) and are compared against a {@link SeriesTransform#PCT_DELTA}
 * series.
 *
 * @since 1.0.0
 */
public enum BoundType {

    ABSOLUTE("absolute"),
    PERCENTAGE("percentage");

    private final String key;

    BoundType(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    @JsonCreator
    public static BoundType fromKey(String key) {
        if (key != null) {
            String normalised = key.toLowerCase(Locale.ROOT);
            for (BoundType type : values()) {
                if (type.key.equals(normalised)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown bound type: '" + key + "'. Supported: absolute, percentage");
    }
}
