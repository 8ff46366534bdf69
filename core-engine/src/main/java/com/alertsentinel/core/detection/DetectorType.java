package com.alertsentinel.core.detection;

import java.util.Locale;

/**
 * Discriminator of the detector configuration union.
 *
 * <p>
 * The {@link #key()} is the value of the {@code type} property in serialized
 * detector configurations.
 * </p>
 *
 * @since 1.0.0
 */
public enum DetectorType {

    THRESHOLD("threshold"),
    ZSCORE("zscore"),
    MAD("mad");

    private final String key;

    DetectorType(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * Resolve a discriminator value, case-insensitively.
     *
     * @param key discriminator, e.g. {@code "zscore"}
     * @return the matching type
     * @throws IllegalArgumentException if {@code key} names no known detector
     */
    public static DetectorType fromKey(String key) {
        if (key != null) {
            String normalised = key.toLowerCase(Locale.ROOT);
            for (DetectorType type : values()) {
                if (type.key.equals(normalised)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown detector type: '" + key
                + "'. Supported types: threshold, zscore, mad");
    }
}
