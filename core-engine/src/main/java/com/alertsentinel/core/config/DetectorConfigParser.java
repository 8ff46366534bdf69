package com.alertsentinel.core.config;

import com.alertsentinel.core.detection.DetectorConfig;
import com.alertsentinel.core.detection.DetectorType;
import com.alertsentinel.core.detection.ThresholdConfig;
import com.alertsentinel.core.error.InvalidConfigException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Acceptance boundary for detector configurations.
 *
 * <p>
 * Turns a raw map (from YAML or a JSON request body) into exactly one
 * validated {@link DetectorConfig} variant. Unknown or missing {@code type}
 * values, unknown properties and out-of-range parameters are all rejected
 * with an {@link InvalidConfigException}.
 * </p>
 *
 * <h3>Feature flag</h3>
 * <p>
 * When {@code detectorsEnabled} is {@code false} only {@code threshold}
 * configurations are accepted. Alerts already stored keep working; the flag
 * only gates what new configuration is let in.
 * </p>
 *
 * <h3>Legacy thresholds</h3>
 * <p>
 * {@link #parseThreshold(Map)} accepts the legacy shape, where {@code type}
 * carries the bound type:
 * </p>
 *
 * <pre>
 * {"type": "percentage", "bounds": {"upper": 0.2}}
 * </pre>
 *
 * @since 1.0.0
 */
public final class DetectorConfigParser {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorConfigParser.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;
    private final boolean detectorsEnabled;

    public DetectorConfigParser(boolean detectorsEnabled) {
        this.detectorsEnabled = detectorsEnabled;
        this.mapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    }

    public boolean isDetectorsEnabled() {
        return detectorsEnabled;
    }

    /**
     * Parse a JSON detector configuration.
     *
     * @param json JSON object text; must not be {@code null}
     * @return the validated configuration
     * @throws InvalidConfigException if the configuration is rejected
     */
    public DetectorConfig parse(String json) {
        Objects.requireNonNull(json, "json must not be null");
        Map<String, Object> raw;
        try {
            raw = mapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new InvalidConfigException("Malformed detector config: " + e.getOriginalMessage(), e);
        }
        if (raw == null) {
            throw new InvalidConfigException("Detector config must be a JSON object");
        }
        return parse(raw);
    }

    /**
     * Parse a raw detector configuration map.
     *
     * @param raw map with a {@code type} discriminator; must not be {@code null}
     * @return the validated configuration
     * @throws InvalidConfigException if the configuration is rejected
     */
    public DetectorConfig parse(Map<String, ?> raw) {
        Objects.requireNonNull(raw, "raw config must not be null");
        Object typeValue = raw.get("type");
        if (!(typeValue instanceof String typeName) || typeName.isBlank()) {
            throw new InvalidConfigException("Invalid detector config: 'type' is required");
        }

        DetectorType type;
        try {
            type = DetectorType.fromKey(typeName);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigException(e.getMessage(), e);
        }
        if (!detectorsEnabled && type != DetectorType.THRESHOLD) {
            throw new InvalidConfigException("Detector type '" + type.key()
                    + "' is not enabled; only threshold detectors are accepted");
        }

        Map<String, Object> normalised = new LinkedHashMap<>(raw);
        normalised.put("type", type.key());
        DetectorConfig config = convert(normalised, type);
        config.validate();
        LOG.debug("Accepted detector config {}", config);
        return config;
    }

    /**
     * Parse a legacy threshold, in which {@code type} is the bound type
     * ({@code absolute} or {@code percentage}).
     *
     * @param raw legacy threshold map; must not be {@code null}
     * @return the threshold configuration, not yet combined with a condition
     * @throws InvalidConfigException if the threshold is rejected
     */
    public ThresholdConfig parseThreshold(Map<String, ?> raw) {
        Objects.requireNonNull(raw, "raw threshold must not be null");
        Map<String, Object> normalised = new LinkedHashMap<>(raw);
        Object boundType = normalised.remove("type");
        if (boundType != null && !normalised.containsKey("bound_type")) {
            normalised.put("bound_type", boundType);
        }
        normalised.put("type", DetectorType.THRESHOLD.key());
        return (ThresholdConfig) convert(normalised, DetectorType.THRESHOLD);
    }

    /**
     * @return the JSON form of {@code config}, readable by {@link #parse(String)}
     */
    public String toJson(DetectorConfig config) {
        try {
            return mapper.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize detector config " + config, e);
        }
    }

    private DetectorConfig convert(Map<String, Object> raw, DetectorType type) {
        try {
            return mapper.convertValue(raw, DetectorConfig.class);
        } catch (IllegalArgumentException e) {
            String detail = e.getCause() instanceof JsonMappingException mapping
                    ? mapping.getOriginalMessage()
                    : e.getMessage();
            throw new InvalidConfigException("Invalid " + type.key() + " detector config: " + detail, e);
        }
    }
}
