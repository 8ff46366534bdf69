package com.alertsentinel.core.config;

import com.alertsentinel.core.detection.DetectorConfig;
import com.alertsentinel.core.detection.ThresholdConfig;
import com.alertsentinel.core.error.InvalidConfigException;
import com.alertsentinel.core.model.AlertCondition;
import com.alertsentinel.core.model.AlertConfiguration;
import com.alertsentinel.core.model.CalculationInterval;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One alert as written in the alerts YAML file.
 *
 * <p>
 * Mutable bean populated by SnakeYAML; {@link #toConfiguration(DetectorConfigParser)}
 * turns it into a validated {@link AlertConfiguration}. Enum-valued fields
 * are kept as strings so that a typo is reported together with every other
 * problem instead of failing the whole YAML parse.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertDefinition {

    private String id;
    private String name;
    private String insightRef;
    private int seriesIndex;

    /** {@code absolute_value}, {@code relative_increase} or {@code relative_decrease}. */
    private String condition = "absolute_value";

    /** Legacy threshold: {@code type} (bound type) and {@code bounds}. */
    private Map<String, Object> threshold;

    /** Detector configuration; takes precedence over {@link #threshold}. */
    private Map<String, Object> detectorConfig;

    private String calculationInterval = "daily";
    private boolean checkOngoingInterval;
    private boolean skipWeekend;
    private boolean enabled = true;
    private List<String> subscribedUsers = new ArrayList<>();
    private List<String> destinations = new ArrayList<>();

    // ---------------------------------------------------------------
    // Conversion
    // ---------------------------------------------------------------

    /**
     * Convert and validate this definition.
     *
     * @param parser detector configuration parser; must not be {@code null}
     * @return the validated alert
     * @throws InvalidConfigException listing every problem found
     */
    public AlertConfiguration toConfiguration(DetectorConfigParser parser) {
        Objects.requireNonNull(parser, "DetectorConfigParser must not be null");
        List<String> errors = new ArrayList<>();

        AlertCondition parsedCondition = null;
        try {
            parsedCondition = AlertCondition.fromString(condition);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        CalculationInterval parsedInterval = null;
        try {
            parsedInterval = CalculationInterval.fromString(calculationInterval);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        DetectorConfig parsedDetector = null;
        if (detectorConfig != null) {
            try {
                parsedDetector = parser.parse(detectorConfig);
            } catch (InvalidConfigException e) {
                errors.add(e.getMessage());
            }
        }
        ThresholdConfig parsedThreshold = null;
        if (threshold != null) {
            try {
                parsedThreshold = parser.parseThreshold(threshold);
            } catch (InvalidConfigException e) {
                errors.add(e.getMessage());
            }
        }
        if (!errors.isEmpty()) {
            throw InvalidConfigException.fromErrors("alert '" + id + "'", errors);
        }

        return AlertConfiguration.builder()
                .id(id)
                .name(name)
                .insightRef(insightRef)
                .seriesIndex(seriesIndex)
                .condition(parsedCondition)
                .threshold(parsedThreshold)
                .detectorConfig(parsedDetector)
                .calculationInterval(parsedInterval)
                .checkOngoingInterval(checkOngoingInterval)
                .skipWeekend(skipWeekend)
                .enabled(enabled)
                .subscribedUsers(new LinkedHashSet<>(subscribedUsers))
                .destinations(new LinkedHashSet<>(destinations))
                .build();
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getInsightRef() {
        return insightRef;
    }

    public void setInsightRef(String insightRef) {
        this.insightRef = insightRef;
    }

    public int getSeriesIndex() {
        return seriesIndex;
    }

    public void setSeriesIndex(int seriesIndex) {
        this.seriesIndex = seriesIndex;
    }

    public String getCondition() {
        return condition;
    }

    public void setCondition(String condition) {
        this.condition = condition;
    }

    public Map<String, Object> getThreshold() {
        return threshold;
    }

    public void setThreshold(Map<String, Object> threshold) {
        this.threshold = threshold;
    }

    public Map<String, Object> getDetectorConfig() {
        return detectorConfig;
    }

    public void setDetectorConfig(Map<String, Object> detectorConfig) {
        this.detectorConfig = detectorConfig;
    }

    public String getCalculationInterval() {
        return calculationInterval;
    }

    public void setCalculationInterval(String calculationInterval) {
        this.calculationInterval = calculationInterval;
    }

    public boolean isCheckOngoingInterval() {
        return checkOngoingInterval;
    }

    public void setCheckOngoingInterval(boolean checkOngoingInterval) {
        this.checkOngoingInterval = checkOngoingInterval;
    }

    public boolean isSkipWeekend() {
        return skipWeekend;
    }

    public void setSkipWeekend(boolean skipWeekend) {
        this.skipWeekend = skipWeekend;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<String> getSubscribedUsers() {
        return subscribedUsers;
    }

    public void setSubscribedUsers(List<String> subscribedUsers) {
        this.subscribedUsers = subscribedUsers != null ? new ArrayList<>(subscribedUsers) : new ArrayList<>();
    }

    public List<String> getDestinations() {
        return destinations;
    }

    public void setDestinations(List<String> destinations) {
        this.destinations = destinations != null ? new ArrayList<>(destinations) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "AlertDefinition{" +
                "id='" + id + '\'' +
                ", insightRef='" + insightRef + '\'' +
                ", condition='" + condition + '\'' +
                ", calculationInterval='" + calculationInterval + '\'' +
                ", detectorConfig=" + detectorConfig +
                ", threshold=" + threshold +
                '}';
    }
}
