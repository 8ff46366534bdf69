package com.alertsentinel.core.config;

import com.alertsentinel.core.error.InvalidConfigException;
import com.alertsentinel.core.model.AlertConfiguration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Top-level POJO for the alerts YAML configuration.
 *
 * <pre>
 * alerts:
 *   - id: signups-anomaly
 *     insightRef: insight-signups
 *     calculationInterval: daily
 *     detectorConfig:
 *       type: zscore
 *       window: 30
 *       z_threshold: 3.0
 *     subscribedUsers: [alice]
 * </pre>
 *
 * @since 1.0.0
 */
public class AlertsConfig {

    private List<AlertDefinition> alerts = new ArrayList<>();

    /**
     * @return unmodifiable list of alert definitions
     */
    public List<AlertDefinition> getAlerts() {
        return Collections.unmodifiableList(alerts);
    }

    /**
     * Set the alerts list (used by SnakeYAML during deserialization).
     */
    public void setAlerts(List<AlertDefinition> alerts) {
        this.alerts = alerts != null ? new ArrayList<>(alerts) : new ArrayList<>();
    }

    /**
     * Convert every definition, collecting all errors before failing.
     *
     * @param parser detector configuration parser
     * @return validated alerts, in file order
     * @throws InvalidConfigException if any definition is invalid or ids repeat
     */
    public List<AlertConfiguration> toConfigurations(DetectorConfigParser parser) {
        List<String> errors = new ArrayList<>();
        List<AlertConfiguration> configurations = new ArrayList<>();
        Set<String> ids = new HashSet<>();

        for (int i = 0; i < alerts.size(); i++) {
            AlertDefinition definition = alerts.get(i);
            if (definition == null) {
                errors.add("Alert at index " + i + " is empty");
                continue;
            }
            if (definition.getId() != null && !ids.add(definition.getId())) {
                errors.add("Duplicate alert id: '" + definition.getId() + "'");
                continue;
            }
            try {
                configurations.add(definition.toConfiguration(parser));
            } catch (InvalidConfigException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new InvalidConfigException(
                    "Alerts configuration validation failed:\n  - " + String.join("\n  - ", errors));
        }
        return configurations;
    }

    @Override
    public String toString() {
        return "AlertsConfig{alerts=" + alerts + '}';
    }
}
