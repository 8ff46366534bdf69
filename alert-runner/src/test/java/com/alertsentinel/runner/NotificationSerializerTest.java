package com.alertsentinel.runner;

import com.alertsentinel.core.detection.ThresholdConfig;
import com.alertsentinel.core.model.AlertCheck;
import com.alertsentinel.core.model.AlertConfiguration;
import com.alertsentinel.core.model.AlertState;
import com.alertsentinel.core.model.NotificationTarget;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link NotificationSerializer}.
 */
class NotificationSerializerTest {

    private final NotificationSerializer serializer = new NotificationSerializer();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("Notification JSON carries ISO timestamps and typed targets")
    void serializesFiringNotification() throws Exception {
        AlertCheck check = AlertCheck.builder()
                .id("check-1")
                .alertId("signups")
                .createdAt(Instant.parse("2024-05-06T09:00:00Z"))
                .state(AlertState.FIRING)
                .calculatedValue(12.0)
                .rawValue(12.0)
                .breaches(List.of("The value (12.00) is above the upper threshold (10.00)"))
                .targetsNotified(true)
                .build();
        Set<NotificationTarget> targets = new LinkedHashSet<>(List.of(
                NotificationTarget.user("alice"), NotificationTarget.destination("ops-slack")));

        JsonNode json = mapper.readTree(serializer.serialize(AlertNotification.of(targets, alert(), check)));

        assertThat(json.get("checkId").asText()).isEqualTo("check-1");
        assertThat(json.get("alertId").asText()).isEqualTo("signups");
        assertThat(json.get("alertName").asText()).isEqualTo("Signups");
        assertThat(json.get("state").asText()).isEqualTo("FIRING");
        assertThat(json.get("checkedAt").asText()).isEqualTo("2024-05-06T09:00:00Z");
        assertThat(json.get("calculatedValue").asDouble()).isEqualTo(12.0);
        assertThat(json.get("breaches")).hasSize(1);
        assertThat(json.get("targets").get(0).asText()).isEqualTo("user:alice");
        assertThat(json.get("targets").get(1).asText()).isEqualTo("destination:ops-slack");
        assertThat(json.has("errorMessage")).isFalse();
    }

    @Test
    @DisplayName("Errored notifications carry the error and no value")
    void serializesErroredNotification() throws Exception {
        AlertCheck check = AlertCheck.builder()
                .alertId("signups")
                .createdAt(Instant.parse("2024-05-06T09:00:00Z"))
                .state(AlertState.ERRORED)
                .errorMessage("query layer down")
                .targetsNotified(true)
                .build();

        JsonNode json = mapper.readTree(serializer.serialize(
                AlertNotification.of(Set.of(NotificationTarget.user("alice")), alert(), check)));

        assertThat(json.get("state").asText()).isEqualTo("ERRORED");
        assertThat(json.get("errorMessage").asText()).isEqualTo("query layer down");
        assertThat(json.has("calculatedValue")).isFalse();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static AlertConfiguration alert() {
        return AlertConfiguration.builder()
                .id("signups")
                .name("Signups")
                .insightRef("insight-7")
                .threshold(ThresholdConfig.absolute(null, 10.0))
                .build();
    }
}
