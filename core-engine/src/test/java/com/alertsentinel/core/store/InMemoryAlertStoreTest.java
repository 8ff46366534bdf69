package com.alertsentinel.core.store;

import com.alertsentinel.core.model.AlertCheck;
import com.alertsentinel.core.model.AlertConfiguration;
import com.alertsentinel.core.model.AlertState;
import com.alertsentinel.core.support.TestAlerts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link InMemoryAlertStore}.
 */
class InMemoryAlertStoreTest {

    private final InMemoryAlertStore store = new InMemoryAlertStore();

    @Test
    @DisplayName("Saving replaces the alert with the same id")
    void saveReplaces() {
        store.save(TestAlerts.upperThreshold("a1", 10).build());
        store.save(TestAlerts.upperThreshold("a1", 10).enabled(false).build());

        assertThat(store.find("a1")).get().extracting(AlertConfiguration::isEnabled).isEqualTo(false);
        assertThat(store.find("missing")).isEmpty();
    }

    @Test
    @DisplayName("findAll is ordered by id")
    void findAllOrdered() {
        store.save(TestAlerts.upperThreshold("b", 10).build());
        store.save(TestAlerts.upperThreshold("a", 10).build());
        store.save(TestAlerts.upperThreshold("c", 10).build());

        assertThat(store.findAll()).extracting(AlertConfiguration::getId).containsExactly("a", "b", "c");
    }

    @Test
    @DisplayName("Recent checks are newest first and limited")
    void recentChecks() {
        for (int i = 0; i < 5; i++) {
            store.appendCheck(check("a1", i));
        }
        store.appendCheck(check("other", 0));

        assertThat(store.recentChecks("a1", 3))
                .extracting(AlertCheck::getCalculatedValue)
                .containsExactly(4.0, 3.0, 2.0);
        assertThat(store.recentChecks("a1", 0)).isEmpty();
        assertThat(store.recentChecks("unknown", 3)).isEmpty();
        assertThatThrownBy(() -> store.recentChecks("a1", -1)).isInstanceOf(IllegalArgumentException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static AlertCheck check(String alertId, int n) {
        return AlertCheck.builder()
                .alertId(alertId)
                .createdAt(Instant.parse("2024-05-06T09:00:00Z").plusSeconds(n * 3600L))
                .state(AlertState.NOT_FIRING)
                .calculatedValue((double) n)
                .build();
    }
}
