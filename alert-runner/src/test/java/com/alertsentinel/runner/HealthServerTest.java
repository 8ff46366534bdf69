package com.alertsentinel.runner;

import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link HealthServer} against a real socket.
 */
class HealthServerTest {

    private final HttpClient client = HttpClient.newHttpClient();
    private final AtomicBoolean ready = new AtomicBoolean(false);
    private HealthServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    @Test
    @DisplayName("Health is UP; readiness follows the supplier")
    void healthAndReadiness() throws Exception {
        server = start(new CollectorRegistry());

        HttpResponse<String> health = get("/health");
        assertThat(health.statusCode()).isEqualTo(200);
        assertThat(health.body()).isEqualTo("{\"status\":\"UP\"}");

        assertThat(get("/readiness").statusCode()).isEqualTo(503);
        ready.set(true);
        assertThat(get("/readiness").statusCode()).isEqualTo(200);
    }

    @Test
    @DisplayName("Metrics are exposed in the Prometheus text format")
    void metrics() throws Exception {
        CollectorRegistry registry = new CollectorRegistry();
        new SentinelMetrics(registry).onTriggerDropped("a1");
        server = start(registry);

        HttpResponse<String> response = get("/metrics");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).contains("alert_triggers_dropped_total 1.0");
    }

    @Test
    @DisplayName("Out-of-range ports are rejected; stop is idempotent")
    void lifecycle() {
        HealthServer unstarted = new HealthServer(new CollectorRegistry(), ready::get);

        assertThatThrownBy(() -> unstarted.start(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThat(unstarted.isRunning()).isFalse();
        assertThat(unstarted.getPort()).isEqualTo(-1);
        unstarted.stop();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private HealthServer start(CollectorRegistry registry) {
        HealthServer started = new HealthServer(registry, ready::get);
        started.start(0);
        assertThat(started.isRunning()).isTrue();
        return started;
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(
                URI.create("http://localhost:" + server.getPort() + path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
