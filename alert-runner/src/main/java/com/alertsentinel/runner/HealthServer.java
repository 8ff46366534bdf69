package com.alertsentinel.runner;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Lightweight HTTP server for probes and metrics scraping.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}: {@code 200 OK} with body {@code {"status":"UP"}}
 * while the process is running</li>
 * <li>{@code GET /readiness}: {@code 200} once the scheduler is started,
 * {@code 503} before</li>
 * <li>{@code GET /metrics}: the Prometheus text exposition format</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer}.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);
    private static final byte[] UP_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);
    private static final byte[] NOT_READY_RESPONSE = "{\"status\":\"STARTING\"}".getBytes(StandardCharsets.UTF_8);

    private final CollectorRegistry registry;
    private final BooleanSupplier readiness;

    private HttpServer server;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public HealthServer(CollectorRegistry registry, BooleanSupplier readiness) {
        this.registry = Objects.requireNonNull(registry, "CollectorRegistry must not be null");
        this.readiness = Objects.requireNonNull(readiness, "readiness must not be null");
    }

    /**
     * Start the server on the given port.
     *
     * @param port TCP port to bind to; {@code 0} picks a free port
     * @throws IllegalArgumentException if port is out of range
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", exchange -> respond(exchange, 200, "application/json", UP_RESPONSE));
            server.createContext("/readiness", this::handleReadiness);
            server.createContext("/metrics", this::handleMetrics);

            server.setExecutor(Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "health-server");
                t.setDaemon(true);
                return t;
            }));

            server.start();
            running.set(true);
            LOG.info("Health server started on port {}", getPort());
        } catch (IOException e) {
            LOG.error("Failed to start health server on port {}: {}", port, e.getMessage(), e);
        }
    }

    /**
     * Stop the server.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            LOG.info("Health server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port, or {@code -1} if not running
     */
    public int getPort() {
        return server != null && running.get() ? server.getAddress().getPort() : -1;
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private void handleReadiness(HttpExchange exchange) throws IOException {
        if (readiness.getAsBoolean()) {
            respond(exchange, 200, "application/json", UP_RESPONSE);
        } else {
            respond(exchange, 503, "application/json", NOT_READY_RESPONSE);
        }
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        Writer writer = new StringWriter();
        TextFormat.write004(writer, registry.metricFamilySamples());
        respond(exchange, 200, TextFormat.CONTENT_TYPE_004, writer.toString().getBytes(StandardCharsets.UTF_8));
    }

    private static void respond(HttpExchange exchange, int status, String contentType, byte[] body)
            throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
