package com.hydrosentinel.service;

import com.hydrosentinel.core.model.MetricsSnapshot;
import com.hydrosentinel.core.pipeline.PipelineState;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * HTTP health, readiness and metrics endpoint for the service. Readiness follows the
 * pipeline lifecycle, so a draining instance is taken out of rotation before
 * it stops.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} – {@code 200 OK} with body {@code {"status":"UP"}}
 * while the process lives</li>
 * <li>{@code GET /readiness} – {@code 200 OK} while the pipeline is
 * {@code RUNNING}, {@code 503} otherwise; Kubernetes readiness check
 * target</li>
 * <li>{@code GET /metrics} – current performance snapshot as JSON</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer} so no external dependencies
 * (Jetty, Netty, etc.) are required.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);
    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);

    private final Supplier<PipelineState> state;
    private final Supplier<MetricsSnapshot> metrics;
    private final JsonCodec codec;

    private HttpServer server;
    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * @param state   current pipeline state
     * @param metrics current metrics snapshot
     * @param codec   JSON encoder for the snapshot
     */
    public HealthServer(Supplier<PipelineState> state, Supplier<MetricsSnapshot> metrics, JsonCodec codec) {
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    /**
     * Start the health server on the given port.
     *
     * @param port TCP port to bind to; must be in range [0, 65535], 0 picks a
     *             free port
     * @throws IllegalArgumentException if port is out of range
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", HealthServer::handleHealthCheck);
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
     * Stop serving immediately. Idempotent.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            LOG.info("Health server stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port, or {@code -1} if not started
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : -1;
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private static void handleHealthCheck(HttpExchange exchange) throws IOException {
        respond(exchange, 200, HEALTH_RESPONSE);
    }

    private void handleReadiness(HttpExchange exchange) throws IOException {
        PipelineState current = state.get();
        boolean ready = current == PipelineState.RUNNING;
        String body = "{\"status\":\"" + (ready ? "READY" : "NOT_READY") + "\",\"pipeline\":\"" + current + "\"}";
        respond(exchange, ready ? 200 : 503, body.getBytes(StandardCharsets.UTF_8));
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        byte[] body;
        try {
            body = codec.metrics(metrics.get());
        } catch (RuntimeException e) {
            LOG.error("Failed to render metrics snapshot", e);
            respond(exchange, 500, "{\"error\":\"metrics unavailable\"}".getBytes(StandardCharsets.UTF_8));
            return;
        }
        respond(exchange, 200, body);
    }

    private static void respond(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
