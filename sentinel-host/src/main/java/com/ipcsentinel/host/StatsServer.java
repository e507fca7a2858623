package com.ipcsentinel.host;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Lightweight HTTP server exposing liveness and guard statistics.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} – {@code 200 OK} with body {@code {"status":"UP"}}</li>
 * <li>{@code GET /stats} – {@code 200 OK} with the JSON of the snapshot
 * returned by the stats supplier</li>
 * </ul>
 *
 * <p>
 * Other methods get {@code 405}. Built on the JDK {@link HttpServer}.
 * </p>
 *
 * @since 1.0.0
 */
public class StatsServer {

    private static final Logger LOG = LoggerFactory.getLogger(StatsServer.class);
    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);

    private final Supplier<?> statsSupplier;
    private final ObjectMapper mapper;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private HttpServer server;
    private ExecutorService executor;

    /**
     * @param statsSupplier produces the object serialized for {@code /stats}
     */
    public StatsServer(Supplier<?> statsSupplier) {
        this.statsSupplier = Objects.requireNonNull(statsSupplier, "statsSupplier must not be null");
        this.mapper = HostJson.newMapper();
    }

    /**
     * Start the server.
     *
     * @param port TCP port in [0, 65535]; 0 binds a free port
     * @throws IllegalArgumentException if the port is out of range
     * @throws IllegalStateException    if the server is already running
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Stats port must be in range [0, 65535], got: " + port);
        }
        if (running.get()) {
            throw new IllegalStateException("Stats server already running on port " + getPort());
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", this::handleHealth);
            server.createContext("/stats", this::handleStats);

            executor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "stats-server");
                t.setDaemon(true);
                return t;
            });
            server.setExecutor(executor);

            server.start();
            running.set(true);
            LOG.info("Stats server started on port {}", getPort());
        } catch (IOException e) {
            LOG.error("Failed to start stats server on port {}: {}", port, e.getMessage(), e);
        }
    }

    /**
     * Stop the server. Does nothing if it is not running.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdownNow();
            LOG.info("Stats server stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port, or -1 when not running
     */
    public int getPort() {
        return running.get() ? server.getAddress().getPort() : -1;
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (rejectNonGet(exchange)) {
            return;
        }
        respond(exchange, 200, HEALTH_RESPONSE);
    }

    private void handleStats(HttpExchange exchange) throws IOException {
        if (rejectNonGet(exchange)) {
            return;
        }
        byte[] body;
        try {
            body = mapper.writeValueAsBytes(statsSupplier.get());
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize stats: {}", e.getMessage(), e);
            respond(exchange, 500, "{\"error\":\"stats unavailable\"}".getBytes(StandardCharsets.UTF_8));
            return;
        }
        respond(exchange, 200, body);
    }

    private static boolean rejectNonGet(HttpExchange exchange) throws IOException {
        if ("GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            return false;
        }
        exchange.getResponseHeaders().set("Allow", "GET");
        exchange.sendResponseHeaders(405, -1);
        exchange.close();
        return true;
    }

    private static void respond(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
