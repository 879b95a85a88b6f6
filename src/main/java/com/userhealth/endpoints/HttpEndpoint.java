package com.userhealth.endpoints;

import com.userhealth.config.server.EndpointConfig;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Abstract base class for the embedded HTTP endpoints.
 *
 * <p>Provides common functionality including:
 * <ul>
 *   <li>HTTP server binding with configurable address, port, backlog and worker pool</li>
 *   <li>Clean stop of the server and its worker pool</li>
 *   <li>Response generation utilities for JSON and plain text</li>
 * </ul>
 */
public abstract class HttpEndpoint {
    private static final Logger log = LogManager.getLogger(HttpEndpoint.class);

    /**
     * Embedded HTTP server instance.
     */
    protected HttpServer server;

    /**
     * Request worker pool.
     */
    protected ExecutorService executor;

    /**
     * Grace delay for in-flight exchanges on stop.
     */
    private int stopDelaySeconds = 1;

    /**
     * Starts the HTTP endpoint with the given configuration.
     *
     * @param config EndpointConfig containing bind, port and pool settings.
     * @throws IOException If an I/O error occurs during server startup.
     */
    public abstract void start(EndpointConfig config) throws IOException;

    /**
     * Creates the HTTP server without starting it.
     *
     * @param config      EndpointConfig.
     * @param defaultPort Port used when none is configured.
     * @return Bound HttpServer.
     * @throws IOException If the address cannot be bound.
     */
    protected HttpServer bind(EndpointConfig config, int defaultPort) throws IOException {
        String bind = config.getBind("0.0.0.0");
        int port = config.getPort(defaultPort);
        server = HttpServer.create(new InetSocketAddress(bind, port), config.getBacklog());
        executor = Executors.newFixedThreadPool(config.getThreads());
        server.setExecutor(executor);
        stopDelaySeconds = config.getStopDelaySeconds();
        log.debug("Bound {} to {}:{} with {} threads", getClass().getSimpleName(), bind, getPort(), config.getThreads());
        return server;
    }

    /**
     * Stops the server and its worker pool.
     * <p>Safe to call more than once.
     */
    public void stop() {
        if (server != null) {
            server.stop(stopDelaySeconds);
            log.info("{} stopped", getClass().getSimpleName());
            server = null;
        }
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            executor = null;
        }
    }

    /**
     * Gets the bound port.
     *
     * @return Port number or -1 if not started.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : -1;
    }

    /**
     * Sends a JSON response with the specified HTTP status code.
     *
     * @param exchange HTTP exchange.
     * @param code     HTTP status code.
     * @param json     JSON payload.
     * @throws IOException If an I/O error occurs.
     */
    void sendJson(HttpExchange exchange, int code, String json) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(code, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
        log.debug("Sent JSON response: status={}, bytes={}", code, bytes.length);
    }

    /**
     * Serializes an object with the shared Gson and sends it as JSON.
     *
     * @param exchange HTTP exchange.
     * @param code     HTTP status code.
     * @param payload  Object to serialize.
     * @throws IOException If an I/O error occurs.
     */
    void sendJson(HttpExchange exchange, int code, Object payload) throws IOException {
        sendJson(exchange, code, ApiEndpointUtils.getGson().toJson(payload));
    }

    /**
     * Sends a JSON error body of the form {@code {"error": kind, "message": message}}.
     *
     * @param exchange HTTP exchange.
     * @param code     HTTP status code.
     * @param kind     Error kind.
     * @param message  Human readable message.
     * @throws IOException If an I/O error occurs.
     */
    void sendError(HttpExchange exchange, int code, String kind, String message) throws IOException {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error", kind);
        error.put("message", message);
        sendJson(exchange, code, error);
    }

    /**
     * Sends a response with the specified HTTP status code, content type, and payload.
     *
     * @param exchange    HTTP exchange.
     * @param code        HTTP status code.
     * @param contentType Content-Type header value.
     * @param response    Response payload.
     * @throws IOException If an I/O error occurs.
     */
    protected void sendResponse(HttpExchange exchange, int code, String contentType, String response) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        byte[] bytes = response.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(code, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
        log.trace("Sent response: status={}, contentType={}, bytes={}", code, contentType, bytes.length);
    }
}
