package com.userhealth.endpoints;

import com.userhealth.config.server.EndpointConfig;
import com.userhealth.config.server.ServerConfig;
import com.userhealth.metrics.MetricsRegistry;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Monitoring service endpoint.
 *
 * <p>This class sets up a second embedded HTTP server exposing application metrics in Prometheus format
 * and a liveness probe reporting uptime. It owns the Prometheus registry and publishes it through
 * {@link MetricsRegistry} so other components can register meters.
 */
public class ServiceEndpoint extends HttpEndpoint {
    private static final Logger log = LogManager.getLogger(ServiceEndpoint.class);

    protected final long startTime = System.currentTimeMillis();
    private final PrometheusMeterRegistry prometheusRegistry;
    private JvmGcMetrics jvmGcMetrics;

    /**
     * Constructs a new ServiceEndpoint with its own registry and publishes it.
     */
    public ServiceEndpoint() {
        this(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT));
    }

    /**
     * Constructs a new ServiceEndpoint with the given registry and publishes it.
     *
     * @param prometheusRegistry Registry to expose.
     */
    public ServiceEndpoint(PrometheusMeterRegistry prometheusRegistry) {
        this.prometheusRegistry = prometheusRegistry;
        MetricsRegistry.register(prometheusRegistry);
    }

    /**
     * Starts the embedded HTTP server for the service endpoint.
     * <p>Binds JVM metrics and creates HTTP contexts for all endpoints.
     *
     * @param config EndpointConfig containing bind and port settings.
     * @throws IOException If an I/O error occurs during server startup.
     */
    @Override
    public void start(EndpointConfig config) throws IOException {
        bindJvmMetrics();

        HttpServer httpServer = bind(config, ServerConfig.DEFAULT_SERVICE_PORT);
        createContexts(httpServer);
        httpServer.start();
    }

    @Override
    public void stop() {
        super.stop();
        if (jvmGcMetrics != null) {
            jvmGcMetrics.close();
            jvmGcMetrics = null;
        }
    }

    /**
     * Gets the exposed registry.
     *
     * @return PrometheusMeterRegistry.
     */
    public PrometheusMeterRegistry getPrometheusRegistry() {
        return prometheusRegistry;
    }

    /**
     * Binds standard JVM metrics to the Prometheus registry.
     * <p>This includes memory usage, garbage collection, thread metrics, and processor metrics.
     */
    private void bindJvmMetrics() {
        new JvmMemoryMetrics().bindTo(prometheusRegistry);
        jvmGcMetrics = new JvmGcMetrics();
        jvmGcMetrics.bindTo(prometheusRegistry);
        new JvmThreadMetrics().bindTo(prometheusRegistry);
        new ProcessorMetrics().bindTo(prometheusRegistry);
    }

    /**
     * Creates and registers HTTP context handlers for all supported endpoints.
     *
     * @param httpServer Bound server.
     */
    private void createContexts(HttpServer httpServer) {
        int port = getPort();

        httpServer.createContext("/", this::handleLandingPage);
        log.info("Service landing available at http://localhost:{}/", port);

        httpServer.createContext("/metrics/prometheus", this::handlePrometheus);
        log.info("Prometheus data available at http://localhost:{}/metrics/prometheus", port);

        httpServer.createContext("/health", this::handleHealth);
        log.info("Service health available at http://localhost:{}/health", port);
    }

    /**
     * Handles requests for the landing page, which lists all available endpoints.
     *
     * @param exchange The HTTP exchange object.
     * @throws IOException If an I/O error occurs.
     */
    protected void handleLandingPage(HttpExchange exchange) throws IOException {
        if (!"/".equals(exchange.getRequestURI().getPath())) {
            sendError(exchange, 404, "NotFound", "Not Found");
            return;
        }

        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("health", "/health");
        endpoints.put("prometheus", "/metrics/prometheus");
        sendJson(exchange, 200, Map.of("endpoints", endpoints));
    }

    /**
     * Handles requests for Prometheus metrics.
     *
     * @param exchange The HTTP exchange object.
     * @throws IOException If an I/O error occurs.
     */
    protected void handlePrometheus(HttpExchange exchange) throws IOException {
        log.debug("Handling /metrics/prometheus: method={}, uri={}, remote={}",
                exchange.getRequestMethod(), exchange.getRequestURI(), exchange.getRemoteAddress());
        sendResponse(exchange, 200, "text/plain; version=0.0.4; charset=utf-8", prometheusRegistry.scrape());
    }

    /**
     * Handles requests for the application's health status.
     * <p>Provides a JSON response with the status and uptime.
     *
     * @param exchange The HTTP exchange object.
     * @throws IOException If an I/O error occurs.
     */
    protected void handleHealth(HttpExchange exchange) throws IOException {
        log.debug("Handling /health: method={}, uri={}, remote={}",
                exchange.getRequestMethod(), exchange.getRequestURI(), exchange.getRemoteAddress());
        Duration uptime = Duration.ofMillis(System.currentTimeMillis() - startTime);
        String uptimeString = String.format("%dd %dh %dm %ds",
                uptime.toDays(),
                uptime.toHoursPart(),
                uptime.toMinutesPart(),
                uptime.toSecondsPart());

        sendJson(exchange, 200, String.format("{\"status\":\"UP\", \"uptime\":\"%s\"}", uptimeString));
    }
}
