package com.userhealth.endpoints;

import com.google.gson.Gson;
import com.userhealth.config.server.EndpointConfig;
import com.userhealth.metrics.MetricsRegistry;
import com.userhealth.metrics.UserMetrics;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.parallel.Execution;
import org.junit.jupiter.api.parallel.ExecutionMode;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the monitoring service endpoint.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@Execution(ExecutionMode.SAME_THREAD)
class ServiceEndpointTest {

    private ServiceEndpoint serviceEndpoint;
    private PrometheusMeterRegistry registry;
    private String baseUrl;
    private HttpClient httpClient;

    @BeforeAll
    void setUp() throws Exception {
        registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        serviceEndpoint = new ServiceEndpoint(registry);
        UserMetrics.resetCounters();
        UserMetrics.initialize();

        Map<String, Object> configMap = new HashMap<>();
        configMap.put("bind", "127.0.0.1");
        configMap.put("port", 0);
        configMap.put("stopDelaySeconds", 0);
        serviceEndpoint.start(new EndpointConfig(configMap));

        baseUrl = "http://127.0.0.1:" + serviceEndpoint.getPort();
        httpClient = HttpClient.newHttpClient();
    }

    @AfterAll
    void tearDown() {
        serviceEndpoint.stop();
        UserMetrics.resetCounters();
        MetricsRegistry.register(null);
    }

    @Test
    void testRegistryPublished() {
        assertSame(registry, MetricsRegistry.getPrometheusRegistry());
        assertSame(registry, serviceEndpoint.getPrometheusRegistry());
    }

    @Test
    void testHealth() throws Exception {
        HttpResponse<String> response = get("/health");
        assertEquals(200, response.statusCode());

        @SuppressWarnings("unchecked")
        Map<String, Object> map = new Gson().fromJson(response.body(), Map.class);
        assertEquals("UP", map.get("status"));
        assertTrue(String.valueOf(map.get("uptime")).matches("\\d+d \\d+h \\d+m \\d+s"));
    }

    @Test
    void testPrometheus() throws Exception {
        UserMetrics.incrementCreated();

        HttpResponse<String> response = get("/metrics/prometheus");
        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("text/plain"));
        assertTrue(response.body().contains("userhealth_users_created_total"));
        assertTrue(response.body().contains("userhealth_users_deleted_total"));
        assertTrue(response.body().contains("jvm_memory_used_bytes"));
    }

    @Test
    void testLanding() throws Exception {
        HttpResponse<String> response = get("/");
        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("/metrics/prometheus"));

        assertEquals(404, get("/missing").statusCode());
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .GET()
                .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
