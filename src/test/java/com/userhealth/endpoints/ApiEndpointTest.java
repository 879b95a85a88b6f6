package com.userhealth.endpoints;

import com.google.gson.Gson;
import com.userhealth.config.server.EndpointConfig;
import com.userhealth.user.repository.InMemoryUserRepository;
import com.userhealth.user.service.UserService;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.parallel.Execution;
import org.junit.jupiter.api.parallel.ExecutionMode;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the discovery and health routes.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@Execution(ExecutionMode.SAME_THREAD)
class ApiEndpointTest {

    private ApiEndpoint apiEndpoint;
    private String baseUrl;
    private HttpClient httpClient;
    private Gson gson;

    @BeforeAll
    void setUp() throws IOException {
        apiEndpoint = new ApiEndpoint(new UserService(new InMemoryUserRepository()), "user-health-api", "1.2.3");

        Map<String, Object> configMap = new HashMap<>();
        configMap.put("bind", "127.0.0.1");
        configMap.put("port", 0);
        configMap.put("stopDelaySeconds", 0);
        apiEndpoint.start(new EndpointConfig(configMap));

        baseUrl = "http://127.0.0.1:" + apiEndpoint.getPort();
        httpClient = HttpClient.newHttpClient();
        gson = new Gson();
    }

    @AfterAll
    void tearDown() {
        apiEndpoint.stop();
        assertEquals(-1, apiEndpoint.getPort());
    }

    @Test
    void testHealth() throws Exception {
        HttpResponse<String> response = send("GET", "/health");

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").contains("application/json"));
        assertEquals("{\"status\":\"ok\"}", response.body());
    }

    @Test
    void testHealthIndependentOfStore() throws Exception {
        HttpRequest create = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/users"))
                .POST(HttpRequest.BodyPublishers.ofString("{\"name\":\"Ann\",\"email\":\"ann@x.com\"}"))
                .build();
        assertEquals(201, httpClient.send(create, HttpResponse.BodyHandlers.ofString()).statusCode());

        assertEquals("{\"status\":\"ok\"}", send("GET", "/health").body());
    }

    @Test
    void testHealthMethodValidation() throws Exception {
        assertEquals(405, send("POST", "/health").statusCode());
        assertEquals(405, send("DELETE", "/health").statusCode());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testLanding() throws Exception {
        HttpResponse<String> response = send("GET", "/");
        assertEquals(200, response.statusCode());

        Map<String, Object> map = gson.fromJson(response.body(), Map.class);
        assertEquals("user-health-api", map.get("service"));
        assertEquals("1.2.3", map.get("version"));

        Map<String, Object> docs = (Map<String, Object>) map.get("docs");
        assertEquals("/health", docs.get("health"));
        assertEquals("/users", docs.get("users"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testUnknownPath() throws Exception {
        HttpResponse<String> response = send("GET", "/nope");
        assertEquals(404, response.statusCode());
        Map<String, Object> map = gson.fromJson(response.body(), Map.class);
        assertEquals("NotFound", map.get("error"));

        assertEquals(404, send("GET", "/healthz").statusCode());
        assertEquals(404, send("GET", "/usersx").statusCode());
    }

    private HttpResponse<String> send(String method, String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .method(method, HttpRequest.BodyPublishers.noBody())
                .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
