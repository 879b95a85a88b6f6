package com.userhealth.endpoints;

import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Handler for the root path.
 *
 * <p>Serves a JSON discovery document naming the service, its version and the available routes.
 * <br>Being mounted at "/", it also answers 404 for any path no other handler claims.
 */
public class LandingHandler implements ApiHandler {
    private static final String PATH = "/";

    private final HttpEndpoint endpoint;
    private final Map<String, Object> document = new LinkedHashMap<>();

    /**
     * Constructs a new LandingHandler.
     *
     * @param endpoint    The parent HTTP endpoint for response utilities.
     * @param serviceName Service name.
     * @param version     Service version.
     */
    public LandingHandler(HttpEndpoint endpoint, String serviceName, String version) {
        this.endpoint = endpoint;

        Map<String, String> docs = new LinkedHashMap<>();
        docs.put("health", "/health");
        docs.put("users", "/users");

        document.put("service", serviceName);
        document.put("version", version);
        document.put("docs", docs);
    }

    @Override
    public String getPath() {
        return PATH;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        if (!PATH.equals(exchange.getRequestURI().getPath())) {
            endpoint.sendError(exchange, 404, "NotFound", "Not Found");
            return;
        }
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            endpoint.sendError(exchange, 405, "MethodNotAllowed", "Method Not Allowed");
            return;
        }

        endpoint.sendJson(exchange, 200, document);
    }
}
