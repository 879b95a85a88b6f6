package com.userhealth.endpoints;

import com.sun.net.httpserver.HttpExchange;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/**
 * Handler for the /health liveness endpoint.
 *
 * <p>Always answers {@code {"status":"ok"}} regardless of store state.
 */
public class HealthHandler implements ApiHandler {
    private static final Logger log = LogManager.getLogger(HealthHandler.class);
    private static final String PATH = "/health";

    private final HttpEndpoint endpoint;

    /**
     * Constructs a new HealthHandler.
     *
     * @param endpoint The parent HTTP endpoint for response utilities.
     */
    public HealthHandler(HttpEndpoint endpoint) {
        this.endpoint = endpoint;
    }

    @Override
    public String getPath() {
        return PATH;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        log.debug("Handling /health: method={}, uri={}, remote={}",
                exchange.getRequestMethod(), exchange.getRequestURI(), exchange.getRemoteAddress());

        if (!PATH.equals(exchange.getRequestURI().getPath())) {
            endpoint.sendError(exchange, 404, "NotFound", "Not Found");
            return;
        }
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            endpoint.sendError(exchange, 405, "MethodNotAllowed", "Method Not Allowed");
            return;
        }

        endpoint.sendJson(exchange, 200, "{\"status\":\"ok\"}");
    }
}
