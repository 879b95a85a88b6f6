package com.userhealth.endpoints;

import com.userhealth.config.server.EndpointConfig;
import com.userhealth.config.server.ServerConfig;
import com.userhealth.user.service.UserService;
import com.sun.net.httpserver.HttpServer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * API endpoint for health checks and user management.
 *
 * <p>Starts a lightweight HTTP server exposing:
 * <ul>
 *   <li><b>GET /</b>: JSON discovery document with service name, version and routes.</li>
 *   <li><b>GET /health</b>: Liveness endpoint returning HTTP 200 with <code>{"status":"ok"}</code>.</li>
 *   <li><b>/users</b>: User CRUD, see {@link UsersHandler}.</li>
 * </ul>
 */
public class ApiEndpoint extends HttpEndpoint {
    private static final Logger log = LogManager.getLogger(ApiEndpoint.class);

    private final UserService userService;
    private final String serviceName;
    private final String version;

    /**
     * Constructs a new ApiEndpoint.
     *
     * @param userService User service shared by all requests.
     * @param serviceName Service name for the discovery document.
     * @param version     Service version for the discovery document.
     */
    public ApiEndpoint(UserService userService, String serviceName, String version) {
        this.userService = Objects.requireNonNull(userService, "userService");
        this.serviceName = serviceName;
        this.version = version;
    }

    /**
     * Starts the API endpoint with endpoint configuration.
     *
     * @param config EndpointConfig containing bind, port and pool settings.
     * @throws IOException If an I/O error occurs during server startup.
     */
    @Override
    public void start(EndpointConfig config) throws IOException {
        HttpServer httpServer = bind(config, ServerConfig.DEFAULT_API_PORT);

        List<ApiHandler> handlers = List.of(
                new LandingHandler(this, serviceName, version),
                new HealthHandler(this),
                new UsersHandler(this, userService)
        );
        for (ApiHandler handler : handlers) {
            httpServer.createContext(handler.getPath(), handler::handle);
        }

        httpServer.start();
        int port = getPort();
        log.info("Landing available at http://localhost:{}/", port);
        log.info("Health available at http://localhost:{}/health", port);
        log.info("Users available at http://localhost:{}/users", port);
    }
}
