package com.userhealth.main;

import com.userhealth.config.server.EndpointConfig;
import com.userhealth.config.server.ServerConfig;
import com.userhealth.endpoints.ApiEndpoint;
import com.userhealth.endpoints.ServiceEndpoint;
import com.userhealth.metrics.UserMetrics;
import com.userhealth.user.repository.InMemoryUserRepository;
import com.userhealth.user.repository.UserRepository;
import com.userhealth.user.service.UserService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.naming.ConfigurationException;
import java.io.IOException;

/**
 * Main server class.
 *
 * <p>This class is responsible for initializing and managing the server's lifecycle.
 * <p>It owns the single user store instance and hands it to the API endpoint through the user service.
 *
 * <p>The server is started by calling the static {@link #run(String)} method with the path
 * to the configuration directory, or {@link #start(ServerConfig)} with a ready configuration.
 *
 * @see Foundation
 */
public class Server {
    private static final Logger log = LogManager.getLogger(Server.class);

    private final UserRepository repository;
    private final ApiEndpoint apiEndpoint;
    private ServiceEndpoint serviceEndpoint;
    private Thread shutdownHook;

    /**
     * Constructs a new Server around the given store.
     *
     * @param config     Server configuration.
     * @param repository User store.
     */
    Server(ServerConfig config, UserRepository repository) {
        this.repository = repository;
        this.apiEndpoint = new ApiEndpoint(new UserService(repository), config.getServiceName(), config.getVersion());
    }

    /**
     * Initializes configuration and starts the server.
     *
     * @param path The directory path containing the configuration files.
     * @return Running server.
     * @throws ConfigurationException If there is an issue with the configuration files.
     * @throws IOException            If an endpoint cannot be bound.
     */
    public static Server run(String path) throws ConfigurationException, IOException {
        Foundation.init(path);
        Server server = start(Config.getServer());
        server.registerShutdownHook();
        return server;
    }

    /**
     * Starts a server with a fresh empty store.
     *
     * @param config Server configuration.
     * @return Running server.
     * @throws IOException If an endpoint cannot be bound.
     */
    public static Server start(ServerConfig config) throws IOException {
        Server server = new Server(config, new InMemoryUserRepository());
        try {
            server.startup(config);
        } catch (IOException e) {
            server.stop();
            throw e;
        }
        return server;
    }

    /**
     * Starts the service endpoint when enabled, then the API endpoint.
     *
     * @param config Server configuration.
     * @throws IOException If an endpoint cannot be bound.
     */
    private void startup(ServerConfig config) throws IOException {
        EndpointConfig service = config.getService();
        if (service.isEnabled()) {
            serviceEndpoint = new ServiceEndpoint();
            serviceEndpoint.start(service);
            UserMetrics.resetCounters();
            UserMetrics.initialize();
            UserMetrics.bindStore(repository);
        } else {
            log.info("Service endpoint disabled");
        }

        apiEndpoint.start(config.getApi());
        log.info("Service {} version {} started", config.getServiceName(), config.getVersion());
    }

    /**
     * Stops all endpoints.
     * <p>Safe to call more than once.
     */
    public void stop() {
        log.info("Service is shutting down.");
        apiEndpoint.stop();
        if (serviceEndpoint != null) {
            serviceEndpoint.stop();
        }
        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                // JVM already shutting down, the hook is running.
                log.debug("Shutdown hook not removed: {}", e.getMessage());
            }
            shutdownHook = null;
        }
        log.info("Shutdown complete.");
    }

    /**
     * Registers a shutdown hook to ensure graceful termination of the server.
     */
    private void registerShutdownHook() {
        shutdownHook = new Thread(() -> {
            shutdownHook = null;
            stop();
        });
        Runtime.getRuntime().addShutdownHook(shutdownHook);
    }

    /**
     * Gets the API endpoint.
     *
     * @return ApiEndpoint.
     */
    public ApiEndpoint getApiEndpoint() {
        return apiEndpoint;
    }

    /**
     * Gets the service endpoint.
     *
     * @return ServiceEndpoint or null when disabled.
     */
    public ServiceEndpoint getServiceEndpoint() {
        return serviceEndpoint;
    }
}
