package com.userhealth.main;

import com.userhealth.config.server.ServerConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/**
 * Master configuration container.
 *
 * <p>ServerConfig holds the listener settings for the API and service endpoints.
 *
 * @see ServerConfig
 */
public class Config {
    private static final Logger log = LogManager.getLogger(Config.class);

    /**
     * Private constructor.
     */
    private Config() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Server configuration.
     */
    private static ServerConfig server = new ServerConfig();

    /**
     * Gets server config.
     *
     * @return ServerConfig.
     */
    public static ServerConfig getServer() {
        return server;
    }

    /**
     * Init server config.
     *
     * @param path File path.
     * @throws IOException Unable to read file.
     */
    public static void initServer(String path) throws IOException {
        server = new ServerConfig(path);
        log.debug("Loaded server config: {}", path);
    }

    /**
     * Sets server config.
     *
     * @param config ServerConfig instance.
     */
    public static void setServer(ServerConfig config) {
        server = config;
    }
}
