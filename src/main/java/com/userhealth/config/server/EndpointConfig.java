package com.userhealth.config.server;

import com.userhealth.config.BasicConfig;

import java.util.Map;

/**
 * Embedded HTTP endpoint configuration.
 *
 * <p>This class provides type safe access to the listener settings of the API and service endpoints.
 */
public class EndpointConfig extends BasicConfig {

    /**
     * Constructs a new EndpointConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public EndpointConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Checks if the endpoint should be started.
     *
     * @return True unless explicitly disabled.
     */
    public boolean isEnabled() {
        return getBooleanProperty("enabled", true);
    }

    /**
     * Gets the bind address.
     *
     * @param defaultBind Default bind address.
     * @return Bind address.
     */
    public String getBind(String defaultBind) {
        return getStringProperty("bind", defaultBind);
    }

    /**
     * Gets the port number for this endpoint.
     * <p>Port 0 binds an ephemeral port.
     *
     * @param defaultPort Default port to use if not configured.
     * @return Port number.
     */
    public int getPort(int defaultPort) {
        return Math.toIntExact(getLongProperty("port", (long) defaultPort));
    }

    /**
     * Gets the socket backlog.
     *
     * @return Backlog, defaults to 10.
     */
    public int getBacklog() {
        return Math.toIntExact(getLongProperty("backlog", 10L));
    }

    /**
     * Gets the request worker thread count.
     *
     * @return Thread count, at least 1.
     */
    public int getThreads() {
        return Math.max(1, Math.toIntExact(getLongProperty("threads", 10L)));
    }

    /**
     * Gets the grace delay given to in-flight exchanges on stop.
     *
     * @return Delay in seconds.
     */
    public int getStopDelaySeconds() {
        return Math.max(0, Math.toIntExact(getLongProperty("stopDelaySeconds", 1L)));
    }
}
