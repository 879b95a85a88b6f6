package com.userhealth.config.server;

import com.userhealth.config.ConfigFoundation;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Server configuration.
 *
 * <p>This class provides type safe access to {@code server.json5}.
 * <p>The API port and the service version can be overridden from the environment:
 * <ul>
 *   <li>System property {@code port}, then environment variable {@code PORT}, override {@code api.port}.</li>
 *   <li>Environment variable {@code APP_VERSION} overrides {@code version}.</li>
 * </ul>
 *
 * @see EndpointConfig
 */
public class ServerConfig extends ConfigFoundation {

    /**
     * Default API port.
     */
    public static final int DEFAULT_API_PORT = 5000;

    /**
     * Default service (monitoring) port.
     */
    public static final int DEFAULT_SERVICE_PORT = 5080;

    /**
     * Environment lookup, replaceable for tests.
     */
    private UnaryOperator<String> env = System::getenv;

    /**
     * Constructs a new ServerConfig instance.
     */
    public ServerConfig() {
        super();
    }

    /**
     * Constructs a new ServerConfig instance.
     *
     * @param map Configuration map.
     */
    public ServerConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new ServerConfig instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public ServerConfig(String path) throws IOException {
        super(path);
    }

    /**
     * Sets environment lookup.
     *
     * @param env Function mapping variable name to value or null.
     * @return Self.
     */
    public ServerConfig setEnv(UnaryOperator<String> env) {
        this.env = env;
        return this;
    }

    /**
     * Gets bind address.
     *
     * @return String.
     */
    public String getBind() {
        return getStringProperty("bind", "0.0.0.0");
    }

    /**
     * Gets service name as reported by the discovery document.
     *
     * @return String.
     */
    public String getServiceName() {
        return getStringProperty("serviceName", "user-health-api");
    }

    /**
     * Gets service version.
     *
     * @return APP_VERSION environment variable, else configured version, else "dev".
     */
    public String getVersion() {
        String fromEnv = env.apply("APP_VERSION");
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv.trim();
        }
        return getStringProperty("version", "dev");
    }

    /**
     * Gets Log4j2 configuration file path.
     *
     * @return Path or null to keep the classpath configuration.
     */
    public String getLog4j2() {
        return getStringProperty("log4j2");
    }

    /**
     * Gets API endpoint config with the port overrides applied.
     *
     * @return EndpointConfig.
     */
    public EndpointConfig getApi() {
        Map<String, Object> api = new HashMap<>(getMapProperty("api"));
        api.putIfAbsent("bind", getBind());
        if (!api.containsKey("threads") && hasProperty("threads")) {
            api.put("threads", map.get("threads"));
        }
        api.put("port", getApiPort(new EndpointConfig(api).getPort(DEFAULT_API_PORT)));
        return new EndpointConfig(api);
    }

    /**
     * Gets service (monitoring) endpoint config.
     *
     * @return EndpointConfig.
     */
    public EndpointConfig getService() {
        Map<String, Object> service = new HashMap<>(getMapProperty("service"));
        service.putIfAbsent("bind", getBind());
        service.putIfAbsent("port", DEFAULT_SERVICE_PORT);
        return new EndpointConfig(service);
    }

    /**
     * Resolves the API port.
     *
     * @param configured Port from configuration.
     * @return Port number.
     */
    private int getApiPort(int configured) {
        String override = System.getProperty("port");
        if (override == null || override.isBlank()) {
            override = env.apply("PORT");
        }
        if (override != null && !override.isBlank()) {
            try {
                return Integer.parseInt(override.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port override: " + override, e);
            }
        }
        return configured;
    }
}
