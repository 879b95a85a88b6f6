package com.userhealth.config.server;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ServerConfigTest {

    private ServerConfig config;

    @BeforeEach
    void before() throws IOException {
        System.clearProperty("port");
        config = new ServerConfig("src/test/resources/cfg/server.json5").setEnv(name -> null);
    }

    @AfterEach
    void after() {
        System.clearProperty("port");
    }

    @Test
    void getBind() {
        assertEquals("127.0.0.1", config.getBind());
    }

    @Test
    void getVersion() {
        assertEquals("test", config.getVersion());
    }

    @Test
    void getVersionFromEnvironment() {
        config.setEnv(name -> "APP_VERSION".equals(name) ? "1.4.0" : null);

        assertEquals("1.4.0", config.getVersion());
    }

    @Test
    void getVersionDefault() {
        assertEquals("dev", new ServerConfig().setEnv(name -> null).getVersion());
    }

    @Test
    void getServiceName() {
        assertEquals("user-health-api", config.getServiceName());
    }

    @Test
    void getApi() {
        EndpointConfig api = config.getApi();

        assertEquals(0, api.getPort(ServerConfig.DEFAULT_API_PORT));
        assertEquals("127.0.0.1", api.getBind("0.0.0.0"));
        assertEquals(5, api.getBacklog());
        assertEquals(4, api.getThreads());
        assertEquals(0, api.getStopDelaySeconds());
        assertTrue(api.isEnabled());
    }

    @Test
    void getApiDefaults() {
        EndpointConfig api = new ServerConfig().setEnv(name -> null).getApi();

        assertEquals(5000, api.getPort(ServerConfig.DEFAULT_API_PORT));
        assertEquals("0.0.0.0", api.getBind("::"));
        assertEquals(10, api.getBacklog());
        assertEquals(10, api.getThreads());
        assertEquals(1, api.getStopDelaySeconds());
    }

    @Test
    void getApiPortFromEnvironment() {
        config.setEnv(name -> "PORT".equals(name) ? "5050" : null);

        assertEquals(5050, config.getApi().getPort(ServerConfig.DEFAULT_API_PORT));
    }

    @Test
    void getApiPortSystemPropertyWins() {
        config.setEnv(name -> "PORT".equals(name) ? "5050" : null);
        System.setProperty("port", "5060");

        assertEquals(5060, config.getApi().getPort(ServerConfig.DEFAULT_API_PORT));
    }

    @Test
    void getApiPortInvalidOverride() {
        config.setEnv(name -> "PORT".equals(name) ? "http" : null);

        assertThrows(IllegalArgumentException.class, () -> config.getApi());
    }

    @Test
    void getService() {
        EndpointConfig service = config.getService();

        assertTrue(service.isEnabled());
        assertEquals(0, service.getPort(ServerConfig.DEFAULT_SERVICE_PORT));
        assertEquals("127.0.0.1", service.getBind("0.0.0.0"));
    }

    @Test
    void getServiceDefaults() {
        EndpointConfig service = new ServerConfig().getService();

        assertTrue(service.isEnabled());
        assertEquals(5080, service.getPort(0));
    }

    @Test
    void getServiceDisabled() {
        Map<String, Object> map = new HashMap<>();
        map.put("service", new HashMap<>(Map.of("enabled", false)));

        assertFalse(new ServerConfig(map).getService().isEnabled());
    }

    @Test
    void getLog4j2() {
        assertNull(config.getLog4j2());
    }
}
