package com.userhealth.main;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.LoggerContext;

import javax.naming.ConfigurationException;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configuration bootstrap.
 *
 * <p>Loads {@code server.json5} from the configuration directory and applies the optional Log4j2 override.
 */
public class Foundation {
    private static final Logger log = LogManager.getLogger(Foundation.class);

    /**
     * Server configuration filename.
     */
    public static final String SERVER_CONFIG = "server.json5";

    /**
     * Private constructor.
     */
    private Foundation() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Initializes configuration from directory.
     *
     * @param path Directory path.
     * @throws ConfigurationException Directory or server config missing or unreadable.
     */
    public static void init(String path) throws ConfigurationException {
        if (path == null || !new File(path).isDirectory()) {
            throw new ConfigurationException("Path is not a directory: " + path);
        }

        Path serverConfig = Paths.get(path, SERVER_CONFIG);
        if (!Files.isReadable(serverConfig)) {
            throw new ConfigurationException("Cannot read " + serverConfig);
        }

        try {
            Config.initServer(serverConfig.toString());
        } catch (IOException e) {
            ConfigurationException ex = new ConfigurationException("Unable to load " + serverConfig + ": " + e.getMessage());
            ex.setRootCause(e);
            throw ex;
        }

        configureLogging(Config.getServer().getLog4j2());
    }

    /**
     * Reconfigures Log4j2 from an external XML file when one is configured.
     *
     * @param log4j2 Path to Log4j2 XML or null.
     */
    static void configureLogging(String log4j2) {
        if (log4j2 == null || log4j2.isBlank()) {
            return;
        }

        File file = new File(log4j2);
        if (!file.isFile()) {
            log.warn("Log4j2 config not found, keeping classpath configuration: {}", log4j2);
            return;
        }

        LoggerContext context = (LoggerContext) LogManager.getContext(false);
        context.setConfigLocation(file.toURI());
        log.info("Log4j2 configured from {}", file.getAbsolutePath());
    }
}
