package com.userhealth.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration file loader.
 *
 * <p>Reads JSON5 files into a map using a lenient Gson parser.
 * <br>Comments, unquoted keys and single quoted strings are accepted.
 */
@SuppressWarnings("unchecked")
public class ConfigFoundation extends BasicConfig {
    private static final Logger log = LogManager.getLogger(ConfigFoundation.class);

    /**
     * Constructs a new empty ConfigFoundation instance.
     */
    public ConfigFoundation() {
        super();
    }

    /**
     * Constructs a new ConfigFoundation instance with given map.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new ConfigFoundation instance and loads given file.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read or parse file.
     */
    public ConfigFoundation(String path) throws IOException {
        super(load(Paths.get(path)));
    }

    /**
     * Reads and parses a JSON5 file.
     *
     * @param path File path.
     * @return Map, empty for a blank file.
     * @throws IOException Unable to read or parse file.
     */
    static Map<String, Object> load(Path path) throws IOException {
        String content = Files.readString(path, StandardCharsets.UTF_8);
        try {
            Map<String, Object> parsed = new Gson().fromJson(content, Map.class);
            log.debug("Loaded config file: {} ({} keys)", path, parsed != null ? parsed.size() : 0);
            return parsed != null ? parsed : new HashMap<>();
        } catch (JsonParseException e) {
            throw new IOException("Invalid config file " + path + ": " + e.getMessage(), e);
        }
    }
}
