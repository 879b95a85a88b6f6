package com.userhealth.config;

import java.util.HashMap;
import java.util.Map;

/**
 * Container for configuration maps with type safe accessors.
 *
 * <p>Numbers parsed from JSON arrive as {@link Double} so numeric getters accept any {@link Number}
 * and numeric strings.
 */
@SuppressWarnings("unchecked")
public class BasicConfig {

    /**
     * Configuration map.
     */
    protected Map<String, Object> map = new HashMap<>();

    /**
     * Constructs a new empty BasicConfig instance.
     */
    public BasicConfig() {
    }

    /**
     * Constructs a new BasicConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public BasicConfig(Map<String, Object> map) {
        if (map != null) {
            this.map = map;
        }
    }

    /**
     * Gets the underlying map.
     *
     * @return Map.
     */
    public Map<String, Object> getMap() {
        return map;
    }

    /**
     * Checks if property exists.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean hasProperty(String name) {
        return map.containsKey(name) && map.get(name) != null;
    }

    /**
     * Gets string property.
     *
     * @param name Property name.
     * @return String or null.
     */
    public String getStringProperty(String name) {
        return getStringProperty(name, null);
    }

    /**
     * Gets string property with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return String.
     */
    public String getStringProperty(String name, String defaultValue) {
        Object value = map.get(name);
        return value != null ? String.valueOf(value) : defaultValue;
    }

    /**
     * Gets long property with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Long.
     */
    public Long getLongProperty(String name, Long defaultValue) {
        Object value = map.get(name);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String string && !string.isBlank()) {
            try {
                return Long.parseLong(string.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * Gets boolean property.
     *
     * @param name Property name.
     * @return Boolean, false if not set.
     */
    public boolean getBooleanProperty(String name) {
        return getBooleanProperty(name, false);
    }

    /**
     * Gets boolean property with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String name, boolean defaultValue) {
        Object value = map.get(name);
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String string) {
            return Boolean.parseBoolean(string.trim());
        }
        return defaultValue;
    }

    /**
     * Gets map property.
     *
     * @param name Property name.
     * @return Map, empty if not set or not a map.
     */
    public Map<String, Object> getMapProperty(String name) {
        Object value = map.get(name);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return new HashMap<>();
    }
}
