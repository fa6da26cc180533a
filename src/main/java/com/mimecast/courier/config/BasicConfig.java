package com.mimecast.courier.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Map backed configuration container.
 *
 * <p>This provides type safe accessors over a generic map of values as produced by Gson.
 * <p>Dotted keys may be used to address nested maps.
 * <br><b>Example:</b>
 * <pre>getStringProperty("certificate.path")</pre>
 */
@SuppressWarnings("unchecked")
public class BasicConfig {

    /**
     * Configuration map.
     */
    protected Map<String, Object> map = new HashMap<>();

    /**
     * Constructs a new BasicConfig instance.
     */
    public BasicConfig() {
        // Empty map.
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
     * Gets configuration map.
     *
     * @return Map of String, Object.
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
        return getProperty(name) != null;
    }

    /**
     * Gets property by name following dotted paths.
     *
     * @param name Property name.
     * @return Object or null.
     */
    protected Object getProperty(String name) {
        if (map.containsKey(name)) {
            return map.get(name);
        }

        Object value = map;
        for (String key : name.split("\\.")) {
            if (!(value instanceof Map)) {
                return null;
            }
            value = ((Map<String, Object>) value).get(key);
        }

        return value;
    }

    /**
     * Gets String property.
     *
     * @param name Property name.
     * @return String.
     */
    public String getStringProperty(String name) {
        return getStringProperty(name, null);
    }

    /**
     * Gets String property with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return String.
     */
    public String getStringProperty(String name, String defaultValue) {
        Object value = getProperty(name);
        return value != null ? String.valueOf(value) : defaultValue;
    }

    /**
     * Gets Long property.
     *
     * @param name Property name.
     * @return Long.
     */
    public Long getLongProperty(String name) {
        return getLongProperty(name, null);
    }

    /**
     * Gets Long property with default.
     * <p>Gson parses all numbers as Double so any Number is accepted.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Long.
     */
    public Long getLongProperty(String name, Long defaultValue) {
        Object value = getProperty(name);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * Gets Double property with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Double.
     */
    public Double getDoubleProperty(String name, Double defaultValue) {
        Object value = getProperty(name);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }

    /**
     * Gets Boolean property.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String name) {
        return getBooleanProperty(name, false);
    }

    /**
     * Gets Boolean property with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String name, boolean defaultValue) {
        Object value = getProperty(name);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    /**
     * Gets List property.
     *
     * @param name Property name.
     * @return List, empty if missing.
     */
    public List<Object> getListProperty(String name) {
        Object value = getProperty(name);
        return value instanceof List ? (List<Object>) value : new ArrayList<>();
    }

    /**
     * Gets Map property.
     *
     * @param name Property name.
     * @return Map, empty if missing.
     */
    public Map<String, Object> getMapProperty(String name) {
        Object value = getProperty(name);
        return value instanceof Map ? (Map<String, Object>) value : new HashMap<>();
    }
}
