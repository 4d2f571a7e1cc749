package com.mailexchange.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Map backed configuration container.
 *
 * <p>Provides type safe accessors over a parsed JSON5 object.
 * <p>Keys may be dotted to reach into nested objects, for example {@code auth.user}.
 * <p>Numbers parsed by Gson come in as doubles so numeric accessors normalize them.
 */
@SuppressWarnings("unchecked")
public class BasicConfig {

    /**
     * Configuration map.
     */
    protected Map<String, Object> map;

    /**
     * Constructs a new BasicConfig instance with an empty map.
     */
    public BasicConfig() {
        this.map = new HashMap<>();
    }

    /**
     * Constructs a new BasicConfig instance with given map.
     *
     * @param map Configuration map, null is treated as empty.
     */
    public BasicConfig(Map<String, Object> map) {
        this.map = map != null ? map : new HashMap<>();
    }

    /**
     * Gets the underlying map.
     *
     * @return Map instance.
     */
    public Map<String, Object> getMap() {
        return map;
    }

    /**
     * Checks if a property exists.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean hasProperty(String name) {
        return getProperty(name) != null;
    }

    /**
     * Gets a raw property.
     * <p>Resolves dotted names against nested maps when there is no literal match.
     *
     * @param name Property name.
     * @return Object or null.
     */
    public Object getProperty(String name) {
        if (map.containsKey(name)) {
            return map.get(name);
        }

        if (name.contains(".")) {
            Object current = map;
            for (String part : name.split("\\.")) {
                if (!(current instanceof Map)) {
                    return null;
                }
                current = ((Map<String, Object>) current).get(part);
            }
            return current;
        }

        return null;
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
        Object value = getProperty(name);
        return value != null ? String.valueOf(value) : defaultValue;
    }

    /**
     * Gets long property.
     *
     * @param name Property name.
     * @return Long or null.
     */
    public Long getLongProperty(String name) {
        return getLongProperty(name, null);
    }

    /**
     * Gets long property with default.
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
     * Gets boolean property.
     *
     * @param name Property name.
     * @return Boolean.
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
     * Gets list property.
     *
     * @param name Property name.
     * @return List or null.
     */
    public List<?> getListProperty(String name) {
        Object value = getProperty(name);
        return value instanceof List ? (List<?>) value : null;
    }

    /**
     * Gets list of strings property.
     * <p>Non string entries are converted with {@link String#valueOf(Object)}.
     *
     * @param name Property name.
     * @return List of strings, never null.
     */
    public List<String> getStringListProperty(String name) {
        List<String> list = new ArrayList<>();
        List<?> raw = getListProperty(name);
        if (raw != null) {
            for (Object entry : raw) {
                if (entry != null) {
                    list.add(String.valueOf(entry));
                }
            }
        }
        return list;
    }

    /**
     * Gets map property.
     *
     * @param name Property name.
     * @return Map, empty if absent.
     */
    public Map<String, Object> getMapProperty(String name) {
        Object value = getProperty(name);
        return value instanceof Map ? (Map<String, Object>) value : new HashMap<>();
    }
}
