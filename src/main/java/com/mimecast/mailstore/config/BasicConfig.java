package com.mimecast.mailstore.config;

import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration foundation.
 *
 * <p>Provides type safe accessors over a configuration map.
 * <p>Maps are usually read from JSON5 files which Gson parses leniently, so comments and unquoted keys are fine.
 * <p>Gson maps every number to a {@link Double}, hence the numeric getters accept any {@link Number}.
 */
@SuppressWarnings("unchecked")
public class BasicConfig {

    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {
    }.getType();

    /**
     * Configuration map.
     */
    protected final Map<String, Object> map;

    /**
     * Constructs a new BasicConfig instance with an empty map.
     */
    public BasicConfig() {
        this.map = new HashMap<>();
    }

    /**
     * Constructs a new BasicConfig instance.
     *
     * @param map Configuration map, null is treated as empty.
     */
    public BasicConfig(Map<String, Object> map) {
        this.map = map != null ? map : new HashMap<>();
    }

    /**
     * Constructs a new BasicConfig instance from a JSON5 file.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public BasicConfig(String path) throws IOException {
        this(readFile(path));
    }

    /**
     * Reads a JSON5 file into a map.
     *
     * @param path Path to configuration file.
     * @return Configuration map.
     * @throws IOException Unable to read file.
     */
    static Map<String, Object> readFile(String path) throws IOException {
        String content = Files.readString(Path.of(path), StandardCharsets.UTF_8);
        Map<String, Object> parsed = new Gson().fromJson(content, MAP_TYPE);
        return parsed != null ? parsed : new HashMap<>();
    }

    /**
     * Gets the underlying map.
     *
     * @return Configuration map.
     */
    public Map<String, Object> getMap() {
        return map;
    }

    /**
     * Checks if property is present.
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
     * @param def  Default value.
     * @return String.
     */
    public String getStringProperty(String name, String def) {
        Object value = map.get(name);
        return value != null ? String.valueOf(value) : def;
    }

    /**
     * Gets long property.
     *
     * @param name Property name.
     * @param def  Default value.
     * @return Long.
     */
    public Long getLongProperty(String name, Long def) {
        Object value = map.get(name);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                return def;
            }
        }
        return def;
    }

    /**
     * Gets boolean property.
     *
     * @param name Property name.
     * @return Boolean, false if absent.
     */
    public boolean getBooleanProperty(String name) {
        return getBooleanProperty(name, false);
    }

    /**
     * Gets boolean property.
     *
     * @param name Property name.
     * @param def  Default value.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String name, boolean def) {
        Object value = map.get(name);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return def;
    }

    /**
     * Gets list property.
     * <p>A single scalar value is wrapped into a list.
     *
     * @param name Property name.
     * @return List, empty if absent.
     */
    public List<Object> getListProperty(String name) {
        Object value = map.get(name);
        if (value instanceof List) {
            return (List<Object>) value;
        }
        if (value != null) {
            return List.of(value);
        }
        return Collections.emptyList();
    }

    /**
     * Gets list property as strings.
     *
     * @param name Property name.
     * @return List of strings, empty if absent.
     */
    public List<String> getStringListProperty(String name) {
        List<String> list = new ArrayList<>();
        for (Object item : getListProperty(name)) {
            if (item != null) {
                list.add(String.valueOf(item));
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
        Object value = map.get(name);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return new HashMap<>();
    }
}
