package com.mimecast.catcher.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
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
 * <p>Map backed configuration with typed accessors.
 * <p>Files are JSON5 flavoured JSON, comments and unquoted keys are accepted.
 */
@SuppressWarnings("unchecked")
public class ConfigFoundation {

    /**
     * Configuration map.
     */
    protected Map<String, Object> map = new HashMap<>();

    /**
     * Constructs a new empty ConfigFoundation instance.
     */
    public ConfigFoundation() {
    }

    /**
     * Constructs a new ConfigFoundation instance with configuration map.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        this.map = map != null ? map : new HashMap<>();
    }

    /**
     * Constructs a new ConfigFoundation instance from file.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read or parse file.
     */
    public ConfigFoundation(String path) throws IOException {
        this.map = parse(Files.readString(Path.of(path), StandardCharsets.UTF_8));
    }

    /**
     * Parses JSON5 text into a map.
     *
     * @param json JSON string.
     * @return Map instance, empty for blank input.
     * @throws IOException Unable to parse.
     */
    public static Map<String, Object> parse(String json) throws IOException {
        try (Reader reader = new StringReader(json)) {
            JsonReader jsonReader = new JsonReader(reader);
            jsonReader.setLenient(true);
            Map<String, Object> parsed = new Gson().fromJson(jsonReader, new TypeToken<Map<String, Object>>() {}.getType());
            return parsed != null ? parsed : new HashMap<>();
        } catch (JsonParseException e) {
            throw new IOException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Gets configuration map.
     *
     * @return Map.
     */
    public Map<String, Object> getMap() {
        return map;
    }

    /**
     * Has property.
     *
     * @param key Property key.
     * @return Boolean.
     */
    public boolean hasProperty(String key) {
        return map.containsKey(key) && map.get(key) != null;
    }

    /**
     * Gets string property.
     *
     * @param key          Property key.
     * @param defaultValue Default value.
     * @return String.
     */
    public String getStringProperty(String key, String defaultValue) {
        return hasProperty(key) ? String.valueOf(map.get(key)) : defaultValue;
    }

    /**
     * Gets string property.
     *
     * @param key Property key.
     * @return String or null.
     */
    public String getStringProperty(String key) {
        return getStringProperty(key, null);
    }

    /**
     * Gets long property.
     * <p>Numbers parsed from JSON are doubles, numeric strings are accepted too.
     *
     * @param key          Property key.
     * @param defaultValue Default value.
     * @return Long.
     */
    public Long getLongProperty(String key, Long defaultValue) {
        if (!hasProperty(key)) {
            return defaultValue;
        }

        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }

        try {
            return Long.parseLong(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * Gets boolean property.
     *
     * @param key          Property key.
     * @param defaultValue Default value.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String key, boolean defaultValue) {
        if (!hasProperty(key)) {
            return defaultValue;
        }

        Object value = map.get(key);
        return value instanceof Boolean ? (Boolean) value : Boolean.parseBoolean(String.valueOf(value));
    }

    /**
     * Gets boolean property.
     *
     * @param key Property key.
     * @return Boolean, false if missing.
     */
    public boolean getBooleanProperty(String key) {
        return getBooleanProperty(key, false);
    }

    /**
     * Gets list property as strings.
     *
     * @param key          Property key.
     * @param defaultValue Default value.
     * @return List of String.
     */
    public List<String> getListProperty(String key, List<String> defaultValue) {
        if (!hasProperty(key) || !(map.get(key) instanceof List)) {
            return defaultValue;
        }

        List<String> list = new ArrayList<>();
        for (Object entry : (List<Object>) map.get(key)) {
            list.add(String.valueOf(entry));
        }

        return list;
    }

    /**
     * Gets map property.
     *
     * @param key Property key.
     * @return Map, empty if missing.
     */
    public Map<String, Object> getMapProperty(String key) {
        if (hasProperty(key) && map.get(key) instanceof Map) {
            return (Map<String, Object>) map.get(key);
        }

        return Collections.emptyMap();
    }
}
