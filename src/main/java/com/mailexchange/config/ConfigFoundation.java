package com.mailexchange.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration file foundation.
 *
 * <p>Reads a JSON5 file from disk and exposes it through {@link BasicConfig}.
 * <p>Gson parses leniently so comments, single quotes and unquoted keys are accepted.
 */
public class ConfigFoundation extends BasicConfig {

    /**
     * Constructs a new ConfigFoundation instance with an empty map.
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
     * Constructs a new ConfigFoundation instance from file.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read or parse file.
     */
    public ConfigFoundation(String path) throws IOException {
        super(parse(Paths.get(path)));
    }

    /**
     * Parses a JSON5 file into a map.
     *
     * @param path File path.
     * @return Map instance.
     * @throws IOException Unable to read or parse file.
     */
    @SuppressWarnings("unchecked")
    static Map<String, Object> parse(Path path) throws IOException {
        String content = Files.readString(path, StandardCharsets.UTF_8);
        try {
            Map<String, Object> parsed = new Gson().fromJson(content, Map.class);
            return parsed != null ? parsed : new HashMap<>();
        } catch (JsonParseException e) {
            throw new IOException("Invalid JSON5 in " + path + ": " + e.getMessage(), e);
        }
    }
}
