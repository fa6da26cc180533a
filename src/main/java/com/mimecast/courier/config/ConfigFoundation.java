package com.mimecast.courier.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration foundation.
 *
 * <p>Adds JSON5 file loading on top of {@link BasicConfig}.
 * <p>Gson runs lenient so comments, unquoted keys and single quotes are accepted.
 *
 * @see BasicConfig
 */
public class ConfigFoundation extends BasicConfig {
    protected static final Logger log = LogManager.getLogger(ConfigFoundation.class);

    private static final Type MAP_TYPE = new TypeToken<LinkedHashMap<String, Object>>() {}.getType();

    /**
     * Constructs a new ConfigFoundation instance.
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
     * Constructs a new ConfigFoundation instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read or parse file.
     */
    public ConfigFoundation(String path) throws IOException {
        super(readFile(path));
    }

    /**
     * Reads and parses a JSON5 file into a map.
     *
     * @param path File path.
     * @return Map of String, Object.
     * @throws IOException Unable to read or parse file.
     */
    protected static Map<String, Object> readFile(String path) throws IOException {
        Path file = Paths.get(path);
        if (!Files.isRegularFile(file)) {
            throw new IOException("Configuration file not found: " + path);
        }

        String content = Files.readString(file, StandardCharsets.UTF_8);
        Map<String, Object> parsed;
        try {
            parsed = fromJson(content);
        } catch (JsonParseException e) {
            throw new IOException("Unable to parse configuration file: " + path, e);
        }

        log.debug("Loaded configuration file: {}", path);
        return parsed != null ? parsed : new LinkedHashMap<>();
    }

    /**
     * Parses a JSON5 string into a map.
     *
     * @param json JSON5 string.
     * @return Map of String, Object.
     */
    public static Map<String, Object> fromJson(String json) {
        Gson gson = new GsonBuilder().setLenient().create();
        return gson.fromJson(json, MAP_TYPE);
    }
}
