package com.bsa.analyzer.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class ConfigReader {

    public static final String DEFAULT_FILE = "bsa.json";

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes a config file.
     *
     * @throws ConfigReadException if the file is missing, empty or malformed, or names an unknown
     *     detection mode
     */
    public AnalyzerConfig read(Path configPath) {
        if (!Files.isRegularFile(configPath)) {
            throw new ConfigReadException("Config file not found: " + configPath);
        }
        try (FileReader reader = new FileReader(configPath.toFile(), StandardCharsets.UTF_8)) {
            AnalyzerConfig config = GSON.fromJson(reader, AnalyzerConfig.class);
            if (config == null) {
                throw new ConfigReadException("Config file is empty: " + configPath);
            }
            try {
                config.getDetectionMode();
            } catch (IllegalArgumentException e) {
                throw new ConfigReadException("Invalid detection_mode in " + configPath + ": " + e.getMessage(), e);
            }
            return config;
        } catch (JsonParseException e) {
            throw new ConfigReadException("Config file is not valid JSON: " + configPath, e);
        } catch (FileNotFoundException e) {
            throw new ConfigReadException("Config file not found: " + configPath, e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read config " + configPath + ": " + e.getMessage(), e);
        }
    }

    /** {@code bsa.json} in the project root when present, defaults otherwise. */
    public AnalyzerConfig readOrDefault(Path projectRoot) {
        Path candidate = projectRoot.resolve(DEFAULT_FILE);
        if (!Files.exists(candidate)) {
            return new AnalyzerConfig();
        }
        return read(candidate);
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
