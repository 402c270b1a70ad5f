package com.prettyprinter.config;

import com.prettyprinter.util.LoggerUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads formatting configuration from YAML files, with validation and fallback to the
 * bundled defaults.
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerUtil.getLogger(ConfigurationLoader.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/config/default-config.yml";

    private static FormattingConfig _cachedDefaultConfig = null;

    /**
     * Loads configuration from a file with fallback to defaults.
     */
    public static FormattingConfig loadConfig(Path configPath) {
        if (configPath == null) {
            logger.fine("No config path provided, using default configuration");
            return loadDefaultConfig();
        }

        if (!Files.exists(configPath)) {
            logger.fine("Configuration file not found: " + configPath + ", using default configuration");
            return loadDefaultConfig();
        }

        try {
            logger.info("Loading configuration from: " + configPath);

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(configPath.toFile(), Map.class);
            if (config == null) {
                logger.warning("Configuration file is empty: " + configPath + ", using default configuration");
                return loadDefaultConfig();
            }

            FormattingConfig formattingConfig = _createConfigFromMap(config);
            logger.info("Configuration loaded successfully: " + formattingConfig);

            return formattingConfig;
        } catch (Exception e) {
            logger.log(Level.WARNING, "Error parsing configuration file: " + e.getMessage(), e);
            logger.info("Falling back to default configuration");
            return loadDefaultConfig();
        }
    }

    /**
     * Loads the embedded default configuration with caching.
     */
    public static synchronized FormattingConfig loadDefaultConfig() {
        if (_cachedDefaultConfig != null) {
            return _cachedDefaultConfig;
        }

        try (InputStream defaultConfigStream =
                     ConfigurationLoader.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {

            if (defaultConfigStream == null) {
                logger.severe("Default configuration resource not found: " + DEFAULT_CONFIG_RESOURCE);
                return FormattingConfig.defaults();
            }

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(defaultConfigStream, Map.class);

            _cachedDefaultConfig = _createConfigFromMap(config);
            logger.fine("Default configuration loaded successfully");

            return _cachedDefaultConfig;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to load default configuration", e);
            return FormattingConfig.defaults();
        }
    }

    /**
     * Creates a configuration from a parsed map. Missing, mistyped and out-of-range
     * values take their defaults.
     */
    static FormattingConfig _createConfigFromMap(Map<String, Object> config) {
        Map<String, Object> layout = _section(config, "layout");
        Map<String, Object> formatting = _section(config, "formatting");

        _validateIntRange(layout, "tabWidth", 1, 16);
        _validateIntRange(layout, "maxNewlines", 1, 10);

        return FormattingConfig.builder()
                .tabWidth(_intValue(layout, "tabWidth", FormattingConfig.DEFAULT_TAB_WIDTH))
                .useTabs(_booleanValue(layout, "useTabs", true))
                .respectNewlines(_booleanValue(layout, "respectNewlines", true))
                .maxNewlines(_intValue(layout, "maxNewlines", FormattingConfig.DEFAULT_MAX_NEWLINES))
                .printComments(_booleanValue(formatting, "comments", true))
                .optionalSemicolons(_booleanValue(formatting, "optionalSemicolons", false))
                .html(_booleanValue(formatting, "html", false))
                .experimentalDef(_booleanValue(formatting, "experimentalDef", false))
                .debug(_booleanValue(formatting, "debug", false))
                .build();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> _section(Map<String, Object> config, String name) {
        Object section = config.get(name);
        if (section instanceof Map) {
            return new HashMap<>((Map<String, Object>) section);
        }
        if (section != null) {
            logger.warning("Invalid '" + name + "' section in config, using defaults");
        }
        return new HashMap<>();
    }

    /**
     * Validates that an integer configuration value is within the specified range.
     */
    private static void _validateIntRange(Map<String, Object> config, String key, int min, int max) {
        if (config.containsKey(key) && config.get(key) instanceof Number) {
            int value = ((Number) config.get(key)).intValue();
            if (value < min || value > max) {
                logger.warning("Configuration value '" + key + "' is outside acceptable range " +
                        "(" + min + "-" + max + "). Using default value.");
                config.remove(key);
            }
        }
    }

    private static int _intValue(Map<String, Object> config, String key, int defaultValue) {
        Object value = config.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        logger.warning("Configuration value '" + key + "' is not a number: " + value + ". Using default value.");
        return defaultValue;
    }

    private static boolean _booleanValue(Map<String, Object> config, String key, boolean defaultValue) {
        Object value = config.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String && ("true".equalsIgnoreCase((String) value) || "false".equalsIgnoreCase((String) value))) {
            return Boolean.parseBoolean((String) value);
        }
        logger.warning("Configuration value '" + key + "' is not a boolean: " + value + ". Using default value.");
        return defaultValue;
    }

    /**
     * Saves configuration to a file.
     */
    public static void saveConfig(FormattingConfig config, Path configPath) throws IOException {
        try {
            Path parent = configPath.getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.writeValue(configPath.toFile(), config.toMap());

            logger.info("Configuration saved successfully to: " + configPath);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to save configuration to: " + configPath, e);
            throw e;
        }
    }
}
