package me.christianrobert.cpp2py.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    public static final String RULES = "translation.rules";
    public static final String FIXED_POINT = "translation.fixed-point";
    public static final String MAX_PASSES = "translation.max-passes";
    public static final String STRICT = "translation.strict";
    public static final String WORKERS = "translation.workers";
    public static final String SOURCE_EXTENSIONS = "translation.source-extensions";

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public ConfigService() {
        initializeDefaultConfiguration();
    }

    private void initializeDefaultConfiguration() {
        // empty rule list means every registered rule
        configuration.put(RULES, "");
        configuration.put(FIXED_POINT, false);
        configuration.put(MAX_PASSES, 10);
        configuration.put(STRICT, false);
        configuration.put(WORKERS, Math.max(1, Runtime.getRuntime().availableProcessors()));
        configuration.put(SOURCE_EXTENSIONS, ".cpp,.cc,.cxx,.c++,.h,.hpp,.hh,.hxx");

        log.info("Configuration service initialized with default values");
    }

    private String getConfigValueAsString(String key) {
        Object value = configuration.get(key);
        return value != null ? value.toString() : null;
    }

    public Boolean getConfigValueAsBoolean(String key) {
        Object value = configuration.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return null;
    }

    /**
     * Gets a configuration value as an integer. Accepts numbers and numeric strings.
     *
     * @param key Configuration key
     * @return the value, or null when missing or not numeric
     */
    public Integer getConfigValueAsInteger(String key) {
        Object value = configuration.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                log.warn("Config value {} = '{}' is not a number", key, value);
                return null;
            }
        }
        return null;
    }

    /**
     * Gets a configuration value as a list of strings.
     * Supports comma-separated values: "for-loop-to-range,main-guard"
     * Trims whitespace and filters out empty strings.
     *
     * @param key Configuration key
     * @return List of strings, or empty list if value is null/empty
     */
    public List<String> getConfigValueAsStringList(String key) {
        String value = getConfigValueAsString(key);
        if (value == null || value.trim().isEmpty()) {
            return new ArrayList<>();
        }

        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    public void updateConfiguration(Map<String, Object> newConfig) {
        log.info("Updating configuration with {} entries", newConfig.size());

        newConfig.forEach((key, value) -> {
            Object oldValue = configuration.put(key, value);
            if (log.isDebugEnabled()) {
                log.debug("Config updated: {} = {} (was: {})", key, value, oldValue);
            }
        });

        log.info("Configuration updated successfully");
    }
}
