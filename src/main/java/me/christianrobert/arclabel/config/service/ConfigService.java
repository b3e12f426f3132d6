package me.christianrobert.arclabel.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Runtime settings of the label transformer.
 *
 * <p>Held in memory, seeded with defaults at startup and changeable through the REST API.
 * Only the keys listed below are accepted.</p>
 */
@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    /** Name of the label function (Function FindLabel ... End Function). */
    public static final String FUNCTION_NAME = "label.function-name";
    /** Render CASE expressions with one WHEN/ELSE per line. */
    public static final String PRETTY_PRINT = "label.pretty-print";

    private static final Set<String> KNOWN_KEYS = Set.of(FUNCTION_NAME, PRETTY_PRINT);
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public ConfigService() {
        initializeDefaultConfiguration();
    }

    private void initializeDefaultConfiguration() {
        configuration.put(FUNCTION_NAME, "FindLabel");
        configuration.put(PRETTY_PRINT, false);

        log.info("Configuration service initialized with default values");
    }

    public Map<String, Object> getAllConfiguration() {
        return new HashMap<>(configuration);
    }

    public Object getConfigValue(String key) {
        return configuration.get(key);
    }

    public String getConfigValueAsString(String key) {
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

    public String getFunctionName() {
        return getConfigValueAsString(FUNCTION_NAME);
    }

    public boolean isPrettyPrint() {
        return Boolean.TRUE.equals(getConfigValueAsBoolean(PRETTY_PRINT));
    }

    /**
     * Applies several settings at once. Nothing is applied if any entry is invalid.
     *
     * @throws IllegalArgumentException for an unknown key or an invalid value
     */
    public void updateConfiguration(Map<String, Object> newConfig) {
        log.info("Updating configuration with {} entries", newConfig.size());

        newConfig.forEach(this::validate);
        newConfig.forEach((key, value) -> {
            Object oldValue = configuration.put(key, value);
            if (log.isDebugEnabled()) {
                log.debug("Config updated: {} = {} (was: {})", key, value, oldValue);
            }
        });

        log.info("Configuration updated successfully");
    }

    /**
     * @throws IllegalArgumentException for an unknown key or an invalid value
     */
    public void setConfigValue(String key, Object value) {
        validate(key, value);
        Object oldValue = configuration.put(key, value);
        log.debug("Config value set: {} = {} (was: {})", key, value, oldValue);
    }

    public boolean hasConfigKey(String key) {
        return configuration.containsKey(key);
    }

    public void resetToDefaults() {
        log.info("Resetting configuration to defaults");
        configuration.clear();
        initializeDefaultConfiguration();
    }

    private void validate(String key, Object value) {
        if (!KNOWN_KEYS.contains(key)) {
            throw new IllegalArgumentException("Unknown configuration key: " + key);
        }
        if (value == null) {
            throw new IllegalArgumentException("Configuration value for " + key + " must not be null");
        }
        if (FUNCTION_NAME.equals(key) && !IDENTIFIER.matcher(value.toString()).matches()) {
            throw new IllegalArgumentException("Function name must be an identifier: " + value);
        }
        if (PRETTY_PRINT.equals(key) && !(value instanceof Boolean)
                && !"true".equalsIgnoreCase(value.toString()) && !"false".equalsIgnoreCase(value.toString())) {
            throw new IllegalArgumentException("Pretty print must be true or false: " + value);
        }
    }
}
