package me.christianrobert.vbs2js.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.vbs2js.transformer.context.TranspilerOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    public static final String INDENT = "transpiler.indent";
    public static final String EMIT_HEADER = "transpiler.emit-header";
    public static final String POST_PROCESSING_ENABLED = "transpiler.post-processing.enabled";
    public static final String HUMANIZE_CHAR_CODES = "transpiler.post-processing.humanize-char-codes";
    public static final String CONTAINER_CORRECTION = "transpiler.post-processing.container-correction";
    public static final String RESIDUAL_KEYWORD_SCAN = "transpiler.residual-keyword-scan";

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public ConfigService() {
        initializeDefaultConfiguration();
    }

    private void initializeDefaultConfiguration() {
        configuration.put(INDENT, TranspilerOptions.DEFAULT_INDENT);
        configuration.put(EMIT_HEADER, true);
        configuration.put(POST_PROCESSING_ENABLED, true);
        configuration.put(HUMANIZE_CHAR_CODES, true);
        configuration.put(CONTAINER_CORRECTION, true);
        configuration.put(RESIDUAL_KEYWORD_SCAN, true);

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

    /**
     * Snapshot of the transpiler settings; missing or unreadable values fall back to the defaults.
     */
    public TranspilerOptions getTranspilerOptions() {
        return new TranspilerOptions(
                getConfigValueAsString(INDENT),
                booleanOrDefault(EMIT_HEADER),
                booleanOrDefault(POST_PROCESSING_ENABLED),
                booleanOrDefault(HUMANIZE_CHAR_CODES),
                booleanOrDefault(CONTAINER_CORRECTION),
                booleanOrDefault(RESIDUAL_KEYWORD_SCAN));
    }

    private boolean booleanOrDefault(String key) {
        Boolean value = getConfigValueAsBoolean(key);
        return value == null || value;
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

    public void setConfigValue(String key, Object value) {
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
}
