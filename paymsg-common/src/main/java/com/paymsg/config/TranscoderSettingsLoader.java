package com.paymsg.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads {@link TranscoderSettings} from a classpath JSON file.
 *
 * The default settings are read once and shared; callers that need different
 * values load their own copy from another resource.
 */
public class TranscoderSettingsLoader {

    private static final Logger log = LoggerFactory.getLogger(TranscoderSettingsLoader.class);
    public static final String DEFAULT_SETTINGS_PATH = "/config/paymsg-settings.json";

    private final ObjectMapper objectMapper;

    public TranscoderSettingsLoader() {
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Shared settings from the default classpath location.
     *
     * @throws SettingsLoadException if the settings cannot be loaded
     */
    public static TranscoderSettings defaults() {
        return DefaultsHolder.DEFAULTS;
    }

    /**
     * Load settings from the default classpath location.
     */
    public TranscoderSettings load() {
        return load(DEFAULT_SETTINGS_PATH);
    }

    /**
     * Load settings from a specific classpath location.
     *
     * @param classpathPath path of the JSON file (e.g. "/config/paymsg-settings.json")
     * @throws SettingsLoadException if the file is missing or malformed
     */
    public TranscoderSettings load(String classpathPath) {
        try (InputStream inputStream = getClass().getResourceAsStream(classpathPath)) {
            if (inputStream == null) {
                throw new SettingsLoadException("Settings file not found in classpath: " + classpathPath);
            }
            TranscoderSettings settings = objectMapper.readValue(inputStream, TranscoderSettings.class);
            log.info("Loaded transcoder settings from {} ({} MX targets)",
                classpathPath, settings.getMxNamespaces() != null ? settings.getMxNamespaces().size() : 0);
            return settings;
        } catch (IOException e) {
            log.error("Failed to load transcoder settings from: {}", classpathPath, e);
            throw new SettingsLoadException("Failed to load transcoder settings from " + classpathPath, e);
        }
    }

    private static final class DefaultsHolder {
        private static final TranscoderSettings DEFAULTS = new TranscoderSettingsLoader().load();
    }
}
