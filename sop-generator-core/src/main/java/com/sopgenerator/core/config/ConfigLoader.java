package com.sopgenerator.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading SOP generator configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code sop-generator.yaml} into {@link SopConfig} records.
 * If the config file is missing or invalid, returns {@link SopConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SopConfig config = ConfigLoader.load(Paths.get("sop-generator.yaml"));
 * String font = config.style().fontFamily();
 * }</pre>
 */
public final class ConfigLoader {

    public static final String DEFAULT_FILE_NAME = "sop-generator.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link SopConfig#defaults()}.
     *
     * @param configPath path to {@code sop-generator.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static SopConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return SopConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return SopConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            SopConfig config = YAML_MAPPER.readValue(configPath.toFile(), SopConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return SopConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return SopConfig.defaults();
        }
    }
}
