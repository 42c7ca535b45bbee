package com.pseudoconv.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading pseudoconv configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code pseudoconv.yaml} into {@link ProjectConfig} records.
 * If the config file is missing, unparseable or names an unknown style or policy,
 * returns {@link ProjectConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ProjectConfig config = ConfigLoader.load(Paths.get("pseudoconv.yaml"));
 * ConvertResult result = converter.convert(source, config.toOptions());
 * }</pre>
 */
public class ConfigLoader {

    /** Configuration file looked up in the working directory. */
    public static final String DEFAULT_FILE_NAME = "pseudoconv.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be used, logs a warning or error and
     * returns {@link ProjectConfig#defaults()}.
     *
     * @param configPath path to {@code pseudoconv.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static ProjectConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return ProjectConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ProjectConfig.defaults();
        }

        ProjectConfig config;
        try {
            log.debug("Loading configuration from: {}", configPath);
            config = YAML_MAPPER.readValue(configPath.toFile(), ProjectConfig.class);
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ProjectConfig.defaults();
        }

        if (config == null) {
            log.warn("Configuration file is empty: {}. Using defaults.", configPath);
            return ProjectConfig.defaults();
        }

        try {
            config.toOptions();
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration in {}: {}. Using defaults.", configPath, e.getMessage());
            return ProjectConfig.defaults();
        }

        log.info("Loaded configuration from: {}", configPath);
        return config;
    }
}
