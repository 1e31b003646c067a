package com.legacylens.core.config;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Utility for loading configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code legacylens.yaml} into {@link AnalyzerConfig} records.
 * If the file is missing, unreadable or invalid, returns {@link AnalyzerConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AnalyzerConfig config = ConfigLoader.load(Path.of("legacylens.yaml"));
 * config.source().extensions(); // [.cbl, .cob, ...]
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code legacylens.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static AnalyzerConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return AnalyzerConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return AnalyzerConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            AnalyzerConfig config = YAML_MAPPER.readValue(configPath.toFile(), AnalyzerConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return AnalyzerConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return validateEncodings(config);
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return AnalyzerConfig.defaults();
        }
    }

    private static AnalyzerConfig validateEncodings(AnalyzerConfig config) {
        AnalyzerConfig validated = config;
        if (!isSupported(config.source().encoding())) {
            log.warn("Unsupported source encoding '{}'. Using {}.",
                config.source().encoding(), AnalyzerConfig.DEFAULT_ENCODING);
            validated = validated.withEncoding(AnalyzerConfig.DEFAULT_ENCODING);
        }
        if (!isSupported(config.output().encoding())) {
            log.warn("Unsupported output encoding '{}'. Using {}.",
                config.output().encoding(), AnalyzerConfig.DEFAULT_ENCODING);
            validated = validated.withOutputEncoding(AnalyzerConfig.DEFAULT_ENCODING);
        }
        return validated;
    }

    private static boolean isSupported(String encoding) {
        try {
            return Charset.isSupported(encoding);
        } catch (IllegalArgumentException e) {
            log.debug("Illegal charset name '{}': {}", encoding, e.getMessage());
            return false;
        }
    }
}
