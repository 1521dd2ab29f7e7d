package com.dnssentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link SentinelConfig} from YAML.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH}</li>
 * <li>Explicit path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource, {@value #DEFAULT_RESOURCE} by default</li>
 * </ol>
 *
 * <p>
 * Every {@code load*} path validates after parsing and fails fast.
 * Duplicate YAML keys are rejected.
 * </p>
 *
 * @since 1.0.0
 */
public final class SentinelConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SentinelConfigLoader.class);

    public static final String ENV_CONFIG_PATH = "SENTINEL_CONFIG_PATH";
    public static final String DEFAULT_RESOURCE = "sentinel.yml";

    private SentinelConfigLoader() {
    }

    /**
     * Load using automatic resolution: env path when it exists, otherwise the
     * default classpath resource.
     */
    public static SentinelConfig load() {
        return load(System.getenv(ENV_CONFIG_PATH));
    }

    static SentinelConfig load(String envPath) {
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading configuration from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading configuration from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static SentinelConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file: " + path, e);
        }
    }

    /**
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static SentinelConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = SentinelConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static SentinelConfig parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(SentinelConfig.class, options));

        SentinelConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed configuration in " + source + ": " + e.getMessage(), e);
        }
        if (config == null) {
            LOG.warn("Configuration {} is empty - using defaults", source);
            config = new SentinelConfig();
        }
        config.validate();

        LOG.info("Loaded configuration from {}: {} alert rule(s), alerts {}",
                source, config.getAlerts().getRules().size(),
                config.getAlerts().isEnabled() ? "enabled" : "disabled");
        return config;
    }
}
