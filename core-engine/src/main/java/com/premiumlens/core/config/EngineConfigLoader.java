package com.premiumlens.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link EngineConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(Path)}</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <p>
 * Every {@code load*} method validates after parsing, so a bad alias table or
 * an out-of-range setting fails at startup instead of silently skewing a
 * parse.
 * </p>
 *
 * @since 1.0.0
 */
public final class EngineConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(EngineConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "PREMIUM_LENS_CONFIG_PATH";

    /** Classpath resource holding the shipped defaults. */
    public static final String DEFAULT_RESOURCE = "premium-lens.yml";

    private EngineConfigLoader() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load the configuration using automatic resolution.
     *
     * <p>
     * If {@code PREMIUM_LENS_CONFIG_PATH} names an existing file it wins;
     * otherwise {@value #DEFAULT_RESOURCE} is read from the classpath, and if
     * that is absent too the built-in {@link EngineConfig#defaults()} apply.
     * </p>
     *
     * @return parsed and validated configuration
     * @throws IllegalStateException if validation fails
     */
    public static EngineConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading engine config from environment path: {}", envPath);
            return fromFile(Path.of(envPath));
        }
        if (EngineConfigLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) == null) {
            LOG.warn("No {} on the classpath, using built-in defaults", DEFAULT_RESOURCE);
            return EngineConfig.defaults();
        }
        LOG.info("Loading engine config from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load the configuration from a file.
     *
     * @param path YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static EngineConfig fromFile(Path path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = Files.newInputStream(path)) {
            return parseAndValidate(is, path.toString());
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Engine config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read engine config file: " + path, e);
        }
    }

    /**
     * Load the configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static EngineConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = EngineConfigLoader.class.getClassLoader().getResourceAsStream(resource);
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

    private static EngineConfig parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(EngineConfig.class, options));

        EngineConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed engine config in " + source + ": " + e.getMessage(), e);
        }

        if (config == null) {
            LOG.warn("Engine config {} is empty, using built-in defaults", source);
            config = EngineConfig.defaults();
        }
        config.validate();

        LOG.info("Loaded engine config from {}: {}", source, config);
        return config;
    }
}
