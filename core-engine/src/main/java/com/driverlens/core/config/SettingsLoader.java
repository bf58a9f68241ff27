package com.driverlens.core.config;

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
import java.util.Map;
import java.util.Objects;

/**
 * Reads {@link AnalysisSettings} from YAML.
 *
 * <p>
 * {@link #load()} looks, in turn, at the file named by
 * {@value #ENV_SETTINGS_PATH}, at the {@value #DEFAULT_RESOURCE} classpath
 * resource, and finally falls back to {@link AnalysisSettings#defaults()}.
 * Keys missing from a document keep their default value; an empty document
 * means all defaults.
 * </p>
 *
 * <p>
 * Every document is validated after parsing. A syntax error, a duplicate key
 * or a failed validation raises {@link IllegalStateException} naming the
 * document it came from.
 * </p>
 *
 * @since 1.0.0
 */
public final class SettingsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SettingsLoader.class);

    /** Environment variable naming a settings file. */
    public static final String ENV_SETTINGS_PATH = "ANALYSIS_CONFIG_PATH";

    /** Classpath resource read when the environment names no file. */
    public static final String DEFAULT_RESOURCE = "analysis.yml";

    private SettingsLoader() {
        // utility class — not instantiable
    }

    public static AnalysisSettings load() {
        return load(System.getenv());
    }

    /**
     * Resolve settings against an explicit environment.
     *
     * <p>
     * A configured path that does not exist is logged and skipped.
     * </p>
     *
     * @param env variable name to value
     * @return validated settings
     */
    static AnalysisSettings load(Map<String, String> env) {
        String configured = env.get(ENV_SETTINGS_PATH);
        if (configured != null && !configured.isBlank()) {
            Path file = Path.of(configured.trim());
            if (Files.isRegularFile(file)) {
                return fromFile(file);
            }
            LOG.warn("{} points to {}, which is not a file; ignoring it", ENV_SETTINGS_PATH, file);
        }
        if (SettingsLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) != null) {
            return fromClasspath(DEFAULT_RESOURCE);
        }
        LOG.info("No settings file or {} resource found, using defaults", DEFAULT_RESOURCE);
        return AnalysisSettings.defaults();
    }

    public static AnalysisSettings fromFile(String path) {
        Objects.requireNonNull(path, "Settings file path must not be null");
        return fromFile(Path.of(path));
    }

    /**
     * @param file YAML file
     * @return validated settings
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if it cannot be read, parsed or
     *                                  validated
     */
    public static AnalysisSettings fromFile(Path file) {
        Objects.requireNonNull(file, "Settings file path must not be null");
        try (InputStream in = Files.newInputStream(file)) {
            return parse(in, file.toString());
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Settings file not found: " + file, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + file, e);
        }
    }

    /**
     * @param resource classpath resource name
     * @return validated settings
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if it cannot be read, parsed or
     *                                  validated
     */
    public static AnalysisSettings fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream in = SettingsLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (in) {
            return parse(in, "classpath:" + resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static AnalysisSettings parse(InputStream in, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        AnalysisSettings settings;
        try {
            settings = new Yaml(new Constructor(AnalysisSettings.class, options)).load(in);
        } catch (YAMLException e) {
            throw new IllegalStateException("Cannot parse analysis settings " + source + ": " + e.getMessage(), e);
        }
        if (settings == null) {
            LOG.warn("Analysis settings {} are empty, using defaults", source);
            settings = AnalysisSettings.defaults();
        }
        try {
            settings.validate();
        } catch (IllegalStateException e) {
            throw new IllegalStateException("Invalid analysis settings " + source + ": " + e.getMessage(), e);
        }
        LOG.info("Analysis settings read from {}: {}", source, settings);
        return settings;
    }
}
