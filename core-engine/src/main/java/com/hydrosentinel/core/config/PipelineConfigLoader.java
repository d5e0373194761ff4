package com.hydrosentinel.core.config;

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
 * Builds the {@link PipelineConfig} a deployment runs with.
 *
 * <p>
 * {@link #load()} looks in three places, first hit wins: the YAML file named
 * by {@value #ENV_CONFIG_PATH}, the {@value #DEFAULT_RESOURCE} bundled on the
 * classpath, and finally the compiled-in defaults. Callers that know where
 * their settings live use {@link #fromFile(String)} or
 * {@link #fromClasspath(String)} directly.
 * </p>
 *
 * <p>
 * Whatever the origin, the result has passed {@link PipelineConfig#validate()};
 * a bad threshold or bounds table stops the ingest service at startup instead
 * of skewing anomaly scores later. Repeated keys in a document are an error,
 * not a silent override, and a blank document means "all defaults".
 * </p>
 *
 * @since 1.0.0
 */
public final class PipelineConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineConfigLoader.class);

    /** Points at an operator-supplied settings file outside the jar. */
    public static final String ENV_CONFIG_PATH = "PIPELINE_CONFIG_PATH";

    /** Settings shipped inside the ingest service jar. */
    public static final String DEFAULT_RESOURCE = "pipeline.yml";

    private PipelineConfigLoader() {
    }

    /**
     * Resolves the deployment's settings: operator file, then bundled
     * resource, then defaults.
     *
     * @return validated settings, never {@code null}
     * @throws IllegalStateException if the chosen source holds invalid values
     */
    public static PipelineConfig load() {
        String override = System.getenv(ENV_CONFIG_PATH);
        if (override != null && !override.isBlank()) {
            if (Files.exists(Path.of(override))) {
                return fromFile(override);
            }
            LOG.warn("{} points at missing file '{}'; ignoring it", ENV_CONFIG_PATH, override);
        }
        if (PipelineConfigLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) != null) {
            return fromClasspath(DEFAULT_RESOURCE);
        }
        LOG.info("No settings file for the pipeline; running on built-in defaults");
        PipelineConfig defaults = new PipelineConfig();
        defaults.validate();
        return defaults;
    }

    /**
     * Reads settings from a YAML file on disk.
     *
     * @param path location of the file
     * @return validated settings
     * @throws IllegalArgumentException if there is no such file
     * @throws IllegalStateException    if the file cannot be read, is not
     *                                  well-formed, or holds invalid values
     */
    public static PipelineConfig fromFile(String path) {
        Objects.requireNonNull(path, "path");
        try (InputStream in = new FileInputStream(path)) {
            return read("file " + path, in);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Pipeline settings file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("I/O error reading pipeline settings from " + path, e);
        }
    }

    /**
     * Reads settings from a YAML resource on the classpath.
     *
     * @param resource resource name, e.g. {@value #DEFAULT_RESOURCE}
     * @return validated settings
     * @throws IllegalArgumentException if the resource is not on the classpath
     * @throws IllegalStateException    if the resource cannot be read, is not
     *                                  well-formed, or holds invalid values
     */
    public static PipelineConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "resource");
        InputStream in = PipelineConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Pipeline settings resource not found on classpath: " + resource);
        }
        try (in) {
            return read("classpath:" + resource, in);
        } catch (IOException e) {
            throw new IllegalStateException("I/O error reading pipeline settings from classpath:" + resource, e);
        }
    }

    private static PipelineConfig read(String origin, InputStream in) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        PipelineConfig config;
        try {
            config = new Yaml(new Constructor(PipelineConfig.class, options)).load(in);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed pipeline settings in " + origin + ": " + e.getMessage(), e);
        }
        if (config == null) {
            LOG.warn("Pipeline settings in {} are blank; every key takes its default", origin);
            config = new PipelineConfig();
        }
        config.validate();
        LOG.info("Pipeline settings from {}: {}", origin, config);
        return config;
    }
}
