package com.mortalitysentinel.core.config;

import com.mortalitysentinel.core.model.ModelDefinition;
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
 * Reads the alert model catalog from YAML.
 *
 * <p>
 * The bundled {@value #DEFAULT_RESOURCE} holds the thirteen production
 * models. A deployment can replace it wholesale by pointing
 * {@value #ENV_MODELS_PATH} at another file; there is no merging. Whatever
 * the source, the result is checked with {@link ModelCatalogConfig#validate()}
 * and must define at least one model, so a broken catalog stops the service
 * before it accepts requests.
 * </p>
 *
 * <p>
 * Malformed YAML and invalid definitions both surface as
 * {@link IllegalStateException} naming the source; a missing file or
 * resource is an {@link IllegalArgumentException}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ModelCatalogLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ModelCatalogLoader.class);

    /** Environment variable naming a catalog file that replaces the bundled one. */
    public static final String ENV_MODELS_PATH = "MODELS_CONFIG_PATH";

    /** Classpath resource holding the bundled catalog. */
    public static final String DEFAULT_RESOURCE = "models.yml";

    private ModelCatalogLoader() {
    }

    /**
     * Read the file named by {@value #ENV_MODELS_PATH} when it exists, the
     * bundled catalog otherwise.
     *
     * @return validated catalog configuration
     */
    public static ModelCatalogConfig load() {
        String override = System.getenv(ENV_MODELS_PATH);
        if (override != null && !override.isBlank()) {
            Path file = Path.of(override);
            if (Files.isRegularFile(file)) {
                return fromFile(file);
            }
            LOG.warn("{} points at '{}', which is not a file; using bundled catalog", ENV_MODELS_PATH, override);
        }
        return fromClasspath(DEFAULT_RESOURCE);
    }

    public static ModelCatalogConfig fromFile(String path) {
        Objects.requireNonNull(path, "Model catalog path must not be null");
        return fromFile(Path.of(path));
    }

    /**
     * @param file catalog file
     * @return validated catalog configuration
     * @throws IllegalArgumentException if the file does not exist
     */
    public static ModelCatalogConfig fromFile(Path file) {
        Objects.requireNonNull(file, "Model catalog path must not be null");
        String source = "file " + file;
        try (InputStream in = Files.newInputStream(file)) {
            return read(source, in);
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Model catalog file not found: " + file, e);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read model catalog " + source, e);
        }
    }

    /**
     * @param resource resource name relative to the classpath root
     * @return validated catalog configuration
     * @throws IllegalArgumentException if the resource does not exist
     */
    public static ModelCatalogConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        String source = "classpath:" + resource;
        InputStream in = ModelCatalogLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Model catalog resource not found: " + source);
        }
        try (in) {
            return read(source, in);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read model catalog " + source, e);
        }
    }

    private static ModelCatalogConfig read(String source, InputStream in) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        ModelCatalogConfig config;
        try {
            config = new Yaml(new Constructor(ModelCatalogConfig.class, options)).load(in);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed model catalog " + source + ": " + e.getMessage(), e);
        }

        if (config == null || config.getModels().isEmpty()) {
            throw new IllegalStateException("No alert models defined in " + source);
        }
        config.validate();

        LOG.info("Model catalog {} defines {} model(s): {}", source, config.getModels().size(),
                config.getModels().stream().map(ModelDefinition::getId).toList());
        return config;
    }
}
