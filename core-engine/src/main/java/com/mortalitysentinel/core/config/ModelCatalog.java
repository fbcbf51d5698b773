package com.mortalitysentinel.core.config;

import com.mortalitysentinel.core.model.ModelDefinition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only registry of alert model definitions keyed by id.
 *
 * <p>
 * Built once from a validated {@link ModelCatalogConfig} and then shared
 * process-wide. Listing order follows the configuration file. The catalog
 * keeps private copies of the loaded definitions and hands out fresh copies,
 * so callers cannot alter the configuration it evaluates with.
 * </p>
 *
 * @since 1.0.0
 */
public final class ModelCatalog {

    private final Map<String, ModelDefinition> definitions;

    /**
     * @param config validated catalog configuration
     * @throws IllegalStateException if the configuration is invalid
     */
    public ModelCatalog(ModelCatalogConfig config) {
        Objects.requireNonNull(config, "ModelCatalogConfig must not be null");
        config.validate();
        Map<String, ModelDefinition> byId = new LinkedHashMap<>();
        for (ModelDefinition definition : config.getModels()) {
            byId.put(definition.getId(), definition.copy());
        }
        this.definitions = Collections.unmodifiableMap(byId);
    }

    /**
     * Load the catalog using {@link ModelCatalogLoader#load()} resolution.
     *
     * @return the catalog
     */
    public static ModelCatalog load() {
        return new ModelCatalog(ModelCatalogLoader.load());
    }

    /**
     * @param modelId model id, e.g. {@code model10}
     * @return the definition, or empty if the id is unknown
     */
    public Optional<ModelDefinition> find(String modelId) {
        if (modelId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(definitions.get(modelId)).map(ModelDefinition::copy);
    }

    /**
     * @return all definitions in catalog order
     */
    public List<ModelDefinition> list() {
        return definitions.values().stream()
                .map(ModelDefinition::copy)
                .toList();
    }

    public int size() {
        return definitions.size();
    }

    @Override
    public String toString() {
        return "ModelCatalog" + definitions.keySet();
    }
}
