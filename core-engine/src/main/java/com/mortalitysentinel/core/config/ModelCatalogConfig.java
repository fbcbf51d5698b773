package com.mortalitysentinel.core.config;

import com.mortalitysentinel.core.model.ModelDefinition;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Top-level POJO for the model catalog YAML.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * models:
 *   - id: model1
 *     displayName: "Model 1: Deaths &gt; Highest (Last 3 months)"
 *     metric: DEATHS
 *     windowMonths: 3
 *     comparison: HIGHEST_HISTORICAL
 * </pre>
 *
 * @since 1.0.0
 */
public class ModelCatalogConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<ModelDefinition> models = new ArrayList<>();

    /**
     * @return unmodifiable list of model definitions, in file order
     */
    public List<ModelDefinition> getModels() {
        return Collections.unmodifiableList(models);
    }

    /**
     * Set the models list (used by SnakeYAML during deserialization).
     *
     * @param models the model definitions
     */
    public void setModels(List<ModelDefinition> models) {
        this.models = models != null ? new ArrayList<>(models) : new ArrayList<>();
    }

    /**
     * Validate every definition and reject duplicate ids.
     *
     * <p>
     * Collects all errors and throws a single exception if anything is invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more definitions are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();

        for (int i = 0; i < models.size(); i++) {
            ModelDefinition model = models.get(i);
            if (model == null) {
                errors.add("Model at index " + i + " is empty");
                continue;
            }
            try {
                model.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (model.getId() != null && !seenIds.add(model.getId())) {
                errors.add("Duplicate model id: '" + model.getId() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Model catalog validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "ModelCatalogConfig{models=" + models + '}';
    }
}
