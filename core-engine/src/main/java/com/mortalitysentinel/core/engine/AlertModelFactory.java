package com.mortalitysentinel.core.engine;

import com.mortalitysentinel.core.model.ModelDefinition;

import java.util.Objects;

/**
 * Creates {@link AlertModel} instances from {@link ModelDefinition}s.
 *
 * <p>
 * All twelve grid models share {@link BaselineComparisonModel}; only the
 * comparison decides which implementation is used.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertModelFactory {

    private AlertModelFactory() {
        // static utility
    }

    /**
     * @param definition the model definition; must not be {@code null}
     * @return the model enforcing it
     * @throws NullPointerException  if {@code definition} is {@code null}
     * @throws IllegalStateException if the definition is invalid
     */
    public static AlertModel create(ModelDefinition definition) {
        Objects.requireNonNull(definition, "ModelDefinition must not be null");
        definition.validate();

        return switch (definition.getComparison()) {
            case HIGHEST_HISTORICAL, AVG_PLUS_1SD -> new BaselineComparisonModel(definition);
            case INCREASING_TREND -> new IncreasingTrendModel(definition);
        };
    }
}
