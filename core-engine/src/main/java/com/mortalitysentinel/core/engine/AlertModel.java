package com.mortalitysentinel.core.engine;

import com.mortalitysentinel.core.model.AlertResult;
import com.mortalitysentinel.core.model.ModelDefinition;

import java.util.Optional;

/**
 * Contract for all alert models.
 * <p>
 * Implementations are <strong>stateless</strong>: each call classifies one
 * hospital from its own series plus the shared context, so one instance may
 * be used from several threads at once.
 * </p>
 */
public interface AlertModel {

    /**
     * Classify one hospital.
     *
     * @param series  the hospital's records
     * @param context current period and expected-death access
     * @return the result, or empty if the hospital is excluded from this model
     */
    Optional<AlertResult> evaluate(HospitalSeries series, EvaluationContext context);

    /**
     * @return the definition this model enforces
     */
    ModelDefinition getDefinition();
}
