package com.mortalitysentinel.core.engine;

import com.mortalitysentinel.core.model.AlertResult;
import com.mortalitysentinel.core.model.ModelDefinition;

import java.time.YearMonth;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed result of {@link RuleEngine#evaluate(String, EvaluationRequest)}:
 * either an ordered result list or an error.
 *
 * <p>
 * Callers hold on to a successful outcome and hand it to export or delivery
 * explicitly; nothing is cached by the engine.
 * </p>
 *
 * @since 1.0.0
 */
public final class EvaluationOutcome {

    private final String modelId;
    private final ModelDefinition model;
    private final YearMonth currentPeriod;
    private final List<AlertResult> results;
    private final ErrorKind errorKind;
    private final String errorMessage;

    private EvaluationOutcome(String modelId, ModelDefinition model, YearMonth currentPeriod,
                              List<AlertResult> results, ErrorKind errorKind, String errorMessage) {
        this.modelId = modelId;
        this.model = model;
        this.currentPeriod = currentPeriod;
        this.results = results;
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
    }

    /**
     * @param model         the evaluated model
     * @param currentPeriod the period compared, or {@code null} when the
     *                      snapshot held no records
     * @param results       ordered results
     */
    public static EvaluationOutcome success(ModelDefinition model, YearMonth currentPeriod,
                                            List<AlertResult> results) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(results, "results must not be null");
        return new EvaluationOutcome(model.getId(), model, currentPeriod, List.copyOf(results), null, null);
    }

    public static EvaluationOutcome failure(String modelId, ErrorKind errorKind, String errorMessage) {
        Objects.requireNonNull(errorKind, "errorKind must not be null");
        Objects.requireNonNull(errorMessage, "errorMessage must not be null");
        return new EvaluationOutcome(modelId, null, null, List.of(), errorKind, errorMessage);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public String getModelId() {
        return modelId;
    }

    /**
     * @return the model definition, empty when the id was unknown
     */
    public Optional<ModelDefinition> getModel() {
        return Optional.ofNullable(model);
    }

    public Optional<YearMonth> getCurrentPeriod() {
        return Optional.ofNullable(currentPeriod);
    }

    /**
     * @return ordered results, empty on failure
     */
    public List<AlertResult> getResults() {
        return results;
    }

    /**
     * @return the {@code Alert} entries, in result order
     */
    public List<AlertResult> getAlerts() {
        return results.stream().filter(AlertResult::isAlert).toList();
    }

    public Optional<ErrorKind> getErrorKind() {
        return Optional.ofNullable(errorKind);
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    @Override
    public String toString() {
        if (!isSuccess()) {
            return "EvaluationOutcome{modelId='" + modelId + "', error=" + errorKind + ": " + errorMessage + '}';
        }
        return "EvaluationOutcome{modelId='" + modelId + "', currentPeriod=" + currentPeriod
                + ", results=" + results.size() + '}';
    }
}
