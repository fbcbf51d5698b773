package com.mortalitysentinel.core.engine;

import com.mortalitysentinel.core.config.ModelCatalog;
import com.mortalitysentinel.core.model.AlertResult;
import com.mortalitysentinel.core.model.ModelDefinition;
import com.mortalitysentinel.core.model.MonthlyRecord;
import com.mortalitysentinel.core.store.DataUnavailableException;
import com.mortalitysentinel.core.store.TimeSeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Evaluates one catalog model against every hospital in the time-series
 * store.
 *
 * <h3>Current period</h3>
 * <p>
 * All hospitals are compared at the same month: the latest period present in
 * the snapshot, capped by {@link EvaluationRequest#getEndPeriod()}. Hospitals
 * without a record for that month are left out.
 * </p>
 *
 * <h3>Failures</h3>
 * <p>
 * Missing data for a single hospital only excludes that hospital. The whole
 * evaluation fails, as an {@link EvaluationOutcome} rather than an exception,
 * when the model id is unknown or the store cannot be read. The engine never
 * retries the store.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Holds no mutable state; concurrent calls are safe as long as the store
 * supports concurrent reads.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RuleEngine.class);

    private final ModelCatalog catalog;
    private final TimeSeriesStore store;

    public RuleEngine(ModelCatalog catalog, TimeSeriesStore store) {
        this.catalog = Objects.requireNonNull(catalog, "ModelCatalog must not be null");
        this.store = Objects.requireNonNull(store, "TimeSeriesStore must not be null");
    }

    /**
     * @return all model definitions in catalog order
     */
    public List<ModelDefinition> listModels() {
        return catalog.list();
    }

    public Optional<ModelDefinition> findModel(String modelId) {
        return catalog.find(modelId);
    }

    /**
     * Evaluate a model at the latest available period, unfiltered.
     *
     * @param modelId catalog id, e.g. {@code model10}
     * @return ordered results or an error
     */
    public EvaluationOutcome evaluate(String modelId) {
        return evaluate(modelId, EvaluationRequest.latest());
    }

    /**
     * Evaluate a model.
     *
     * @param modelId catalog id, e.g. {@code model10}
     * @param request period cap and alert filtering options
     * @return ordered results or an error; never {@code null}
     */
    public EvaluationOutcome evaluate(String modelId, EvaluationRequest request) {
        Objects.requireNonNull(request, "EvaluationRequest must not be null");

        Optional<ModelDefinition> definition = catalog.find(modelId);
        if (definition.isEmpty()) {
            LOG.warn("Evaluation requested for unknown model '{}'", modelId);
            return EvaluationOutcome.failure(modelId, ErrorKind.UNKNOWN_MODEL, "Unknown model: '" + modelId + "'");
        }

        long startNanos = System.nanoTime();
        try {
            EvaluationOutcome outcome = run(definition.get(), request);
            LOG.info("Model [{}] evaluated for {} in {} ms: {} result(s), {} alert(s)",
                    modelId, outcome.getCurrentPeriod().orElse(null),
                    (System.nanoTime() - startNanos) / 1_000_000,
                    outcome.getResults().size(), outcome.getAlerts().size());
            return outcome;
        } catch (DataUnavailableException e) {
            LOG.error("Model [{}] evaluation failed, time-series data unavailable: {}", modelId, e.getMessage(), e);
            return EvaluationOutcome.failure(modelId, ErrorKind.DATA_UNAVAILABLE,
                    "Time-series data unavailable: " + e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Model [{}] evaluation failed unexpectedly: {}", modelId, e.getMessage(), e);
            return EvaluationOutcome.failure(modelId, ErrorKind.INTERNAL_ERROR,
                    "Evaluation of " + modelId + " failed: " + e.getMessage());
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private EvaluationOutcome run(ModelDefinition definition, EvaluationRequest request) {
        AlertModel model = AlertModelFactory.create(definition);

        TimeSeriesStore data = pinData();
        List<MonthlyRecord> records = fetchRecords(data, request.getEndPeriod().orElse(null));
        Optional<YearMonth> currentPeriod = records.stream()
                .map(MonthlyRecord::getPeriod)
                .max(YearMonth::compareTo);
        if (currentPeriod.isEmpty()) {
            LOG.warn("Model [{}]: no monthly records available up to {}", definition.getId(),
                    request.getEndPeriod().orElse(null));
            return EvaluationOutcome.success(definition, null, List.of());
        }

        EvaluationContext context = new EvaluationContext(currentPeriod.get(), data);
        Map<String, HospitalSeries> seriesByHospital = HospitalSeries.groupByHospital(records);

        List<AlertResult> results = new ArrayList<>(seriesByHospital.size());
        for (HospitalSeries series : seriesByHospital.values()) {
            model.evaluate(series, context)
                    .filter(result -> passesDeathIncreaseFilter(definition, series, result, request))
                    .ifPresent(results::add);
        }

        results.sort(AlertResultOrdering.INSTANCE);
        return EvaluationOutcome.success(definition, currentPeriod.get(), results);
    }

    private TimeSeriesStore pinData() {
        try {
            return Objects.requireNonNull(store.snapshot(), "store returned a null snapshot");
        } catch (DataUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DataUnavailableException("Data snapshot failed: " + e.getMessage(), e);
        }
    }

    private static List<MonthlyRecord> fetchRecords(TimeSeriesStore data, YearMonth endPeriod) {
        try {
            return data.fetchMonthlyRecords(null, null, endPeriod);
        } catch (DataUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DataUnavailableException("Monthly record fetch failed: " + e.getMessage(), e);
        }
    }

    private static boolean passesDeathIncreaseFilter(ModelDefinition definition, HospitalSeries series,
                                                     AlertResult result, EvaluationRequest request) {
        OptionalInt minIncrease = request.getMinDeathIncrease();
        if (minIncrease.isEmpty() || !result.isAlert()) {
            return true;
        }
        Optional<MonthlyRecord> previous = series.at(result.getCurrentPeriod().minusMonths(1));
        if (previous.isEmpty()) {
            return true;
        }
        int increase = result.getDeaths() - previous.get().getDeaths();
        if (increase <= minIncrease.getAsInt()) {
            LOG.debug("Model [{}] hospital '{}' excluded: {} (increase={}, required>{})",
                    definition.getId(), series.getHospitalName(), ExclusionReason.DEATH_INCREASE_FILTER,
                    increase, minIncrease.getAsInt());
            return false;
        }
        return true;
    }
}
