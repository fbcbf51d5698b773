package com.mortalitysentinel.core.engine;

import com.mortalitysentinel.core.model.AlertResult;
import com.mortalitysentinel.core.model.AlertStatus;
import com.mortalitysentinel.core.model.Metric;
import com.mortalitysentinel.core.model.ModelDefinition;
import com.mortalitysentinel.core.model.MonthlyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Window-based alert model.
 *
 * <p>
 * Builds a baseline from the {@code windowMonths} records immediately before
 * the current period, derives a threshold from it (highest value, or mean +
 * 1&sigma;) and raises an alert when the current value is <em>strictly</em>
 * greater than the threshold.
 * </p>
 *
 * <h3>SMR</h3>
 * <p>
 * Baseline periods without expected-death data are dropped from the
 * statistics. The hospital is excluded when every baseline period, or the
 * current period, lacks it.
 * </p>
 *
 * @since 1.0.0
 */
public class BaselineComparisonModel implements AlertModel {

    private static final Logger LOG = LoggerFactory.getLogger(BaselineComparisonModel.class);

    /** Length of the mortality history attached to each result. */
    static final int HISTORY_MONTHS = 6;

    private final ModelDefinition definition;

    /**
     * @param definition a validated non-trend definition
     * @throws IllegalArgumentException if {@code definition} is the trend model
     */
    public BaselineComparisonModel(ModelDefinition definition) {
        this.definition = Objects.requireNonNull(definition, "ModelDefinition must not be null");
        if (definition.isTrend()) {
            throw new IllegalArgumentException(
                    "Model '" + definition.getId() + "' is a trend model, not a baseline comparison");
        }
    }

    @Override
    public Optional<AlertResult> evaluate(HospitalSeries series, EvaluationContext context) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(context, "context must not be null");

        YearMonth current = context.getCurrentPeriod();
        Optional<MonthlyRecord> currentRecord = series.at(current);
        if (currentRecord.isEmpty()) {
            return exclude(series, ExclusionReason.NO_CURRENT_PERIOD);
        }

        List<MonthlyRecord> window = series.precedingWindow(current, definition.getWindowMonths());
        if (window.size() < definition.getWindowMonths()) {
            return exclude(series, ExclusionReason.INSUFFICIENT_HISTORY);
        }

        List<Double> baselineValues = new ArrayList<>(window.size());
        for (MonthlyRecord record : window) {
            metricValue(record, context).ifPresent(baselineValues::add);
        }
        if (baselineValues.isEmpty()) {
            return exclude(series, ExclusionReason.MISSING_EXPECTED_DEATHS);
        }

        OptionalDouble currentValue = metricValue(currentRecord.get(), context);
        if (currentValue.isEmpty()) {
            return exclude(series, ExclusionReason.MISSING_EXPECTED_DEATHS);
        }

        Baseline baseline = StatisticsCalculator.baseline(baselineValues);
        OptionalDouble threshold = StatisticsCalculator.threshold(baseline, definition.getComparison());
        if (threshold.isEmpty()) {
            return exclude(series, ExclusionReason.UNDEFINED_THRESHOLD);
        }

        double value = currentValue.getAsDouble();
        double bound = threshold.getAsDouble();
        AlertStatus status = value > bound ? AlertStatus.ALERT : AlertStatus.NORMAL;

        LOG.debug("Model [{}] hospital '{}': value={} threshold={} baseline={} -> {}",
                definition.getId(), series.getHospitalName(), value, bound, baseline, status);

        MonthlyRecord record = currentRecord.get();
        return Optional.of(AlertResult.builder()
                .hospitalName(series.getHospitalName())
                .currentPeriod(current)
                .deaths(record.getDeaths())
                .mortalityRate(record.getMortalityRate())
                .smr(definition.getMetric() == Metric.SMR ? value : null)
                .value(value)
                .threshold(bound)
                .status(status)
                .last6MonthsMortality(series.mortalityHistory(current, HISTORY_MONTHS))
                .build());
    }

    @Override
    public ModelDefinition getDefinition() {
        return definition;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private OptionalDouble metricValue(MonthlyRecord record, EvaluationContext context) {
        return switch (definition.getMetric()) {
            case DEATHS -> OptionalDouble.of(record.getDeaths());
            case MORTALITY_RATE -> OptionalDouble.of(record.getMortalityRate());
            case SMR -> context.expectedDeathInfo(record.getHospitalName(), record.getPeriod())
                    .map(info -> OptionalDouble.of(info.smrFor(record.getMortalityRate())))
                    .orElse(OptionalDouble.empty());
        };
    }

    private Optional<AlertResult> exclude(HospitalSeries series, ExclusionReason reason) {
        LOG.debug("Model [{}] hospital '{}' excluded: {}", definition.getId(), series.getHospitalName(), reason);
        return Optional.empty();
    }
}
