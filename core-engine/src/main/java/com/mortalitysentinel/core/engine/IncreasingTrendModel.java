package com.mortalitysentinel.core.engine;

import com.mortalitysentinel.core.model.AlertResult;
import com.mortalitysentinel.core.model.AlertStatus;
import com.mortalitysentinel.core.model.ModelDefinition;
import com.mortalitysentinel.core.model.MonthlyRecord;
import com.mortalitysentinel.core.model.MortalityPoint;
import com.mortalitysentinel.core.model.TrendInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.YearMonth;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Increasing-trend alert model.
 *
 * <p>
 * Alerts when the mortality rates of the current calendar month and the two
 * months before it are strictly increasing. A hospital missing any of those
 * three months is excluded; a gap never counts as a period. There is no baseline:
 * {@code value}, {@code threshold} and {@code smr} stay absent and the
 * inspected rates are reported in {@link TrendInfo}.
 * </p>
 *
 * @since 1.0.0
 */
public class IncreasingTrendModel implements AlertModel {

    private static final Logger LOG = LoggerFactory.getLogger(IncreasingTrendModel.class);

    private final ModelDefinition definition;

    /**
     * @param definition a validated trend definition
     * @throws IllegalArgumentException if {@code definition} is not the trend
     *                                  model
     */
    public IncreasingTrendModel(ModelDefinition definition) {
        this.definition = Objects.requireNonNull(definition, "ModelDefinition must not be null");
        if (!definition.isTrend()) {
            throw new IllegalArgumentException(
                    "Model '" + definition.getId() + "' is not an increasing-trend model");
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

        Optional<List<MonthlyRecord>> recent = series.consecutive(current, ModelDefinition.TREND_PERIODS);
        if (recent.isEmpty()) {
            return exclude(series, ExclusionReason.INSUFFICIENT_HISTORY);
        }

        TrendInfo trend = TrendInfo.of(recent.get().stream()
                .map(r -> new MortalityPoint(r.getPeriod(), r.getMortalityRate()))
                .toList());
        AlertStatus status = trend.isStrictlyIncreasing() ? AlertStatus.ALERT : AlertStatus.NORMAL;

        LOG.debug("Model [{}] hospital '{}': {} -> {}", definition.getId(), series.getHospitalName(), trend, status);

        MonthlyRecord record = currentRecord.get();
        return Optional.of(AlertResult.builder()
                .hospitalName(series.getHospitalName())
                .currentPeriod(current)
                .deaths(record.getDeaths())
                .mortalityRate(record.getMortalityRate())
                .status(status)
                .last6MonthsMortality(series.mortalityHistory(current, BaselineComparisonModel.HISTORY_MONTHS))
                .trendInfo(trend)
                .build());
    }

    @Override
    public ModelDefinition getDefinition() {
        return definition;
    }

    private Optional<AlertResult> exclude(HospitalSeries series, ExclusionReason reason) {
        LOG.debug("Model [{}] hospital '{}' excluded: {}", definition.getId(), series.getHospitalName(), reason);
        return Optional.empty();
    }
}
