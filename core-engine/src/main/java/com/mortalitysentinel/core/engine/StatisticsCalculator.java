package com.mortalitysentinel.core.engine;

import com.mortalitysentinel.core.model.Comparison;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Baseline statistics and thresholds shared by every alert model.
 *
 * <p>
 * Standard deviation is always the <strong>population</strong> form (divide
 * by N), so thresholds are consistent across models.
 * </p>
 *
 * @since 1.0.0
 */
public final class StatisticsCalculator {

    /** Minimum number of values for which a standard deviation is defined. */
    static final int MIN_STDDEV_SIZE = 2;

    /** Standard-deviation multiplier of the dashboard alert line. */
    public static final double DASHBOARD_SD_MULTIPLIER = 3.0;

    private StatisticsCalculator() {
        // static utility
    }

    /**
     * Compute mean, population standard deviation and max of a window.
     *
     * @param values window values; must not be {@code null}
     * @return baseline with undefined statistics left empty
     */
    public static Baseline baseline(List<Double> values) {
        Objects.requireNonNull(values, "values must not be null");
        int n = values.size();
        if (n == 0) {
            return new Baseline(0, OptionalDouble.empty(), OptionalDouble.empty(), OptionalDouble.empty());
        }

        double sum = 0;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            sum += v;
            max = Math.max(max, v);
        }
        double mean = sum / n;

        OptionalDouble stddev = OptionalDouble.empty();
        if (n >= MIN_STDDEV_SIZE) {
            stddev = OptionalDouble.of(populationStdDev(values, mean));
        }
        return new Baseline(n, OptionalDouble.of(mean), stddev, OptionalDouble.of(max));
    }

    /**
     * Derive the alert threshold of a comparison from a baseline.
     *
     * @param baseline   window statistics
     * @param comparison {@link Comparison#HIGHEST_HISTORICAL} or
     *                   {@link Comparison#AVG_PLUS_1SD}
     * @return the threshold, or empty if the statistic it needs is undefined
     * @throws IllegalArgumentException for {@link Comparison#INCREASING_TREND},
     *                                  which has no threshold
     */
    public static OptionalDouble threshold(Baseline baseline, Comparison comparison) {
        Objects.requireNonNull(baseline, "baseline must not be null");
        Objects.requireNonNull(comparison, "comparison must not be null");
        return switch (comparison) {
            case HIGHEST_HISTORICAL -> baseline.getMax();
            case AVG_PLUS_1SD -> {
                if (baseline.getMean().isEmpty() || baseline.getStddev().isEmpty()) {
                    yield OptionalDouble.empty();
                }
                yield OptionalDouble.of(baseline.getMean().getAsDouble() + baseline.getStddev().getAsDouble());
            }
            case INCREASING_TREND -> throw new IllegalArgumentException(
                    "INCREASING_TREND has no baseline threshold");
        };
    }

    /**
     * Summarise a series for display: mean, population standard deviation
     * ({@code 0} for a single value) and {@code mean + sdMultiplier * stddev}.
     *
     * @param values       series values; must not be {@code null}
     * @param sdMultiplier standard-deviation multiplier of the threshold line
     * @return the summary, or empty for an empty series
     */
    public static Optional<SummaryStatistics> summary(List<Double> values, double sdMultiplier) {
        Objects.requireNonNull(values, "values must not be null");
        Baseline baseline = baseline(values);
        if (baseline.getMean().isEmpty()) {
            return Optional.empty();
        }
        double mean = baseline.getMean().getAsDouble();
        double stddev = baseline.getStddev().orElse(0.0);
        return Optional.of(new SummaryStatistics(baseline.getCount(), mean, stddev, mean + sdMultiplier * stddev));
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static double populationStdDev(List<Double> values, double mean) {
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / values.size());
    }
}
