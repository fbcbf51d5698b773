package com.mortalitysentinel.core.engine;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Statistics of a baseline window: mean, population standard deviation and
 * maximum.
 *
 * <p>
 * Each statistic is empty when it is undefined for the window: mean and max
 * for an empty window, standard deviation for fewer than two values.
 * </p>
 *
 * @since 1.0.0
 */
public final class Baseline {

    private final int count;
    private final OptionalDouble mean;
    private final OptionalDouble stddev;
    private final OptionalDouble max;

    Baseline(int count, OptionalDouble mean, OptionalDouble stddev, OptionalDouble max) {
        this.count = count;
        this.mean = Objects.requireNonNull(mean);
        this.stddev = Objects.requireNonNull(stddev);
        this.max = Objects.requireNonNull(max);
    }

    public int getCount() {
        return count;
    }

    public OptionalDouble getMean() {
        return mean;
    }

    public OptionalDouble getStddev() {
        return stddev;
    }

    public OptionalDouble getMax() {
        return max;
    }

    @Override
    public String toString() {
        return "Baseline{count=" + count + ", mean=" + mean + ", stddev=" + stddev + ", max=" + max + '}';
    }
}
