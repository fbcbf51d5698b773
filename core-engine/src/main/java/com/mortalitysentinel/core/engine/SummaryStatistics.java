package com.mortalitysentinel.core.engine;

/**
 * Dashboard summary of a hospital's mortality rates over a date range.
 *
 * @since 1.0.0
 */
public final class SummaryStatistics {

    private final int count;
    private final double mean;
    private final double stddev;
    private final double threshold;

    SummaryStatistics(int count, double mean, double stddev, double threshold) {
        this.count = count;
        this.mean = mean;
        this.stddev = stddev;
        this.threshold = threshold;
    }

    public int getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    /**
     * @return population standard deviation, {@code 0} for a single value
     */
    public double getStddev() {
        return stddev;
    }

    /**
     * @return {@code mean + k * stddev} for the multiplier the summary was built
     *         with
     */
    public double getThreshold() {
        return threshold;
    }

    @Override
    public String toString() {
        return "SummaryStatistics{count=" + count + ", mean=" + mean + ", stddev=" + stddev
                + ", threshold=" + threshold + '}';
    }
}
