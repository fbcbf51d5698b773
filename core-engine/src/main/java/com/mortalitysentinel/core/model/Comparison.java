package com.mortalitysentinel.core.model;

/**
 * How a model turns its baseline window into an alert threshold.
 *
 * @since 1.0.0
 */
public enum Comparison {

    /** Threshold is the maximum value seen in the baseline window. */
    HIGHEST_HISTORICAL,

    /** Threshold is the baseline mean plus one population standard deviation. */
    AVG_PLUS_1SD,

    /**
     * No threshold: alerts when the three most recent mortality rates are
     * strictly increasing.
     */
    INCREASING_TREND
}
