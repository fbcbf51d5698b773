package com.mortalitysentinel.core.model;

/**
 * Quantity a model compares against its baseline.
 *
 * @since 1.0.0
 */
public enum Metric {

    /** Absolute death count for the month. */
    DEATHS,

    /** Deaths as a percentage of discharged patients. */
    MORTALITY_RATE,

    /** Mortality rate divided by the expected death percentage. */
    SMR
}
