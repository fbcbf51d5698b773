package com.mortalitysentinel.core.model;

/**
 * Rough cost of evaluating a model, used by callers to pick an evaluation
 * timeout.
 *
 * @since 1.0.0
 */
public enum ComplexityClass {

    /** Deaths or mortality-rate models over a 3-month window. */
    SIMPLE,

    /** Deaths or mortality-rate models over a 6-month window, and the trend model. */
    STANDARD,

    /** SMR models, which need an expected-death lookup per period. */
    EXTENDED
}
