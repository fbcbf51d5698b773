package com.mortalitysentinel.core.engine;

/**
 * Why a hospital was left out of a model's result list.
 *
 * <p>
 * Exclusions are not errors: the hospital simply has no result for that
 * model and evaluation carries on with the next one.
 * </p>
 *
 * @since 1.0.0
 */
public enum ExclusionReason {

    /** No record for the evaluation's current period. */
    NO_CURRENT_PERIOD,

    /** Fewer periods of history than the model's window needs. */
    INSUFFICIENT_HISTORY,

    /** SMR undefined for the current period or for every baseline period. */
    MISSING_EXPECTED_DEATHS,

    /** The comparison's statistic is undefined for the baseline window. */
    UNDEFINED_THRESHOLD,

    /** Alert suppressed because deaths did not rise enough over last month. */
    DEATH_INCREASE_FILTER
}
