package com.mortalitysentinel.core.engine;

/**
 * Failure categories of a whole evaluation.
 *
 * @since 1.0.0
 */
public enum ErrorKind {

    /** The requested model id is not in the catalog. */
    UNKNOWN_MODEL,

    /** The time-series store failed or did not answer in time. */
    DATA_UNAVAILABLE,

    /** Unexpected failure inside the engine. */
    INTERNAL_ERROR
}
