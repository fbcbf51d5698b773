package com.mortalitysentinel.core.engine;

import com.mortalitysentinel.core.model.AlertResult;

import java.util.Comparator;

/**
 * Result ordering: {@code Alert} entries first, then by compared value
 * descending (mortality rate for the trend model, which has no value), then
 * by hospital name ascending.
 *
 * @since 1.0.0
 */
public final class AlertResultOrdering {

    public static final Comparator<AlertResult> INSTANCE = Comparator
            .comparing((AlertResult r) -> !r.isAlert())
            .thenComparing(AlertResultOrdering::sortValue, Comparator.reverseOrder())
            .thenComparing(AlertResult::getHospitalName);

    private AlertResultOrdering() {
        // static utility
    }

    private static Double sortValue(AlertResult result) {
        return result.getValue() != null ? result.getValue() : result.getMortalityRate();
    }
}
