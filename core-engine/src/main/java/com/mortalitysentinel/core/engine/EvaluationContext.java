package com.mortalitysentinel.core.engine;

import com.mortalitysentinel.core.model.ExpectedDeathInfo;
import com.mortalitysentinel.core.store.DataUnavailableException;
import com.mortalitysentinel.core.store.TimeSeriesStore;

import java.time.YearMonth;
import java.util.Objects;
import java.util.Optional;

/**
 * Shared, read-only inputs of one evaluation: the current period all
 * hospitals are compared at, and access to expected-death data for SMR.
 *
 * @since 1.0.0
 */
public final class EvaluationContext {

    private final YearMonth currentPeriod;
    private final TimeSeriesStore store;

    public EvaluationContext(YearMonth currentPeriod, TimeSeriesStore store) {
        this.currentPeriod = Objects.requireNonNull(currentPeriod, "currentPeriod must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    public YearMonth getCurrentPeriod() {
        return currentPeriod;
    }

    /**
     * @return expected-death data for the hospital-month, or empty if none
     * @throws DataUnavailableException if the store fails
     */
    public Optional<ExpectedDeathInfo> expectedDeathInfo(String hospitalName, YearMonth period) {
        try {
            return store.fetchExpectedDeathInfo(hospitalName, period);
        } catch (DataUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DataUnavailableException(
                    "Expected-death lookup failed for " + hospitalName + " " + period + ": " + e.getMessage(), e);
        }
    }
}
