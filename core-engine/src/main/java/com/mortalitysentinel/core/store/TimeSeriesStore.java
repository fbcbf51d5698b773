package com.mortalitysentinel.core.store;

import com.mortalitysentinel.core.model.ExpectedDeathInfo;
import com.mortalitysentinel.core.model.MonthlyRecord;

import java.time.YearMonth;
import java.util.List;
import java.util.Optional;

/**
 * Source of monthly mortality records and expected-death data.
 *
 * <p>
 * Implementations may block (for example while a slow warehouse query runs);
 * bounding that latency is the caller's job. Failures are reported as
 * {@link DataUnavailableException} and are never retried by the engine.
 * </p>
 * <p>
 * Implementations must be safe for concurrent reads.
 * </p>
 */
public interface TimeSeriesStore {

    /**
     * Fetch monthly records, ordered by hospital name and then by period.
     *
     * @param hospitalName restrict to one hospital, or {@code null} for all
     * @param startPeriod  inclusive lower bound, or {@code null} for none
     * @param endPeriod    inclusive upper bound, or {@code null} for none
     * @return ordered records; empty when nothing matches
     * @throws DataUnavailableException if the underlying source cannot be read
     */
    List<MonthlyRecord> fetchMonthlyRecords(String hospitalName, YearMonth startPeriod, YearMonth endPeriod);

    /**
     * Fetch the expected death percentage for one hospital-month.
     *
     * @param hospitalName hospital identifier
     * @param period       calendar month
     * @return the expected-death data, or empty if none is recorded
     * @throws DataUnavailableException if the underlying source cannot be read
     */
    Optional<ExpectedDeathInfo> fetchExpectedDeathInfo(String hospitalName, YearMonth period);

    /**
     * A consistent view of the data for one evaluation. Every fetch made on
     * the returned store sees the same data, even if the source changes in the
     * meantime. Stores whose data never changes return themselves.
     *
     * @return a store pinned to the current data
     * @throws DataUnavailableException if the underlying source cannot be read
     */
    default TimeSeriesStore snapshot() {
        return this;
    }

    /**
     * @return distinct hospital names in ascending order
     * @throws DataUnavailableException if the underlying source cannot be read
     */
    default List<String> listHospitals() {
        return fetchMonthlyRecords(null, null, null).stream()
                .map(MonthlyRecord::getHospitalName)
                .distinct()
                .sorted()
                .toList();
    }
}
