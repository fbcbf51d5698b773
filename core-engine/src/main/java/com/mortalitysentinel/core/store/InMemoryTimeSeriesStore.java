package com.mortalitysentinel.core.store;

import com.mortalitysentinel.core.model.ExpectedDeathInfo;
import com.mortalitysentinel.core.model.MonthlyRecord;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable in-memory {@link TimeSeriesStore} snapshot.
 *
 * <p>
 * Built through the {@link Builder}. A record for an existing
 * (hospital, period) pair replaces the earlier one, so periods stay unique
 * within a hospital's series.
 * </p>
 *
 * @since 1.0.0
 */
public final class InMemoryTimeSeriesStore implements TimeSeriesStore {

    private static final Comparator<MonthlyRecord> ORDER = Comparator
            .comparing(MonthlyRecord::getHospitalName)
            .thenComparing(MonthlyRecord::getPeriod);

    private final List<MonthlyRecord> records;
    private final Map<String, ExpectedDeathInfo> expectedByKey;
    private final Map<String, ExpectedDeathInfo> expectedByHospital;

    private InMemoryTimeSeriesStore(Builder builder) {
        List<MonthlyRecord> sorted = new ArrayList<>(builder.records.values());
        sorted.sort(ORDER);
        this.records = Collections.unmodifiableList(sorted);
        this.expectedByKey = Map.copyOf(builder.expectedByKey);
        this.expectedByHospital = Map.copyOf(builder.expectedByHospital);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public List<MonthlyRecord> fetchMonthlyRecords(String hospitalName, YearMonth startPeriod,
                                                   YearMonth endPeriod) {
        return records.stream()
                .filter(r -> hospitalName == null || r.getHospitalName().equals(hospitalName))
                .filter(r -> startPeriod == null || !r.getPeriod().isBefore(startPeriod))
                .filter(r -> endPeriod == null || !r.getPeriod().isAfter(endPeriod))
                .toList();
    }

    @Override
    public Optional<ExpectedDeathInfo> fetchExpectedDeathInfo(String hospitalName, YearMonth period) {
        ExpectedDeathInfo exact = expectedByKey.get(key(hospitalName, period));
        if (exact != null) {
            return Optional.of(exact);
        }
        return Optional.ofNullable(expectedByHospital.get(hospitalName));
    }

    private static String key(String hospitalName, YearMonth period) {
        return hospitalName + '|' + period;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link InMemoryTimeSeriesStore}.
     */
    public static class Builder {
        private final Map<String, MonthlyRecord> records = new HashMap<>();
        private final Map<String, ExpectedDeathInfo> expectedByKey = new HashMap<>();
        private final Map<String, ExpectedDeathInfo> expectedByHospital = new HashMap<>();

        public Builder record(MonthlyRecord record) {
            Objects.requireNonNull(record, "record must not be null");
            records.put(key(record.getHospitalName(), record.getPeriod()), record);
            return this;
        }

        public Builder record(String hospitalName, YearMonth period, int totalPatients, int deaths) {
            return record(new MonthlyRecord(hospitalName, period, totalPatients, deaths));
        }

        public Builder records(Iterable<MonthlyRecord> records) {
            records.forEach(this::record);
            return this;
        }

        /**
         * Expected death percentage for one hospital-month.
         */
        public Builder expectedDeaths(String hospitalName, YearMonth period, double percentage) {
            Objects.requireNonNull(hospitalName, "hospitalName must not be null");
            Objects.requireNonNull(period, "period must not be null");
            expectedByKey.put(key(hospitalName, period), new ExpectedDeathInfo(percentage));
            return this;
        }

        /**
         * Expected death percentage applying to every period of a hospital that
         * has no month-specific value.
         */
        public Builder expectedDeaths(String hospitalName, double percentage) {
            Objects.requireNonNull(hospitalName, "hospitalName must not be null");
            expectedByHospital.put(hospitalName, new ExpectedDeathInfo(percentage));
            return this;
        }

        public InMemoryTimeSeriesStore build() {
            return new InMemoryTimeSeriesStore(this);
        }
    }
}
