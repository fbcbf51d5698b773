package com.mortalitysentinel.core.store;

import com.mortalitysentinel.core.model.ExpectedDeathInfo;
import com.mortalitysentinel.core.model.MonthlyRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.YearMonth;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link InMemoryTimeSeriesStore}.
 */
class InMemoryTimeSeriesStoreTest {

    private static final YearMonth JAN = YearMonth.of(2024, 1);

    private final InMemoryTimeSeriesStore store = InMemoryTimeSeriesStore.builder()
            .record("Beta", JAN.plusMonths(1), 100, 2)
            .record("Alpha", JAN.plusMonths(2), 100, 3)
            .record("Alpha", JAN, 100, 1)
            .record("Beta", JAN, 100, 1)
            .expectedDeaths("Alpha", JAN, 1.5)
            .expectedDeaths("Alpha", 2.0)
            .build();

    @Test
    @DisplayName("Should order records by hospital then period")
    void shouldOrderRecords() {
        assertThat(store.fetchMonthlyRecords(null, null, null))
                .extracting(r -> r.getHospitalName() + "@" + r.getPeriod())
                .containsExactly("Alpha@2024-01", "Alpha@2024-03", "Beta@2024-01", "Beta@2024-02");
    }

    @Test
    @DisplayName("Should filter by hospital and inclusive period bounds")
    void shouldFilterRecords() {
        assertThat(store.fetchMonthlyRecords("Alpha", JAN.plusMonths(1), JAN.plusMonths(2)))
                .extracting(MonthlyRecord::getDeaths)
                .containsExactly(3);
        assertThat(store.fetchMonthlyRecords(null, null, JAN)).hasSize(2);
    }

    @Test
    @DisplayName("Later record for the same hospital and month should replace the earlier one")
    void shouldReplaceDuplicateRecord() {
        InMemoryTimeSeriesStore replaced = InMemoryTimeSeriesStore.builder()
                .record("Alpha", JAN, 100, 1)
                .record("Alpha", JAN, 100, 9)
                .build();

        assertThat(replaced.fetchMonthlyRecords(null, null, null))
                .singleElement()
                .extracting(MonthlyRecord::getDeaths)
                .isEqualTo(9);
    }

    @Test
    @DisplayName("Month-specific expected deaths should win over the hospital-wide value")
    void shouldResolveExpectedDeaths() {
        assertThat(store.fetchExpectedDeathInfo("Alpha", JAN)).contains(new ExpectedDeathInfo(1.5));
        assertThat(store.fetchExpectedDeathInfo("Alpha", JAN.plusMonths(5))).contains(new ExpectedDeathInfo(2.0));
        assertThat(store.fetchExpectedDeathInfo("Beta", JAN)).isEmpty();
    }

    @Test
    @DisplayName("Should list distinct hospitals in name order")
    void shouldListHospitals() {
        assertThat(store.listHospitals()).containsExactly("Alpha", "Beta");
    }
}
