package com.mortalitysentinel.service;

import com.mortalitysentinel.core.config.ModelCatalog;
import com.mortalitysentinel.core.config.ModelCatalogLoader;
import com.mortalitysentinel.core.engine.ErrorKind;
import com.mortalitysentinel.core.engine.EvaluationOutcome;
import com.mortalitysentinel.core.engine.RuleEngine;
import com.mortalitysentinel.core.model.ExpectedDeathInfo;
import com.mortalitysentinel.core.model.MonthlyRecord;
import com.mortalitysentinel.core.store.DataUnavailableException;
import com.mortalitysentinel.core.store.InMemoryTimeSeriesStore;
import com.mortalitysentinel.core.store.TimeSeriesStore;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ModelEvaluationService}.
 */
class ModelEvaluationServiceTest {

    private static ModelCatalog catalog;

    @BeforeAll
    static void loadCatalog() {
        catalog = new ModelCatalog(ModelCatalogLoader.fromClasspath(ModelCatalogLoader.DEFAULT_RESOURCE));
    }

    @Test
    @DisplayName("Should return the engine's outcome within the deadline")
    void shouldEvaluateWithinDeadline() {
        InMemoryTimeSeriesStore store = InMemoryTimeSeriesStore.builder()
                .record("Alpha", YearMonth.of(2024, 1), 100, 5)
                .record("Alpha", YearMonth.of(2024, 2), 100, 5)
                .record("Alpha", YearMonth.of(2024, 3), 100, 5)
                .record("Alpha", YearMonth.of(2024, 4), 100, 9)
                .build();

        try (ModelEvaluationService service = service(store, Duration.ofSeconds(5))) {
            EvaluationOutcome outcome = service.evaluate("model1");

            assertThat(outcome.isSuccess()).isTrue();
            assertThat(outcome.getAlerts()).hasSize(1);
        }
    }

    @Test
    @DisplayName("Slow store should be reported as data unavailable after the deadline")
    void shouldTimeOutSlowStore() {
        try (ModelEvaluationService service = service(new BlockingStore(), Duration.ofMillis(200))) {
            long start = System.nanoTime();
            EvaluationOutcome outcome = service.evaluate("model10");

            assertThat(outcome.getErrorKind()).contains(ErrorKind.DATA_UNAVAILABLE);
            assertThat(outcome.getErrorMessage()).hasValueSatisfying(m -> assertThat(m).contains("timed out"));
            assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
        }
    }

    @Test
    @DisplayName("Unknown model should be reported without using the pool")
    void shouldReportUnknownModel() {
        try (ModelEvaluationService service = service(new BlockingStore(), Duration.ofMillis(200))) {
            assertThat(service.evaluate("model42").getErrorKind()).contains(ErrorKind.UNKNOWN_MODEL);
            assertThat(service.listModels()).hasSize(13);
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static ModelEvaluationService service(TimeSeriesStore store, Duration timeout) {
        return new ModelEvaluationService(new RuleEngine(catalog, store), complexity -> timeout, 2);
    }

    /**
     * Store whose queries block until interrupted.
     */
    private static final class BlockingStore implements TimeSeriesStore {
        private final CountDownLatch never = new CountDownLatch(1);

        @Override
        public List<MonthlyRecord> fetchMonthlyRecords(String hospitalName, YearMonth startPeriod,
                                                       YearMonth endPeriod) {
            try {
                never.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw new DataUnavailableException("query abandoned");
        }

        @Override
        public Optional<ExpectedDeathInfo> fetchExpectedDeathInfo(String hospitalName, YearMonth period) {
            return Optional.empty();
        }
    }
}
