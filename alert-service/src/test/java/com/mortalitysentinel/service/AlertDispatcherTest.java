package com.mortalitysentinel.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mortalitysentinel.core.config.ModelCatalog;
import com.mortalitysentinel.core.config.ModelCatalogLoader;
import com.mortalitysentinel.core.engine.RuleEngine;
import com.mortalitysentinel.core.format.ChatMessageFormatter;
import com.mortalitysentinel.core.store.InMemoryTimeSeriesStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.YearMonth;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests {@link AlertDispatcher} end to end against a local webhook.
 */
class AlertDispatcherTest {

    private static final YearMonth START = YearMonth.of(2024, 1);

    private static ModelCatalog catalog;

    private WebhookRecorder webhook;
    private ModelEvaluationService evaluationService;

    @BeforeAll
    static void loadCatalog() {
        catalog = new ModelCatalog(ModelCatalogLoader.fromClasspath(ModelCatalogLoader.DEFAULT_RESOURCE));
    }

    @BeforeEach
    void setUp() throws IOException {
        webhook = new WebhookRecorder();
    }

    @AfterEach
    void tearDown() {
        webhook.close();
        if (evaluationService != null) {
            evaluationService.close();
        }
    }

    @Test
    @DisplayName("Should send alerting hospitals and report their count")
    void shouldSendAlerts() throws Exception {
        InMemoryTimeSeriesStore.Builder store = InMemoryTimeSeriesStore.builder();
        series(store, "Alpha", 5, 5, 5, 9);
        series(store, "Beta", 5, 5, 5, 5);

        DispatchReport report = dispatcher(store, webhook.url()).dispatch("model1");

        assertThat(report.isSuccess()).isTrue();
        assertThat(report.getHospitalsCount()).isEqualTo(1);
        String text = postedText();
        assertThat(text).contains("*Hospitals with Alerts: 1*", "*1. Alpha*");
        assertThat(text).doesNotContain("Beta");
    }

    @Test
    @DisplayName("Alerts with a death increase of two or less should not be sent")
    void shouldApplyDeathIncreaseFilter() throws Exception {
        InMemoryTimeSeriesStore.Builder store = InMemoryTimeSeriesStore.builder();
        series(store, "Alpha", 5, 5, 5, 7);

        DispatchReport report = dispatcher(store, webhook.url()).dispatch("model1");

        assertThat(report.isSuccess()).isTrue();
        assertThat(report.getHospitalsCount()).isZero();
        assertThat(postedText()).startsWith("✅").contains("No hospital has a mortality rate");
    }

    @Test
    @DisplayName("Unknown model should fail without posting")
    void shouldFailForUnknownModel() {
        DispatchReport report = dispatcher(InMemoryTimeSeriesStore.builder(), webhook.url()).dispatch("model77");

        assertThat(report.isSuccess()).isFalse();
        assertThat(report.getMessage()).contains("model77");
        assertThat(webhook.bodies()).isEmpty();
    }

    @Test
    @DisplayName("Webhook error should be reported, not thrown")
    void shouldReportDeliveryFailure() {
        webhook.respondWith(503);
        InMemoryTimeSeriesStore.Builder store = InMemoryTimeSeriesStore.builder();
        series(store, "Alpha", 5, 5, 5, 9);

        DispatchReport report = dispatcher(store, webhook.url()).dispatch("model1");

        assertThat(report.isSuccess()).isFalse();
        assertThat(report.getMessage()).startsWith("Delivery failed").contains("503");
    }

    @Test
    @DisplayName("Unconfigured webhook should be reported, not thrown")
    void shouldReportMissingWebhook() {
        InMemoryTimeSeriesStore.Builder store = InMemoryTimeSeriesStore.builder();
        series(store, "Alpha", 5, 5, 5, 9);

        DispatchReport report = dispatcher(store, "").dispatch("model1");

        assertThat(report.isSuccess()).isFalse();
        assertThat(report.getMessage()).contains("not configured");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private AlertDispatcher dispatcher(InMemoryTimeSeriesStore.Builder store, String webhookUrl) {
        evaluationService = new ModelEvaluationService(new RuleEngine(catalog, store.build()),
                complexity -> Duration.ofSeconds(10), 1);
        return new AlertDispatcher(evaluationService, new ChatMessageFormatter(),
                new GoogleChatNotifier(webhookUrl, Duration.ofSeconds(5)));
    }

    private String postedText() throws IOException {
        assertThat(webhook.bodies()).hasSize(1);
        return new ObjectMapper().readTree(webhook.bodies().get(0)).get("text").asText();
    }

    private static void series(InMemoryTimeSeriesStore.Builder store, String hospital, int... deaths) {
        for (int i = 0; i < deaths.length; i++) {
            store.record(hospital, START.plusMonths(i), 1000, deaths[i]);
        }
    }
}
