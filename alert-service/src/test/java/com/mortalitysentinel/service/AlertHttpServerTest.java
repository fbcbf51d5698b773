package com.mortalitysentinel.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mortalitysentinel.core.config.ModelCatalog;
import com.mortalitysentinel.core.config.ModelCatalogLoader;
import com.mortalitysentinel.core.engine.RuleEngine;
import com.mortalitysentinel.core.format.ChatMessageFormatter;
import com.mortalitysentinel.core.store.TimeSeriesStore;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * HTTP-level tests of {@link AlertHttpServer} over the CSV fixtures in
 * {@code src/test/resources/data}.
 */
class AlertHttpServerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final HttpClient CLIENT = HttpClient.newHttpClient();

    private static ModelCatalog catalog;
    private static ModelEvaluationService evaluationService;
    private static AlertHttpServer server;

    @BeforeAll
    static void startServer() throws Exception {
        catalog = new ModelCatalog(ModelCatalogLoader.fromClasspath(ModelCatalogLoader.DEFAULT_RESOURCE));
        Path dataDir = Path.of(AlertHttpServerTest.class.getResource("/data").toURI());
        TimeSeriesStore store = new CsvTimeSeriesStore(dataDir);
        evaluationService = new ModelEvaluationService(new RuleEngine(catalog, store),
                complexity -> Duration.ofSeconds(10), 2);
        server = newServer(evaluationService, store);
        server.start(0);
    }

    @AfterAll
    static void stopServer() {
        server.stop();
        evaluationService.close();
    }

    @Test
    @DisplayName("Health and readiness should report UP")
    void shouldReportHealth() throws Exception {
        assertThat(get("/health").body()).isEqualTo("{\"status\":\"UP\"}");
        assertThat(get("/readiness").statusCode()).isEqualTo(200);
    }

    @Test
    @DisplayName("Should list the catalog models")
    void shouldListModels() throws Exception {
        JsonNode models = json(get("/api/models"));

        assertThat(models).hasSize(13);
        assertThat(models.get(0).get("id").asText()).isEqualTo("model1");
        assertThat(models.get(9).get("display_name").asText()).contains("Highest");
    }

    @Test
    @DisplayName("Should return ordered results for the latest period")
    void shouldReturnResults() throws Exception {
        HttpResponse<String> response = get("/api/models/model10/results");
        JsonNode body = json(response);

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(body.get("model_id").asText()).isEqualTo("model10");
        assertThat(body.get("current_period").asText()).isEqualTo("2024-07");
        JsonNode results = body.get("results");
        assertThat(results).hasSize(2);
        assertThat(results.get(0).get("hospital_name").asText()).isEqualTo("General Hospital");
        assertThat(results.get(0).get("status").asText()).isEqualTo("Alert");
        assertThat(results.get(0).get("mortality_rate").asDouble()).isEqualTo(4.0);
        assertThat(results.get(0).get("last_6_months_mortality")).hasSize(6);
        assertThat(results.get(1).get("hospital_name").asText()).isEqualTo("City Clinic");
        assertThat(results.get(1).get("status").asText()).isEqualTo("Normal");
    }

    @Test
    @DisplayName("SMR results should use expected deaths from the CSV fixture")
    void shouldReturnSmrResults() throws Exception {
        JsonNode results = json(get("/api/models/model6/results")).get("results");

        assertThat(results).hasSize(1);
        assertThat(results.get(0).get("hospital_name").asText()).isEqualTo("General Hospital");
        assertThat(results.get(0).get("smr").asDouble()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("End period should move the current period back")
    void shouldHonourEndPeriod() throws Exception {
        JsonNode body = json(get("/api/models/model9/results?end=2024-06"));

        assertThat(body.get("current_period").asText()).isEqualTo("2024-06");
        assertThat(body.get("results").get(0).get("deaths").asInt()).isEqualTo(24);
    }

    @Test
    @DisplayName("Malformed end period should be a bad request")
    void shouldRejectMalformedEnd() throws Exception {
        assertThat(get("/api/models/model10/results?end=June").statusCode()).isEqualTo(400);
    }

    @Test
    @DisplayName("Unknown model should be not found")
    void shouldReturnNotFoundForUnknownModel() throws Exception {
        HttpResponse<String> response = get("/api/models/model99/results");

        assertThat(response.statusCode()).isEqualTo(404);
        assertThat(json(response).get("error").asText()).contains("model99");
    }

    @Test
    @DisplayName("Export should return a CSV attachment")
    void shouldExportCsv() throws Exception {
        HttpResponse<String> response = get("/api/models/model10/export");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(
                v -> assertThat(v).startsWith("text/csv"));
        assertThat(response.headers().firstValue("Content-Disposition")).hasValueSatisfying(
                v -> assertThat(v).contains("model10_results_2024-07.csv"));
        String[] lines = response.body().split("\n");
        assertThat(lines).hasSize(3);
        assertThat(lines[0]).startsWith("hospital_name,current_period,status");
        assertThat(lines[1]).startsWith("General Hospital,2024-07,Alert");
    }

    @Test
    @DisplayName("Alert without a webhook should report a bad gateway")
    void shouldReportUndeliverableAlert() throws Exception {
        HttpResponse<String> response = CLIENT.send(request("/api/models/model10/alert")
                .POST(HttpRequest.BodyPublishers.noBody()).build(), HttpResponse.BodyHandlers.ofString());

        assertThat(response.statusCode()).isEqualTo(502);
        JsonNode body = json(response);
        assertThat(body.get("success").asBoolean()).isFalse();
        assertThat(body.get("hospitals_count").asInt()).isZero();
    }

    @Test
    @DisplayName("Alert endpoint should only accept POST")
    void shouldRejectGetOnAlert() throws Exception {
        assertThat(get("/api/models/model10/alert").statusCode()).isEqualTo(405);
    }

    @Test
    @DisplayName("Should list hospitals in name order")
    void shouldListHospitals() throws Exception {
        JsonNode hospitals = json(get("/api/hospitals"));

        assertThat(hospitals).extracting(JsonNode::asText)
                .containsExactly("City Clinic", "General Hospital", "Riverside");
    }

    @Test
    @DisplayName("Should return a hospital's monthly series with statistics")
    void shouldReturnMortalityData() throws Exception {
        JsonNode body = json(get("/api/mortality-data?hospital_name=General%20Hospital"
                + "&start_date=2024-02-01&end_date=2024-07-31"));

        JsonNode monthly = body.get("monthly_data");
        assertThat(monthly).hasSize(6);
        assertThat(monthly.get(0).get("date").asText()).isEqualTo("2024-02-01");
        assertThat(monthly.get(0).get("total_patients").asInt()).isEqualTo(1000);
        assertThat(monthly.get(5).get("mortality_rate").asDouble()).isEqualTo(4.0);
        assertThat(body.get("statistics").get("count").asInt()).isEqualTo(6);
        assertThat(body.get("statistics").get("threshold").asDouble())
                .isGreaterThan(body.get("statistics").get("mean").asDouble());
    }

    @Test
    @DisplayName("Malformed dates and a missing hospital should be bad requests")
    void shouldRejectBadMortalityQuery() throws Exception {
        assertThat(get("/api/mortality-data?hospital_name=Riverside&start_date=2024-13-01").statusCode())
                .isEqualTo(400);
        assertThat(get("/api/mortality-data?start_date=2024-01-01").statusCode()).isEqualTo(400);
    }

    @Test
    @DisplayName("Unreadable data should be reported as service unavailable")
    void shouldReportUnavailableData(@TempDir Path emptyDir) throws Exception {
        TimeSeriesStore store = new CsvTimeSeriesStore(emptyDir);
        try (ModelEvaluationService service = new ModelEvaluationService(new RuleEngine(catalog, store),
                complexity -> Duration.ofSeconds(10), 1)) {
            AlertHttpServer unavailable = newServer(service, store);
            unavailable.start(0);
            try {
                HttpResponse<String> results = CLIENT.send(HttpRequest.newBuilder(URI.create(
                                "http://127.0.0.1:" + unavailable.getPort() + "/api/models/model1/results")).build(),
                        HttpResponse.BodyHandlers.ofString());
                HttpResponse<String> hospitals = CLIENT.send(HttpRequest.newBuilder(URI.create(
                                "http://127.0.0.1:" + unavailable.getPort() + "/api/hospitals")).build(),
                        HttpResponse.BodyHandlers.ofString());

                assertThat(results.statusCode()).isEqualTo(503);
                assertThat(hospitals.statusCode()).isEqualTo(503);
            } finally {
                unavailable.stop();
            }
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static AlertHttpServer newServer(ModelEvaluationService service, TimeSeriesStore store) {
        AlertDispatcher dispatcher = new AlertDispatcher(service, new ChatMessageFormatter(),
                new GoogleChatNotifier(null, Duration.ofSeconds(2)));
        return new AlertHttpServer(service, store, dispatcher);
    }

    private static HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.getPort() + path))
                .timeout(Duration.ofSeconds(10));
    }

    private static HttpResponse<String> get(String path) throws IOException, InterruptedException {
        return CLIENT.send(request(path).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    private static JsonNode json(HttpResponse<String> response) throws IOException {
        return MAPPER.readTree(response.body());
    }
}
