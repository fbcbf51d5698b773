package com.mortalitysentinel.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mortalitysentinel.core.engine.ErrorKind;
import com.mortalitysentinel.core.engine.EvaluationOutcome;
import com.mortalitysentinel.core.engine.EvaluationRequest;
import com.mortalitysentinel.core.format.AlertCsvFormatter;
import com.mortalitysentinel.core.format.AlertJson;
import com.mortalitysentinel.core.model.ModelDefinition;
import com.mortalitysentinel.core.store.DataUnavailableException;
import com.mortalitysentinel.core.store.TimeSeriesStore;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP API of the alert service, on the JDK built-in {@link HttpServer}.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}, {@code GET /readiness}: {@code {"status":"UP"}}</li>
 * <li>{@code GET /api/models}: model ids and display names</li>
 * <li>{@code GET /api/models/{id}/results[?end=YYYY-MM]}: evaluation results
 * as JSON; 404 for an unknown model, 503 when data is unavailable</li>
 * <li>{@code GET /api/models/{id}/export[?end=YYYY-MM]}: the same results as
 * a CSV attachment</li>
 * <li>{@code POST /api/models/{id}/alert}: send the chat alert; 200 when
 * delivered, 502 otherwise</li>
 * <li>{@code GET /api/hospitals}: hospital names</li>
 * <li>{@code GET /api/mortality-data?hospital_name=&start_date=&end_date=}:
 * one hospital's monthly series with summary statistics</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class AlertHttpServer {

    private static final Logger LOG = LoggerFactory.getLogger(AlertHttpServer.class);

    private static final String JSON = "application/json; charset=utf-8";
    private static final String CSV = "text/csv; charset=utf-8";
    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);
    private static final String MODELS_PATH = "/api/models";

    private final ModelEvaluationService evaluationService;
    private final TimeSeriesStore store;
    private final AlertDispatcher dispatcher;
    private final AlertCsvFormatter csvFormatter = new AlertCsvFormatter();
    private final ObjectMapper mapper = AlertJson.newObjectMapper();

    private HttpServer server;
    private ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public AlertHttpServer(ModelEvaluationService evaluationService, TimeSeriesStore store,
                           AlertDispatcher dispatcher) {
        this.evaluationService = Objects.requireNonNull(evaluationService, "evaluationService must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
    }

    /**
     * Start the server.
     *
     * @param port TCP port to bind to, in [0, 65535]; {@code 0} picks a free
     *             port
     * @throws IllegalArgumentException if port is out of range
     * @throws UncheckedIOException     if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("HTTP port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to bind HTTP server on port " + port, e);
        }
        server.createContext("/health", AlertHttpServer::handleHealthCheck);
        server.createContext("/readiness", AlertHttpServer::handleHealthCheck);
        server.createContext(MODELS_PATH, guarded(this::handleModels));
        server.createContext("/api/hospitals", guarded(this::handleHospitals));
        server.createContext("/api/mortality-data", guarded(this::handleMortalityData));

        AtomicInteger counter = new AtomicInteger();
        executor = Executors.newFixedThreadPool(4, r -> {
            Thread t = new Thread(r, "http-server-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.start();
        running.set(true);
        LOG.info("HTTP server started on port {}", getPort());
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdownNow();
            LOG.info("HTTP server stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port
     * @throws IllegalStateException if the server was never started
     */
    public int getPort() {
        if (server == null) {
            throw new IllegalStateException("HTTP server not started");
        }
        return server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private static void handleHealthCheck(HttpExchange exchange) throws IOException {
        send(exchange, 200, JSON, HEALTH_RESPONSE);
    }

    private void handleModels(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        String rest = path.length() > MODELS_PATH.length() ? path.substring(MODELS_PATH.length() + 1) : "";
        if (rest.isEmpty()) {
            requireMethod(exchange, "GET");
            ArrayNode models = mapper.createArrayNode();
            for (ModelDefinition model : evaluationService.listModels()) {
                models.addObject()
                        .put("id", model.getId())
                        .put("display_name", model.getDisplayName());
            }
            sendJson(exchange, 200, models);
            return;
        }

        String[] segments = rest.split("/");
        if (segments.length != 2 || segments[0].isEmpty()) {
            throw new HttpError(404, "Not found: " + path);
        }
        String modelId = segments[0];
        switch (segments[1]) {
            case "results" -> {
                requireMethod(exchange, "GET");
                EvaluationOutcome outcome = evaluate(exchange, modelId);
                ObjectNode body = mapper.createObjectNode();
                body.put("model_id", modelId);
                body.put("display_name", outcome.getModel().map(ModelDefinition::getDisplayName).orElse(null));
                body.put("current_period", outcome.getCurrentPeriod().map(YearMonth::toString).orElse(null));
                body.set("results", mapper.valueToTree(outcome.getResults()));
                sendJson(exchange, 200, body);
            }
            case "export" -> {
                requireMethod(exchange, "GET");
                EvaluationOutcome outcome = evaluate(exchange, modelId);
                String period = outcome.getCurrentPeriod().map(YearMonth::toString).orElse("none");
                exchange.getResponseHeaders().set("Content-Disposition",
                        "attachment; filename=\"" + modelId + "_results_" + period + ".csv\"");
                send(exchange, 200, CSV,
                        csvFormatter.format(outcome.getResults()).getBytes(StandardCharsets.UTF_8));
            }
            case "alert" -> {
                requireMethod(exchange, "POST");
                DispatchReport report = dispatcher.dispatch(modelId);
                sendJson(exchange, report.isSuccess() ? 200 : 502, report);
            }
            default -> throw new HttpError(404, "Not found: " + path);
        }
    }

    private void handleHospitals(HttpExchange exchange) throws IOException {
        requireMethod(exchange, "GET");
        sendJson(exchange, 200, store.listHospitals());
    }

    private void handleMortalityData(HttpExchange exchange) throws IOException {
        requireMethod(exchange, "GET");
        Map<String, String> params = queryParams(exchange.getRequestURI());
        String hospitalName = params.get("hospital_name");
        if (hospitalName == null || hospitalName.isBlank()) {
            throw new HttpError(400, "Query parameter 'hospital_name' is required");
        }
        YearMonth start = parseDate(params.get("start_date"), "start_date");
        YearMonth end = parseDate(params.get("end_date"), "end_date");
        if (start != null && end != null && start.isAfter(end)) {
            throw new HttpError(400, "start_date must not be after end_date");
        }
        sendJson(exchange, 200, MortalityDataReport.of(hospitalName,
                store.fetchMonthlyRecords(hospitalName, start, end)));
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private EvaluationOutcome evaluate(HttpExchange exchange, String modelId) {
        EvaluationRequest request = EvaluationRequest.latest();
        String end = queryParams(exchange.getRequestURI()).get("end");
        if (end != null && !end.isBlank()) {
            try {
                request = request.withEndPeriod(YearMonth.parse(end.trim()));
            } catch (DateTimeParseException e) {
                throw new HttpError(400, "Invalid 'end' period, expected YYYY-MM: " + end);
            }
        }
        EvaluationOutcome outcome = evaluationService.evaluate(modelId, request);
        if (!outcome.isSuccess()) {
            ErrorKind kind = outcome.getErrorKind().orElse(ErrorKind.INTERNAL_ERROR);
            int status = switch (kind) {
                case UNKNOWN_MODEL -> 404;
                case DATA_UNAVAILABLE -> 503;
                case INTERNAL_ERROR -> 500;
            };
            throw new HttpError(status, outcome.getErrorMessage().orElse(kind.name()));
        }
        return outcome;
    }

    private static YearMonth parseDate(String value, String name) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return YearMonth.from(LocalDate.parse(value.trim()));
        } catch (DateTimeParseException e) {
            throw new HttpError(400, "Invalid '" + name + "', expected YYYY-MM-DD: " + value);
        }
    }

    private static void requireMethod(HttpExchange exchange, String method) {
        if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Allow", method);
            throw new HttpError(405, "Method " + exchange.getRequestMethod() + " not allowed");
        }
    }

    static Map<String, String> queryParams(URI uri) {
        Map<String, String> params = new HashMap<>();
        String query = uri.getRawQuery();
        if (query == null || query.isEmpty()) {
            return params;
        }
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            params.putIfAbsent(URLDecoder.decode(key, StandardCharsets.UTF_8),
                    URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }

    private HttpHandler guarded(Route route) {
        return exchange -> {
            try {
                route.handle(exchange);
            } catch (HttpError e) {
                LOG.debug("{} {} -> {}: {}", exchange.getRequestMethod(), exchange.getRequestURI(),
                        e.status, e.getMessage());
                sendError(exchange, e.status, e.getMessage());
            } catch (DataUnavailableException e) {
                LOG.error("{} {} failed, data unavailable: {}", exchange.getRequestMethod(),
                        exchange.getRequestURI(), e.getMessage(), e);
                sendError(exchange, 503, "Time-series data unavailable: " + e.getMessage());
            } catch (RuntimeException e) {
                LOG.error("{} {} failed: {}", exchange.getRequestMethod(), exchange.getRequestURI(),
                        e.getMessage(), e);
                sendError(exchange, 500, "Internal error: " + e.getMessage());
            } finally {
                exchange.close();
            }
        };
    }

    private void sendError(HttpExchange exchange, int status, String message) throws IOException {
        ObjectNode body = mapper.createObjectNode();
        body.put("error", message);
        sendJson(exchange, status, body);
    }

    private void sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        send(exchange, status, JSON, mapper.writeValueAsBytes(body));
    }

    private static void send(HttpExchange exchange, int status, String contentType, byte[] body)
            throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    @FunctionalInterface
    private interface Route {
        void handle(HttpExchange exchange) throws IOException;
    }

    /**
     * Request failure with the HTTP status to answer.
     */
    private static final class HttpError extends RuntimeException {
        private static final long serialVersionUID = 1L;
        private final int status;

        HttpError(int status, String message) {
            super(message);
            this.status = status;
        }
    }
}
