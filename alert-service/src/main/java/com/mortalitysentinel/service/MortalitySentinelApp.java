package com.mortalitysentinel.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point of the Mortality Sentinel alert service.
 *
 * <h3>Startup</h3>
 * <pre>
 *   environment → ServiceConfig
 *     → models.yml → ModelCatalog
 *     → DATA_DIR CSV files → CsvTimeSeriesStore
 *     → RuleEngine on a worker pool
 *     → HTTP API on HTTP_PORT
 * </pre>
 *
 * <p>
 * The process runs until terminated; a shutdown hook stops the HTTP server
 * and the evaluation pool.
 * </p>
 *
 * @since 1.0.0
 */
public final class MortalitySentinelApp {

    private static final Logger LOG = LoggerFactory.getLogger(MortalitySentinelApp.class);

    private MortalitySentinelApp() {
        // entry-point class
    }

    public static void main(String[] args) {
        // 1. Load configuration
        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("Starting Mortality Sentinel with config: {}", config);

        // 2. Load models and wire the engine
        AlertServiceContext context = AlertServiceContext.create(config);

        // 3. Start the HTTP API with shutdown hook
        AlertHttpServer httpServer = new AlertHttpServer(context.getEvaluationService(), context.getStore(),
                context.getDispatcher());
        httpServer.start(config.getHttpPort());
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            httpServer.stop();
            context.close();
        }, "service-shutdown"));
    }
}
