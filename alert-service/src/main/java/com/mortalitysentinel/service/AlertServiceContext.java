package com.mortalitysentinel.service;

import com.mortalitysentinel.core.config.ModelCatalog;
import com.mortalitysentinel.core.config.ModelCatalogConfig;
import com.mortalitysentinel.core.config.ModelCatalogLoader;
import com.mortalitysentinel.core.engine.RuleEngine;
import com.mortalitysentinel.core.format.ChatMessageFormatter;
import com.mortalitysentinel.core.store.TimeSeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Wires the engine and its collaborators from a {@link ServiceConfig}.
 * Shared by the long-running service and the one-shot alert command.
 *
 * @since 1.0.0
 */
public final class AlertServiceContext implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AlertServiceContext.class);

    private final TimeSeriesStore store;
    private final ModelEvaluationService evaluationService;
    private final AlertDispatcher dispatcher;

    AlertServiceContext(TimeSeriesStore store, ModelEvaluationService evaluationService,
                        AlertDispatcher dispatcher) {
        this.store = store;
        this.evaluationService = evaluationService;
        this.dispatcher = dispatcher;
    }

    /**
     * @param config service configuration; must not be {@code null}
     * @return the wired context
     * @throws IllegalStateException if the model catalog is invalid
     */
    public static AlertServiceContext create(ServiceConfig config) {
        Objects.requireNonNull(config, "config must not be null");

        ModelCatalog catalog = new ModelCatalog(loadCatalog(config));
        TimeSeriesStore store = new CsvTimeSeriesStore(Path.of(config.getDataDir()));
        ModelEvaluationService evaluationService = new ModelEvaluationService(new RuleEngine(catalog, store), config);

        GoogleChatNotifier notifier = new GoogleChatNotifier(config.getGoogleChatWebhookUrl(),
                config.getWebhookTimeout());
        if (!notifier.isConfigured()) {
            LOG.warn("GOOGLE_CHAT_WEBHOOK_URL is not set; chat alerts will not be delivered");
        }
        AlertDispatcher dispatcher = new AlertDispatcher(evaluationService, new ChatMessageFormatter(), notifier);

        return new AlertServiceContext(store, evaluationService, dispatcher);
    }

    public TimeSeriesStore getStore() {
        return store;
    }

    public ModelEvaluationService getEvaluationService() {
        return evaluationService;
    }

    public AlertDispatcher getDispatcher() {
        return dispatcher;
    }

    @Override
    public void close() {
        evaluationService.close();
    }

    private static ModelCatalogConfig loadCatalog(ServiceConfig config) {
        String path = config.getModelsConfigPath();
        if (path != null && !path.isBlank()) {
            return ModelCatalogLoader.fromFile(path);
        }
        return ModelCatalogLoader.load();
    }
}
