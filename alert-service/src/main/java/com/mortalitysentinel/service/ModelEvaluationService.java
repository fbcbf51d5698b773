package com.mortalitysentinel.service;

import com.mortalitysentinel.core.engine.ErrorKind;
import com.mortalitysentinel.core.engine.EvaluationOutcome;
import com.mortalitysentinel.core.engine.EvaluationRequest;
import com.mortalitysentinel.core.engine.RuleEngine;
import com.mortalitysentinel.core.model.ComplexityClass;
import com.mortalitysentinel.core.model.ModelDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Runs {@link RuleEngine} evaluations on a bounded worker pool with a
 * deadline per model complexity class.
 *
 * <p>
 * A slow store query never blocks the caller past the deadline: a timed-out
 * evaluation is cancelled and reported as
 * {@link ErrorKind#DATA_UNAVAILABLE}.
 * </p>
 *
 * @since 1.0.0
 */
public class ModelEvaluationService implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ModelEvaluationService.class);

    private final RuleEngine engine;
    private final Function<ComplexityClass, Duration> timeouts;
    private final ExecutorService executor;

    /**
     * @param engine   the rule engine; must not be {@code null}
     * @param timeouts deadline per complexity class; must not be {@code null}
     * @param threads  worker pool size; must be {@code >= 1}
     */
    public ModelEvaluationService(RuleEngine engine, Function<ComplexityClass, Duration> timeouts, int threads) {
        this.engine = Objects.requireNonNull(engine, "RuleEngine must not be null");
        this.timeouts = Objects.requireNonNull(timeouts, "timeouts must not be null");
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1, got: " + threads);
        }
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "model-evaluation-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public ModelEvaluationService(RuleEngine engine, ServiceConfig config) {
        this(engine, config::timeoutFor, config.getEvaluationThreads());
    }

    public List<ModelDefinition> listModels() {
        return engine.listModels();
    }

    public EvaluationOutcome evaluate(String modelId) {
        return evaluate(modelId, EvaluationRequest.latest());
    }

    /**
     * Evaluate a model within the deadline of its complexity class.
     *
     * @return the engine's outcome, or a {@code DATA_UNAVAILABLE} failure on
     *         timeout; never {@code null}
     */
    public EvaluationOutcome evaluate(String modelId, EvaluationRequest request) {
        Objects.requireNonNull(request, "EvaluationRequest must not be null");
        ModelDefinition definition = engine.findModel(modelId).orElse(null);
        if (definition == null) {
            return engine.evaluate(modelId, request);
        }

        Duration timeout = timeouts.apply(definition.getComplexityClass());
        Future<EvaluationOutcome> future = executor.submit(() -> engine.evaluate(modelId, request));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warn("Model [{}] ({}) evaluation timed out after {} ms", modelId,
                    definition.getComplexityClass(), timeout.toMillis());
            return EvaluationOutcome.failure(modelId, ErrorKind.DATA_UNAVAILABLE,
                    "Evaluation of " + modelId + " timed out after " + timeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return EvaluationOutcome.failure(modelId, ErrorKind.INTERNAL_ERROR,
                    "Evaluation of " + modelId + " was interrupted");
        } catch (ExecutionException e) {
            LOG.error("Model [{}] evaluation failed: {}", modelId, e.getCause().getMessage(), e.getCause());
            return EvaluationOutcome.failure(modelId, ErrorKind.INTERNAL_ERROR,
                    "Evaluation of " + modelId + " failed: " + e.getCause().getMessage());
        }
    }

    /**
     * Stop accepting evaluations and interrupt running ones.
     */
    @Override
    public void close() {
        executor.shutdownNow();
        LOG.info("Model evaluation pool stopped");
    }
}
