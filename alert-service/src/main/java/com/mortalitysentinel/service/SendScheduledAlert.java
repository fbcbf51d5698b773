package com.mortalitysentinel.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One-shot command that evaluates a model and sends its chat alert, for
 * cron-driven weekly runs.
 *
 * <p>
 * Usage: {@code SendScheduledAlert [model_id]}, default
 * {@value #DEFAULT_MODEL_ID}. Exits {@code 0} when the message was
 * delivered and {@code 1} otherwise.
 * </p>
 *
 * @since 1.0.0
 */
public final class SendScheduledAlert {

    private static final Logger LOG = LoggerFactory.getLogger(SendScheduledAlert.class);

    public static final String DEFAULT_MODEL_ID = "model10";

    private SendScheduledAlert() {
        // entry-point class
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * @return process exit code
     */
    static int run(String[] args) {
        String modelId = args.length > 0 && !args[0].isBlank() ? args[0].trim() : DEFAULT_MODEL_ID;
        LOG.info("Sending scheduled alert for model [{}]", modelId);

        DispatchReport report;
        try (AlertServiceContext context = AlertServiceContext.create(ServiceConfig.fromEnvironment())) {
            report = context.getDispatcher().dispatch(modelId);
        } catch (RuntimeException e) {
            LOG.error("Scheduled alert for model [{}] could not start: {}", modelId, e.getMessage(), e);
            return 1;
        }

        if (report.isSuccess()) {
            LOG.info("Scheduled alert for model [{}] sent: {}", modelId, report.getMessage());
            return 0;
        }
        LOG.error("Scheduled alert for model [{}] failed: {}", modelId, report.getMessage());
        return 1;
    }
}
