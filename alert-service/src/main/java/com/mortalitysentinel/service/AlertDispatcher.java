package com.mortalitysentinel.service;

import com.mortalitysentinel.core.engine.EvaluationOutcome;
import com.mortalitysentinel.core.engine.EvaluationRequest;
import com.mortalitysentinel.core.format.ChatMessage;
import com.mortalitysentinel.core.format.ChatMessageFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Evaluates a model and delivers its alerts to the chat webhook.
 *
 * <p>
 * Alerts whose deaths rose by {@value #MIN_DEATH_INCREASE} or fewer since
 * the previous month are not sent. When nothing alerts an all-clear message
 * is delivered instead. {@link #dispatch(String)} never throws; every failure
 * is reported in the returned {@link DispatchReport}.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(AlertDispatcher.class);

    public static final int MIN_DEATH_INCREASE = 2;

    private final ModelEvaluationService evaluationService;
    private final ChatMessageFormatter formatter;
    private final GoogleChatNotifier notifier;

    public AlertDispatcher(ModelEvaluationService evaluationService, ChatMessageFormatter formatter,
                           GoogleChatNotifier notifier) {
        this.evaluationService = Objects.requireNonNull(evaluationService, "evaluationService must not be null");
        this.formatter = Objects.requireNonNull(formatter, "formatter must not be null");
        this.notifier = Objects.requireNonNull(notifier, "notifier must not be null");
    }

    /**
     * @param modelId catalog id of the model to alert on
     * @return delivery report; never {@code null}
     */
    public DispatchReport dispatch(String modelId) {
        try {
            EvaluationOutcome outcome = evaluationService.evaluate(modelId,
                    EvaluationRequest.latest().withMinDeathIncrease(MIN_DEATH_INCREASE));
            if (!outcome.isSuccess()) {
                String error = outcome.getErrorMessage().orElse("evaluation failed");
                LOG.warn("Alert for model [{}] not sent: {}", modelId, error);
                return DispatchReport.failed(error);
            }

            ChatMessage message = formatter.format(outcome);
            notifier.send(message);

            int alerts = outcome.getAlerts().size();
            LOG.info("Alert for model [{}] sent: {} hospital(s) alerting", modelId, alerts);
            return DispatchReport.delivered(alerts == 0
                    ? "No alerts for " + modelId + "; all-clear message sent"
                    : "Alert sent for " + alerts + " hospital(s)", alerts);
        } catch (AlertDeliveryException e) {
            LOG.error("Alert for model [{}] could not be delivered: {}", modelId, e.getMessage(), e);
            return DispatchReport.failed("Delivery failed: " + e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Alert for model [{}] failed: {}", modelId, e.getMessage(), e);
            return DispatchReport.failed("Alert failed: " + e.getMessage());
        }
    }
}
