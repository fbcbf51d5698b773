package com.mortalitysentinel.service;

/**
 * Raised when a chat message could not be delivered to the webhook.
 *
 * @since 1.0.0
 */
public class AlertDeliveryException extends Exception {

    private static final long serialVersionUID = 1L;

    public AlertDeliveryException(String message) {
        super(message);
    }

    public AlertDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
