package com.mortalitysentinel.core.store;

/**
 * Thrown by a {@link TimeSeriesStore} when its backing source cannot be read.
 *
 * @since 1.0.0
 */
public class DataUnavailableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DataUnavailableException(String message) {
        super(message);
    }

    public DataUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
