package com.mortalitysentinel.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Outcome of one alert dispatch: whether the message was delivered, a
 * human-readable message and the number of alerting hospitals.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"success", "message", "hospitals_count"})
public final class DispatchReport {

    private final boolean success;
    private final String message;
    private final int hospitalsCount;

    private DispatchReport(boolean success, String message, int hospitalsCount) {
        this.success = success;
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.hospitalsCount = hospitalsCount;
    }

    public static DispatchReport delivered(String message, int hospitalsCount) {
        return new DispatchReport(true, message, hospitalsCount);
    }

    public static DispatchReport failed(String message) {
        return new DispatchReport(false, message, 0);
    }

    @JsonProperty("success")
    public boolean isSuccess() {
        return success;
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
    }

    @JsonProperty("hospitals_count")
    public int getHospitalsCount() {
        return hospitalsCount;
    }

    @Override
    public String toString() {
        return "DispatchReport{success=" + success + ", message='" + message + "', hospitalsCount="
                + hospitalsCount + '}';
    }
}
