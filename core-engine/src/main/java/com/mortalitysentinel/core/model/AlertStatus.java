package com.mortalitysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of one hospital for one model.
 *
 * @since 1.0.0
 */
public enum AlertStatus {
    ALERT("Alert"),
    NORMAL("Normal");

    private final String label;

    AlertStatus(String label) {
        this.label = label;
    }

    /**
     * @return the label used in exports and messages ({@code Alert} or
     *         {@code Normal})
     */
    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Parse an exported label back into a status, ignoring case.
     *
     * @param label {@code Alert} or {@code Normal}
     * @return matching status
     * @throws IllegalArgumentException if the label is not recognised
     */
    @JsonCreator
    public static AlertStatus fromLabel(String label) {
        for (AlertStatus status : values()) {
            if (status.label.equalsIgnoreCase(label)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown alert status: '" + label + "'");
    }

    @Override
    public String toString() {
        return label;
    }
}
