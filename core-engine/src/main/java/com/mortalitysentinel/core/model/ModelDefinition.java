package com.mortalitysentinel.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Describes a single alert model loaded from the model catalog.
 *
 * <p>
 * Twelve models form a grid of {@link Metric} &times; {@link Comparison}
 * &times; window length (3 or 6 months). The thirteenth uses
 * {@link Comparison#INCREASING_TREND}, which ignores the window and inspects
 * the current calendar month and the two months before it instead.
 * </p>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization to verify
 * that all required fields are present and legal.
 * </p>
 *
 * @since 1.0.0
 */
public class ModelDefinition implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Number of consecutive calendar months inspected by the trend model. */
    public static final int TREND_PERIODS = 3;

    /** Unique model id, e.g. {@code model10}. */
    private String id;

    /** Human-readable name shown in listings and messages. */
    private String displayName;

    private Metric metric;

    /** Baseline length in periods strictly before the current period. */
    private int windowMonths;

    private Comparison comparison;

    /** No-arg constructor required by SnakeYAML. */
    public ModelDefinition() {
    }

    public ModelDefinition(String id, String displayName, Metric metric, int windowMonths,
                           Comparison comparison) {
        this.id = id;
        this.displayName = displayName;
        this.metric = metric;
        this.windowMonths = windowMonths;
        this.comparison = comparison;
    }

    /**
     * @return a detached copy; changes to it never reach this instance
     */
    public ModelDefinition copy() {
        return new ModelDefinition(id, displayName, metric, windowMonths, comparison);
    }

    // ---------------------------------------------------------------
    // Derived properties
    // ---------------------------------------------------------------

    /**
     * @return {@code true} for the increasing-trend model
     */
    public boolean isTrend() {
        return comparison == Comparison.INCREASING_TREND;
    }

    /**
     * @return the cost bucket callers use to size evaluation timeouts
     */
    public ComplexityClass getComplexityClass() {
        if (metric == Metric.SMR) {
            return ComplexityClass.EXTENDED;
        }
        if (!isTrend() && windowMonths <= 3) {
            return ComplexityClass.SIMPLE;
        }
        return ComplexityClass.STANDARD;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that all required fields are present and contain legal values.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (id == null || id.isBlank()) {
            errors.add("Model 'id' is required");
        }
        if (displayName == null || displayName.isBlank()) {
            errors.add("Model '" + id + "' requires 'displayName'");
        }
        if (metric == null) {
            errors.add("Model '" + id + "' requires 'metric'");
        }
        if (comparison == null) {
            errors.add("Model '" + id + "' requires 'comparison'");
        } else if (comparison == Comparison.INCREASING_TREND) {
            if (metric != null && metric != Metric.MORTALITY_RATE) {
                errors.add("Trend model '" + id + "' only supports metric MORTALITY_RATE");
            }
        } else if (windowMonths != 3 && windowMonths != 6) {
            errors.add("Model '" + id + "' requires 'windowMonths' of 3 or 6, got: " + windowMonths);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid ModelDefinition: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public Metric getMetric() {
        return metric;
    }

    public void setMetric(Metric metric) {
        this.metric = metric;
    }

    public int getWindowMonths() {
        return windowMonths;
    }

    public void setWindowMonths(int windowMonths) {
        this.windowMonths = windowMonths;
    }

    public Comparison getComparison() {
        return comparison;
    }

    public void setComparison(Comparison comparison) {
        this.comparison = comparison;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ModelDefinition that))
            return false;
        return windowMonths == that.windowMonths
                && Objects.equals(id, that.id)
                && metric == that.metric
                && comparison == that.comparison;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, metric, windowMonths, comparison);
    }

    @Override
    public String toString() {
        return "ModelDefinition{" +
                "id='" + id + '\'' +
                ", metric=" + metric +
                ", windowMonths=" + windowMonths +
                ", comparison=" + comparison +
                '}';
    }
}
