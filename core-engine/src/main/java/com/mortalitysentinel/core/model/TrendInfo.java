package com.mortalitysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.YearMonth;
import java.util.List;
import java.util.Objects;

/**
 * The three consecutive mortality rates inspected by the trend model, oldest
 * first.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"month1", "month2", "month3", "rate1", "rate2", "rate3"})
public final class TrendInfo implements Serializable {

    private static final long serialVersionUID = 1L;

    private final MortalityPoint first;
    private final MortalityPoint second;
    private final MortalityPoint third;

    /**
     * @param points exactly three points in chronological order
     * @throws IllegalArgumentException if {@code points} does not hold three
     *                                  entries
     */
    public static TrendInfo of(List<MortalityPoint> points) {
        Objects.requireNonNull(points, "points must not be null");
        if (points.size() != ModelDefinition.TREND_PERIODS) {
            throw new IllegalArgumentException(
                    "Trend requires exactly " + ModelDefinition.TREND_PERIODS + " points, got: " + points.size());
        }
        return new TrendInfo(points.get(0), points.get(1), points.get(2));
    }

    private TrendInfo(MortalityPoint first, MortalityPoint second, MortalityPoint third) {
        this.first = Objects.requireNonNull(first);
        this.second = Objects.requireNonNull(second);
        this.third = Objects.requireNonNull(third);
    }

    /**
     * @return {@code true} when {@code rate1 < rate2 < rate3}
     */
    @JsonIgnore
    public boolean isStrictlyIncreasing() {
        return getRate1() < getRate2() && getRate2() < getRate3();
    }

    @JsonProperty("month1")
    @JsonFormat(pattern = "yyyy-MM")
    public YearMonth getMonth1() {
        return first.getPeriod();
    }

    @JsonProperty("month2")
    @JsonFormat(pattern = "yyyy-MM")
    public YearMonth getMonth2() {
        return second.getPeriod();
    }

    @JsonProperty("month3")
    @JsonFormat(pattern = "yyyy-MM")
    public YearMonth getMonth3() {
        return third.getPeriod();
    }

    @JsonProperty("rate1")
    public double getRate1() {
        return first.getMortalityRate();
    }

    @JsonProperty("rate2")
    public double getRate2() {
        return second.getMortalityRate();
    }

    @JsonProperty("rate3")
    public double getRate3() {
        return third.getMortalityRate();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TrendInfo that))
            return false;
        return first.equals(that.first) && second.equals(that.second) && third.equals(that.third);
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, second, third);
    }

    @Override
    public String toString() {
        return "TrendInfo{" + first + " -> " + second + " -> " + third + '}';
    }
}
