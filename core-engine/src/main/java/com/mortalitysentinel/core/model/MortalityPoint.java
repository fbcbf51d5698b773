package com.mortalitysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.YearMonth;
import java.util.Objects;

/**
 * Mortality rate of one period, used for the six-month history attached to
 * every result.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"period", "mortality_rate"})
public final class MortalityPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final YearMonth period;
    private final double mortalityRate;

    public MortalityPoint(YearMonth period, double mortalityRate) {
        this.period = Objects.requireNonNull(period, "period must not be null");
        this.mortalityRate = mortalityRate;
    }

    @JsonProperty("period")
    @JsonFormat(pattern = "yyyy-MM")
    public YearMonth getPeriod() {
        return period;
    }

    @JsonProperty("mortality_rate")
    public double getMortalityRate() {
        return mortalityRate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MortalityPoint that))
            return false;
        return Double.compare(mortalityRate, that.mortalityRate) == 0 && period.equals(that.period);
    }

    @Override
    public int hashCode() {
        return Objects.hash(period, mortalityRate);
    }

    @Override
    public String toString() {
        return period + ":" + mortalityRate;
    }
}
