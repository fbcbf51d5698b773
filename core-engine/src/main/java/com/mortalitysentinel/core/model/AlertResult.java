package com.mortalitysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of evaluating one hospital against one model.
 *
 * <p>
 * This is the sole input contract for exports and chat delivery: they format
 * what the engine returns and never re-derive the status or threshold. JSON
 * field names are snake_case.
 * </p>
 *
 * <h3>Absent values</h3>
 * <p>
 * {@code smr} is {@code null} for non-SMR models. {@code value} and
 * {@code threshold} are {@code null} for the trend model, which instead carries
 * {@code trendInfo}. Absent is never encoded as zero.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code hospitalName}, {@code currentPeriod} and
 * {@code status} are required; omitting any of them throws a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"hospital_name", "current_period", "deaths", "mortality_rate", "smr", "value",
        "threshold", "status", "last_6_months_mortality", "trend_info"})
public final class AlertResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String hospitalName;
    private final YearMonth currentPeriod;
    private final int deaths;
    private final double mortalityRate;
    private final Double smr;
    private final Double value;
    private final Double threshold;
    private final AlertStatus status;
    private final List<MortalityPoint> last6MonthsMortality;
    private final TrendInfo trendInfo;

    private AlertResult(Builder builder) {
        this.hospitalName = Objects.requireNonNull(builder.hospitalName, "hospitalName must not be null");
        this.currentPeriod = Objects.requireNonNull(builder.currentPeriod, "currentPeriod must not be null");
        this.status = Objects.requireNonNull(builder.status, "status must not be null");
        this.deaths = builder.deaths;
        this.mortalityRate = builder.mortalityRate;
        this.smr = builder.smr;
        this.value = builder.value;
        this.threshold = builder.threshold;
        this.last6MonthsMortality = Collections.unmodifiableList(new ArrayList<>(builder.last6MonthsMortality));
        this.trendInfo = builder.trendInfo;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AlertResult} instances.
     */
    public static class Builder {
        private String hospitalName;
        private YearMonth currentPeriod;
        private int deaths;
        private double mortalityRate;
        private Double smr;
        private Double value;
        private Double threshold;
        private AlertStatus status;
        private List<MortalityPoint> last6MonthsMortality = List.of();
        private TrendInfo trendInfo;

        public Builder hospitalName(String hospitalName) {
            this.hospitalName = hospitalName;
            return this;
        }

        public Builder currentPeriod(YearMonth currentPeriod) {
            this.currentPeriod = currentPeriod;
            return this;
        }

        public Builder deaths(int deaths) {
            this.deaths = deaths;
            return this;
        }

        public Builder mortalityRate(double mortalityRate) {
            this.mortalityRate = mortalityRate;
            return this;
        }

        public Builder smr(Double smr) {
            this.smr = smr;
            return this;
        }

        public Builder value(Double value) {
            this.value = value;
            return this;
        }

        public Builder threshold(Double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder status(AlertStatus status) {
            this.status = status;
            return this;
        }

        public Builder last6MonthsMortality(List<MortalityPoint> last6MonthsMortality) {
            this.last6MonthsMortality = last6MonthsMortality != null ? last6MonthsMortality : List.of();
            return this;
        }

        public Builder trendInfo(TrendInfo trendInfo) {
            this.trendInfo = trendInfo;
            return this;
        }

        /**
         * @return a new {@link AlertResult}
         * @throws NullPointerException if a required field is {@code null}
         */
        public AlertResult build() {
            return new AlertResult(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    @JsonProperty("hospital_name")
    public String getHospitalName() {
        return hospitalName;
    }

    @JsonProperty("current_period")
    @JsonFormat(pattern = "yyyy-MM")
    public YearMonth getCurrentPeriod() {
        return currentPeriod;
    }

    @JsonProperty("deaths")
    public int getDeaths() {
        return deaths;
    }

    @JsonProperty("mortality_rate")
    public double getMortalityRate() {
        return mortalityRate;
    }

    @JsonProperty("smr")
    public Double getSmr() {
        return smr;
    }

    /**
     * @return the metric value that was compared, or {@code null} for the trend
     *         model
     */
    @JsonProperty("value")
    public Double getValue() {
        return value;
    }

    @JsonProperty("threshold")
    public Double getThreshold() {
        return threshold;
    }

    @JsonProperty("status")
    public AlertStatus getStatus() {
        return status;
    }

    /**
     * @return unmodifiable list of up to six points, most recent last
     */
    @JsonProperty("last_6_months_mortality")
    public List<MortalityPoint> getLast6MonthsMortality() {
        return last6MonthsMortality;
    }

    @JsonProperty("trend_info")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public TrendInfo getTrendInfo() {
        return trendInfo;
    }

    @JsonIgnore
    public boolean isAlert() {
        return status == AlertStatus.ALERT;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertResult that))
            return false;
        return deaths == that.deaths
                && Double.compare(mortalityRate, that.mortalityRate) == 0
                && hospitalName.equals(that.hospitalName)
                && currentPeriod.equals(that.currentPeriod)
                && Objects.equals(smr, that.smr)
                && Objects.equals(value, that.value)
                && Objects.equals(threshold, that.threshold)
                && status == that.status
                && last6MonthsMortality.equals(that.last6MonthsMortality)
                && Objects.equals(trendInfo, that.trendInfo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hospitalName, currentPeriod, deaths, mortalityRate, smr, value, threshold, status);
    }

    @Override
    public String toString() {
        return "AlertResult{" +
                "hospitalName='" + hospitalName + '\'' +
                ", currentPeriod=" + currentPeriod +
                ", value=" + value +
                ", threshold=" + threshold +
                ", status=" + status +
                '}';
    }
}
