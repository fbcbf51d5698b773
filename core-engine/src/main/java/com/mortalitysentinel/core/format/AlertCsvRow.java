package com.mortalitysentinel.core.format;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.mortalitysentinel.core.model.AlertStatus;

import java.time.YearMonth;

/**
 * One flattened CSV row of an {@link com.mortalitysentinel.core.model.AlertResult}.
 *
 * <p>
 * Mutable bean so Jackson can both write and read it.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"hospital_name", "current_period", "status", "deaths", "mortality_rate", "smr", "value",
        "threshold", "last_6_months_mortality", "trend_info"})
public class AlertCsvRow {

    @JsonProperty("hospital_name")
    private String hospitalName;

    @JsonProperty("current_period")
    @JsonFormat(pattern = "yyyy-MM")
    private YearMonth currentPeriod;

    @JsonProperty("status")
    private AlertStatus status;

    @JsonProperty("deaths")
    private Integer deaths;

    @JsonProperty("mortality_rate")
    private Double mortalityRate;

    @JsonProperty("smr")
    private Double smr;

    @JsonProperty("value")
    private Double value;

    @JsonProperty("threshold")
    private Double threshold;

    /** {@code yyyy-MM:rate} pairs joined by {@code ;}. */
    @JsonProperty("last_6_months_mortality")
    private String last6MonthsMortality;

    /** {@code yyyy-MM:rate} pairs joined by {@code ;}, blank for non-trend models. */
    @JsonProperty("trend_info")
    private String trendInfo;

    public String getHospitalName() {
        return hospitalName;
    }

    public void setHospitalName(String hospitalName) {
        this.hospitalName = hospitalName;
    }

    public YearMonth getCurrentPeriod() {
        return currentPeriod;
    }

    public void setCurrentPeriod(YearMonth currentPeriod) {
        this.currentPeriod = currentPeriod;
    }

    public AlertStatus getStatus() {
        return status;
    }

    public void setStatus(AlertStatus status) {
        this.status = status;
    }

    public Integer getDeaths() {
        return deaths;
    }

    public void setDeaths(Integer deaths) {
        this.deaths = deaths;
    }

    public Double getMortalityRate() {
        return mortalityRate;
    }

    public void setMortalityRate(Double mortalityRate) {
        this.mortalityRate = mortalityRate;
    }

    public Double getSmr() {
        return smr;
    }

    public void setSmr(Double smr) {
        this.smr = smr;
    }

    public Double getValue() {
        return value;
    }

    public void setValue(Double value) {
        this.value = value;
    }

    public Double getThreshold() {
        return threshold;
    }

    public void setThreshold(Double threshold) {
        this.threshold = threshold;
    }

    public String getLast6MonthsMortality() {
        return last6MonthsMortality;
    }

    public void setLast6MonthsMortality(String last6MonthsMortality) {
        this.last6MonthsMortality = last6MonthsMortality;
    }

    public String getTrendInfo() {
        return trendInfo;
    }

    public void setTrendInfo(String trendInfo) {
        this.trendInfo = trendInfo;
    }

    @Override
    public String toString() {
        return "AlertCsvRow{" +
                "hospitalName='" + hospitalName + '\'' +
                ", currentPeriod=" + currentPeriod +
                ", status=" + status +
                '}';
    }
}
