package com.mortalitysentinel.service;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.mortalitysentinel.core.engine.StatisticsCalculator;
import com.mortalitysentinel.core.engine.SummaryStatistics;
import com.mortalitysentinel.core.model.MonthlyRecord;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One hospital's monthly mortality series with its summary statistics,
 * as shown on the dashboard chart.
 *
 * <p>
 * The statistics use a threshold line of mean +
 * {@value StatisticsCalculator#DASHBOARD_SD_MULTIPLIER} standard deviations
 * and are {@code null} when the range holds no data.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"hospital_name", "monthly_data", "statistics"})
public final class MortalityDataReport {

    private final String hospitalName;
    private final List<MonthlyPoint> monthlyData;
    private final SummaryStatistics statistics;

    private MortalityDataReport(String hospitalName, List<MonthlyPoint> monthlyData,
                                SummaryStatistics statistics) {
        this.hospitalName = hospitalName;
        this.monthlyData = monthlyData;
        this.statistics = statistics;
    }

    /**
     * @param hospitalName the hospital
     * @param records      its records in chronological order
     */
    public static MortalityDataReport of(String hospitalName, List<MonthlyRecord> records) {
        Objects.requireNonNull(hospitalName, "hospitalName must not be null");
        Objects.requireNonNull(records, "records must not be null");
        List<MonthlyPoint> points = new ArrayList<>(records.size());
        List<Double> rates = new ArrayList<>(records.size());
        for (MonthlyRecord record : records) {
            points.add(new MonthlyPoint(record));
            rates.add(record.getMortalityRate());
        }
        SummaryStatistics statistics = StatisticsCalculator
                .summary(rates, StatisticsCalculator.DASHBOARD_SD_MULTIPLIER)
                .orElse(null);
        return new MortalityDataReport(hospitalName, List.copyOf(points), statistics);
    }

    @JsonProperty("hospital_name")
    public String getHospitalName() {
        return hospitalName;
    }

    @JsonProperty("monthly_data")
    public List<MonthlyPoint> getMonthlyData() {
        return monthlyData;
    }

    @JsonProperty("statistics")
    public SummaryStatistics getStatistics() {
        return statistics;
    }

    /**
     * One month of the series.
     */
    @JsonPropertyOrder({"date", "year", "month", "total_patients", "deaths", "mortality_rate"})
    public static final class MonthlyPoint {
        private final MonthlyRecord record;

        MonthlyPoint(MonthlyRecord record) {
            this.record = record;
        }

        @JsonProperty("date")
        @JsonFormat(pattern = "yyyy-MM-dd")
        public LocalDate getDate() {
            return record.getPeriod().atDay(1);
        }

        @JsonProperty("year")
        public int getYear() {
            return record.getPeriod().getYear();
        }

        @JsonProperty("month")
        public int getMonth() {
            return record.getPeriod().getMonthValue();
        }

        @JsonProperty("total_patients")
        public int getTotalPatients() {
            return record.getTotalPatients();
        }

        @JsonProperty("deaths")
        public int getDeaths() {
            return record.getDeaths();
        }

        @JsonProperty("mortality_rate")
        public double getMortalityRate() {
            return record.getMortalityRate();
        }
    }
}
