package com.mortalitysentinel.core.model;

import java.io.Serializable;
import java.time.YearMonth;
import java.util.Objects;

/**
 * One hospital-month of discharge outcomes.
 *
 * <p>
 * The mortality rate is always derived from {@code deaths / totalPatients}
 * and is never stored on its own, so it cannot drift from its source counts.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Immutable and therefore safe to share between concurrent evaluations.
 * </p>
 *
 * @since 1.0.0
 */
public final class MonthlyRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String hospitalName;
    private final YearMonth period;
    private final int totalPatients;
    private final int deaths;

    /**
     * @param hospitalName  hospital identifier; must not be blank
     * @param period        calendar month of the record
     * @param totalPatients discharged patients in the month, {@code >= 0}
     * @param deaths        deaths in the month, {@code 0 <= deaths <= totalPatients}
     * @throws NullPointerException     if {@code hospitalName} or {@code period} is
     *                                  {@code null}
     * @throws IllegalArgumentException if the counts are out of range
     */
    public MonthlyRecord(String hospitalName, YearMonth period, int totalPatients, int deaths) {
        this.hospitalName = Objects.requireNonNull(hospitalName, "hospitalName must not be null");
        this.period = Objects.requireNonNull(period, "period must not be null");
        if (hospitalName.isBlank()) {
            throw new IllegalArgumentException("hospitalName must not be blank");
        }
        if (totalPatients < 0) {
            throw new IllegalArgumentException(
                    "totalPatients must be >= 0 for " + hospitalName + " " + period + ", got: " + totalPatients);
        }
        if (deaths < 0 || deaths > totalPatients) {
            throw new IllegalArgumentException(
                    "deaths must be in [0, " + totalPatients + "] for " + hospitalName + " " + period
                            + ", got: " + deaths);
        }
        this.totalPatients = totalPatients;
        this.deaths = deaths;
    }

    public String getHospitalName() {
        return hospitalName;
    }

    public YearMonth getPeriod() {
        return period;
    }

    public int getTotalPatients() {
        return totalPatients;
    }

    public int getDeaths() {
        return deaths;
    }

    /**
     * Mortality as a percentage of discharged patients.
     *
     * @return {@code 100 * deaths / totalPatients}, or {@code 0} when there were
     *         no patients
     */
    public double getMortalityRate() {
        if (totalPatients == 0) {
            return 0.0;
        }
        return 100.0 * deaths / totalPatients;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MonthlyRecord that))
            return false;
        return totalPatients == that.totalPatients
                && deaths == that.deaths
                && hospitalName.equals(that.hospitalName)
                && period.equals(that.period);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hospitalName, period, totalPatients, deaths);
    }

    @Override
    public String toString() {
        return "MonthlyRecord{" +
                "hospitalName='" + hospitalName + '\'' +
                ", period=" + period +
                ", totalPatients=" + totalPatients +
                ", deaths=" + deaths +
                '}';
    }
}
