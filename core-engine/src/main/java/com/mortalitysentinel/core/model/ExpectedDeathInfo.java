package com.mortalitysentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Expected death percentage for one hospital-month, the denominator of the
 * standardized mortality ratio.
 *
 * @since 1.0.0
 */
public final class ExpectedDeathInfo implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double expectedDeathPercentage;

    /**
     * @param expectedDeathPercentage expected mortality percentage; must be
     *                                {@code > 0}
     * @throws IllegalArgumentException if the percentage is not positive
     */
    public ExpectedDeathInfo(double expectedDeathPercentage) {
        if (!(expectedDeathPercentage > 0)) {
            throw new IllegalArgumentException(
                    "expectedDeathPercentage must be > 0, got: " + expectedDeathPercentage);
        }
        this.expectedDeathPercentage = expectedDeathPercentage;
    }

    public double getExpectedDeathPercentage() {
        return expectedDeathPercentage;
    }

    /**
     * @param mortalityRate observed mortality percentage
     * @return observed over expected mortality
     */
    public double smrFor(double mortalityRate) {
        return mortalityRate / expectedDeathPercentage;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ExpectedDeathInfo that))
            return false;
        return Double.compare(expectedDeathPercentage, that.expectedDeathPercentage) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(expectedDeathPercentage);
    }

    @Override
    public String toString() {
        return "ExpectedDeathInfo{expectedDeathPercentage=" + expectedDeathPercentage + '}';
    }
}
