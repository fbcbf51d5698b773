package com.mortalitysentinel.core.engine;

import java.time.YearMonth;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Caller options for one evaluation.
 *
 * <ul>
 * <li>{@code endPeriod} caps the current period: it becomes the latest period
 * in the snapshot at or before this month. Without it the latest period
 * overall is used.</li>
 * <li>{@code minDeathIncrease} suppresses alerts whose current deaths exceed
 * the previous calendar month's deaths by this many or fewer. Hospitals
 * without a previous-month record keep their alert.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class EvaluationRequest {

    private static final EvaluationRequest LATEST = new EvaluationRequest(null, null);

    private final YearMonth endPeriod;
    private final Integer minDeathIncrease;

    private EvaluationRequest(YearMonth endPeriod, Integer minDeathIncrease) {
        this.endPeriod = endPeriod;
        this.minDeathIncrease = minDeathIncrease;
    }

    /**
     * @return request for the latest period with no filtering
     */
    public static EvaluationRequest latest() {
        return LATEST;
    }

    /**
     * @param endPeriod latest admissible current period, or {@code null}
     */
    public EvaluationRequest withEndPeriod(YearMonth endPeriod) {
        return new EvaluationRequest(endPeriod, minDeathIncrease);
    }

    /**
     * @param minDeathIncrease minimum month-over-month death increase an alert
     *                         must exceed; must be {@code >= 0}
     * @throws IllegalArgumentException if negative
     */
    public EvaluationRequest withMinDeathIncrease(int minDeathIncrease) {
        if (minDeathIncrease < 0) {
            throw new IllegalArgumentException("minDeathIncrease must be >= 0, got: " + minDeathIncrease);
        }
        return new EvaluationRequest(endPeriod, minDeathIncrease);
    }

    public Optional<YearMonth> getEndPeriod() {
        return Optional.ofNullable(endPeriod);
    }

    public OptionalInt getMinDeathIncrease() {
        return minDeathIncrease == null ? OptionalInt.empty() : OptionalInt.of(minDeathIncrease);
    }

    @Override
    public String toString() {
        return "EvaluationRequest{endPeriod=" + endPeriod + ", minDeathIncrease=" + minDeathIncrease + '}';
    }
}
