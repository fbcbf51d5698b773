package com.mortalitysentinel.core.engine;

import com.mortalitysentinel.core.model.MonthlyRecord;
import com.mortalitysentinel.core.model.MortalityPoint;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * One hospital's monthly records, unique per period and kept in
 * chronological order.
 *
 * @since 1.0.0
 */
public final class HospitalSeries {

    private final String hospitalName;
    private final NavigableMap<YearMonth, MonthlyRecord> byPeriod;

    private HospitalSeries(String hospitalName, NavigableMap<YearMonth, MonthlyRecord> byPeriod) {
        this.hospitalName = hospitalName;
        this.byPeriod = Collections.unmodifiableNavigableMap(byPeriod);
    }

    /**
     * Build a series from records of a single hospital. A later record for a
     * period already present replaces the earlier one.
     *
     * @throws IllegalArgumentException if a record belongs to another hospital
     */
    public static HospitalSeries of(String hospitalName, Collection<MonthlyRecord> records) {
        Objects.requireNonNull(hospitalName, "hospitalName must not be null");
        Objects.requireNonNull(records, "records must not be null");
        NavigableMap<YearMonth, MonthlyRecord> byPeriod = new TreeMap<>();
        for (MonthlyRecord record : records) {
            if (!hospitalName.equals(record.getHospitalName())) {
                throw new IllegalArgumentException(
                        "Record for '" + record.getHospitalName() + "' in series of '" + hospitalName + "'");
            }
            byPeriod.put(record.getPeriod(), record);
        }
        return new HospitalSeries(hospitalName, byPeriod);
    }

    /**
     * Split a mixed record list into one series per hospital.
     *
     * @return series keyed by hospital name, in ascending name order
     */
    public static Map<String, HospitalSeries> groupByHospital(Collection<MonthlyRecord> records) {
        Objects.requireNonNull(records, "records must not be null");
        Map<String, List<MonthlyRecord>> grouped = new TreeMap<>();
        for (MonthlyRecord record : records) {
            grouped.computeIfAbsent(record.getHospitalName(), k -> new ArrayList<>()).add(record);
        }
        Map<String, HospitalSeries> series = new TreeMap<>();
        grouped.forEach((name, list) -> series.put(name, of(name, list)));
        return series;
    }

    public String getHospitalName() {
        return hospitalName;
    }

    public int size() {
        return byPeriod.size();
    }

    public Optional<MonthlyRecord> at(YearMonth period) {
        return Optional.ofNullable(byPeriod.get(period));
    }

    public Optional<YearMonth> latestPeriod() {
        return byPeriod.isEmpty() ? Optional.empty() : Optional.of(byPeriod.lastKey());
    }

    /**
     * Up to {@code count} most recent records strictly before {@code period}.
     *
     * @return records in chronological order
     */
    public List<MonthlyRecord> precedingWindow(YearMonth period, int count) {
        return mostRecent(byPeriod.headMap(period, false), count);
    }

    /**
     * Records of the {@code count} calendar months ending at {@code period}.
     *
     * @return records in chronological order, or empty if any of those months
     *         has no record
     */
    public Optional<List<MonthlyRecord>> consecutive(YearMonth period, int count) {
        List<MonthlyRecord> result = new ArrayList<>(count);
        for (long back = count - 1L; back >= 0; back--) {
            MonthlyRecord record = byPeriod.get(period.minusMonths(back));
            if (record == null) {
                return Optional.empty();
            }
            result.add(record);
        }
        return Optional.of(result);
    }

    /**
     * Mortality rates of the {@code months} calendar months ending at
     * {@code period}, skipping months without a record.
     *
     * @return points in chronological order, most recent last
     */
    public List<MortalityPoint> mortalityHistory(YearMonth period, int months) {
        YearMonth from = period.minusMonths(months - 1L);
        List<MortalityPoint> points = new ArrayList<>();
        for (MonthlyRecord record : byPeriod.subMap(from, true, period, true).values()) {
            points.add(new MortalityPoint(record.getPeriod(), record.getMortalityRate()));
        }
        return points;
    }

    private static List<MonthlyRecord> mostRecent(NavigableMap<YearMonth, MonthlyRecord> view, int count) {
        List<MonthlyRecord> result = new ArrayList<>(Math.min(count, view.size()));
        Iterator<MonthlyRecord> it = view.descendingMap().values().iterator();
        while (it.hasNext() && result.size() < count) {
            result.add(it.next());
        }
        Collections.reverse(result);
        return result;
    }

    @Override
    public String toString() {
        return "HospitalSeries{" + hospitalName + ", periods=" + byPeriod.keySet() + '}';
    }
}
