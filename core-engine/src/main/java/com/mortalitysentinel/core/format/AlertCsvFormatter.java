package com.mortalitysentinel.core.format;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mortalitysentinel.core.model.AlertResult;
import com.mortalitysentinel.core.model.MortalityPoint;
import com.mortalitysentinel.core.model.TrendInfo;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Serializes engine results to CSV and reads such exports back.
 *
 * <p>
 * The first row is a header using the result's snake_case field names.
 * Absent values ({@code smr}, {@code value}, {@code threshold} for some
 * models) are written as empty cells and read back as {@code null}. Status and
 * thresholds are written exactly as the engine produced them.
 * </p>
 *
 * <p>
 * Instances are immutable and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertCsvFormatter {

    private final CsvSchema schema;
    private final ObjectWriter writer;
    private final ObjectReader reader;

    public AlertCsvFormatter() {
        CsvMapper mapper = CsvMapper.builder()
                .addModule(new JavaTimeModule())
                .enable(CsvParser.Feature.EMPTY_STRING_AS_NULL)
                .build();
        this.schema = mapper.schemaFor(AlertCsvRow.class).withHeader();
        this.writer = mapper.writer(schema);
        this.reader = mapper.readerFor(AlertCsvRow.class).with(schema);
    }

    /**
     * @param results engine results, in the order to export
     * @return CSV text with a header row
     */
    public String format(List<AlertResult> results) {
        Objects.requireNonNull(results, "results must not be null");
        if (results.isEmpty()) {
            return headerLine();
        }
        List<AlertCsvRow> rows = new ArrayList<>(results.size());
        for (AlertResult result : results) {
            rows.add(toRow(result));
        }
        try {
            return writer.writeValueAsString(rows);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write alert CSV", e);
        }
    }

    /**
     * Read an export produced by {@link #format(List)}.
     *
     * @param csv CSV text including the header row
     * @return one row per exported result, in file order
     * @throws IllegalArgumentException if the text is not a valid export
     */
    public List<AlertCsvRow> parse(String csv) {
        Objects.requireNonNull(csv, "csv must not be null");
        try (MappingIterator<AlertCsvRow> it = reader.readValues(csv)) {
            return it.readAll();
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed alert CSV: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private String headerLine() {
        List<String> names = new ArrayList<>();
        for (CsvSchema.Column column : schema) {
            names.add(column.getName());
        }
        return String.join(",", names) + "\n";
    }

    private static AlertCsvRow toRow(AlertResult result) {
        AlertCsvRow row = new AlertCsvRow();
        row.setHospitalName(result.getHospitalName());
        row.setCurrentPeriod(result.getCurrentPeriod());
        row.setStatus(result.getStatus());
        row.setDeaths(result.getDeaths());
        row.setMortalityRate(result.getMortalityRate());
        row.setSmr(result.getSmr());
        row.setValue(result.getValue());
        row.setThreshold(result.getThreshold());
        row.setLast6MonthsMortality(joinPoints(result.getLast6MonthsMortality()));
        TrendInfo trend = result.getTrendInfo();
        if (trend != null) {
            row.setTrendInfo(joinPoints(List.of(
                    new MortalityPoint(trend.getMonth1(), trend.getRate1()),
                    new MortalityPoint(trend.getMonth2(), trend.getRate2()),
                    new MortalityPoint(trend.getMonth3(), trend.getRate3()))));
        }
        return row;
    }

    private static String joinPoints(List<MortalityPoint> points) {
        return points.stream()
                .map(p -> p.getPeriod() + ":" + String.format(Locale.ROOT, "%.2f", p.getMortalityRate()))
                .collect(Collectors.joining(";"));
    }
}
