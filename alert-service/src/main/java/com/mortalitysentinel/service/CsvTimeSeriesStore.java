package com.mortalitysentinel.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.mortalitysentinel.core.model.ExpectedDeathInfo;
import com.mortalitysentinel.core.model.MonthlyRecord;
import com.mortalitysentinel.core.store.DataUnavailableException;
import com.mortalitysentinel.core.store.InMemoryTimeSeriesStore;
import com.mortalitysentinel.core.store.TimeSeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.DateTimeException;
import java.time.YearMonth;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link TimeSeriesStore} backed by two CSV files in a data directory.
 *
 * <h3>Files</h3>
 * <ul>
 * <li>{@code monthly_mortality.csv} (required):
 * {@code hospital_name,year,month,total_patients,deaths}</li>
 * <li>{@code expected_deaths.csv} (optional):
 * {@code hospital_name,year,month,expected_death_percentage}. A row with
 * blank {@code year} and {@code month} applies to every period of that
 * hospital.</li>
 * </ul>
 *
 * <p>
 * Both files are re-parsed whenever their modification time changes, so each
 * query sees the latest data. {@link #snapshot()} pins the data for a whole
 * evaluation, so records and expected deaths always come from the same
 * load. Read and parse failures are reported as
 * {@link DataUnavailableException}.
 * </p>
 *
 * @since 1.0.0
 */
public class CsvTimeSeriesStore implements TimeSeriesStore {

    private static final Logger LOG = LoggerFactory.getLogger(CsvTimeSeriesStore.class);

    public static final String MONTHLY_FILE = "monthly_mortality.csv";
    public static final String EXPECTED_FILE = "expected_deaths.csv";

    private final Path monthlyFile;
    private final Path expectedFile;
    private final ObjectReader monthlyReader;
    private final ObjectReader expectedReader;

    private InMemoryTimeSeriesStore snapshot;
    private FileTime monthlyModified;
    private FileTime expectedModified;

    /**
     * @param dataDir directory holding the CSV files; must not be {@code null}
     */
    public CsvTimeSeriesStore(Path dataDir) {
        Objects.requireNonNull(dataDir, "dataDir must not be null");
        this.monthlyFile = dataDir.resolve(MONTHLY_FILE);
        this.expectedFile = dataDir.resolve(EXPECTED_FILE);

        CsvMapper mapper = CsvMapper.builder()
                .enable(CsvParser.Feature.TRIM_SPACES)
                .enable(CsvParser.Feature.EMPTY_STRING_AS_NULL)
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .build();
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        this.monthlyReader = mapper.readerFor(MonthlyRow.class).with(schema);
        this.expectedReader = mapper.readerFor(ExpectedRow.class).with(schema);
    }

    @Override
    public List<MonthlyRecord> fetchMonthlyRecords(String hospitalName, YearMonth startPeriod,
                                                   YearMonth endPeriod) {
        return currentSnapshot().fetchMonthlyRecords(hospitalName, startPeriod, endPeriod);
    }

    @Override
    public Optional<ExpectedDeathInfo> fetchExpectedDeathInfo(String hospitalName, YearMonth period) {
        return currentSnapshot().fetchExpectedDeathInfo(hospitalName, period);
    }

    @Override
    public TimeSeriesStore snapshot() {
        return currentSnapshot();
    }

    // ---------------------------------------------------------------
    // Snapshot management
    // ---------------------------------------------------------------

    private synchronized InMemoryTimeSeriesStore currentSnapshot() {
        FileTime monthlyTime = modifiedTime(monthlyFile);
        if (monthlyTime == null) {
            throw new DataUnavailableException("Monthly mortality file not found: " + monthlyFile);
        }
        FileTime expectedTime = modifiedTime(expectedFile);

        if (snapshot != null && monthlyTime.equals(monthlyModified)
                && Objects.equals(expectedTime, expectedModified)) {
            return snapshot;
        }

        InMemoryTimeSeriesStore.Builder builder = InMemoryTimeSeriesStore.builder();
        int records = loadMonthly(builder);
        int expected = expectedTime == null ? 0 : loadExpected(builder);

        snapshot = builder.build();
        monthlyModified = monthlyTime;
        expectedModified = expectedTime;
        LOG.info("Loaded {} monthly record(s) and {} expected-death row(s) from {}",
                records, expected, monthlyFile.getParent());
        return snapshot;
    }

    private int loadMonthly(InMemoryTimeSeriesStore.Builder builder) {
        int count = 0;
        try (MappingIterator<MonthlyRow> it = monthlyReader.readValues(monthlyFile.toFile())) {
            while (it.hasNextValue()) {
                MonthlyRow row = it.nextValue();
                count++;
                try {
                    builder.record(new MonthlyRecord(row.hospitalName,
                            YearMonth.of(require(row.year, "year"), require(row.month, "month")),
                            require(row.totalPatients, "total_patients"), require(row.deaths, "deaths")));
                } catch (IllegalArgumentException | NullPointerException | DateTimeException e) {
                    throw new DataUnavailableException(
                            "Invalid row " + count + " in " + monthlyFile + ": " + e.getMessage(), e);
                }
            }
        } catch (IOException | RuntimeException e) {
            throw unavailable(monthlyFile, e);
        }
        return count;
    }

    private int loadExpected(InMemoryTimeSeriesStore.Builder builder) {
        int count = 0;
        try (MappingIterator<ExpectedRow> it = expectedReader.readValues(expectedFile.toFile())) {
            while (it.hasNextValue()) {
                ExpectedRow row = it.nextValue();
                count++;
                try {
                    Objects.requireNonNull(row.hospitalName, "hospital_name is required");
                    double percentage = require(row.expectedDeathPercentage, "expected_death_percentage");
                    if (row.year == null && row.month == null) {
                        builder.expectedDeaths(row.hospitalName, percentage);
                    } else {
                        builder.expectedDeaths(row.hospitalName,
                                YearMonth.of(require(row.year, "year"), require(row.month, "month")), percentage);
                    }
                } catch (IllegalArgumentException | NullPointerException | DateTimeException e) {
                    throw new DataUnavailableException(
                            "Invalid row " + count + " in " + expectedFile + ": " + e.getMessage(), e);
                }
            }
        } catch (IOException | RuntimeException e) {
            throw unavailable(expectedFile, e);
        }
        return count;
    }

    private static FileTime modifiedTime(Path file) {
        try {
            return Files.exists(file) ? Files.getLastModifiedTime(file) : null;
        } catch (IOException e) {
            throw new DataUnavailableException("Cannot stat " + file + ": " + e.getMessage(), e);
        }
    }

    private static DataUnavailableException unavailable(Path file, Exception e) {
        if (e instanceof DataUnavailableException due) {
            return due;
        }
        return new DataUnavailableException("Failed to read " + file + ": " + e.getMessage(), e);
    }

    private static <T> T require(T value, String column) {
        return Objects.requireNonNull(value, column + " is required");
    }

    // ---------------------------------------------------------------
    // Row types
    // ---------------------------------------------------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class MonthlyRow {
        @JsonProperty("hospital_name")
        String hospitalName;
        @JsonProperty("year")
        Integer year;
        @JsonProperty("month")
        Integer month;
        @JsonProperty("total_patients")
        Integer totalPatients;
        @JsonProperty("deaths")
        Integer deaths;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class ExpectedRow {
        @JsonProperty("hospital_name")
        String hospitalName;
        @JsonProperty("year")
        Integer year;
        @JsonProperty("month")
        Integer month;
        @JsonProperty("expected_death_percentage")
        Double expectedDeathPercentage;
    }
}
