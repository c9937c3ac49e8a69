package com.boxoffice.movies.ingest;

import com.boxoffice.movies.model.RevenueObservation;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Streams the daily revenue CSV into {@link RevenueObservation}s.
 *
 * <p>The file needs a header row with at least {@code id}, {@code date} and {@code title};
 * {@code revenue}, {@code theaters} and {@code distributor} are optional. Rows are read one
 * at a time, so the whole file never sits in memory. Each {@link #iterator()} call opens
 * the file again and starts a fresh {@link DataQualityReport}.</p>
 *
 * <p>A row that cannot be parsed is logged and skipped. I/O failures are thrown as
 * {@link UncheckedIOException}.</p>
 */
@Slf4j
public class RevenueCsvReader implements Iterable<RevenueObservation> {

    private static final String MISSING_DISTRIBUTOR = "-";

    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    private final Path path;
    private final boolean skipZeroRevenue;
    private DataQualityReport lastReport = new DataQualityReport();

    public RevenueCsvReader(Path path) {
        this(path, false);
    }

    public RevenueCsvReader(Path path, boolean skipZeroRevenue) {
        this.path = path;
        this.skipZeroRevenue = skipZeroRevenue;
    }

    @Override
    public Iterator<RevenueObservation> iterator() {
        if (!Files.isRegularFile(path)) {
            throw new UncheckedIOException(new NoSuchFileException(path.toString()));
        }
        try {
            MappingIterator<Map<String, String>> rows = CSV_MAPPER
                    .readerFor(Map.class)
                    .with(CsvSchema.emptySchema().withHeader())
                    .readValues(path.toFile());
            lastReport = new DataQualityReport();
            log.info("Reading revenue data from {}", path);
            return new ObservationIterator(rows, lastReport);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open " + path, e);
        }
    }

    /**
     * Report of the most recent pass. Complete once that pass has been fully consumed.
     */
    public DataQualityReport getLastReport() {
        return lastReport;
    }

    public Path getPath() {
        return path;
    }

    // ──────────────────────── row parsing ────────────────────────────────

    /**
     * Parses one CSV row. Quality counters are only touched once the whole row is valid.
     *
     * @param rowNumber 1-based line number in the file, header included
     */
    static RevenueObservation parseRow(Map<String, String> row, long rowNumber, DataQualityReport report)
            throws RevenueParseException {
        String id = required(row, "id", rowNumber);
        String title = required(row, "title", rowNumber);
        LocalDate date = parseDate(required(row, "date", rowNumber), rowNumber);

        String rawRevenue = trimmed(row.get("revenue"));
        BigDecimal revenue = parseRevenue(rawRevenue, rowNumber);

        String rawTheaters = trimmed(row.get("theaters"));
        Integer theaters = parseTheaters(rawTheaters, rowNumber);

        String distributor = trimmed(row.get("distributor"));
        if (MISSING_DISTRIBUTOR.equals(distributor)) {
            distributor = null;
        }

        if (revenue.signum() == 0) {
            report.recordZeroRevenue();
        }
        if (theaters == null) {
            report.recordEmptyTheaters();
        }
        if (distributor == null) {
            report.recordMissingDistributor();
        }

        return RevenueObservation.builder()
                .id(id)
                .observationDate(date)
                .title(title)
                .revenue(revenue)
                .theaters(theaters)
                .distributor(distributor)
                .hasValidTheaters(theaters != null)
                .hasValidDistributor(distributor != null)
                .build();
    }

    private static String required(Map<String, String> row, String column, long rowNumber)
            throws RevenueParseException {
        String value = trimmed(row.get(column));
        if (value == null) {
            throw new RevenueParseException(rowNumber, "missing required column '" + column + "'");
        }
        return value;
    }

    private static LocalDate parseDate(String value, long rowNumber) throws RevenueParseException {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new RevenueParseException(rowNumber, "invalid date '" + value + "'", e);
        }
    }

    private static BigDecimal parseRevenue(String value, long rowNumber) throws RevenueParseException {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        BigDecimal revenue;
        try {
            revenue = new BigDecimal(value);
        } catch (NumberFormatException e) {
            throw new RevenueParseException(rowNumber, "invalid revenue '" + value + "'", e);
        }
        if (revenue.signum() < 0) {
            throw new RevenueParseException(rowNumber, "negative revenue '" + value + "'");
        }
        return revenue;
    }

    private static Integer parseTheaters(String value, long rowNumber) throws RevenueParseException {
        if (value == null) {
            return null;
        }
        int theaters;
        try {
            theaters = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new RevenueParseException(rowNumber, "invalid theaters '" + value + "'", e);
        }
        if (theaters < 0) {
            throw new RevenueParseException(rowNumber, "negative theaters '" + value + "'");
        }
        return theaters;
    }

    private static String trimmed(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    // ──────────────────────── iteration ──────────────────────────────────

    private final class ObservationIterator implements Iterator<RevenueObservation> {

        private final MappingIterator<Map<String, String>> rows;
        private final DataQualityReport report;
        private long rowNumber = 1;
        private RevenueObservation next;
        private boolean finished;

        ObservationIterator(MappingIterator<Map<String, String>> rows, DataQualityReport report) {
            this.rows = rows;
            this.report = report;
        }

        @Override
        public boolean hasNext() {
            while (next == null && !finished) {
                advance();
            }
            return next != null;
        }

        @Override
        public RevenueObservation next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            RevenueObservation current = next;
            next = null;
            return current;
        }

        private void advance() {
            try {
                if (!rows.hasNextValue()) {
                    finish();
                    return;
                }
                Map<String, String> row = rows.nextValue();
                rowNumber++;
                RevenueObservation observation = parseRow(row, rowNumber, report);
                if (skipZeroRevenue && observation.getRevenue().signum() == 0) {
                    report.recordSkipped();
                    return;
                }
                report.recordProcessed();
                next = observation;
            } catch (RevenueParseException e) {
                log.warn("Skipping row: {}", e.getMessage());
                report.recordSkipped();
            } catch (IOException e) {
                closeQuietly();
                throw new UncheckedIOException("Failed reading " + path + " near row " + rowNumber, e);
            }
        }

        private void finish() throws IOException {
            finished = true;
            rows.close();
            log.info("Parsed {} revenue records ({} skipped)", report.getProcessed(), report.getSkipped());
            log.info("Data quality: zero revenue={}, empty theaters={}, missing distributor={}",
                    report.getZeroRevenue(), report.getEmptyTheaters(), report.getMissingDistributor());
        }

        private void closeQuietly() {
            finished = true;
            try {
                rows.close();
            } catch (IOException e) {
                log.debug("Failed to close {} after read error: {}", path, e.getMessage());
            }
        }
    }
}
