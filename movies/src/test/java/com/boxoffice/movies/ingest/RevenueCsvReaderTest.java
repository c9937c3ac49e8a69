package com.boxoffice.movies.ingest;

import com.boxoffice.movies.model.RevenueObservation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RevenueCsvReaderTest {

    private static final String HEADER = "id,date,title,revenue,theaters,distributor";

    @TempDir
    Path dir;

    @Test
    void parsesCompleteRow() throws Exception {
        Path csv = write(HEADER, "r1,2023-07-21,Barbie,162022044.00,4243,Warner Bros.");

        List<RevenueObservation> rows = readAll(new RevenueCsvReader(csv));

        assertThat(rows).singleElement().satisfies(row -> {
            assertThat(row.getId()).isEqualTo("r1");
            assertThat(row.getObservationDate()).isEqualTo(LocalDate.of(2023, 7, 21));
            assertThat(row.getTitle()).isEqualTo("Barbie");
            assertThat(row.getRevenue()).isEqualByComparingTo("162022044");
            assertThat(row.getTheaters()).isEqualTo(4243);
            assertThat(row.getDistributor()).isEqualTo("Warner Bros.");
            assertThat(row.isHasValidTheaters()).isTrue();
            assertThat(row.isHasValidDistributor()).isTrue();
        });
    }

    @Test
    void blankOptionalFieldsAreCountedNotDropped() throws Exception {
        Path csv = write(HEADER,
                "r1,2023-01-01,Quiet Film,,,-",
                "r2,2023-01-01,Loud Film,0,10,",
                "r3,2023-01-02,Loud Film,500,12,Indie Co");
        RevenueCsvReader reader = new RevenueCsvReader(csv);

        List<RevenueObservation> rows = readAll(reader);

        assertThat(rows).hasSize(3);
        RevenueObservation quiet = rows.get(0);
        assertThat(quiet.getRevenue()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(quiet.getTheaters()).isNull();
        assertThat(quiet.isHasValidTheaters()).isFalse();
        assertThat(quiet.getDistributor()).isNull();
        assertThat(quiet.isHasValidDistributor()).isFalse();

        DataQualityReport report = reader.getLastReport();
        assertThat(report.getProcessed()).isEqualTo(3);
        assertThat(report.getSkipped()).isZero();
        assertThat(report.getZeroRevenue()).isEqualTo(2);
        assertThat(report.getEmptyTheaters()).isEqualTo(1);
        assertThat(report.getMissingDistributor()).isEqualTo(2);
    }

    @Test
    void invalidRowsAreSkippedAndCounted() throws Exception {
        Path csv = write(HEADER,
                "r1,2023-01-01,Good,100,1,A",
                "r2,not-a-date,Bad Date,100,1,A",
                "r3,2023-01-01,,100,1,A",
                "r4,2023-01-01,Bad Revenue,lots,1,A",
                "r5,2023-01-01,Bad Theaters,100,many,A",
                "r6,2023-01-01,Negative,-5,1,A",
                "r7,2023-01-02,Also Good,200,2,B");
        RevenueCsvReader reader = new RevenueCsvReader(csv);

        List<RevenueObservation> rows = readAll(reader);

        assertThat(rows).extracting(RevenueObservation::getId).containsExactly("r1", "r7");
        assertThat(reader.getLastReport().getSkipped()).isEqualTo(5);
        assertThat(reader.getLastReport().getProcessed()).isEqualTo(2);
    }

    @Test
    void quotedTitlesKeepCommasAndWhitespaceIsTrimmed() throws Exception {
        Path csv = write(HEADER, "r1, 2023-01-01 ,\"Crouching Tiger, Hidden Dragon\", 10 , 3 , Sony ");

        RevenueObservation row = readAll(new RevenueCsvReader(csv)).get(0);

        assertThat(row.getTitle()).isEqualTo("Crouching Tiger, Hidden Dragon");
        assertThat(row.getRevenue()).isEqualByComparingTo("10");
        assertThat(row.getDistributor()).isEqualTo("Sony");
    }

    @Test
    void optionalColumnsMayBeAbsent() throws Exception {
        Path csv = write("id,date,title", "r1,2023-01-01,Minimal");

        RevenueObservation row = readAll(new RevenueCsvReader(csv)).get(0);

        assertThat(row.getRevenue()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(row.isHasValidTheaters()).isFalse();
        assertThat(row.isHasValidDistributor()).isFalse();
    }

    @Test
    void zeroRevenueRowsCanBeSkipped() throws Exception {
        Path csv = write(HEADER,
                "r1,2023-01-01,Nothing,0,1,A",
                "r2,2023-01-01,Something,1,1,A");
        RevenueCsvReader reader = new RevenueCsvReader(csv, true);

        assertThat(readAll(reader)).extracting(RevenueObservation::getId).containsExactly("r2");
        assertThat(reader.getLastReport().getSkipped()).isEqualTo(1);
    }

    @Test
    void eachIterationRereadsTheFile() throws Exception {
        Path csv = write(HEADER, "r1,2023-01-01,Once,1,1,A");
        RevenueCsvReader reader = new RevenueCsvReader(csv);

        assertThat(readAll(reader)).hasSize(1);
        assertThat(readAll(reader)).hasSize(1);
        assertThat(reader.getLastReport().getProcessed()).isEqualTo(1);
    }

    @Test
    void missingFileFails() {
        RevenueCsvReader reader = new RevenueCsvReader(dir.resolve("absent.csv"));

        assertThatThrownBy(reader::iterator).isInstanceOf(UncheckedIOException.class);
    }

    private Path write(String... lines) throws Exception {
        Path csv = dir.resolve("revenues.csv");
        Files.writeString(csv, String.join("\n", lines) + "\n");
        return csv;
    }

    private static List<RevenueObservation> readAll(RevenueCsvReader reader) {
        List<RevenueObservation> rows = new ArrayList<>();
        reader.forEach(rows::add);
        return rows;
    }
}
