package com.boxoffice.movies.ingest;

import lombok.Getter;
import lombok.ToString;

/**
 * Counters for one pass over the revenue file.
 *
 * <p>{@code processed} counts emitted observations, {@code skipped} counts dropped rows.
 * The issue counters only count rows that were emitted.</p>
 */
@Getter
@ToString
public class DataQualityReport {

    private long processed;
    private long skipped;
    private long zeroRevenue;
    private long emptyTheaters;
    private long missingDistributor;

    void recordProcessed() {
        processed++;
    }

    void recordSkipped() {
        skipped++;
    }

    void recordZeroRevenue() {
        zeroRevenue++;
    }

    void recordEmptyTheaters() {
        emptyTheaters++;
    }

    void recordMissingDistributor() {
        missingDistributor++;
    }
}
