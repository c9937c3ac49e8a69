package com.boxoffice.pipeline;

import com.boxoffice.model.EnrichmentStats;
import lombok.Value;

import java.util.List;

/**
 * What an enrichment pass produced: the matched payloads in rank order, and the figures.
 *
 * @param <T> the metadata payload type
 */
@Value
public class EnrichmentRun<T> {

    List<T> enriched;
    EnrichmentStats stats;
    boolean cancelled;
}
