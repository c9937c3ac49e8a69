package com.boxoffice.model;

import lombok.Builder;
import lombok.Value;

/**
 * Snapshot of one enrichment run plus the cache and API budget state at the time it was
 * taken.
 */
@Value
@Builder
public class EnrichmentStats {

    // ── This run ─────────────────────────────────────────────────────────
    int processed;
    int cacheHits;
    int matched;
    int notFound;
    int errored;
    /** Entities left without a lookup because the request budget ran out or the run was cancelled. */
    int skipped;

    // ── Cache contents ───────────────────────────────────────────────────
    int totalCached;
    long cachedMatches;
    long cachedNotFound;
    long cachedErrors;

    // ── API budget ───────────────────────────────────────────────────────
    long apiCallsThisSession;
    long apiCallsRemaining;
}
