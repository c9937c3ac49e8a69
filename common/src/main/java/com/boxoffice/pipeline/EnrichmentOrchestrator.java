package com.boxoffice.pipeline;

import com.boxoffice.cache.CacheEntry;
import com.boxoffice.cache.MetadataCache;
import com.boxoffice.enrichment.Enricher;
import com.boxoffice.enrichment.FetchOutcome;
import com.boxoffice.model.EnrichmentStats;
import com.boxoffice.model.LookupKey;
import com.boxoffice.model.ResultKind;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

/**
 * Walks a ranked entity list and resolves metadata for each entity, cache first.
 *
 * <p>Per entity, strictly in order:</p>
 * <ol>
 *   <li>derive a year hint from the title ({@link YearHintExtractor}) and the {@link LookupKey}</li>
 *   <li>cache hit: use the stored outcome, no network activity, whatever its variant</li>
 *   <li>cache miss: {@link Enricher#resolve}, then persist the outcome (match, not-found or
 *       error) before moving on</li>
 *   <li>a {@code SKIPPED} outcome (budget exhausted) is counted and never cached</li>
 * </ol>
 *
 * <p>Not thread-safe. Entities are processed one at a time since the request budget and
 * the backoff sleep are shared state. A cancellation check runs between entities.</p>
 *
 * @param <T> the metadata payload type
 */
@Slf4j
public class EnrichmentOrchestrator<T> {

    private static final BooleanSupplier NEVER_CANCELLED = () -> false;

    private final Enricher<T> enricher;
    private final MetadataCache<T> cache;
    private final int progressInterval;
    private final Clock clock;

    public EnrichmentOrchestrator(Enricher<T> enricher, MetadataCache<T> cache, int progressInterval) {
        this(enricher, cache, progressInterval, Clock.systemUTC());
    }

    public EnrichmentOrchestrator(Enricher<T> enricher, MetadataCache<T> cache,
                                  int progressInterval, Clock clock) {
        if (progressInterval <= 0) {
            throw new IllegalArgumentException("progressInterval must be positive");
        }
        this.enricher = enricher;
        this.cache = cache;
        this.progressInterval = progressInterval;
        this.clock = clock;
    }

    public <E> EnrichmentRun<T> enrich(List<E> rankedEntities, Function<E, String> titleOf) {
        return enrich(rankedEntities, titleOf, NEVER_CANCELLED);
    }

    /**
     * Enriches {@code rankedEntities} in order.
     *
     * @param titleOf   extracts the lookup title from an entity
     * @param cancelled checked before each entity; once it returns {@code true} the
     *                  remaining entities are counted as skipped
     */
    public <E> EnrichmentRun<T> enrich(List<E> rankedEntities, Function<E, String> titleOf,
                                       BooleanSupplier cancelled) {
        List<T> enriched = new ArrayList<>();
        Counters counters = new Counters();
        int total = rankedEntities.size();
        boolean wasCancelled = false;

        for (int i = 0; i < total; i++) {
            if (cancelled.getAsBoolean()) {
                counters.skipped += total - i;
                wasCancelled = true;
                log.warn("Enrichment cancelled after {}/{} entities", i, total);
                break;
            }

            String title = titleOf.apply(rankedEntities.get(i));
            T payload = enrichOne(title, counters);
            if (payload != null) {
                enriched.add(payload);
            }
            counters.processed++;

            if (counters.processed % progressInterval == 0) {
                log.info("Progress: {}/{} | Enriched: {} | API calls remaining: {}",
                        counters.processed, total, enriched.size(), enricher.getCallsRemaining());
            }
        }

        EnrichmentStats stats = snapshot(counters);
        log.info("Enrichment complete: {}/{} movies matched", enriched.size(), total);
        return new EnrichmentRun<>(List.copyOf(enriched), stats, wasCancelled);
    }

    /**
     * Current cache and budget figures, without any per-run counts.
     */
    public EnrichmentStats getStats() {
        return snapshot(new Counters());
    }

    // ──────────────────────── internals ──────────────────────────────────

    private T enrichOne(String title, Counters counters) {
        Integer year = YearHintExtractor.extract(title);
        LookupKey key = LookupKey.of(title, year);

        var cached = cache.get(key);
        if (cached.isPresent()) {
            log.debug("Cache hit: {}", title);
            counters.cacheHits++;
            return count(cached.get(), counters);
        }

        FetchOutcome<T> outcome = enricher.resolve(title, year);
        Instant now = clock.instant();
        CacheEntry<T> entry;
        switch (outcome.getStatus()) {
            case MATCHED:
                entry = CacheEntry.matched(title, outcome.getPayload(), now);
                break;
            case NOT_FOUND:
                entry = CacheEntry.notFound(title, now);
                break;
            case ERROR:
                entry = CacheEntry.error(title, outcome.getMessage(), now);
                break;
            default:
                log.debug("Skipped lookup for '{}': {}", title, outcome.getMessage());
                counters.skipped++;
                return null;
        }
        cache.put(key, entry);
        return count(entry, counters);
    }

    private T count(CacheEntry<T> entry, Counters counters) {
        switch (entry.getResultKind()) {
            case MATCH:
                counters.matched++;
                return entry.getPayload();
            case NOT_FOUND:
                counters.notFound++;
                return null;
            default:
                counters.errored++;
                return null;
        }
    }

    private EnrichmentStats snapshot(Counters counters) {
        Map<ResultKind, Long> byKind = cache.countByKind();
        return EnrichmentStats.builder()
                .processed(counters.processed)
                .cacheHits(counters.cacheHits)
                .matched(counters.matched)
                .notFound(counters.notFound)
                .errored(counters.errored)
                .skipped(counters.skipped)
                .totalCached(cache.size())
                .cachedMatches(byKind.get(ResultKind.MATCH))
                .cachedNotFound(byKind.get(ResultKind.NOT_FOUND))
                .cachedErrors(byKind.get(ResultKind.ERROR))
                .apiCallsThisSession(enricher.getCallsMade())
                .apiCallsRemaining(enricher.getCallsRemaining())
                .build();
    }

    private static final class Counters {
        int processed;
        int cacheHits;
        int matched;
        int notFound;
        int errored;
        int skipped;
    }
}
