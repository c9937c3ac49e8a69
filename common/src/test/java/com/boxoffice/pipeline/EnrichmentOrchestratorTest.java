package com.boxoffice.pipeline;

import com.boxoffice.cache.CacheEntry;
import com.boxoffice.cache.JsonFileMetadataCache;
import com.boxoffice.enrichment.Enricher;
import com.boxoffice.enrichment.FetchOutcome;
import com.boxoffice.model.EnrichmentStats;
import com.boxoffice.model.LookupKey;
import com.boxoffice.model.ResultKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EnrichmentOrchestratorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T00:00:00Z"), ZoneOffset.UTC);

    @Mock
    private Enricher<String> enricher;

    @TempDir
    Path dir;

    private JsonFileMetadataCache<String> cache;
    private EnrichmentOrchestrator<String> orchestrator;

    @BeforeEach
    void setUp() {
        cache = new JsonFileMetadataCache<>(dir.resolve("cache.json"), String.class, false);
        orchestrator = new EnrichmentOrchestrator<>(enricher, cache, 2, CLOCK);
        lenient().when(enricher.getCallsRemaining()).thenReturn(100L);
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    @Test
    void resolvesInOrderAndCachesEveryTerminalOutcome() {
        when(enricher.resolve("Heat", null)).thenReturn(FetchOutcome.matched("heat-meta", 1));
        when(enricher.resolve("Unknown", null)).thenReturn(FetchOutcome.notFound(1));
        when(enricher.resolve("Flaky", null)).thenReturn(FetchOutcome.error("Timeout", 3));

        EnrichmentRun<String> run = orchestrator.enrich(List.of("Heat", "Unknown", "Flaky"), Function.identity());

        assertThat(run.getEnriched()).containsExactly("heat-meta");
        assertThat(run.isCancelled()).isFalse();
        EnrichmentStats stats = run.getStats();
        assertThat(stats.getProcessed()).isEqualTo(3);
        assertThat(stats.getMatched()).isEqualTo(1);
        assertThat(stats.getNotFound()).isEqualTo(1);
        assertThat(stats.getErrored()).isEqualTo(1);
        assertThat(stats.getTotalCached()).isEqualTo(3);

        CacheEntry<String> error = cache.get(LookupKey.of("Flaky", null)).orElseThrow();
        assertThat(error.getResultKind()).isEqualTo(ResultKind.ERROR);
        assertThat(error.getErrorMessage()).isEqualTo("Timeout");
        assertThat(error.getCachedAt()).isEqualTo(CLOCK.instant());
    }

    @Test
    void secondRunIsServedEntirelyFromCache() {
        when(enricher.resolve("Heat", null)).thenReturn(FetchOutcome.matched("heat-meta", 1));
        when(enricher.resolve("Unknown", null)).thenReturn(FetchOutcome.notFound(1));
        when(enricher.resolve("Flaky", null)).thenReturn(FetchOutcome.error("HTTP 500", 3));
        List<String> titles = List.of("Heat", "Unknown", "Flaky");

        EnrichmentRun<String> first = orchestrator.enrich(titles, Function.identity());
        EnrichmentRun<String> second = orchestrator.enrich(titles, Function.identity());

        verify(enricher, times(3)).resolve(anyString(), any());
        assertThat(second.getEnriched()).isEqualTo(first.getEnriched());
        assertThat(second.getStats().getCacheHits()).isEqualTo(3);
        assertThat(second.getStats().getErrored()).isEqualTo(1);
        assertThat(second.getStats().getNotFound()).isEqualTo(1);
    }

    @Test
    void duplicateTitleInOneRunHitsCache() {
        when(enricher.resolve("Heat", null)).thenReturn(FetchOutcome.matched("heat-meta", 1));

        EnrichmentRun<String> run = orchestrator.enrich(List.of("Heat", "HEAT "), Function.identity());

        verify(enricher, times(1)).resolve(anyString(), any());
        assertThat(run.getEnriched()).containsExactly("heat-meta", "heat-meta");
        assertThat(run.getStats().getCacheHits()).isEqualTo(1);
    }

    @Test
    void yearHintIsPassedToEnricherAndKeyed() {
        when(enricher.resolve("The Polar Express2017 IMAX Release", 2017))
                .thenReturn(FetchOutcome.notFound(1));

        orchestrator.enrich(List.of("The Polar Express2017 IMAX Release"), Function.identity());

        verify(enricher).resolve(eq("The Polar Express2017 IMAX Release"), eq(2017));
        assertThat(cache.contains(LookupKey.of("The Polar Express2017 IMAX Release", 2017))).isTrue();
    }

    @Test
    void skippedLookupIsNotCached() {
        when(enricher.resolve("Heat", null)).thenReturn(FetchOutcome.skipped("Daily request limit of 0 reached", 0));

        EnrichmentRun<String> run = orchestrator.enrich(List.of("Heat"), Function.identity());

        assertThat(run.getStats().getSkipped()).isEqualTo(1);
        assertThat(run.getEnriched()).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void cancellationStopsBetweenEntities() {
        when(enricher.resolve("First", null)).thenReturn(FetchOutcome.notFound(1));
        AtomicInteger checks = new AtomicInteger();

        EnrichmentRun<String> run = orchestrator.enrich(
                List.of("First", "Second", "Third"), Function.identity(), () -> checks.incrementAndGet() > 1);

        assertThat(run.isCancelled()).isTrue();
        assertThat(run.getStats().getProcessed()).isEqualTo(1);
        assertThat(run.getStats().getSkipped()).isEqualTo(2);
        verify(enricher, never()).resolve(eq("Second"), isNull());
    }
}
