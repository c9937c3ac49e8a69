package com.boxoffice.movies;

import com.boxoffice.BoxOfficeJobBase;
import com.boxoffice.cache.JsonFileMetadataCache;
import com.boxoffice.config.ElasticsearchConfig;
import com.boxoffice.config.PipelineConfig;
import com.boxoffice.elasticsearch.ElasticsearchService;
import com.boxoffice.enrichment.Enricher;
import com.boxoffice.enrichment.EnricherFactory;
import com.boxoffice.model.EnrichmentStats;
import com.boxoffice.movies.aggregation.RevenueAggregator;
import com.boxoffice.movies.ingest.RevenueCsvReader;
import com.boxoffice.movies.model.MovieMetadata;
import com.boxoffice.movies.model.RankedMovie;
import com.boxoffice.movies.model.RevenueObservation;
import com.boxoffice.movies.warehouse.LoadValidation;
import com.boxoffice.movies.warehouse.MovieWarehouseLoader;
import com.boxoffice.pipeline.EnrichmentOrchestrator;
import com.boxoffice.pipeline.EnrichmentRun;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Box-office pipeline: read daily revenues, rank titles by total revenue, enrich the top
 * titles from OMDb through the persistent cache, and load both record sets into the
 * warehouse.
 *
 * <p>Usage: {@code java -jar boxoffice-movies.jar [path/to/pipeline-config.yaml]}</p>
 */
@Slf4j
public class MoviesJob extends BoxOfficeJobBase {

    private static final String DEFAULT_CONFIG = "pipeline-config.yaml";

    private EnrichmentRun<MovieMetadata> lastRun;

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = new MoviesJob().run(args);
        } catch (Exception e) {
            log.error("Pipeline failed: {}", e.getMessage(), e);
            exitCode = 1;
        }
        System.exit(exitCode);
    }

    @Override
    protected String getDefaultConfigResource() {
        return DEFAULT_CONFIG;
    }

    @Override
    protected String getJobName() {
        return "BOX OFFICE ENRICHMENT PIPELINE";
    }

    @Override
    protected int execute(PipelineConfig config) throws Exception {
        Path csvPath = Paths.get(config.getInput().getCsvPath());
        if (!Files.isRegularFile(csvPath)) {
            log.error("CSV file not found: {}", csvPath);
            throw new NoSuchFileException(csvPath.toString());
        }
        RevenueCsvReader reader = new RevenueCsvReader(csvPath, config.getInput().isSkipZeroRevenue());
        boolean warehouseEnabled = config.getElasticsearch().isEnabled();

        // Step 1: ingest. Observations are only kept in memory when the warehouse needs them.
        log.info("Step 1: Parsing revenue data");
        List<RevenueObservation> observations = new ArrayList<>();
        Iterable<RevenueObservation> source = reader;
        if (warehouseEnabled) {
            reader.forEach(observations::add);
            source = observations;
        }

        // Step 2: aggregate and rank
        log.info("Step 2: Aggregating revenue by movie");
        List<RankedMovie> topMovies = new RevenueAggregator().rank(source, config.getInput().getTopN());
        if (!topMovies.isEmpty()) {
            RankedMovie top = topMovies.get(0);
            log.info("Top movie: {} (${})", top.getTitle(), top.getTotalRevenue().toPlainString());
        }

        // Step 3: enrich
        log.info("Step 3: Enriching {} movies", topMovies.size());
        lastRun = enrich(config, topMovies);
        logStats(lastRun.getStats());

        // Step 4: warehouse
        if (warehouseEnabled) {
            log.info("Step 4: Loading data to the warehouse");
            load(config.getElasticsearch(), observations, lastRun.getEnriched());
        } else {
            log.info("Step 4: Warehouse load disabled, skipping");
        }

        log.info("Processed {} revenue records, enriched {} of {} movies",
                reader.getLastReport().getProcessed(), lastRun.getEnriched().size(), topMovies.size());
        return 0;
    }

    /**
     * Result of the enrichment step of the last {@link #run} on this instance.
     */
    public EnrichmentRun<MovieMetadata> getLastRun() {
        return lastRun;
    }

    private EnrichmentRun<MovieMetadata> enrich(PipelineConfig config, List<RankedMovie> topMovies) {
        Enricher<MovieMetadata> enricher = EnricherFactory.create(config.getEnricher());
        try (enricher;
             JsonFileMetadataCache<MovieMetadata> cache = new JsonFileMetadataCache<>(
                     Paths.get(config.getCache().getPath()), enricher.getPayloadType(),
                     config.getCache().isLockEnabled())) {
            EnrichmentOrchestrator<MovieMetadata> orchestrator = new EnrichmentOrchestrator<>(
                    enricher, cache, config.getEnricher().getProgressInterval());
            return orchestrator.enrich(topMovies, RankedMovie::getTitle,
                    () -> Thread.currentThread().isInterrupted());
        }
    }

    private void load(ElasticsearchConfig esConfig, List<RevenueObservation> observations,
                      List<MovieMetadata> movies) throws Exception {
        try (ElasticsearchService elasticsearch = new ElasticsearchService(esConfig)) {
            MovieWarehouseLoader loader = new MovieWarehouseLoader(elasticsearch, esConfig);
            loader.loadRevenues(observations);
            loader.loadMovies(movies);

            Map<String, LoadValidation> validation = loader.validateLoad();
            validation.values().forEach(v -> {
                if (v.isSuccessful()) {
                    log.info("{}: {} rows", v.getAlias(), v.getDocumentCount());
                } else {
                    log.warn("{}: validation failed ({})", v.getAlias(), v.getError());
                }
            });
        }
    }

    private static void logStats(EnrichmentStats stats) {
        log.info("Enrichment stats: processed={} cacheHits={} matched={} notFound={} errors={} skipped={}",
                stats.getProcessed(), stats.getCacheHits(), stats.getMatched(), stats.getNotFound(),
                stats.getErrored(), stats.getSkipped());
        log.info("Cache: total={} matches={} notFound={} errors={}",
                stats.getTotalCached(), stats.getCachedMatches(), stats.getCachedNotFound(),
                stats.getCachedErrors());
        log.info("API calls this session: {} ({} remaining)",
                stats.getApiCallsThisSession(), stats.getApiCallsRemaining());
    }
}
