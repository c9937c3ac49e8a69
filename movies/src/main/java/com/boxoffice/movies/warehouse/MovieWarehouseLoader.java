package com.boxoffice.movies.warehouse;

import com.boxoffice.config.ElasticsearchConfig;
import com.boxoffice.elasticsearch.ElasticsearchService;
import com.boxoffice.movies.model.MovieMetadata;
import com.boxoffice.movies.model.RevenueObservation;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the two staging record sets into the warehouse, each as a full replace.
 */
@Slf4j
public class MovieWarehouseLoader {

    private final ElasticsearchService elasticsearch;
    private final String revenuesAlias;
    private final String moviesAlias;

    public MovieWarehouseLoader(ElasticsearchService elasticsearch, ElasticsearchConfig config) {
        this.elasticsearch = elasticsearch;
        this.revenuesAlias = config.getRevenuesAlias();
        this.moviesAlias = config.getMoviesAlias();
    }

    /**
     * @throws com.boxoffice.elasticsearch.WarehouseLoadException if the load did not complete
     */
    public int loadRevenues(List<RevenueObservation> observations) {
        log.info("Loading {} revenue records to {}", observations.size(), revenuesAlias);
        int loaded = elasticsearch.replaceAlias(revenuesAlias, observations, RevenueObservation::getId);
        log.info("Loaded {} rows to {}", loaded, revenuesAlias);
        return loaded;
    }

    /**
     * One document per enriched row, with ids assigned by Elasticsearch. Two ranked titles
     * resolving to the same film are both kept, as separate rows.
     *
     * @throws com.boxoffice.elasticsearch.WarehouseLoadException if the load did not complete
     */
    public int loadMovies(List<MovieMetadata> movies) {
        log.info("Loading {} enriched movies to {}", movies.size(), moviesAlias);
        int loaded = elasticsearch.replaceAlias(moviesAlias, movies, movie -> null);
        log.info("Loaded {} rows to {}", loaded, moviesAlias);
        return loaded;
    }

    /**
     * Counts the documents behind both aliases. A failing count is recorded, not thrown.
     */
    public Map<String, LoadValidation> validateLoad() {
        Map<String, LoadValidation> results = new LinkedHashMap<>();
        for (String alias : List.of(revenuesAlias, moviesAlias)) {
            try {
                results.put(alias, LoadValidation.counted(alias, elasticsearch.count(alias)));
            } catch (IOException | RuntimeException e) {
                log.error("Failed to validate {}: {}", alias, e.getMessage());
                results.put(alias, LoadValidation.failed(alias, e.getMessage()));
            }
        }
        return results;
    }
}
