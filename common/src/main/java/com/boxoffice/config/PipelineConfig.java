package com.boxoffice.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Top-level pipeline configuration.
 *
 * <p>Bound from YAML (see {@code pipeline-config.yaml}). Secrets and deployment-specific
 * paths are not expected in the file; {@link #applyEnvironment(Map)} overlays them from
 * environment variables after loading:</p>
 * <ul>
 *   <li>{@code OMDB_API_KEY} → {@code enricher.apiKey}</li>
 *   <li>{@code REVENUES_CSV_PATH} → {@code input.csvPath}</li>
 *   <li>{@code OMDB_CACHE_PATH} → {@code cache.path}</li>
 *   <li>{@code ELASTICSEARCH_HOSTS} (comma separated), {@code ELASTICSEARCH_USERNAME},
 *       {@code ELASTICSEARCH_PASSWORD} → {@code elasticsearch.*}</li>
 * </ul>
 */
@Data
public class PipelineConfig {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private InputSection input = new InputSection();
    private CacheConfig cache = new CacheConfig();
    private EnricherConfig enricher = new EnricherConfig();
    private ElasticsearchConfig elasticsearch = new ElasticsearchConfig();

    // ── Loading ──────────────────────────────────────────────────────────

    /**
     * Loads configuration from a YAML file on disk.
     */
    public static PipelineConfig load(String path) throws IOException {
        return YAML_MAPPER.readValue(new File(path), PipelineConfig.class);
    }

    /**
     * Loads configuration from a classpath resource.
     */
    public static PipelineConfig loadFromClasspath(String resource) throws IOException {
        try (InputStream is = PipelineConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IOException("Resource not found on classpath: " + resource);
            }
            return YAML_MAPPER.readValue(is, PipelineConfig.class);
        }
    }

    /**
     * Overlays environment variables on top of the loaded values. Blank variables are ignored.
     *
     * @return this config, for chaining
     */
    public PipelineConfig applyEnvironment(Map<String, String> env) {
        overlay(env, "OMDB_API_KEY", enricher::setApiKey);
        overlay(env, "REVENUES_CSV_PATH", input::setCsvPath);
        overlay(env, "OMDB_CACHE_PATH", cache::setPath);
        overlay(env, "ELASTICSEARCH_HOSTS", hosts -> elasticsearch.setHosts(
                Arrays.stream(hosts.split(","))
                        .map(String::trim)
                        .filter(h -> !h.isEmpty())
                        .collect(Collectors.toList())));
        overlay(env, "ELASTICSEARCH_USERNAME", elasticsearch::setUsername);
        overlay(env, "ELASTICSEARCH_PASSWORD", elasticsearch::setPassword);
        return this;
    }

    /**
     * Checks that every value the pipeline cannot run without is present.
     *
     * @throws PipelineConfigurationException on the first problem found
     */
    public void validate() {
        require(input.getCsvPath(), "input.csvPath (or REVENUES_CSV_PATH)");
        require(cache.getPath(), "cache.path (or OMDB_CACHE_PATH)");
        require(enricher.getClassName(), "enricher.className");
        require(enricher.getApiUrl(), "enricher.apiUrl");
        require(enricher.getApiKey(), "enricher.apiKey (or OMDB_API_KEY)");

        if (input.getTopN() != null && input.getTopN() <= 0) {
            throw new PipelineConfigurationException("input.topN must be positive, got " + input.getTopN());
        }
        if (enricher.getMaxRetries() < 1) {
            throw new PipelineConfigurationException("enricher.maxRetries must be at least 1");
        }
        if (enricher.getTimeoutMs() <= 0) {
            throw new PipelineConfigurationException("enricher.timeoutMs must be positive");
        }
        if (enricher.getRetryDelayMs() < 0 || enricher.getDailyRequestLimit() < 0
                || enricher.getRateLimitPerSecond() < 0) {
            throw new PipelineConfigurationException(
                    "enricher.retryDelayMs, dailyRequestLimit and rateLimitPerSecond must not be negative");
        }
        if (enricher.getProgressInterval() <= 0) {
            throw new PipelineConfigurationException("enricher.progressInterval must be positive");
        }
        if (elasticsearch.isEnabled()) {
            if (elasticsearch.getHosts() == null || elasticsearch.getHosts().isEmpty()) {
                throw new PipelineConfigurationException(
                        "elasticsearch.hosts (or ELASTICSEARCH_HOSTS) is required when elasticsearch.enabled");
            }
            if (elasticsearch.getBulkSize() <= 0) {
                throw new PipelineConfigurationException("elasticsearch.bulkSize must be positive");
            }
        }
    }

    private static void overlay(Map<String, String> env, String variable,
                                Consumer<String> setter) {
        String value = env.get(variable);
        if (value != null && !value.isBlank()) {
            setter.accept(value.trim());
        }
    }

    private static void require(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new PipelineConfigurationException("Missing required configuration: " + name);
        }
    }

    // ── Nested section POJOs ─────────────────────────────────────────────

    @Data
    public static class InputSection {
        private String csvPath = "data/raw/revenues_per_day.csv";

        /** How many top-ranked movies to enrich; {@code null} enriches all of them. */
        private Integer topN = 800;

        /** Drop observations with zero revenue before aggregation. */
        private boolean skipZeroRevenue = false;
    }
}
