package com.boxoffice.enrichment;

import com.boxoffice.config.EnricherConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * An enricher that looks subjects up with one HTTP GET per attempt.
 *
 * <h3>Attempt loop</h3>
 * <p>Up to {@code maxRetries} attempts per lookup. Before each attempt one unit of the
 * {@link RequestBudget} is consumed and the {@link EnrichmentRateLimiter} is honoured; an
 * exhausted budget ends the lookup as {@link FetchOutcome.Status#SKIPPED} with no request
 * sent. Outcomes are classified as:</p>
 * <ul>
 *   <li>timeout, connection failure, HTTP 5xx/429 or an unparseable body: retried after
 *       {@code retryDelayMs * attempt} (linear backoff); {@code ERROR} once attempts run out</li>
 *   <li>any other non-2xx status: {@code ERROR} at once, a retry would send the same bad request</li>
 *   <li>{@link #isNotFound} response: {@code NOT_FOUND}, no retry</li>
 *   <li>anything else: mapped by {@link #mapFromResponse}, {@code MATCHED}</li>
 * </ul>
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>{@code apiUrl} – the HTTP endpoint; query parameters from {@link #mapToRequest} are appended</li>
 *   <li>{@code timeoutMs} – per-attempt HTTP timeout (default: 10000)</li>
 *   <li>{@code maxRetries}, {@code retryDelayMs}, {@code dailyRequestLimit}, {@code rateLimitPerSecond}</li>
 * </ul>
 *
 * @param <T> the metadata payload type
 */
@Slf4j
public abstract class ApiEnricher<T> implements Enricher<T> {

    private EnricherConfig config;
    private String apiUrl;
    private long timeoutMs;
    private int maxRetries;
    private long retryDelayMs;

    private HttpClient httpClient;
    private ObjectMapper objectMapper;
    private Sleeper sleeper;
    private RequestBudget budget;
    private EnrichmentRateLimiter rateLimiter;
    private boolean budgetWarned;

    protected Clock clock = Clock.systemUTC();

    @Override
    public void init(EnricherConfig config) {
        init(config, null, Sleeper.SYSTEM, Clock.systemUTC());
    }

    /**
     * Initialises with explicit collaborators. A {@code null} client gets a default one
     * built from {@code timeoutMs}.
     */
    public void init(EnricherConfig config, HttpClient httpClient, Sleeper sleeper, Clock clock) {
        this.config = config;
        this.apiUrl = config.getApiUrl();
        this.timeoutMs = config.getTimeoutMs();
        this.maxRetries = Math.max(1, config.getMaxRetries());
        this.retryDelayMs = config.getRetryDelayMs();
        this.httpClient = httpClient != null
                ? httpClient
                : HttpClient.newBuilder()
                        .version(HttpClient.Version.HTTP_1_1)
                        .connectTimeout(Duration.ofMillis(timeoutMs))
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build();
        this.objectMapper = new ObjectMapper();
        this.sleeper = sleeper;
        this.clock = clock;
        this.budget = new RequestBudget(config.getDailyRequestLimit());
        this.budgetWarned = false;
        this.rateLimiter = new EnrichmentRateLimiter(config.getRateLimitPerSecond());
        log.info("Initialised {} '{}' → {} (attempts: {}, daily limit: {}, rate limit: {}/s)",
                getClass().getSimpleName(), config.getName(), apiUrl, maxRetries,
                config.getDailyRequestLimit(), config.getRateLimitPerSecond());
    }

    // ── Lookup ───────────────────────────────────────────────────────────

    @Override
    public FetchOutcome<T> resolve(String title, Integer year) {
        ensureInitialised();

        HttpRequest request = buildRequest(title, year);
        String lastFailure = null;
        int attempt = 0;

        while (attempt < maxRetries) {
            if (!budget.tryAcquire()) {
                if (budgetWarned) {
                    log.debug("Daily API limit reached, skipping lookup: {}", title);
                } else {
                    budgetWarned = true;
                    log.warn("Daily API limit reached ({}), skipping this and all further lookups", budget.getLimit());
                }
                return FetchOutcome.skipped("Daily request limit of " + budget.getLimit() + " reached", attempt);
            }
            attempt++;

            try {
                rateLimiter.acquire(sleeper);
                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                int status = response.statusCode();

                if (isRetryableStatus(status)) {
                    lastFailure = "HTTP " + status;
                    log.warn("HTTP error on attempt {}/{}: status={} title={}", attempt, maxRetries, status, title);
                } else if (status < 200 || status >= 300) {
                    log.error("HTTP {} for '{}', not retrying", status, title);
                    return FetchOutcome.error("HTTP " + status, attempt);
                } else {
                    LookupResponse parsed = parseResponseBody(response.body());
                    if (parsed.getKind() == LookupResponse.Kind.NOT_FOUND) {
                        log.info("Not found: {}", title);
                        return FetchOutcome.notFound(attempt);
                    }
                    if (parsed.getKind() == LookupResponse.Kind.MATCH) {
                        return mapMatch(title, parsed, attempt);
                    }
                    lastFailure = "Malformed response: " + parsed.getDetail();
                    log.warn("Malformed response on attempt {}/{}: {} ({})",
                            attempt, maxRetries, title, parsed.getDetail());
                }
            } catch (HttpTimeoutException e) {
                lastFailure = "Timeout: " + e.getMessage();
                log.warn("Timeout on attempt {}/{}: {}", attempt, maxRetries, title);
            } catch (IOException e) {
                lastFailure = e.getClass().getSimpleName() + ": " + e.getMessage();
                log.warn("Request error on attempt {}/{}: {} ({})", attempt, maxRetries, title, lastFailure);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return FetchOutcome.skipped("Interrupted during lookup", attempt);
            }

            if (attempt < maxRetries) {
                try {
                    sleeper.sleep(retryDelayMs * attempt);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return FetchOutcome.skipped("Interrupted during backoff", attempt);
                }
            }
        }

        log.error("All {} attempts failed for: {}", maxRetries, title);
        return FetchOutcome.error("All " + maxRetries + " attempts failed, last: " + lastFailure, attempt);
    }

    @Override
    public long getCallsMade() {
        return budget == null ? 0 : budget.getUsed();
    }

    @Override
    public long getCallsRemaining() {
        return budget == null ? 0 : budget.getRemaining();
    }

    protected EnricherConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        log.info("Closed {} for {} after {} API calls", getClass().getSimpleName(), apiUrl, getCallsMade());
    }

    // ──────────────────────── internals ──────────────────────────────────

    protected boolean isRetryableStatus(int status) {
        return status >= 500 || status == 429;
    }

    private FetchOutcome<T> mapMatch(String title, LookupResponse parsed, int attempt) {
        try {
            return FetchOutcome.matched(mapFromResponse(title, parsed.getBody()), attempt);
        } catch (RuntimeException e) {
            log.error("Failed to map response for '{}': {}", title, e.getMessage(), e);
            return FetchOutcome.error("Failed to map response: " + e.getMessage(), attempt);
        }
    }

    private HttpRequest buildRequest(String title, Integer year) {
        String query = mapToRequest(title, year).entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
        String separator = apiUrl.contains("?") ? "&" : "?";
        return HttpRequest.newBuilder()
                .uri(URI.create(query.isEmpty() ? apiUrl : apiUrl + separator + query))
                .header("Accept", "application/json")
                .timeout(Duration.ofMillis(timeoutMs))
                .GET()
                .build();
    }

    private LookupResponse parseResponseBody(String body) {
        JsonNode node;
        try {
            node = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            return LookupResponse.malformed(e.getOriginalMessage());
        }
        if (node == null || !node.isObject()) {
            return LookupResponse.malformed("expected a JSON object");
        }
        Map<String, Object> fields = objectMapper.convertValue(node, new TypeReference<>() {});
        return isNotFound(fields) ? LookupResponse.notFound(fields) : LookupResponse.match(fields);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    private void ensureInitialised() {
        if (httpClient == null || budget == null) {
            throw new IllegalStateException(getClass().getSimpleName() + " used before init()");
        }
    }
}
