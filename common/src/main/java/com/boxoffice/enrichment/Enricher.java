package com.boxoffice.enrichment;

import com.boxoffice.config.EnricherConfig;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Contract for metadata lookup implementations.
 *
 * <p>An enricher resolves one {@code (title, year)} lookup at a time against an external
 * service, behind its own request budget, rate limiting and retry policy. It never touches
 * the cache; that is the orchestrator's job.</p>
 *
 * <h3>Mapping hooks</h3>
 * <p>Domain-specific enrichers override the mapping methods to build the service's query
 * parameters and to turn its response into the typed payload.</p>
 *
 * @param <T> the metadata payload type
 */
public interface Enricher<T> extends AutoCloseable {

    /**
     * Initialises the enricher with its configuration. Called once, before any lookup.
     */
    void init(EnricherConfig config);

    /** Payload class, used to (de)serialise cached matches. */
    Class<T> getPayloadType();

    // ── Mapping hooks ────────────────────────────────────────────────────

    /**
     * Builds the query parameters for one lookup.
     *
     * @param title the title as it appears in the source data
     * @param year  optional release year hint, may be {@code null}
     */
    default Map<String, String> mapToRequest(String title, Integer year) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("title", title);
        if (year != null) {
            params.put("year", String.valueOf(year));
        }
        return params;
    }

    /**
     * Tells whether a well-formed response means "this subject does not exist".
     * Default: never.
     */
    default boolean isNotFound(Map<String, Object> apiResponse) {
        return false;
    }

    /**
     * Converts a well-formed, matching response into the typed payload. Must not throw for
     * missing or odd-looking fields; those normalise to {@code null}.
     */
    T mapFromResponse(String title, Map<String, Object> apiResponse);

    // ── Lookup ───────────────────────────────────────────────────────────

    /**
     * Performs one lookup, retrying transient failures.
     */
    FetchOutcome<T> resolve(String title, Integer year);

    /** Network calls made by this instance so far. */
    long getCallsMade();

    /** Network calls left before lookups are skipped. */
    long getCallsRemaining();

    /**
     * Releases resources held by this enricher.
     */
    @Override
    void close();
}
