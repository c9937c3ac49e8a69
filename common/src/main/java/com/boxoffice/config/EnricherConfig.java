package com.boxoffice.config;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Configuration for the metadata enricher: which implementation to load, where the
 * lookup API lives, and how much of its budget a run may spend.
 */
@Data
@NoArgsConstructor
public class EnricherConfig {

    private String name;
    private String className;
    private String apiUrl;
    private String apiKey;
    private Map<String, String> properties = new HashMap<>();

    /** Per-attempt HTTP timeout (default: 10 seconds). */
    private long timeoutMs = 10_000;

    /** Total attempts per lookup, the first one included (default: 3). */
    private int maxRetries = 3;

    /** Base backoff delay; attempt {@code n} waits {@code retryDelayMs * n} before attempt {@code n + 1}. */
    private long retryDelayMs = 1_000;

    /** Network calls allowed per process lifetime before lookups are skipped (default: 1000). */
    private int dailyRequestLimit = 1_000;

    /** Max requests per second; {@code 0} disables pacing. */
    private int rateLimitPerSecond = 0;

    /** Log progress every N entities. */
    private int progressInterval = 100;

    public String getProperty(String key) {
        return properties.get(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getOrDefault(key, defaultValue);
    }
}
