package com.boxoffice.config;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Location of the persistent lookup cache.
 */
@Data
@NoArgsConstructor
public class CacheConfig {

    private String path = "data/cache/omdb_cache.json";

    /** Hold an exclusive lock on {@code <path>.lock} while the cache is open. */
    private boolean lockEnabled = true;
}
