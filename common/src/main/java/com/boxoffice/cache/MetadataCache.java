package com.boxoffice.cache;

import com.boxoffice.model.LookupKey;
import com.boxoffice.model.ResultKind;

import java.util.Map;
import java.util.Optional;

/**
 * Durable store of lookup outcomes keyed by {@link LookupKey}.
 *
 * <p>Once a key is present it is never re-queried and never overwritten, whatever the
 * variant of its entry. {@link #put} must be durable before it returns.</p>
 *
 * @param <T> the metadata payload type
 */
public interface MetadataCache<T> extends AutoCloseable {

    Optional<CacheEntry<T>> get(LookupKey key);

    /**
     * Stores the outcome for a key that is not yet cached and persists it.
     *
     * @throws IllegalStateException if the key already has an entry
     * @throws CacheWriteException   if the entry could not be persisted
     */
    void put(LookupKey key, CacheEntry<T> entry);

    boolean contains(LookupKey key);

    int size();

    /** Number of entries per variant; every variant is present, possibly with a zero count. */
    Map<ResultKind, Long> countByKind();

    @Override
    void close();
}
