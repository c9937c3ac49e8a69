package com.boxoffice.cache;

import com.boxoffice.model.LookupKey;
import com.boxoffice.model.ResultKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * {@link MetadataCache} backed by a single pretty-printed JSON object on disk.
 *
 * <p>The file is read once on construction and rewritten in full after every
 * {@link #put}: written to a temp file in the same directory, then moved over the old
 * one, so a crash mid-write leaves the previous version intact. Keys are written in
 * sorted order so the file diffs cleanly between runs.</p>
 *
 * <h3>Corrupt files</h3>
 * <p>An unreadable cache file is not fatal. It is moved aside to
 * {@code <name>.corrupt-<epochMillis>} and the cache starts empty. A readable file with
 * unusable entries (no result kind, or a match without payload) is moved aside the same
 * way and rewritten with only the usable entries.</p>
 *
 * <h3>Locking</h3>
 * <p>With locking enabled the cache holds an exclusive lock on {@code <name>.lock} until
 * {@link #close()}. A second instance, in this or another process, fails with
 * {@link CacheLockException}.</p>
 *
 * <p>Full-file rewrites are fine while writes are bounded by the lookup API's daily quota
 * (low thousands). Beyond that an append-only log would be the replacement.</p>
 *
 * @param <T> the metadata payload type
 */
@Slf4j
public class JsonFileMetadataCache<T> implements MetadataCache<T> {

    private final Path path;
    private final ObjectMapper objectMapper;
    private final JavaType fileType;
    private final Map<String, CacheEntry<T>> entries;

    private FileChannel lockChannel;
    private FileLock lock;

    public JsonFileMetadataCache(Path path, Class<T> payloadType, boolean lockEnabled) {
        this.path = path;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        JavaType entryType = objectMapper.getTypeFactory()
                .constructParametricType(CacheEntry.class, payloadType);
        this.fileType = objectMapper.getTypeFactory()
                .constructMapType(TreeMap.class, objectMapper.constructType(String.class), entryType);

        if (lockEnabled) {
            acquireLock();
        }
        this.entries = load();
    }

    @Override
    public Optional<CacheEntry<T>> get(LookupKey key) {
        return Optional.ofNullable(entries.get(key.asCacheKey()));
    }

    @Override
    public boolean contains(LookupKey key) {
        return entries.containsKey(key.asCacheKey());
    }

    @Override
    public void put(LookupKey key, CacheEntry<T> entry) {
        String cacheKey = key.asCacheKey();
        if (entries.containsKey(cacheKey)) {
            throw new IllegalStateException("Cache entry already exists for key '" + cacheKey + "'");
        }
        entries.put(cacheKey, entry);
        try {
            save();
        } catch (IOException e) {
            // Keep memory and disk in agreement; the caller aborts the run.
            entries.remove(cacheKey);
            throw new CacheWriteException("Failed to persist cache entry '" + cacheKey + "' to " + path, e);
        }
        log.debug("Cached {} for '{}'", entry.getResultKind(), cacheKey);
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public Map<ResultKind, Long> countByKind() {
        Map<ResultKind, Long> counts = new EnumMap<>(ResultKind.class);
        for (ResultKind kind : ResultKind.values()) {
            counts.put(kind, 0L);
        }
        for (CacheEntry<T> entry : entries.values()) {
            counts.merge(entry.getResultKind(), 1L, Long::sum);
        }
        return counts;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public void close() {
        try {
            if (lock != null && lock.isValid()) {
                lock.release();
            }
            if (lockChannel != null) {
                lockChannel.close();
            }
        } catch (IOException e) {
            log.warn("Failed to release cache lock for {}: {}", path, e.getMessage());
        } finally {
            lock = null;
            lockChannel = null;
        }
    }

    // ──────────────────────── internals ──────────────────────────────────

    private Map<String, CacheEntry<T>> load() {
        if (!Files.exists(path)) {
            log.info("No existing cache at {}", path);
            return new TreeMap<>();
        }
        Map<String, CacheEntry<T>> loaded;
        try {
            loaded = objectMapper.readValue(path.toFile(), fileType);
            if (loaded == null) {
                throw new IOException("cache file holds JSON null");
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to load cache {}: {}. Starting fresh.", path, e.getMessage());
            quarantine();
            return new TreeMap<>();
        }

        Map<String, CacheEntry<T>> valid = new TreeMap<>();
        loaded.forEach((key, entry) -> {
            if (isUsable(entry)) {
                valid.put(key, entry);
            } else {
                log.warn("Dropping unusable cache entry '{}': {}", key, entry);
            }
        });
        if (valid.size() < loaded.size()) {
            log.warn("Cache {} held {} unusable entries, keeping {}", path, loaded.size() - valid.size(), valid.size());
            quarantine();
            rewrite(valid);
        }
        log.info("Loaded {} cached lookups from {}", valid.size(), path);
        return valid;
    }

    /** Every entry needs a variant, and a match needs its payload. */
    private static boolean isUsable(CacheEntry<?> entry) {
        if (entry == null || entry.getResultKind() == null) {
            return false;
        }
        return entry.getResultKind() != ResultKind.MATCH || entry.getPayload() != null;
    }

    private void rewrite(Map<String, CacheEntry<T>> valid) {
        try {
            save(valid);
        } catch (IOException e) {
            throw new CacheWriteException("Failed to rewrite cleaned cache " + path, e);
        }
    }

    private void quarantine() {
        Path aside = path.resolveSibling(path.getFileName() + ".corrupt-" + System.currentTimeMillis());
        try {
            Files.move(path, aside, StandardCopyOption.REPLACE_EXISTING);
            log.warn("Moved unreadable cache file to {}", aside);
        } catch (IOException e) {
            log.warn("Could not move unreadable cache file {} aside: {}", path, e.getMessage());
        }
    }

    private void save() throws IOException {
        save(entries);
    }

    private void save(Map<String, CacheEntry<T>> content) throws IOException {
        Path directory = path.toAbsolutePath().getParent();
        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, path.getFileName().toString(), ".tmp");
        try {
            objectMapper.writerFor(fileType).writeValue(temp.toFile(), content);
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private void acquireLock() {
        Path lockPath = path.resolveSibling(path.getFileName() + ".lock");
        try {
            Files.createDirectories(lockPath.toAbsolutePath().getParent());
            lockChannel = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            lock = lockChannel.tryLock();
        } catch (OverlappingFileLockException e) {
            closeLockChannelQuietly();
            throw new CacheLockException("Cache " + path + " is already open in this process", e);
        } catch (IOException e) {
            closeLockChannelQuietly();
            throw new CacheLockException("Failed to lock cache " + path, e);
        }
        if (lock == null) {
            closeLockChannelQuietly();
            throw new CacheLockException("Cache " + path + " is locked by another process");
        }
        log.debug("Acquired cache lock {}", lockPath);
    }

    private void closeLockChannelQuietly() {
        if (lockChannel == null) {
            return;
        }
        try {
            lockChannel.close();
        } catch (IOException e) {
            log.debug("Ignoring failure closing lock channel: {}", e.getMessage());
        } finally {
            lockChannel = null;
        }
    }
}
