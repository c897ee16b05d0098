package com.rom.ei.cache;

import com.rom.ei.api.CacheRegion;

import java.util.Optional;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;

import lombok.extern.log4j.Log4j2;

/**
 * Heap-backed cache region on a Caffeine cache, optionally bounded in size.
 *
 * Values are stored by reference; callers that mutate what they get back
 * mutate the cached entry. Cache maintenance runs on the calling thread, so
 * evictions are visible as soon as {@link #put} returns.
 */
@Log4j2
public final class MemoryCacheRegion implements CacheRegion {
    private final String name;
    private final Cache<Object, Object> cache;

    /** Unbounded region. */
    public MemoryCacheRegion(String name) {
        this(name, 0);
    }

    /**
     * @param maxKeys maximum number of entries kept, 0 for unbounded.
     */
    public MemoryCacheRegion(String name, int maxKeys) {
        if (maxKeys < 0)
            throw new IllegalArgumentException("maxKeys must be >= 0, got " + maxKeys);
        this.name = name;
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .recordStats()
                .executor(Runnable::run)
                .removalListener((Object key, Object value, RemovalCause cause) -> {
                    if (cause.wasEvicted())
                        log.debug("Cache region '{}': evicting {}", name, key);
                });
        if (maxKeys > 0)
            builder.maximumSize(maxKeys);
        this.cache = builder.build();
    }

    public String name() {
        return name;
    }

    @Override
    public Optional<Object> get(Object key) {
        Object v = cache.getIfPresent(key);
        log.debug("Cache region '{}': {} for {}", name, v == null ? "miss" : "hit", key);
        return Optional.ofNullable(v);
    }

    @Override
    public void put(Object key, Object value) {
        if (value == null)
            throw new IllegalArgumentException("Cannot cache null for key " + key);
        cache.put(key, value);
    }

    @Override
    public void invalidate(Object key) {
        cache.invalidate(key);
    }

    public int size() {
        cache.cleanUp();
        return (int) cache.estimatedSize();
    }

    public long hits() {
        return cache.stats().hitCount();
    }

    public long misses() {
        return cache.stats().missCount();
    }

    public void clear() {
        cache.invalidateAll();
    }
}
