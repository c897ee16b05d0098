package com.rom.ei.api;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * A key/value store used to memoize expensive computations.
 *
 * Regions are not required to be thread safe.
 */
public interface CacheRegion {

    Optional<Object> get(Object key);

    void put(Object key, Object value);

    /** Drops the entry for {@code key}, if any. */
    void invalidate(Object key);

    /**
     * Returns the cached value for {@code key}, computing and storing it first
     * if it is absent. {@code compute} is invoked at most once per key as long
     * as the region keeps the entry.
     */
    @SuppressWarnings("unchecked")
    default <V> V getOrCompute(Object key, Supplier<V> compute) {
        Optional<Object> hit = get(key);
        if (hit.isPresent())
            return (V) hit.get();
        V value = compute.get();
        put(key, value);
        return value;
    }
}
