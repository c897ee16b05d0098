package com.rom.ei.cache;

/**
 * Key of a memoized per-sample computation: the identity of the owning
 * provider plus the sample index.
 */
public record CacheKey(long ownerId, int index) {
}
