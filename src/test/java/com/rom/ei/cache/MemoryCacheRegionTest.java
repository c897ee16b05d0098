package com.rom.ei.cache;

import com.rom.ei.api.CacheRegion;
import com.rom.ei.api.InvalidConfigurationException;
import org.junit.Test;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

public class MemoryCacheRegionTest {

    @Test
    public void testGetOrComputeComputesOnce() {
        MemoryCacheRegion region = new MemoryCacheRegion("test");
        AtomicInteger calls = new AtomicInteger();
        CacheKey key = new CacheKey(7L, 3);

        String first = region.getOrCompute(key, () -> "value-" + calls.incrementAndGet());
        String second = region.getOrCompute(new CacheKey(7L, 3), () -> "value-" + calls.incrementAndGet());

        assertEquals("value-1", first);
        assertSame(first, second);
        assertEquals(1, calls.get());
        assertEquals(1, region.hits());
        assertEquals(1, region.misses());
    }

    @Test
    public void testKeysOfDifferentOwnersAreDistinct() {
        MemoryCacheRegion region = new MemoryCacheRegion("test");
        region.put(new CacheKey(1L, 0), "a");
        region.put(new CacheKey(2L, 0), "b");
        assertEquals(Optional.of("a"), region.get(new CacheKey(1L, 0)));
        assertEquals(Optional.of("b"), region.get(new CacheKey(2L, 0)));
        assertFalse(region.get(new CacheKey(1L, 1)).isPresent());
    }

    @Test
    public void testBoundedRegionEvicts() {
        MemoryCacheRegion region = new MemoryCacheRegion("bounded", 2);
        region.put("a", 1);
        region.put("b", 2);
        region.put("c", 3);
        region.put("d", 4);

        assertEquals(2, region.size());
    }

    @Test
    public void testUnboundedRegionKeepsEverything() {
        MemoryCacheRegion region = new MemoryCacheRegion("unbounded");
        for (int i = 0; i < 100; i++)
            region.put(new CacheKey(1L, i), i);
        assertEquals(100, region.size());
        assertEquals(Optional.of(0), region.get(new CacheKey(1L, 0)));
    }

    @Test
    public void testInvalidate() {
        MemoryCacheRegion region = new MemoryCacheRegion("test");
        region.put("a", 1);
        region.put("b", 2);
        region.invalidate("a");
        region.invalidate("missing");

        assertEquals(1, region.size());
        assertFalse(region.get("a").isPresent());
        assertTrue(region.get("b").isPresent());
    }

    @Test
    public void testClear() {
        MemoryCacheRegion region = new MemoryCacheRegion("test");
        region.put("a", 1);
        region.clear();
        assertEquals(0, region.size());
        assertFalse(region.get("a").isPresent());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullValuesAreRejected() {
        new MemoryCacheRegion("test").put("a", null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeCapacityIsRejected() {
        new MemoryCacheRegion("test", -1);
    }

    @Test
    public void testRegistry() {
        assertTrue(CacheRegions.contains(CacheRegions.MEMORY));
        assertNotNull(CacheRegions.get("memory"));

        CacheRegion custom = new MemoryCacheRegion("registry-test", 4);
        CacheRegions.register("registry-test", custom);
        assertSame(custom, CacheRegions.get("registry-test"));

        try {
            CacheRegions.get("redis");
            fail("Should throw InvalidConfigurationException for an unknown region");
        } catch (InvalidConfigurationException e) {
            assertTrue(e.getMessage().contains("redis"));
            assertTrue(e.getMessage().contains("memory"));
        }
    }
}
