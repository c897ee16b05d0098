package com.rom.ei.cache;

import com.rom.ei.api.CacheRegion;
import com.rom.ei.api.InvalidConfigurationException;

import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Process-wide registry of named cache regions.
 *
 * The region {@value #MEMORY} is always present. Additional regions (e.g. a
 * bounded one, or one backed by an external store) can be registered under
 * their own name and then selected by name in the settings.
 *
 * Not thread safe; register regions during startup.
 */
public final class CacheRegions {
    public static final String MEMORY = "memory";

    private static final Map<String, CacheRegion> REGIONS = new HashMap<>();

    static {
        REGIONS.put(MEMORY, new MemoryCacheRegion(MEMORY));
    }

    private CacheRegions() {
        // Utility class
    }

    /**
     * @throws InvalidConfigurationException if no region of that name exists.
     */
    public static CacheRegion get(String name) {
        CacheRegion region = name == null ? null : REGIONS.get(name);
        if (region == null)
            throw new InvalidConfigurationException("Unknown cache region '" + name + "', known regions: "
                    + new TreeMap<>(REGIONS).keySet());
        return region;
    }

    /**
     * Registers (or replaces) a region.
     */
    public static void register(String name, CacheRegion region) {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Region name must not be blank");
        REGIONS.put(name, region);
    }

    public static boolean contains(String name) {
        return name != null && REGIONS.containsKey(name);
    }
}
