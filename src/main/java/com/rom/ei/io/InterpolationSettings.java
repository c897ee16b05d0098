package com.rom.ei.io;

import com.rom.ei.algorithms.DeimConfig;
import com.rom.ei.algorithms.EiGreedyConfig;
import com.rom.ei.algorithms.Projection;
import com.rom.ei.cache.CacheRegions;
import com.rom.ei.interpolation.Algorithm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of the interpolation options, as read from JSON.
 *
 * <pre>
 * {
 *   "algorithm": "ei_greedy",
 *   "targetError": 1e-6,
 *   "maxInterpolationDofs": 40,
 *   "projection": "orthogonal",
 *   "cacheRegion": "memory"
 * }
 * </pre>
 *
 * Error norms and inner products are code, not data; they are added to the
 * configs returned by {@link #toEiGreedyConfig()} / {@link #toDeimConfig()}
 * through the builders.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class InterpolationSettings {
    private String algorithm = "ei_greedy";
    private Double targetError;
    private Integer maxInterpolationDofs;
    private String projection = "orthogonal";
    /** DEIM only. */
    private Integer modes;
    private String cacheRegion = CacheRegions.MEMORY;

    public Algorithm algorithmType() {
        return Algorithm.fromString(algorithm);
    }

    public EiGreedyConfig.Builder toEiGreedyBuilder() {
        return EiGreedyConfig.builder()
                .targetError(targetError)
                .maxInterpolationDofs(maxInterpolationDofs)
                .projection(Projection.fromString(projection));
    }

    public EiGreedyConfig toEiGreedyConfig() {
        return toEiGreedyBuilder().build();
    }

    public DeimConfig.Builder toDeimBuilder() {
        return DeimConfig.builder().modes(modes);
    }

    public DeimConfig toDeimConfig() {
        return toDeimBuilder().build();
    }
}
