package com.rom.ei.algorithms;

import com.rom.ei.api.InvalidConfigurationException;

import java.util.Locale;

/**
 * How the greedy search measures the approximation error of an evaluation.
 */
public enum Projection {
    /**
     * Distance to the orthogonal projection onto the span of the collateral
     * basis (w.r.t. the configured inner product).
     */
    ORTHOGONAL,
    /**
     * Distance to the empirical interpolant, i.e. to the basis combination that
     * matches the evaluation at the interpolation DOFs.
     */
    EI;

    /**
     * Parses {@code "orthogonal"} or {@code "ei"}, ignoring case.
     *
     * @throws InvalidConfigurationException for any other value.
     */
    public static Projection fromString(String s) {
        if (s == null)
            throw new InvalidConfigurationException("Projection must not be null");
        return switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "orthogonal" -> ORTHOGONAL;
            case "ei" -> EI;
            default -> throw new InvalidConfigurationException(
                    "Unknown projection '" + s + "', expected 'orthogonal' or 'ei'");
        };
    }
}
