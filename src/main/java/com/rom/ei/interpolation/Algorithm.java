package com.rom.ei.interpolation;

import com.rom.ei.api.InvalidConfigurationException;

import java.util.Locale;

/**
 * Which greedy algorithm generates the interpolation data.
 */
public enum Algorithm {
    EI_GREEDY,
    DEIM;

    /**
     * Parses {@code "ei_greedy"} / {@code "ei-greedy"} or {@code "deim"}, ignoring case.
     */
    public static Algorithm fromString(String s) {
        if (s == null)
            return EI_GREEDY;
        return switch (s.trim().toLowerCase(Locale.ROOT).replace('-', '_')) {
            case "ei_greedy" -> EI_GREEDY;
            case "deim" -> DEIM;
            default -> throw new InvalidConfigurationException(
                    "Unknown algorithm '" + s + "', expected 'ei_greedy' or 'deim'");
        };
    }
}
