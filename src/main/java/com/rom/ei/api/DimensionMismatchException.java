package com.rom.ei.api;

/**
 * Raised before any computation when the input vectors are missing or do not
 * share type and dimension.
 */
public class DimensionMismatchException extends InterpolationException {

    public DimensionMismatchException(String message) {
        super(message);
    }
}
