package com.rom.ei.api;

/**
 * A fatal numerical breakdown, e.g. a Gram matrix that is not positive
 * definite. No partial result is available when this is thrown.
 */
public class NumericalException extends InterpolationException {

    public NumericalException(String message) {
        super(message);
    }

    public NumericalException(String message, Throwable cause) {
        super(message, cause);
    }
}
