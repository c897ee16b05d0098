package com.rom.ei.api;

/**
 * Base class of all failures raised while generating interpolation data.
 */
public abstract class InterpolationException extends RuntimeException {

    protected InterpolationException(String message) {
        super(message);
    }

    protected InterpolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
