package com.rom.ei.api;

/**
 * Raised before any computation when the requested options are invalid or
 * contradict each other.
 */
public class InvalidConfigurationException extends InterpolationException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
