package com.strata.provider.legacy;

/**
 * Raised by a legacy backend when a lookup fails at runtime.
 */
public class LegacyBackendException extends RuntimeException {

    public LegacyBackendException(String message) {
        super(message);
    }

    public LegacyBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
