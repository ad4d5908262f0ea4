package com.strata.lookup;

import java.util.Locale;

/** How strictly deprecated configuration is reported. {@link #OFF} silences deprecation notices. */
public enum StrictMode {
    OFF,
    WARNING,
    ERROR;

    /**
     * @param value {@code off}, {@code warning} or {@code error} (case-insensitive); null or blank = WARNING
     */
    public static StrictMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return WARNING;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown strict mode '" + value + "'; expected off, warning or error", e);
        }
    }
}
