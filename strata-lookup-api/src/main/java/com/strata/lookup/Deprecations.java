package com.strata.lookup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Deprecation notices. Each key is reported at most once per process; notices never affect control flow.
 */
public final class Deprecations {

    private static final Logger log = LoggerFactory.getLogger(Deprecations.class);

    private static final Set<String> ISSUED = ConcurrentHashMap.newKeySet();

    private Deprecations() {
    }

    /**
     * Logs {@code message} unless notices are off or {@code key} was already reported.
     *
     * @return true if the notice was logged by this call
     */
    public static boolean warnOnce(StrictMode strict, String key, String message) {
        return warnOnce(strict, key, message, null);
    }

    /**
     * @param file file the deprecated setting was read from (may be null)
     */
    public static boolean warnOnce(StrictMode strict, String key, String message, Object file) {
        if (strict == StrictMode.OFF) {
            return false;
        }
        if (!ISSUED.add(key)) {
            return false;
        }
        if (file != null) {
            log.warn("Deprecation: {} (file: {})", message, file);
        } else {
            log.warn("Deprecation: {}", message);
        }
        return true;
    }

    /** Whether a notice with this key has been reported. */
    public static boolean isIssued(String key) {
        return ISSUED.contains(key);
    }
}
