package com.strata.provider.legacy;

import java.util.Map;

/**
 * Creates a legacy backend from its section of a hiera 3 document.
 */
@FunctionalInterface
public interface LegacyBackendFactory {

    /**
     * @param config the backend's own configuration section (may be empty)
     * @return a {@link LegacyBackend} or a {@link LegacyBackend1x}
     */
    Object create(Map<String, Object> config);
}
