package com.strata.provider.legacy;

import com.strata.lookup.LookupResult;
import com.strata.lookup.Scope;

import java.util.Map;

/**
 * A hiera 3 style backend.
 */
public interface LegacyBackend {

    /**
     * @param key            root key
     * @param scope          variable scope
     * @param orderOverride  hierarchy level to consult first; null when none
     * @param resolutionType requested merge
     * @param context        backend call context (carries {@code recurse_guard})
     * @return found value or not-found
     * @throws LegacyBackendException on a backend failure
     */
    LookupResult lookup(String key, Scope scope, String orderOverride, ResolutionType resolutionType,
                        Map<String, Object> context);
}
