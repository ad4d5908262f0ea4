package com.strata.provider.legacy;

import com.strata.lookup.Scope;

/**
 * A hiera 1.x style backend: no call context, null means not found.
 */
public interface LegacyBackend1x {

    Object lookup(String key, Scope scope, String orderOverride, ResolutionType resolutionType);
}
