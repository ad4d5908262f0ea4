package com.strata.provider.legacy;

import com.strata.lookup.LookupResult;
import com.strata.lookup.Scope;

import java.util.Map;
import java.util.Objects;

/**
 * Presents a {@link LegacyBackend1x} as a {@link LegacyBackend}.
 */
public final class Backend1xWrapper implements LegacyBackend {

    private final LegacyBackend1x backend;

    public Backend1xWrapper(LegacyBackend1x backend) {
        this.backend = Objects.requireNonNull(backend, "backend");
    }

    @Override
    public LookupResult lookup(String key, Scope scope, String orderOverride, ResolutionType resolutionType,
                               Map<String, Object> context) {
        Object value = backend.lookup(key, scope, orderOverride, resolutionType);
        return value != null ? LookupResult.found(value) : LookupResult.notFound();
    }

    public LegacyBackend1x getWrapped() {
        return backend;
    }
}
