package com.strata.lookup;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Invocation used while a hierarchy configuration is resolved. Every scope variable read through
 * interpolation is remembered so the resolved hierarchy can later be checked for scope drift.
 */
public final class ScopeLookupCollectingInvocation extends Invocation {

    private final Map<String, Object> scopeInterpolations = new LinkedHashMap<>();

    public ScopeLookupCollectingInvocation(Scope scope) {
        super(scope);
    }

    public ScopeLookupCollectingInvocation(Scope scope, Explainer explainer) {
        super(scope, explainer);
    }

    @Override
    public void rememberScopeLookup(String name, Object value) {
        scopeInterpolations.put(name, value);
    }

    /** Variable name to the value it had when it was read. */
    public Map<String, Object> getScopeInterpolations() {
        return Collections.unmodifiableMap(scopeInterpolations);
    }
}
