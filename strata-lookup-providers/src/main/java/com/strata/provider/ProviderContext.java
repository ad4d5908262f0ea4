package com.strata.provider;

import com.strata.lookup.Invocation;
import com.strata.lookup.LookupResult;
import com.strata.lookup.Scope;

import java.util.Collections;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Handed to backend functions. Gives access to the scope, explanation output and a cache that lives as
 * long as the provider's location (one session, or until the hierarchy is rebuilt).
 */
public final class ProviderContext {

    private final FunctionProvider provider;
    private final FunctionContext functionContext;
    private final Invocation invocation;

    ProviderContext(FunctionProvider provider, FunctionContext functionContext, Invocation invocation) {
        this.provider = provider;
        this.functionContext = functionContext;
        this.invocation = invocation;
    }

    /** Not-found answer for {@link LookupKeyFunction} and {@link DataDigFunction}. */
    public LookupResult notFound() {
        return LookupResult.notFound();
    }

    public void explain(Supplier<String> text) {
        invocation.reportText(text);
    }

    public void cache(String key, Object value) {
        functionContext.getCache().put(key, value);
    }

    public void cacheAll(Map<String, ?> entries) {
        functionContext.getCache().putAll(entries);
    }

    public boolean isCached(String key) {
        return functionContext.getCache().containsKey(key);
    }

    public Object getCachedValue(String key) {
        return functionContext.getCache().get(key);
    }

    public Map<String, Object> getCachedEntries() {
        return Collections.unmodifiableMap(functionContext.getCache());
    }

    /** Interpolates {@code %{...}} expressions in the value against the invocation scope. */
    public Object interpolate(Object value) {
        return provider.getServices().getInterpolator().interpolateValue(value, invocation, true);
    }

    public Scope getScope() {
        return invocation.getScope();
    }

    public Invocation getInvocation() {
        return invocation;
    }

    /** Name of the hierarchy entry the function serves. */
    public String getProviderName() {
        return provider.getName();
    }
}
