package com.strata.adapter;

import com.strata.lookup.Invocation;
import com.strata.lookup.KeyNotFoundException;
import com.strata.lookup.LookupResult;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Caller-facing lookup over a {@link LookupAdapter}. Several names may be given; they are tried in order.
 * For each name the invocation's override values win over the tiers. When no name is found anywhere the
 * invocation's default values are tried, then an explicit default.
 */
public final class LookupService {

    private final LookupAdapter adapter;

    public LookupService(LookupAdapter adapter) {
        this.adapter = Objects.requireNonNull(adapter, "adapter");
    }

    /**
     * @throws KeyNotFoundException if no value is found
     */
    public Object lookup(String name, Invocation invocation) {
        return lookup(List.of(name), invocation, null);
    }

    /**
     * @param merge merge strategy for every name; null uses each key's lookup options
     * @throws KeyNotFoundException if no value is found
     */
    public Object lookup(List<String> names, Invocation invocation, Object merge) {
        LookupResult result = search(names, invocation, merge);
        if (result.isNotFound()) {
            throw new KeyNotFoundException(names);
        }
        return result.getValue();
    }

    /** Like {@link #lookup(List, Invocation, Object)} but returns {@code defaultValue} when nothing is found. */
    public Object lookupOrDefault(List<String> names, Invocation invocation, Object merge, Object defaultValue) {
        return search(names, invocation, merge).orElse(defaultValue);
    }

    /** Overrides and tiers per name, then the default values map. */
    public LookupResult search(List<String> names, Invocation invocation, Object merge) {
        if (names.isEmpty()) {
            throw new IllegalArgumentException("At least one name is required");
        }
        Map<String, Object> overrides = invocation.getOverrideValues();
        for (String name : names) {
            if (overrides.containsKey(name)) {
                Object value = overrides.get(name);
                invocation.reportFoundInOverrides(name, value);
                return LookupResult.found(value);
            }
            LookupResult result = adapter.lookup(name, invocation, merge);
            if (result.isFound()) {
                return result;
            }
        }
        Map<String, Object> defaults = invocation.getDefaultValues();
        for (String name : names) {
            if (defaults.containsKey(name)) {
                Object value = defaults.get(name);
                invocation.reportFoundInDefaults(name, value);
                return LookupResult.found(value);
            }
        }
        return LookupResult.notFound();
    }

    public LookupAdapter getAdapter() {
        return adapter;
    }
}
