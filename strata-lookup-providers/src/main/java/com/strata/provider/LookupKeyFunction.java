package com.strata.provider;

import com.strata.lookup.LookupResult;

import java.util.Map;

/**
 * Backend function answering one root key at a time ({@code lookup_key} kind).
 */
@FunctionalInterface
public interface LookupKeyFunction {

    /**
     * @param key     root key
     * @param options entry options; contain {@code path} or {@code uri} when the entry has locations
     * @param context per-location context
     * @return found value or {@link ProviderContext#notFound()}
     */
    LookupResult lookupKey(String key, Map<String, Object> options, ProviderContext context);
}
