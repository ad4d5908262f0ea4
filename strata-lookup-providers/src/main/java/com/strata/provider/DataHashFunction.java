package com.strata.provider;

import java.util.Map;

/**
 * Backend function returning all data of one location as a map ({@code data_hash} kind).
 */
@FunctionalInterface
public interface DataHashFunction {

    /**
     * @param options entry options; contain {@code path} or {@code uri} when the entry has locations
     * @param context per-location context (cache, explanation)
     * @return the data (never null; return an empty map when the location holds nothing)
     */
    Map<String, Object> dataHash(Map<String, Object> options, ProviderContext context);
}
