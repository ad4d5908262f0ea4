package com.strata.provider;

import com.strata.lookup.LookupResult;

import java.util.Map;

/**
 * Backend function given a root key that may itself answer not-found ({@code data_dig} kind).
 * Every answer, not-found included, is memoized per location for the provider's lifetime.
 */
@FunctionalInterface
public interface DataDigFunction {

    LookupResult dataDig(String key, Map<String, Object> options, ProviderContext context);
}
