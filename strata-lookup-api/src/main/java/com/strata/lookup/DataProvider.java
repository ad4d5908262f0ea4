package com.strata.lookup;

import com.strata.lookup.merge.MergeStrategy;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Anything able to answer a key lookup: a tier (global, environment, module) or one entry of a hierarchy.
 */
public interface DataProvider {

    /** Name used in diagnostics (hierarchy entry name or tier label). */
    String getName();

    /**
     * Looks up the root key of {@code key} using {@code merge} to combine the provider's own sources.
     *
     * @return the found value or not-found
     */
    LookupResult keyLookup(LookupKey key, Invocation invocation, MergeStrategy merge);

    /**
     * Hook for a parent provider to filter a data hash produced by one of its hierarchy entries.
     *
     * @param dataHash data returned by a data_hash function
     * @param label    lazily built description of the source (for warnings)
     * @return the data hash to use
     */
    default Map<String, Object> validateDataHash(Map<String, Object> dataHash, Supplier<String> label) {
        return dataHash;
    }

    /** Hook for a parent provider to check a single found value. */
    default Object validateDataValue(Object value, Supplier<String> label) {
        return value;
    }
}
