package com.strata.provider;

import com.strata.lookup.DataProvider;
import com.strata.lookup.Invocation;
import com.strata.lookup.LookupKey;
import com.strata.lookup.LookupResult;
import com.strata.lookup.merge.MergeStrategy;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/** Parent provider that only records validation calls and drops keys starting with {@code drop_}. */
class TestParent implements DataProvider {

    int validatedHashes;

    @Override
    public String getName() {
        return "test parent";
    }

    @Override
    public LookupResult keyLookup(LookupKey key, Invocation invocation, MergeStrategy merge) {
        return LookupResult.notFound();
    }

    @Override
    public Map<String, Object> validateDataHash(Map<String, Object> dataHash, Supplier<String> label) {
        validatedHashes++;
        Map<String, Object> result = new LinkedHashMap<>(dataHash);
        result.keySet().removeIf(k -> k.startsWith("drop_"));
        return result;
    }
}
