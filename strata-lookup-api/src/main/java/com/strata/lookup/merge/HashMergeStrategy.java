package com.strata.lookup.merge;

import com.strata.lookup.MergeTypeException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Merges the top-level entries of maps; for a key present in several sources the earliest source wins.
 */
public final class HashMergeStrategy extends MergeStrategy {

    HashMergeStrategy() {
        super(null);
    }

    @Override
    public String getName() {
        return HASH;
    }

    @Override
    protected Object convertValue(Object value) {
        if (!(value instanceof Map)) {
            throw new MergeTypeException(HASH, "a Hash value", value);
        }
        return value;
    }

    @Override
    protected Object checkedMerge(Object e1, Object e2) {
        Map<Object, Object> result = new LinkedHashMap<>((Map<?, ?>) e2);
        result.putAll((Map<?, ?>) e1);
        return result;
    }
}
