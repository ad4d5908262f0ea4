package com.strata.provider;

import com.strata.lookup.LookupResult;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-location state of a function provider: the loaded data hash, memoized key answers and the
 * free-form cache exposed to backend functions.
 */
final class FunctionContext {

    private Map<String, Object> dataHash;
    private final Map<String, LookupResult> answers = new HashMap<>();
    private final Map<String, Object> cache = new LinkedHashMap<>();

    Map<String, Object> getDataHash() {
        return dataHash;
    }

    void setDataHash(Map<String, Object> dataHash) {
        this.dataHash = dataHash;
    }

    LookupResult getAnswer(String key) {
        return answers.get(key);
    }

    void putAnswer(String key, LookupResult answer) {
        answers.put(key, answer);
    }

    Map<String, Object> getCache() {
        return cache;
    }
}
