package com.strata.provider;

import java.util.Arrays;
import java.util.List;

/**
 * Calling convention of the backend function behind a hierarchy entry. The key is the name used in
 * hiera.yaml ({@code data_hash: yaml_data}).
 */
public enum FunctionKind {
    /** Function returns the whole map for a location; cached per location. */
    DATA_HASH("data_hash"),
    /** Function is asked for one root key at a time. */
    LOOKUP_KEY("lookup_key"),
    /** Function is asked for one root key and may answer not-found; every answer is memoized. */
    DATA_DIG("data_dig"),
    /** Adapter for a legacy (hiera 3) backend. */
    V3_BACKEND("v3_backend"),
    /** Deprecated parameterless data function ({@code mymodule::data}). */
    V4_DATA_HASH("v4_data_hash");

    /** Kinds a v5 entry or the v5 defaults may name. */
    public static final List<FunctionKind> USER_KINDS = List.of(DATA_HASH, LOOKUP_KEY, DATA_DIG);

    /** Kinds a v5 hierarchy entry may name (user kinds plus the legacy v4 function). */
    public static final List<FunctionKind> ENTRY_KINDS = List.of(DATA_HASH, LOOKUP_KEY, DATA_DIG, V4_DATA_HASH);

    private final String key;

    FunctionKind(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /** Kind for a hiera.yaml key, or null if the key names no function kind. */
    public static FunctionKind fromKey(String key) {
        return Arrays.stream(values()).filter(k -> k.key.equals(key)).findFirst().orElse(null);
    }

    @Override
    public String toString() {
        return key;
    }
}
