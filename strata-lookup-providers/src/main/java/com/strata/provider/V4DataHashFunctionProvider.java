package com.strata.provider;

import com.strata.lookup.DataProvider;
import com.strata.lookup.Invocation;

import java.util.Map;

/**
 * Deprecated parameterless data function ({@code mymodule::data}). The function is called once, without
 * options or location, and its map serves all keys.
 */
public class V4DataHashFunctionProvider extends DataHashFunctionProvider {

    public V4DataHashFunctionProvider(String name, DataProvider parent, String functionName,
                                      ProviderServices services) {
        super(name, parent, functionName, null, null, services);
    }

    @Override
    public FunctionKind getKind() {
        return FunctionKind.V4_DATA_HASH;
    }

    @Override
    protected Map<String, Object> loadDataHash(Invocation invocation, ResolvedLocation location) {
        DataHashFunction function = getServices().getFunctions().getDataHash(getFunctionName());
        return function.dataHash(Map.of(), providerContext(null, invocation));
    }
}
