package com.strata.provider;

import com.strata.lookup.DataProvider;
import com.strata.lookup.Invocation;
import com.strata.lookup.LookupKey;
import com.strata.lookup.LookupResult;
import com.strata.lookup.merge.MergeStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Calls a {@link DataHashFunction} once per location and serves every root key from the returned map.
 * Found values are checked by the parent and interpolated.
 */
public class DataHashFunctionProvider extends FunctionProvider {

    private static final Logger log = LoggerFactory.getLogger(DataHashFunctionProvider.class);

    public DataHashFunctionProvider(String name, DataProvider parent, String functionName, Map<String, Object> options,
                                    List<ResolvedLocation> locations, ProviderServices services) {
        super(name, parent, functionName, options, locations, services);
    }

    @Override
    public FunctionKind getKind() {
        return FunctionKind.DATA_HASH;
    }

    @Override
    protected LookupResult invokeWithLocation(Invocation invocation, ResolvedLocation location, LookupKey key,
                                              MergeStrategy merge) {
        String root = key.getRootKey();
        Map<String, Object> data = dataHash(invocation, location);
        if (!data.containsKey(root)) {
            invocation.reportNotFound(root);
            return LookupResult.notFound();
        }
        Object value = getParent().validateDataValue(data.get(root), () -> fullName());
        value = getServices().getInterpolator().interpolateValue(value, invocation, true);
        return LookupResult.found(invocation.reportFound(root, value));
    }

    /** The map of one location; loaded, validated and cached on first use. */
    protected Map<String, Object> dataHash(Invocation invocation, ResolvedLocation location) {
        FunctionContext context = functionContext(location);
        Map<String, Object> data = context.getDataHash();
        if (data == null) {
            data = loadDataHash(invocation, location);
            data = getParent().validateDataHash(data, () -> fullName() + (location != null ? " at " + location : ""));
            context.setDataHash(data != null ? Collections.unmodifiableMap(data) : Collections.emptyMap());
            log.debug("Loaded {} key(s) for {} from {}", context.getDataHash().size(), fullName(), location);
        }
        return context.getDataHash();
    }

    /** Calls the backend function. */
    protected Map<String, Object> loadDataHash(Invocation invocation, ResolvedLocation location) {
        DataHashFunction function = getServices().getFunctions().getDataHash(getFunctionName());
        Map<String, Object> data = function.dataHash(optionsFor(location), providerContext(location, invocation));
        return data != null ? data : Collections.emptyMap();
    }
}
