package com.strata.provider;

import com.strata.lookup.DataProvider;
import com.strata.lookup.Invocation;
import com.strata.lookup.LookupKey;
import com.strata.lookup.LookupResult;
import com.strata.lookup.merge.MergeStrategy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A hierarchy entry backed by a named function. The entry's locations are consulted in order through the
 * merge strategy of the lookup; an entry without locations calls its function once, with no location.
 * <p>
 * A location that does not exist is reported and skipped. Per-location state (loaded data, memoized answers,
 * function cache) lives as long as the provider.
 */
public abstract class FunctionProvider implements DataProvider {

    public static final String PATH = "path";
    public static final String URI = "uri";

    private final String name;
    private final DataProvider parent;
    private final String functionName;
    private final Map<String, Object> options;
    private final List<ResolvedLocation> locations;
    private final ProviderServices services;
    private final Map<ResolvedLocation, FunctionContext> contexts = new HashMap<>();

    /**
     * @param name         hierarchy entry name
     * @param parent       tier provider owning the entry (receives validation hooks)
     * @param functionName backend function name
     * @param options      entry options (already interpolated); null = none
     * @param locations    resolved locations; null = entry without locations
     * @param services     shared collaborators
     */
    protected FunctionProvider(String name, DataProvider parent, String functionName, Map<String, Object> options,
                               List<ResolvedLocation> locations, ProviderServices services) {
        this.name = Objects.requireNonNull(name, "name");
        this.parent = Objects.requireNonNull(parent, "parent");
        this.functionName = Objects.requireNonNull(functionName, "functionName");
        this.options = options != null ? Collections.unmodifiableMap(new LinkedHashMap<>(options)) : Collections.emptyMap();
        this.locations = locations != null ? Collections.unmodifiableList(new ArrayList<>(locations)) : null;
        this.services = Objects.requireNonNull(services, "services");
    }

    /** Function kind this provider calls. */
    public abstract FunctionKind getKind();

    @Override
    public String getName() {
        return name;
    }

    public DataProvider getParent() {
        return parent;
    }

    public String getFunctionName() {
        return functionName;
    }

    public Map<String, Object> getOptions() {
        return options;
    }

    /** Resolved locations, or null when the entry has none. */
    public List<ResolvedLocation> getLocations() {
        return locations;
    }

    public ProviderServices getServices() {
        return services;
    }

    @Override
    public LookupResult keyLookup(LookupKey key, Invocation invocation, MergeStrategy merge) {
        return invocation.with("data_provider", this, () -> {
            if (locations == null) {
                return invokeWithLocation(invocation, null, key, merge);
            }
            return MergeStrategy.strategy(merge).lookup(locations, invocation, location ->
                    invocation.with("location", location, () -> {
                        if (!location.exists()) {
                            invocation.reportLocationNotFound();
                            return LookupResult.notFound();
                        }
                        return invokeWithLocation(invocation, location, key, merge);
                    }));
        });
    }

    /**
     * Looks up the root key of {@code key} in one location.
     *
     * @param location the location, or null for an entry without locations
     */
    protected abstract LookupResult invokeWithLocation(Invocation invocation, ResolvedLocation location,
                                                       LookupKey key, MergeStrategy merge);

    /** Entry options with {@code path} or {@code uri} set to the location. */
    protected Map<String, Object> optionsFor(ResolvedLocation location) {
        if (location == null) {
            return options;
        }
        Map<String, Object> result = new LinkedHashMap<>(options);
        result.put(location.isUri() ? URI : PATH, location.getLocation());
        return Collections.unmodifiableMap(result);
    }

    FunctionContext functionContext(ResolvedLocation location) {
        return contexts.computeIfAbsent(location, l -> new FunctionContext());
    }

    ProviderContext providerContext(ResolvedLocation location, Invocation invocation) {
        return new ProviderContext(this, functionContext(location), invocation);
    }

    /** Label used in diagnostics and warnings ({@code hierarchy entry "common"}). */
    public String fullName() {
        return "hierarchy entry \"" + name + "\"";
    }

    @Override
    public String toString() {
        return getKind() + " function '" + functionName + "' (" + fullName() + ")";
    }
}
