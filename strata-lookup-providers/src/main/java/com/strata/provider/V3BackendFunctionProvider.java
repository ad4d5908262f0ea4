package com.strata.provider;

import com.strata.lookup.DataProvider;
import com.strata.lookup.Invocation;
import com.strata.lookup.LookupException;
import com.strata.lookup.LookupFailedException;
import com.strata.lookup.LookupResult;
import com.strata.lookup.UnrecognizedMergeException;
import com.strata.lookup.merge.MergeStrategy;
import com.strata.provider.legacy.BackendLoadException;
import com.strata.provider.legacy.LegacyBackend;
import com.strata.provider.legacy.ResolutionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adapts a legacy (hiera 3) backend. The backend is instantiated on first use; a backend that cannot be
 * loaded or constructed is reported and makes this entry not-found. Failures raised by the backend during a
 * lookup ({@link com.strata.provider.legacy.LegacyBackendException} or any other runtime failure) abort the
 * lookup as {@link LookupFailedException}.
 */
public class V3BackendFunctionProvider extends LookupKeyFunctionProvider {

    private static final Logger log = LoggerFactory.getLogger(V3BackendFunctionProvider.class);

    public static final String RECURSE_GUARD = "recurse_guard";

    private LegacyBackend backend;

    public V3BackendFunctionProvider(String name, DataProvider parent, String backendName, Map<String, Object> options,
                                     List<ResolvedLocation> locations, ProviderServices services) {
        super(name, parent, backendName, options, locations, services);
    }

    @Override
    public FunctionKind getKind() {
        return FunctionKind.V3_BACKEND;
    }

    @Override
    protected boolean memoizesAnswers() {
        return false;
    }

    @Override
    protected LookupResult lookupKey(String rootKey, Invocation invocation, ResolvedLocation location,
                                     MergeStrategy merge) {
        LegacyBackend b = backend(invocation);
        if (b == null) {
            return LookupResult.notFound();
        }
        Map<String, Object> context = new HashMap<>();
        context.put(RECURSE_GUARD, null);
        try {
            LookupResult result = b.lookup(rootKey, invocation.getScope(), null, convertMerge(merge), context);
            return result != null ? result : LookupResult.notFound();
        } catch (LookupException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new LookupFailedException(topKey(invocation, rootKey), e);
        }
    }

    private LegacyBackend backend(Invocation invocation) {
        if (backend == null) {
            try {
                backend = getServices().getLegacyBackends().instantiate(getFunctionName(), getOptions());
                log.info("Instantiated legacy backend '{}'", getFunctionName());
            } catch (BackendLoadException e) {
                String verb = e.isLoadFailure() ? "load" : "instantiate";
                invocation.reportText(() -> "Unable to " + verb + " backend '" + getFunctionName() + "': " + e.getMessage());
                log.warn("Unable to {} backend '{}': {}", verb, getFunctionName(), e.getMessage());
                return null;
            }
        }
        return backend;
    }

    private static String topKey(Invocation invocation, String rootKey) {
        return invocation.getTopKey() != null ? invocation.getTopKey().getKey() : rootKey;
    }

    /**
     * Translates a merge argument into the legacy vocabulary. Note that {@code deep} maps to the
     * {@code deeper} behavior and {@code reverse_deep} to {@code deep}.
     *
     * @param merge null, a strategy name, a strategy map or a {@link MergeStrategy}
     * @throws UnrecognizedMergeException if the argument names no known strategy
     */
    public static ResolutionType convertMerge(Object merge) {
        if (merge == null) {
            return ResolutionType.priority();
        }
        if (merge instanceof MergeStrategy) {
            return convertMerge(((MergeStrategy) merge).getConfiguration());
        }
        if (merge instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) merge;
            Object strategy = map.get(MergeStrategy.STRATEGY);
            if (MergeStrategy.DEEP.equals(strategy)) {
                return ResolutionType.hash(ResolutionType.Behavior.DEEPER, remainingOptions(map));
            }
            if (MergeStrategy.REVERSE_DEEP.equals(strategy)) {
                return ResolutionType.hash(ResolutionType.Behavior.DEEP, remainingOptions(map));
            }
            if (!(strategy instanceof String)) {
                throw new UnrecognizedMergeException(merge);
            }
            return convertMerge(strategy);
        }
        if (merge instanceof String) {
            switch ((String) merge) {
                case MergeStrategy.FIRST:
                    return ResolutionType.priority();
                case MergeStrategy.UNIQUE:
                    return ResolutionType.array();
                case MergeStrategy.HASH:
                    return ResolutionType.hash(ResolutionType.Behavior.NATIVE);
                case MergeStrategy.DEEP:
                    return ResolutionType.hash(ResolutionType.Behavior.DEEPER);
                case MergeStrategy.REVERSE_DEEP:
                    return ResolutionType.hash(ResolutionType.Behavior.DEEP);
                default:
                    break;
            }
        }
        throw new UnrecognizedMergeException(merge, "Unrecognized value for request 'merge' parameter: '" + merge + "'");
    }

    private static Map<String, Object> remainingOptions(Map<?, ?> map) {
        Map<String, Object> options = new LinkedHashMap<>();
        map.forEach((k, v) -> {
            if (!MergeStrategy.STRATEGY.equals(k)) {
                options.put(String.valueOf(k), v);
            }
        });
        return options;
    }
}
