package com.strata.provider;

import com.strata.lookup.DataProvider;
import com.strata.lookup.Invocation;
import com.strata.lookup.LookupKey;
import com.strata.lookup.LookupResult;
import com.strata.lookup.merge.MergeStrategy;

import java.util.List;
import java.util.Map;

/**
 * Calls a {@link LookupKeyFunction} per root key. Found answers are memoized per location; not-found
 * answers are asked again.
 */
public class LookupKeyFunctionProvider extends FunctionProvider {

    public LookupKeyFunctionProvider(String name, DataProvider parent, String functionName, Map<String, Object> options,
                                     List<ResolvedLocation> locations, ProviderServices services) {
        super(name, parent, functionName, options, locations, services);
    }

    @Override
    public FunctionKind getKind() {
        return FunctionKind.LOOKUP_KEY;
    }

    @Override
    protected LookupResult invokeWithLocation(Invocation invocation, ResolvedLocation location, LookupKey key,
                                              MergeStrategy merge) {
        String root = key.getRootKey();
        FunctionContext context = functionContext(location);
        LookupResult answer = memoizesAnswers() ? context.getAnswer(root) : null;
        if (answer == null) {
            answer = lookupKey(root, invocation, location, merge);
            if (answer.isFound() && memoizesAnswers()) {
                context.putAnswer(root, answer);
            }
        }
        if (answer.isNotFound()) {
            invocation.reportNotFound(root);
            return answer;
        }
        Object value = getParent().validateDataValue(answer.getValue(), () -> fullName());
        return LookupResult.found(invocation.reportFound(root, value));
    }

    /** Whether found answers are kept per location. */
    protected boolean memoizesAnswers() {
        return true;
    }

    /** Asks the backend for one root key. */
    protected LookupResult lookupKey(String rootKey, Invocation invocation, ResolvedLocation location,
                                     MergeStrategy merge) {
        LookupKeyFunction function = getServices().getFunctions().getLookupKey(getFunctionName());
        LookupResult result = function.lookupKey(rootKey, optionsFor(location), providerContext(location, invocation));
        return result != null ? result : LookupResult.notFound();
    }
}
