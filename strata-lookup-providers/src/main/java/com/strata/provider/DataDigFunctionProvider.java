package com.strata.provider;

import com.strata.lookup.DataProvider;
import com.strata.lookup.Invocation;
import com.strata.lookup.LookupKey;
import com.strata.lookup.LookupResult;
import com.strata.lookup.merge.MergeStrategy;

import java.util.List;
import java.util.Map;

/**
 * Calls a {@link DataDigFunction} per root key and memoizes every answer per location, not-found included.
 */
public class DataDigFunctionProvider extends FunctionProvider {

    public DataDigFunctionProvider(String name, DataProvider parent, String functionName, Map<String, Object> options,
                                   List<ResolvedLocation> locations, ProviderServices services) {
        super(name, parent, functionName, options, locations, services);
    }

    @Override
    public FunctionKind getKind() {
        return FunctionKind.DATA_DIG;
    }

    @Override
    protected LookupResult invokeWithLocation(Invocation invocation, ResolvedLocation location, LookupKey key,
                                              MergeStrategy merge) {
        String root = key.getRootKey();
        FunctionContext context = functionContext(location);
        LookupResult answer = context.getAnswer(root);
        if (answer == null) {
            DataDigFunction function = getServices().getFunctions().getDataDig(getFunctionName());
            answer = function.dataDig(root, optionsFor(location), providerContext(location, invocation));
            if (answer == null) {
                answer = LookupResult.notFound();
            }
            context.putAnswer(root, answer);
        }
        if (answer.isNotFound()) {
            invocation.reportNotFound(root);
            return answer;
        }
        Object value = getParent().validateDataValue(answer.getValue(), () -> fullName());
        return LookupResult.found(invocation.reportFound(root, value));
    }
}
