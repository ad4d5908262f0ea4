package com.strata.provider;

import com.strata.lookup.LookupResult;

/** Service-loaded lookup_key function answering every key with its upper-case form. */
public class UpperCaseFunctionProvider implements BackendFunctionProvider {

    public static final String NAME = "upper_case";

    @Override
    public String getFunctionName() {
        return NAME;
    }

    @Override
    public FunctionKind getKind() {
        return FunctionKind.LOOKUP_KEY;
    }

    @Override
    public Object createFunction() {
        return (LookupKeyFunction) (key, options, context) -> LookupResult.found(key.toUpperCase());
    }
}
