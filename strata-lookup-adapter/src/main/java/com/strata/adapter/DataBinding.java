package com.strata.adapter;

import com.strata.lookup.LookupResult;
import com.strata.lookup.Scope;
import com.strata.lookup.merge.MergeStrategy;

/**
 * A legacy data binding terminus answering global lookups when the terminus is not {@code hiera}.
 * Runtime failures other than {@link com.strata.lookup.LookupException} are reported to the caller
 * as {@link com.strata.lookup.LookupFailedException}.
 */
@FunctionalInterface
public interface DataBinding {

    /**
     * @param rootKey     root key of the lookup
     * @param environment environment of the session
     * @param scope       variables of the invocation
     * @param merge       merge strategy of the lookup
     * @return the value, or not-found
     */
    LookupResult find(String rootKey, EnvironmentContext environment, Scope scope, MergeStrategy merge);
}
