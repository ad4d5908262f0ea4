package com.strata.lookup.merge;

import com.strata.lookup.Invocation;
import com.strata.lookup.LookupResult;

import java.util.function.Function;

/** Returns the value of the first source that has one; later sources are not consulted. */
public final class FirstFoundStrategy extends MergeStrategy {

    FirstFoundStrategy() {
        super(null);
    }

    @Override
    public String getName() {
        return FIRST;
    }

    @Override
    public <T> LookupResult lookup(Iterable<T> sources, Invocation invocation, Function<T, LookupResult> attempt) {
        for (T source : sources) {
            LookupResult r = attempt.apply(source);
            if (r.isFound()) {
                return r;
            }
        }
        return LookupResult.notFound();
    }

    @Override
    protected Object checkedMerge(Object e1, Object e2) {
        return e1;
    }
}
