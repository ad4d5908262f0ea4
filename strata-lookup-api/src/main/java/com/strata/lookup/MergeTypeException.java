package com.strata.lookup;

/** A merge strategy was given a value of a type it cannot merge (e.g. a string for a hash merge). */
public final class MergeTypeException extends LookupException {

    public MergeTypeException(String strategyName, String expected, Object actual) {
        super(String.format("The '%s' merge strategy expects %s, got %s",
                strategyName, expected, actual == null ? "null" : actual.getClass().getSimpleName()));
    }
}
