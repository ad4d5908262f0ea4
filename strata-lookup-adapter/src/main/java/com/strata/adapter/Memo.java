package com.strata.adapter;

import java.util.function.Supplier;

/**
 * A value computed at most once. Unresolved until {@link #get} is first called; a computed null stays
 * resolved.
 */
final class Memo<T> {

    private boolean resolved;
    private T value;

    T get(Supplier<T> compute) {
        if (!resolved) {
            value = compute.get();
            resolved = true;
        }
        return value;
    }
}
