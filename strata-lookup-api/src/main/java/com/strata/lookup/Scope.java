package com.strata.lookup;

/**
 * Variable scope consulted by interpolation ({@code %{facts.os}}) and by legacy backends.
 * Names are given without a leading {@code ::}.
 */
public interface Scope {

    /** Value of the variable, or null when the variable is not defined. */
    Object get(String name);

    /** Whether the variable is defined (its value may still be null). */
    boolean exists(String name);

    /** Scope with no variables. */
    static Scope empty() {
        return MapScope.EMPTY;
    }
}
