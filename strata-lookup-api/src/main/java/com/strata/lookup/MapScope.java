package com.strata.lookup;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable {@link Scope} backed by a map. A leading {@code ::} on a name refers to the same (top) scope.
 */
public final class MapScope implements Scope {

    static final MapScope EMPTY = new MapScope(Collections.emptyMap());

    private final Map<String, Object> variables;

    public MapScope() {
        this.variables = new LinkedHashMap<>();
    }

    public MapScope(Map<String, ?> variables) {
        this.variables = new LinkedHashMap<>(variables);
    }

    public MapScope put(String name, Object value) {
        if (this == EMPTY) {
            throw new UnsupportedOperationException("empty scope is immutable");
        }
        variables.put(normalize(name), value);
        return this;
    }

    public MapScope remove(String name) {
        variables.remove(normalize(name));
        return this;
    }

    @Override
    public Object get(String name) {
        return variables.get(normalize(name));
    }

    @Override
    public boolean exists(String name) {
        return variables.containsKey(normalize(name));
    }

    /** Read-only view of the variables. */
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(variables);
    }

    private static String normalize(String name) {
        return name != null && name.startsWith("::") ? name.substring(2) : name;
    }

    @Override
    public String toString() {
        return "MapScope" + variables;
    }
}
