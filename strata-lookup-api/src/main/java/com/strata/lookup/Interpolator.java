package com.strata.lookup;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Expands {@code %{...}} expressions in strings against the scope of an invocation.
 * Implementations must call {@link Invocation#rememberScopeLookup} for every scope variable they read.
 */
public interface Interpolator {

    /**
     * @param template     string possibly containing {@code %{...}} expressions
     * @param invocation   invocation providing the scope
     * @param allowMethods whether method-call forms (e.g. {@code %{lookup('x')}}) are permitted
     * @return expanded string
     */
    String interpolate(String template, Invocation invocation, boolean allowMethods);

    /**
     * Interpolates every string found in {@code value}, descending into maps (keys and values) and lists.
     * Other values are returned unchanged.
     */
    default Object interpolateValue(Object value, Invocation invocation, boolean allowMethods) {
        if (value instanceof String) {
            String s = (String) value;
            return s.contains("%{") ? interpolate(s, invocation, allowMethods) : s;
        }
        if (value instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) value;
            Map<Object, Object> result = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                result.put(interpolateValue(e.getKey(), invocation, allowMethods),
                        interpolateValue(e.getValue(), invocation, allowMethods));
            }
            return result;
        }
        if (value instanceof List) {
            List<?> list = (List<?>) value;
            List<Object> result = new ArrayList<>(list.size());
            for (Object element : list) {
                result.add(interpolateValue(element, invocation, allowMethods));
            }
            return result;
        }
        return value;
    }
}
