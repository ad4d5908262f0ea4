package com.strata.lookup.merge;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Concatenates the values of all sources into one list without duplicates, keeping the first occurrence.
 * Lists are flattened; any other value counts as a one-element list.
 */
public final class UniqueMergeStrategy extends MergeStrategy {

    UniqueMergeStrategy() {
        super(null);
    }

    @Override
    public String getName() {
        return UNIQUE;
    }

    @Override
    protected Object convertValue(Object value) {
        List<Object> flat = new ArrayList<>();
        flatten(value, flat);
        return new ArrayList<>(new LinkedHashSet<>(flat));
    }

    private static void flatten(Object value, List<Object> into) {
        if (value instanceof List) {
            for (Object element : (List<?>) value) {
                flatten(element, into);
            }
        } else {
            into.add(value);
        }
    }

    @Override
    protected Object checkedMerge(Object e1, Object e2) {
        Set<Object> union = new LinkedHashSet<>((List<?>) e1);
        union.addAll((List<?>) e2);
        return new ArrayList<>(union);
    }
}
