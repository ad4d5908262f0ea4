package com.strata.lookup.merge;

import java.util.Map;

/**
 * Deep merge where later sources win. A v3 {@code merge_behavior: deep} maps here, while
 * {@code deeper} maps to {@link DeepMergeStrategy}.
 */
public final class ReverseDeepMergeStrategy extends DeepMergeStrategy {

    ReverseDeepMergeStrategy(Map<String, Object> options) {
        super(options);
    }

    @Override
    public String getName() {
        return REVERSE_DEEP;
    }

    @Override
    protected Object checkedMerge(Object e1, Object e2) {
        return super.checkedMerge(e2, e1);
    }
}
