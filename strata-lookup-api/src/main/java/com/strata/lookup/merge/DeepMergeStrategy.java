package com.strata.lookup.merge;

import com.strata.lookup.ConfigurationException;

import java.util.Map;
import java.util.Set;

/**
 * Recursive merge of maps and lists where earlier sources win. Options:
 * <ul>
 *   <li>{@code knockout_prefix} – string marking a value as a deletion instead of an override</li>
 *   <li>{@code merge_hash_arrays} – merge lists of maps element by element</li>
 *   <li>{@code sort_merge_arrays} – sort merged lists</li>
 *   <li>{@code merge_debug} – log each merge step</li>
 * </ul>
 */
public class DeepMergeStrategy extends MergeStrategy {

    public static final String KNOCKOUT_PREFIX = "knockout_prefix";
    public static final String MERGE_HASH_ARRAYS = "merge_hash_arrays";
    public static final String SORT_MERGE_ARRAYS = "sort_merge_arrays";
    public static final String MERGE_DEBUG = "merge_debug";

    static final Set<String> OPTION_NAMES = Set.of(KNOCKOUT_PREFIX, MERGE_HASH_ARRAYS, SORT_MERGE_ARRAYS, MERGE_DEBUG);

    private final DeepMerge deepMerge;

    DeepMergeStrategy(Map<String, Object> options) {
        super(options);
        for (String option : getOptions().keySet()) {
            if (!OPTION_NAMES.contains(option)) {
                throw new ConfigurationException("Unrecognized option '" + option + "' for merge strategy '" + getName() + "'");
            }
        }
        Object prefix = getOptions().get(KNOCKOUT_PREFIX);
        if (prefix != null && !(prefix instanceof String)) {
            throw new ConfigurationException("Option '" + KNOCKOUT_PREFIX + "' must be a string, got " + prefix);
        }
        this.deepMerge = new DeepMerge(
                (String) prefix,
                isTrue(getOptions().get(MERGE_HASH_ARRAYS)),
                isTrue(getOptions().get(SORT_MERGE_ARRAYS)),
                isTrue(getOptions().get(MERGE_DEBUG)));
    }

    private static boolean isTrue(Object value) {
        if (value instanceof Boolean) return (Boolean) value;
        return value != null && "true".equalsIgnoreCase(value.toString());
    }

    @Override
    public String getName() {
        return DEEP;
    }

    @Override
    protected Object checkedMerge(Object e1, Object e2) {
        return deepMerge.merge(e1, DeepMerge.deepCopy(e2));
    }
}
