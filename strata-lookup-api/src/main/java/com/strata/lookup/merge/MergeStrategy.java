package com.strata.lookup.merge;

import com.strata.lookup.ConfigurationException;
import com.strata.lookup.Invocation;
import com.strata.lookup.LookupResult;
import com.strata.lookup.UnrecognizedMergeException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Combines the results of an ordered sequence of lookup attempts. Used both within a tier (hierarchy
 * entries and locations) and across tiers (global, environment, module).
 * <p>
 * Strategies are created from a merge argument with {@link #strategy(Object)}:
 * <ul>
 *   <li>{@code null} : {@code first}</li>
 *   <li>a name: {@code first}, {@code unique}, {@code hash}, {@code deep}, {@code reverse_deep}</li>
 *   <li>a map with the name under {@code strategy} and options in the other entries</li>
 * </ul>
 * Earlier sources have higher priority, except for {@code reverse_deep}.
 */
public abstract class MergeStrategy {

    public static final String STRATEGY = "strategy";

    public static final String FIRST = "first";
    public static final String UNIQUE = "unique";
    public static final String HASH = "hash";
    public static final String DEEP = "deep";
    public static final String REVERSE_DEEP = "reverse_deep";

    private static final Map<String, MergeStrategy> DEFAULTS;

    static {
        Map<String, MergeStrategy> m = new LinkedHashMap<>();
        m.put(FIRST, new FirstFoundStrategy());
        m.put(UNIQUE, new UniqueMergeStrategy());
        m.put(HASH, new HashMergeStrategy());
        m.put(DEEP, new DeepMergeStrategy(Collections.emptyMap()));
        m.put(REVERSE_DEEP, new ReverseDeepMergeStrategy(Collections.emptyMap()));
        DEFAULTS = Collections.unmodifiableMap(m);
    }

    private final Map<String, Object> options;

    protected MergeStrategy(Map<String, Object> options) {
        this.options = options != null ? Collections.unmodifiableMap(new LinkedHashMap<>(options)) : Collections.emptyMap();
    }

    /**
     * Returns the strategy for a merge argument.
     *
     * @param merge null, a strategy name, a map with a {@code strategy} entry, or a {@link MergeStrategy}
     * @throws UnrecognizedMergeException if the argument names no known strategy
     * @throws ConfigurationException     if the options are not valid for the strategy
     */
    public static MergeStrategy strategy(Object merge) {
        if (merge == null) {
            return DEFAULTS.get(FIRST);
        }
        if (merge instanceof MergeStrategy) {
            return (MergeStrategy) merge;
        }
        if (merge instanceof String) {
            MergeStrategy s = DEFAULTS.get(merge);
            if (s == null) {
                throw new UnrecognizedMergeException(merge);
            }
            return s;
        }
        if (merge instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) merge;
            Object name = map.get(STRATEGY);
            if (!(name instanceof String)) {
                throw new UnrecognizedMergeException(merge,
                        "The hash given as 'merge' must contain the name of a strategy in string form for the key '" + STRATEGY + "'");
            }
            Map<String, Object> opts = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                if (!STRATEGY.equals(e.getKey())) {
                    opts.put(String.valueOf(e.getKey()), e.getValue());
                }
            }
            return create((String) name, opts, merge);
        }
        throw new UnrecognizedMergeException(merge);
    }

    private static MergeStrategy create(String name, Map<String, Object> opts, Object merge) {
        if (!DEFAULTS.containsKey(name)) {
            throw new UnrecognizedMergeException(merge, "Unrecognized merge strategy: '" + name + "'");
        }
        if (opts.isEmpty()) {
            return DEFAULTS.get(name);
        }
        switch (name) {
            case DEEP:
                return new DeepMergeStrategy(opts);
            case REVERSE_DEEP:
                return new ReverseDeepMergeStrategy(opts);
            default:
                throw new ConfigurationException("The merge strategy '" + name + "' does not accept options, got "
                        + opts.keySet());
        }
    }

    /** Strategy name (e.g. {@code deep}). */
    public abstract String getName();

    /** Options given in addition to the name; empty when none. */
    public Map<String, Object> getOptions() {
        return options;
    }

    /**
     * The merge argument this strategy can be recreated from: the name when there are no options, else a
     * map with {@code strategy} and the options.
     */
    public Object getConfiguration() {
        if (options.isEmpty()) {
            return getName();
        }
        Map<String, Object> conf = new LinkedHashMap<>();
        conf.put(STRATEGY, getName());
        conf.putAll(options);
        return conf;
    }

    /**
     * Runs {@code attempt} for each source in order and combines the found values.
     *
     * @param sources    ordered sources (highest priority first)
     * @param invocation invocation receiving diagnostics
     * @param attempt    lookup of one source; returns not-found to move on
     * @return the combined value, or not-found when no source produced a value
     */
    public <T> LookupResult lookup(Iterable<T> sources, Invocation invocation, Function<T, LookupResult> attempt) {
        return invocation.with("merge", this, () -> {
            boolean found = false;
            Object memo = null;
            for (T source : sources) {
                LookupResult r = attempt.apply(source);
                if (r.isNotFound()) {
                    continue;
                }
                if (found) {
                    memo = merge(memo, r.getValue());
                } else {
                    memo = convertValue(r.getValue());
                    found = true;
                }
            }
            if (!found) {
                return LookupResult.notFound();
            }
            return LookupResult.found(invocation.reportResult(memo));
        });
    }

    /**
     * Merges two values; {@code e1} has the higher priority.
     */
    public Object merge(Object e1, Object e2) {
        return checkedMerge(convertValue(e1), convertValue(e2));
    }

    /** Normalizes a found value before it takes part in a merge (e.g. wraps a scalar into a list). */
    protected Object convertValue(Object value) {
        return value;
    }

    protected abstract Object checkedMerge(Object e1, Object e2);

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return options.equals(((MergeStrategy) o).options);
    }

    @Override
    public int hashCode() {
        return getName().hashCode() * 31 + options.hashCode();
    }

    @Override
    public String toString() {
        return getConfiguration().toString();
    }
}
