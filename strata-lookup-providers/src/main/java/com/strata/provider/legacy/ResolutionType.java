package com.strata.provider.legacy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Merge request in the vocabulary of legacy backends: plain priority lookup, array concatenation, or a
 * hash merge with a behavior ({@code native}, {@code deep}, {@code deeper}) and deep merge options.
 */
public final class ResolutionType {

    public enum Kind { PRIORITY, ARRAY, HASH }

    public enum Behavior {
        NATIVE, DEEP, DEEPER;

        @Override
        public String toString() {
            return name().toLowerCase();
        }
    }

    private static final ResolutionType PRIORITY = new ResolutionType(Kind.PRIORITY, null, null);
    private static final ResolutionType ARRAY = new ResolutionType(Kind.ARRAY, null, null);

    private final Kind kind;
    private final Behavior behavior;
    private final Map<String, Object> options;

    private ResolutionType(Kind kind, Behavior behavior, Map<String, Object> options) {
        this.kind = kind;
        this.behavior = behavior;
        this.options = options != null ? Collections.unmodifiableMap(new LinkedHashMap<>(options)) : Collections.emptyMap();
    }

    /** Default legacy lookup: first value found wins. */
    public static ResolutionType priority() {
        return PRIORITY;
    }

    public static ResolutionType array() {
        return ARRAY;
    }

    public static ResolutionType hash(Behavior behavior) {
        return hash(behavior, null);
    }

    public static ResolutionType hash(Behavior behavior, Map<String, Object> options) {
        return new ResolutionType(Kind.HASH, Objects.requireNonNull(behavior, "behavior"), options);
    }

    public Kind getKind() {
        return kind;
    }

    /** Hash merge behavior; null unless {@link Kind#HASH}. */
    public Behavior getBehavior() {
        return behavior;
    }

    /** Deep merge options passed through from the merge argument. */
    public Map<String, Object> getOptions() {
        return options;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResolutionType)) return false;
        ResolutionType that = (ResolutionType) o;
        return kind == that.kind && behavior == that.behavior && options.equals(that.options);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, behavior, options);
    }

    @Override
    public String toString() {
        if (kind != Kind.HASH) {
            return kind.name().toLowerCase();
        }
        return "hash{behavior=" + behavior + (options.isEmpty() ? "" : ", " + options) + "}";
    }
}
