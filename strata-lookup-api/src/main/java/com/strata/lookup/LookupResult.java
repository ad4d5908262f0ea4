package com.strata.lookup;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of one lookup attempt: either a found value (which may itself be {@code null}) or not-found.
 * Not-found is an ordinary value so merge strategies and tiers can move on to the next source.
 */
public final class LookupResult {

    private static final LookupResult NOT_FOUND = new LookupResult(false, null);

    private final boolean found;
    private final Object value;

    private LookupResult(boolean found, Object value) {
        this.found = found;
        this.value = value;
    }

    public static LookupResult found(Object value) {
        return new LookupResult(true, value);
    }

    public static LookupResult notFound() {
        return NOT_FOUND;
    }

    public boolean isFound() {
        return found;
    }

    public boolean isNotFound() {
        return !found;
    }

    /**
     * @return the found value (may be null)
     * @throws IllegalStateException if this result is not-found
     */
    public Object getValue() {
        if (!found) {
            throw new IllegalStateException("No value present: key was not found");
        }
        return value;
    }

    public Object orElse(Object other) {
        return found ? value : other;
    }

    public LookupResult map(Function<Object, Object> mapper) {
        return found ? found(mapper.apply(value)) : this;
    }

    public LookupResult flatMap(Function<Object, LookupResult> mapper) {
        return found ? Objects.requireNonNull(mapper.apply(value), "mapper result") : this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LookupResult)) return false;
        LookupResult that = (LookupResult) o;
        return found == that.found && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(found, value);
    }

    @Override
    public String toString() {
        return found ? "Found[" + value + "]" : "NotFound";
    }
}
