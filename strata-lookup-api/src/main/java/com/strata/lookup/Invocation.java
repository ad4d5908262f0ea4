package com.strata.lookup;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * State of one top-level lookup call: the variable scope, the stack of keys whose lookup is in progress
 * (cycle detection), override and default values, and an optional {@link Explainer} receiving diagnostics.
 * <p>
 * Owned by the caller of one lookup; not thread-safe.
 */
public class Invocation {

    private final Scope scope;
    private final Map<String, Object> overrideValues;
    private final Map<String, Object> defaultValues;
    private final Explainer explainer;
    private final Deque<Frame> inProgress = new ArrayDeque<>();

    private LookupKey topKey;
    private String moduleName;
    private boolean hieraHashCall;

    public Invocation(Scope scope) {
        this(scope, null, null, null);
    }

    public Invocation(Scope scope, Explainer explainer) {
        this(scope, null, null, explainer);
    }

    /**
     * @param scope          variable scope; null = empty scope
     * @param overrideValues values that win over any data provider (may be null)
     * @param defaultValues  values used when no data provider has the key (may be null)
     * @param explainer      diagnostic sink (may be null)
     */
    public Invocation(Scope scope, Map<String, Object> overrideValues, Map<String, Object> defaultValues,
                      Explainer explainer) {
        this.scope = scope != null ? scope : Scope.empty();
        this.overrideValues = overrideValues != null ? Collections.unmodifiableMap(overrideValues) : Collections.emptyMap();
        this.defaultValues = defaultValues != null ? Collections.unmodifiableMap(defaultValues) : Collections.emptyMap();
        this.explainer = explainer;
    }

    /**
     * Runs {@code body} as the lookup of {@code key} for {@code moduleName}. The (key, module) pair is pushed
     * on the in-progress stack for the duration of the body and always popped afterwards.
     *
     * @throws CyclicLookupException if the same pair is already in progress
     */
    public <T> T lookup(LookupKey key, String moduleName, Supplier<T> body) {
        Objects.requireNonNull(key, "key");
        String module = moduleName != null ? moduleName : key.getModuleName();
        Frame frame = new Frame(key.getKey(), module);
        if (inProgress.contains(frame)) {
            List<String> chain = new ArrayList<>();
            for (Iterator<Frame> it = inProgress.descendingIterator(); it.hasNext(); ) {
                chain.add(it.next().key);
            }
            chain.add(key.getKey());
            throw new CyclicLookupException(chain);
        }
        LookupKey savedTopKey = topKey;
        String savedModule = this.moduleName;
        topKey = key;
        this.moduleName = module;
        inProgress.push(frame);
        try {
            return body.get();
        } finally {
            inProgress.pop();
            topKey = savedTopKey;
            this.moduleName = savedModule;
        }
    }

    /**
     * Runs {@code body} nested under a qualifier in the explanation (e.g. {@code ("data_provider", provider)}).
     */
    public <T> T with(String qualifierType, Object qualifier, Supplier<T> body) {
        if (explainer == null) {
            return body.get();
        }
        explainer.push(qualifierType, qualifier);
        try {
            return body.get();
        } finally {
            explainer.pop();
        }
    }

    /** Reports a found value and returns it. */
    public Object reportFound(Object key, Object value) {
        emit("found", () -> key + " => " + value);
        return value;
    }

    public void reportFoundInOverrides(Object key, Object value) {
        emit("found_in_overrides", () -> key + " => " + value);
    }

    public void reportFoundInDefaults(Object key, Object value) {
        emit("found_in_defaults", () -> key + " => " + value);
    }

    public void reportNotFound(Object key) {
        emit("not_found", () -> String.valueOf(key));
    }

    public void reportLocationNotFound() {
        emit("location_not_found", () -> "");
    }

    public void reportModuleNotFound(String module) {
        emit("module_not_found", () -> module);
    }

    public void reportModuleProviderNotFound(String module) {
        emit("module_provider_not_found", () -> module);
    }

    public void reportMergeSource(String source) {
        emit("merge_source", () -> source);
    }

    public void reportInvalidKey(String key) {
        emit("invalid_key", () -> key);
    }

    /** Reports a merged result and returns it. */
    public Object reportResult(Object value) {
        emit("result", () -> String.valueOf(value));
        return value;
    }

    public void reportText(Supplier<String> text) {
        emit("text", text);
    }

    private void emit(String event, Supplier<String> text) {
        if (explainer != null) {
            explainer.accept(event, text.get());
        }
    }

    /**
     * Called by interpolation whenever a scope variable is read. The default implementation ignores it;
     * {@link ScopeLookupCollectingInvocation} records the pairs.
     */
    public void rememberScopeLookup(String name, Object value) {
    }

    public Scope getScope() {
        return scope;
    }

    public Map<String, Object> getOverrideValues() {
        return overrideValues;
    }

    public Map<String, Object> getDefaultValues() {
        return defaultValues;
    }

    /** Diagnostic sink, or null when nothing is explained. */
    public Explainer getExplainer() {
        return explainer;
    }

    public boolean isExplainOptions() {
        return explainer != null && explainer.isExplainOptions();
    }

    public boolean isOnlyExplainOptions() {
        return explainer != null && explainer.isOnlyExplainOptions();
    }

    /** Key of the innermost lookup in progress, or null outside of a lookup. */
    public LookupKey getTopKey() {
        return topKey;
    }

    /** Module of the innermost lookup in progress, or null. */
    public String getModuleName() {
        return moduleName;
    }

    /** True when the call stems from a hiera_hash style call (enables a v3 merge_behavior). */
    public boolean isHieraHashCall() {
        return hieraHashCall;
    }

    public Invocation setHieraHashCall(boolean hieraHashCall) {
        this.hieraHashCall = hieraHashCall;
        return this;
    }

    private static final class Frame {
        private final String key;
        private final String module;

        private Frame(String key, String module) {
            this.key = key;
            this.module = module;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Frame)) return false;
            Frame other = (Frame) o;
            return key.equals(other.key) && Objects.equals(module, other.module);
        }

        @Override
        public int hashCode() {
            return Objects.hash(key, module);
        }
    }
}
