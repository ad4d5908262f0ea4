package com.strata.provider;

import com.strata.lookup.Interpolator;
import com.strata.lookup.ScopeInterpolator;
import com.strata.lookup.StrictMode;
import com.strata.provider.legacy.LegacyBackendRegistry;

import java.util.Objects;

/**
 * Collaborators shared by all function providers of one adapter: backend function lookup, legacy backend
 * loading, interpolation and the strict mode for deprecation notices.
 */
public final class ProviderServices {

    private final BackendFunctionRegistry functions;
    private final LegacyBackendRegistry legacyBackends;
    private final Interpolator interpolator;
    private final StrictMode strictMode;

    private ProviderServices(Builder b) {
        this.functions = b.functions != null ? b.functions : BackendFunctionRegistry.withInstalledFunctions();
        this.legacyBackends = b.legacyBackends != null ? b.legacyBackends : new LegacyBackendRegistry();
        this.interpolator = b.interpolator != null ? b.interpolator : new ScopeInterpolator();
        this.strictMode = b.strictMode != null ? b.strictMode : StrictMode.WARNING;
    }

    /** Services with installed functions, no legacy backends, scope interpolation and {@link StrictMode#WARNING}. */
    public static ProviderServices defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public BackendFunctionRegistry getFunctions() {
        return functions;
    }

    public LegacyBackendRegistry getLegacyBackends() {
        return legacyBackends;
    }

    public Interpolator getInterpolator() {
        return interpolator;
    }

    public StrictMode getStrictMode() {
        return strictMode;
    }

    public static final class Builder {
        private BackendFunctionRegistry functions;
        private LegacyBackendRegistry legacyBackends;
        private Interpolator interpolator;
        private StrictMode strictMode;

        private Builder() {
        }

        public Builder functions(BackendFunctionRegistry functions) {
            this.functions = Objects.requireNonNull(functions, "functions");
            return this;
        }

        public Builder legacyBackends(LegacyBackendRegistry legacyBackends) {
            this.legacyBackends = Objects.requireNonNull(legacyBackends, "legacyBackends");
            return this;
        }

        public Builder interpolator(Interpolator interpolator) {
            this.interpolator = Objects.requireNonNull(interpolator, "interpolator");
            return this;
        }

        public Builder strictMode(StrictMode strictMode) {
            this.strictMode = strictMode;
            return this;
        }

        public ProviderServices build() {
            return new ProviderServices(this);
        }
    }
}
