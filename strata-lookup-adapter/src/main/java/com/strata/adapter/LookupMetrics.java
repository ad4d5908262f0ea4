package com.strata.adapter;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Objects;

/**
 * Micrometer counters for lookups: requests by outcome, tier providers created, hierarchy rebuilds.
 */
public final class LookupMetrics {

    static final String LOOKUP_REQUESTS = "strata.lookup.requests";
    static final String PROVIDER_CREATED = "strata.lookup.provider.created";
    static final String CONFIG_REBUILDS = "strata.hiera.config.rebuilds";

    public static final String OUTCOME_FOUND = "found";
    public static final String OUTCOME_NOT_FOUND = "not_found";
    public static final String OUTCOME_ERROR = "error";

    private final MeterRegistry registry;

    public LookupMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /** Metrics kept in a private {@link SimpleMeterRegistry}. */
    public LookupMetrics() {
        this(new SimpleMeterRegistry());
    }

    public void lookupCompleted(String outcome) {
        registry.counter(LOOKUP_REQUESTS, "outcome", outcome).increment();
    }

    public void providerCreated(String tier) {
        registry.counter(PROVIDER_CREATED, "tier", tier).increment();
    }

    public void configRebuilt() {
        registry.counter(CONFIG_REBUILDS).increment();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
