package com.strata.adapter;

import com.strata.hiera.HieraConfig;
import com.strata.hiera.HieraServices;
import com.strata.lookup.DataProvider;
import com.strata.lookup.Invocation;
import com.strata.lookup.LookupKey;
import com.strata.lookup.LookupResult;
import com.strata.lookup.merge.MergeStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * A tier backed by a hiera.yaml. The configuration is read on first use; its hierarchy entries are the
 * sources the tier's merge runs over.
 */
public abstract class ConfiguredDataProvider implements DataProvider {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredDataProvider.class);

    private final HieraServices services;
    private final LookupMetrics metrics;
    private HieraConfig config;
    private List<DataProvider> lastProviders;

    /**
     * @param config configuration to use instead of reading {@link #configurationPath()}; may be null
     */
    protected ConfiguredDataProvider(HieraServices services, LookupMetrics metrics, HieraConfig config) {
        this.services = Objects.requireNonNull(services, "services");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.config = config != null ? assertConfigVersion(config) : null;
    }

    /** Tier label, e.g. {@code Global}. */
    public abstract String getPlace();

    /** Location of the tier's hiera.yaml. */
    protected abstract Path configurationPath();

    /**
     * @throws com.strata.lookup.ConfigurationException if the configuration version is not allowed in this tier
     */
    protected abstract HieraConfig assertConfigVersion(HieraConfig config);

    /** The tier's configuration, read on first call. */
    public HieraConfig getConfig() {
        if (config == null) {
            Path path = configurationPath();
            config = assertConfigVersion(HieraConfig.create(path, services));
            log.info("{} data provider using {} ({})", getPlace(), config.getName(),
                    config.isSynthesized() ? "default" : path);
        }
        return config;
    }

    @Override
    public LookupResult keyLookup(LookupKey key, Invocation invocation, MergeStrategy merge) {
        return invocation.with("data_provider", this, () -> uncheckedKeyLookup(key, invocation, MergeStrategy.strategy(merge)));
    }

    /** Runs {@code merge} over the hierarchy entries. */
    protected LookupResult uncheckedKeyLookup(LookupKey key, Invocation invocation, MergeStrategy merge) {
        List<DataProvider> providers = dataProviders(invocation);
        if (providers.isEmpty()) {
            invocation.reportNotFound(key);
            return LookupResult.notFound();
        }
        return merge.lookup(providers, invocation, provider -> provider.keyLookup(key, invocation, merge));
    }

    /** Hierarchy entries for the invocation's scope. */
    protected List<DataProvider> dataProviders(Invocation invocation) {
        List<DataProvider> providers = getConfig().configuredDataProviders(invocation, this);
        if (lastProviders != null && providers != lastProviders) {
            metrics.configRebuilt();
        }
        lastProviders = providers;
        return providers;
    }

    protected HieraServices getServices() {
        return services;
    }

    @Override
    public String getName() {
        return getPlace() + " Data Provider (" + (config != null ? config.getName() : "unknown config") + ")";
    }

    @Override
    public String toString() {
        return getName();
    }
}
