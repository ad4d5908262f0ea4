package com.strata.adapter;

import com.strata.hiera.HieraConfig;
import com.strata.hiera.HieraServices;
import com.strata.lookup.ConfigurationException;
import com.strata.lookup.DataProvider;
import com.strata.lookup.Deprecations;
import com.strata.lookup.Invocation;
import com.strata.lookup.LookupException;
import com.strata.lookup.LookupFailedException;
import com.strata.lookup.LookupKey;
import com.strata.lookup.LookupResult;
import com.strata.lookup.StrictMode;
import com.strata.lookup.merge.MergeStrategy;
import com.strata.provider.ProviderServices;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-session lookup over the global, environment and module tiers.
 * <p>
 * The adapter owns the tier providers and the {@code lookup_options} caches of one session. Tier providers
 * are created on first use and kept, including the answer "no provider" for a module. Not thread-safe;
 * independent sessions use independent adapters.
 */
public final class LookupAdapter {

    private static final Logger log = LoggerFactory.getLogger(LookupAdapter.class);

    public static final String MERGE = "merge";
    static final String GLOBAL_ENV_MERGE = "Global and Environment";

    static final String TIER_GLOBAL = "global";
    static final String TIER_ENVIRONMENT = "environment";
    static final String TIER_MODULE = "module";

    private static final List<String> PROVIDER_STACK = List.of(TIER_GLOBAL, TIER_ENVIRONMENT, TIER_MODULE);

    private final EnvironmentContext environment;
    private final LookupSettings settings;
    private final HieraServices services;
    private final DataBinding dataBinding;
    private final LookupMetrics metrics;

    private final Memo<DataProvider> globalProvider = new Memo<>();
    private final Memo<DataProvider> environmentProvider = new Memo<>();
    private final Map<String, Optional<DataProvider>> moduleProviders = new HashMap<>();
    private final Memo<Object> envLookupOptions = new Memo<>();
    private final Map<String, Optional<Object>> lookupOptions = new HashMap<>();

    private LookupAdapter(Builder b) {
        this.environment = Objects.requireNonNull(b.environment, "environment");
        this.settings = b.settings != null ? b.settings : LookupSettings.fromEnvironment();
        this.services = b.services != null ? b.services : HieraServices.builder()
                .providerServices(ProviderServices.builder().strictMode(settings.getStrictMode()).build())
                .codedir(settings.getCodedir())
                .build();
        this.dataBinding = b.dataBinding;
        this.metrics = b.metrics != null ? b.metrics : new LookupMetrics();
    }

    public static Builder builder(EnvironmentContext environment) {
        return new Builder(environment);
    }

    /**
     * Looks up {@code key} in the global, environment and module tiers.
     *
     * @param key        raw key, e.g. {@code mymodule::settings.port}
     * @param invocation scope, explanation and cycle tracking of the call
     * @param merge      merge strategy, strategy name or map; null uses the key's {@code lookup_options}
     *                   and else first found
     * @return the value, or not-found
     * @throws com.strata.lookup.InvalidKeyException  if the key is malformed
     * @throws com.strata.lookup.CyclicLookupException if the key is already being looked up in this call chain
     * @throws ConfigurationException                  if a tier's configuration is invalid
     */
    public LookupResult lookup(String key, Invocation invocation, Object merge) {
        try {
            LookupResult result = doLookup(key, invocation, merge);
            metrics.lookupCompleted(result.isFound() ? LookupMetrics.OUTCOME_FOUND : LookupMetrics.OUTCOME_NOT_FOUND);
            return result;
        } catch (RuntimeException e) {
            metrics.lookupCompleted(LookupMetrics.OUTCOME_ERROR);
            throw e;
        }
    }

    private LookupResult doLookup(String key, Invocation invocation, Object merge) {
        if (LookupKey.isReserved(key)) {
            return invocation.with("invalid_key", LookupKey.LOOKUP_OPTIONS, () -> {
                invocation.reportInvalidKey(key);
                return LookupResult.notFound();
            });
        }
        LookupKey lookupKey = LookupKey.parse(key);
        return invocation.lookup(lookupKey, lookupKey.getModuleName(), () -> {
            if (invocation.isOnlyExplainOptions()) {
                searchTiers(LookupKey.LOOKUP_OPTIONS_KEY, invocation, MergeStrategy.HASH);
                return LookupResult.notFound();
            }
            Object effective = merge;
            if (effective == null) {
                effective = lookupMergeOptions(lookupKey, invocation);
                if (effective != null) {
                    invocation.reportMergeSource(LookupKey.LOOKUP_OPTIONS);
                }
            }
            Object strategy = effective;
            return invocation.with("data", key, () -> searchTiers(lookupKey, invocation, strategy));
        });
    }

    private LookupResult searchTiers(LookupKey key, Invocation invocation, Object merge) {
        MergeStrategy strategy = MergeStrategy.strategy(merge);
        LookupResult combined = strategy.lookup(PROVIDER_STACK, invocation, tier -> lookupInTier(tier, key, invocation, strategy));
        return combined.flatMap(value -> key.dig(invocation, value));
    }

    private LookupResult lookupInTier(String tier, LookupKey key, Invocation invocation, MergeStrategy merge) {
        switch (tier) {
            case TIER_GLOBAL:
                return lookupGlobal(key, invocation, merge);
            case TIER_ENVIRONMENT:
                return lookupInEnvironment(key, invocation, merge);
            default:
                return lookupInModule(key, invocation, merge);
        }
    }

    LookupResult lookupGlobal(LookupKey key, Invocation invocation, MergeStrategy merge) {
        if (settings.isGlobalLookupDisabled()) {
            invocation.reportNotFound(key);
            return LookupResult.notFound();
        }
        if (settings.isHieraTerminus()) {
            DataProvider provider = globalProvider();
            return provider != null ? provider.keyLookup(key, invocation, merge) : LookupResult.notFound();
        }
        String terminus = settings.getDataBindingTerminus();
        if (dataBinding == null) {
            throw new ConfigurationException("No data binding is available for data_binding_terminus '" + terminus + "'");
        }
        return invocation.with(TIER_GLOBAL, terminus, () -> {
            LookupResult result;
            try {
                result = dataBinding.find(key.getRootKey(), environment, invocation.getScope(), merge);
            } catch (LookupException e) {
                throw e;
            } catch (RuntimeException e) {
                LookupKey top = invocation.getTopKey();
                throw new LookupFailedException(top != null ? top.getKey() : key.getKey(), e);
            }
            if (result.isFound()) {
                invocation.reportFound(key, result.getValue());
            } else {
                invocation.reportNotFound(key);
            }
            return result;
        });
    }

    LookupResult lookupInEnvironment(LookupKey key, Invocation invocation, MergeStrategy merge) {
        DataProvider provider = environmentProvider();
        return provider != null ? provider.keyLookup(key, invocation, merge) : LookupResult.notFound();
    }

    LookupResult lookupInModule(LookupKey key, Invocation invocation, MergeStrategy merge) {
        String moduleName = invocation.getModuleName();
        if (moduleName == null) {
            return LookupResult.notFound();
        }
        DataProvider provider = moduleProvider(moduleName);
        if (provider == null) {
            if (environment.getModule(moduleName) == null) {
                invocation.reportModuleNotFound(moduleName);
            } else {
                invocation.reportModuleProviderNotFound(moduleName);
            }
            return LookupResult.notFound();
        }
        return provider.keyLookup(key, invocation, merge);
    }

    /** The {@code merge} entry of the key's lookup options, or null. */
    Object lookupMergeOptions(LookupKey key, Invocation invocation) {
        Map<?, ?> options = lookupLookupOptions(key, invocation);
        return options != null ? options.get(MERGE) : null;
    }

    /**
     * The lookup options for the key's root key: the global and environment options merged with those of
     * the key's module. Computed once per module.
     *
     * @return the options map, or null
     * @throws LookupFailedException if {@code lookup_options} is not a map
     */
    public Map<?, ?> lookupLookupOptions(LookupKey key, Invocation invocation) {
        String moduleName = key.getModuleName();
        Optional<Object> cached = lookupOptions.get(moduleName);
        if (cached == null) {
            Object retrieved = retrieveLookupOptions(moduleName, invocation, MergeStrategy.strategy(MergeStrategy.HASH));
            if (retrieved != null && !(retrieved instanceof Map)) {
                throw new LookupFailedException(key.getKey(), "value of " + LookupKey.LOOKUP_OPTIONS + " must be a hash");
            }
            cached = Optional.ofNullable(retrieved);
            lookupOptions.put(moduleName, cached);
        }
        Object options = cached.orElse(null);
        Object forKey = options != null ? ((Map<?, ?>) options).get(key.getRootKey()) : null;
        return forKey instanceof Map ? (Map<?, ?>) forKey : null;
    }

    private Object retrieveLookupOptions(String moduleName, Invocation invocation, MergeStrategy merge) {
        Invocation meta = invocation.isExplainOptions()
                ? new Invocation(invocation.getScope(), invocation.getExplainer())
                : new Invocation(invocation.getScope());
        return meta.lookup(LookupKey.LOOKUP_OPTIONS_KEY, moduleName, () -> meta.with("meta", LookupKey.LOOKUP_OPTIONS, () -> {
            Object global = envLookupOptions(meta, merge);
            LookupResult module = lookupInModule(LookupKey.LOOKUP_OPTIONS_KEY, meta, merge);
            if (module.isNotFound()) {
                return global;
            }
            if (global == null) {
                return module.getValue();
            }
            List<String> sides = List.of(GLOBAL_ENV_MERGE, "Module " + moduleName);
            return merge.lookup(sides, meta, side -> meta.with("scope", side, () -> LookupResult.found(
                    meta.reportFound(LookupKey.LOOKUP_OPTIONS, GLOBAL_ENV_MERGE.equals(side) ? global : module.getValue()))))
                    .getValue();
        }));
    }

    /** Global and environment lookup options merged once per adapter. */
    private Object envLookupOptions(Invocation invocation, MergeStrategy merge) {
        return envLookupOptions.get(() -> {
            Object global = lookupGlobal(LookupKey.LOOKUP_OPTIONS_KEY, invocation, merge).orElse(null);
            Object env = lookupInEnvironment(LookupKey.LOOKUP_OPTIONS_KEY, invocation, merge).orElse(null);
            if (global == null) {
                return env;
            }
            return env == null ? global : merge.merge(global, env);
        });
    }

    private DataProvider globalProvider() {
        return globalProvider.get(() -> {
            metrics.providerCreated(TIER_GLOBAL);
            return new GlobalDataProvider(settings.getHieraConfig(), services, metrics);
        });
    }

    private DataProvider environmentProvider() {
        return environmentProvider.get(() -> {
            DataProvider provider = initializeEnvironmentProvider();
            if (provider != null) {
                metrics.providerCreated(TIER_ENVIRONMENT);
            }
            return provider;
        });
    }

    private DataProvider moduleProvider(String moduleName) {
        Optional<DataProvider> cached = moduleProviders.get(moduleName);
        if (cached == null) {
            DataProvider provider = initializeModuleProvider(moduleName);
            if (provider != null) {
                metrics.providerCreated(TIER_MODULE);
            }
            cached = Optional.ofNullable(provider);
            moduleProviders.put(moduleName, cached);
        }
        return cached.orElse(null);
    }

    private DataProvider initializeEnvironmentProvider() {
        Path envPath = environment.getPath();
        if (envPath == null) {
            return null;
        }
        String providerName = environment.getEnvironmentDataProvider();
        Path configPath = envPath.resolve(HieraConfig.CONFIG_FILE_NAME);
        Path envConf = environment.getConfigurationFile();
        StrictMode strict = settings.getStrictMode();

        EnvironmentDataProvider ep = null;
        if (Files.exists(configPath)) {
            ep = new EnvironmentDataProvider(environment, services, metrics);
            if (ep.getConfig().getVersion() >= 5) {
                if (providerName != null) {
                    Deprecations.warnOnce(strict, "environment.conf#data_provider",
                            "Defining environment_data_provider='" + providerName + "' in environment.conf is deprecated", envConf);
                    if (!"hiera".equals(providerName)) {
                        Deprecations.warnOnce(strict, "environment.conf#data_provider_overridden",
                                "The environment_data_provider='" + providerName + "' setting is ignored since '"
                                        + configPath + "' version >= 5", envConf);
                    }
                }
                providerName = null;
            }
        }
        if (providerName == null) {
            return ep;
        }

        String msg = "Defining environment_data_provider='" + providerName + "' in environment.conf is deprecated";
        if (ep == null) {
            msg += ". A '" + HieraConfig.CONFIG_FILE_NAME + "' file should be used instead";
        }
        Deprecations.warnOnce(strict, "environment.conf#data_provider", msg, envConf);

        switch (providerName) {
            case "none":
                return null;
            case "hiera":
                return ep != null ? ep : new EnvironmentDataProvider(environment, services, metrics);
            case "function":
                return new EnvironmentDataProvider(environment, services, metrics,
                        HieraConfig.v4FunctionConfig(envPath, "environment::data", services));
            default:
                DataProvider custom = services.getDataProviders().createEnvironmentDataProvider(providerName);
                if (custom == null) {
                    throw new ConfigurationException("Environment '" + environment.getName()
                            + "', cannot find environment_data_provider '" + providerName + "'");
                }
                log.info("Environment '{}' uses custom data provider '{}'", environment.getName(), providerName);
                return custom;
        }
    }

    private DataProvider initializeModuleProvider(String moduleName) {
        ModuleInfo module = environment.getModule(moduleName);
        if (module == null) {
            return null;
        }
        StrictMode strict = settings.getStrictMode();
        boolean binding = false;
        String providerName = module.getDataProviderName();
        if (providerName == null) {
            providerName = services.getDataProviders().getModuleBinding(moduleName);
            binding = providerName != null;
        }
        String bindingKey = "ModuleBinding#data_provider-" + moduleName;
        String metadataKey = "metadata.json#data_provider-" + moduleName;

        ModuleDataProvider mp = null;
        if (module.hasHieraConfig()) {
            mp = new ModuleDataProvider(module, services, metrics);
            if (mp.getConfig().getVersion() >= 5) {
                if (providerName != null) {
                    if (binding) {
                        Deprecations.warnOnce(strict, bindingKey, "Defining data_provider '" + providerName
                                + "' as a binding is deprecated. The binding is ignored since a '"
                                + HieraConfig.CONFIG_FILE_NAME + "' with version >= 5 is present");
                    } else {
                        Deprecations.warnOnce(strict, metadataKey, "Defining \"data_provider\": \"" + providerName
                                + "\" in metadata.json is deprecated. It is ignored since a '"
                                + HieraConfig.CONFIG_FILE_NAME + "' with version >= 5 is present", module.getMetadataFile());
                    }
                }
                providerName = null;
            }
        }
        if (providerName == null) {
            return mp;
        }

        String suffix = mp == null ? ". A '" + HieraConfig.CONFIG_FILE_NAME + "' file should be used instead" : "";
        if (binding) {
            Deprecations.warnOnce(strict, bindingKey,
                    "Defining data_provider '" + providerName + "' as a binding is deprecated" + suffix);
        } else {
            Deprecations.warnOnce(strict, metadataKey,
                    "Defining \"data_provider\": \"" + providerName + "\" in metadata.json is deprecated" + suffix,
                    module.getMetadataFile());
        }

        switch (providerName) {
            case "none":
                return null;
            case "hiera":
                return mp != null ? mp : new ModuleDataProvider(module, services, metrics);
            case "function":
                return new ModuleDataProvider(module, services, metrics,
                        HieraConfig.v4FunctionConfig(module.getPath(), moduleName + "::data", services));
            default:
                DataProvider custom = services.getDataProviders().createModuleDataProvider(providerName);
                if (custom == null) {
                    throw new ConfigurationException("Environment '" + environment.getName()
                            + "', cannot find module_data_provider '" + providerName + "'");
                }
                log.info("Module '{}' uses custom data provider '{}'", moduleName, providerName);
                return custom;
        }
    }

    public EnvironmentContext getEnvironment() {
        return environment;
    }

    public LookupSettings getSettings() {
        return settings;
    }

    public HieraServices getServices() {
        return services;
    }

    public LookupMetrics getMetrics() {
        return metrics;
    }

    public static final class Builder {
        private final EnvironmentContext environment;
        private LookupSettings settings;
        private HieraServices services;
        private DataBinding dataBinding;
        private LookupMetrics metrics;

        private Builder(EnvironmentContext environment) {
            this.environment = environment;
        }

        public Builder settings(LookupSettings settings) {
            this.settings = settings;
            return this;
        }

        /** Registries and location handling; default is built from the settings. */
        public Builder services(HieraServices services) {
            this.services = services;
            return this;
        }

        /** Terminus for global lookups when the settings name one other than {@code hiera}. */
        public Builder dataBinding(DataBinding dataBinding) {
            this.dataBinding = dataBinding;
            return this;
        }

        public Builder metrics(LookupMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public LookupAdapter build() {
            return new LookupAdapter(this);
        }
    }
}
