package com.strata.adapter;

import com.strata.hiera.HieraConfig;
import com.strata.hiera.HieraServices;
import com.strata.lookup.ConfigurationException;
import com.strata.lookup.Invocation;
import com.strata.lookup.LookupKey;
import com.strata.lookup.LookupResult;
import com.strata.lookup.MergeTypeException;
import com.strata.lookup.merge.DeepMergeStrategy;
import com.strata.lookup.merge.HashMergeStrategy;
import com.strata.lookup.merge.MergeStrategy;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * The global tier, configured by the hiera.yaml named in {@link LookupSettings#getHieraConfig()}.
 * Version 4 is not allowed here. With a version 3 configuration its {@code merge_behavior} replaces a
 * {@code hash} merge for hiera_hash style calls.
 */
public final class GlobalDataProvider extends ConfiguredDataProvider {

    private final Path configPath;

    public GlobalDataProvider(Path configPath, HieraServices services, LookupMetrics metrics) {
        super(services, metrics, null);
        this.configPath = Objects.requireNonNull(configPath, "configPath");
    }

    @Override
    public String getPlace() {
        return "Global";
    }

    @Override
    protected Path configurationPath() {
        return configPath;
    }

    @Override
    protected HieraConfig assertConfigVersion(HieraConfig config) {
        if (config.getVersion() == 4) {
            throw new ConfigurationException(config.getName() + " cannot be used in the global layer");
        }
        return config;
    }

    @Override
    protected LookupResult uncheckedKeyLookup(LookupKey key, Invocation invocation, MergeStrategy merge) {
        HieraConfig config = getConfig();
        if (config.getVersion() != 3 || !invocation.isHieraHashCall()) {
            return super.uncheckedKeyLookup(key, invocation, merge);
        }
        MergeStrategy effective = merge;
        MergeStrategy configured = config.getMergeStrategy();
        if (configured != null && merge instanceof HashMergeStrategy) {
            effective = configured;
            MergeStrategy applied = configured;
            invocation.reportText(() -> "Using merge_behavior '" + applied + "' from " + config.getName());
        }
        LookupResult result = super.uncheckedKeyLookup(key, invocation, effective);
        boolean hashMerge = effective instanceof HashMergeStrategy || effective instanceof DeepMergeStrategy;
        if (hashMerge && result.isFound() && !(result.getValue() instanceof Map)) {
            throw new MergeTypeException(effective.getName(), "a Hash value", result.getValue());
        }
        return result;
    }
}
