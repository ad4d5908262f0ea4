package com.strata.adapter;

import com.strata.hiera.HieraConfig;
import com.strata.hiera.HieraServices;
import com.strata.lookup.ConfigurationException;

import java.nio.file.Path;
import java.util.Objects;

/** The environment tier, configured by {@code <environment>/hiera.yaml}. Version 3 is not allowed here. */
public final class EnvironmentDataProvider extends ConfiguredDataProvider {

    private final EnvironmentContext environment;

    public EnvironmentDataProvider(EnvironmentContext environment, HieraServices services, LookupMetrics metrics) {
        this(environment, services, metrics, null);
    }

    /**
     * @param config configuration to use instead of the environment's hiera.yaml (e.g. a legacy function shim)
     */
    public EnvironmentDataProvider(EnvironmentContext environment, HieraServices services, LookupMetrics metrics,
                                   HieraConfig config) {
        super(services, metrics, config);
        this.environment = Objects.requireNonNull(environment, "environment");
        Objects.requireNonNull(environment.getPath(), "environment path");
    }

    @Override
    public String getPlace() {
        return "Environment";
    }

    @Override
    protected Path configurationPath() {
        return environment.getPath().resolve(HieraConfig.CONFIG_FILE_NAME);
    }

    @Override
    protected HieraConfig assertConfigVersion(HieraConfig config) {
        if (config.getVersion() == 3) {
            throw new ConfigurationException(config.getName() + " cannot be used in an environment");
        }
        return config;
    }
}
