package com.strata.hiera;

import com.strata.lookup.StrictMode;
import com.strata.provider.ProviderServices;
import com.strata.provider.registry.DataProviderRegistry;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Collaborators of {@link HieraConfig}: provider services, the custom data provider registry, location
 * resolution, the code directory used by the version 3 default data directory, and a listener told about
 * every hierarchy (re)build.
 */
public final class HieraServices {

    private final ProviderServices providerServices;
    private final DataProviderRegistry dataProviders;
    private final LocationResolver locationResolver;
    private final Path codedir;
    private final Consumer<HieraConfig> buildListener;

    private HieraServices(Builder b) {
        this.providerServices = b.providerServices != null ? b.providerServices : ProviderServices.defaults();
        this.dataProviders = b.dataProviders != null ? b.dataProviders : new DataProviderRegistry();
        this.locationResolver = b.locationResolver != null ? b.locationResolver
                : new FileSystemLocationResolver(providerServices.getInterpolator());
        this.codedir = b.codedir != null ? b.codedir : Paths.get("/etc/strata/code");
        this.buildListener = b.buildListener != null ? b.buildListener : config -> { };
    }

    public static HieraServices defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public ProviderServices getProviderServices() {
        return providerServices;
    }

    public DataProviderRegistry getDataProviders() {
        return dataProviders;
    }

    public LocationResolver getLocationResolver() {
        return locationResolver;
    }

    public Path getCodedir() {
        return codedir;
    }

    public StrictMode getStrictMode() {
        return providerServices.getStrictMode();
    }

    void notifyBuilt(HieraConfig config) {
        buildListener.accept(config);
    }

    public static final class Builder {
        private ProviderServices providerServices;
        private DataProviderRegistry dataProviders;
        private LocationResolver locationResolver;
        private Path codedir;
        private Consumer<HieraConfig> buildListener;

        private Builder() {
        }

        public Builder providerServices(ProviderServices providerServices) {
            this.providerServices = Objects.requireNonNull(providerServices, "providerServices");
            return this;
        }

        public Builder dataProviders(DataProviderRegistry dataProviders) {
            this.dataProviders = Objects.requireNonNull(dataProviders, "dataProviders");
            return this;
        }

        public Builder locationResolver(LocationResolver locationResolver) {
            this.locationResolver = Objects.requireNonNull(locationResolver, "locationResolver");
            return this;
        }

        public Builder codedir(Path codedir) {
            this.codedir = codedir;
            return this;
        }

        /** Called after a hierarchy was built from scratch (first time or after scope drift). */
        public Builder buildListener(Consumer<HieraConfig> buildListener) {
            this.buildListener = buildListener;
            return this;
        }

        public HieraServices build() {
            return new HieraServices(this);
        }
    }
}
