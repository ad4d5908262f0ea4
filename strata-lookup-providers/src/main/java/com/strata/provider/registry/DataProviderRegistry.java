package com.strata.provider.registry;

import com.strata.lookup.DataProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Custom data providers by name: path-based factories for version 4 {@code backend} entries, module and
 * environment data providers selected by name, and per-module provider bindings.
 * <p>
 * Module and environment providers are registered as suppliers; every {@link #createModuleDataProvider}
 * call yields a fresh instance.
 */
public final class DataProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(DataProviderRegistry.class);

    private final Map<String, PathBasedDataProviderFactory> pathBasedFactories = new ConcurrentHashMap<>();
    private final Map<String, Supplier<? extends DataProvider>> moduleProviders = new ConcurrentHashMap<>();
    private final Map<String, Supplier<? extends DataProvider>> environmentProviders = new ConcurrentHashMap<>();
    private final Map<String, String> moduleBindings = new ConcurrentHashMap<>();

    /**
     * @param backend backend name used in version 4 hierarchy entries
     * @throws IllegalArgumentException if the name is blank or taken, or the factory version is not 1 or 2
     */
    public void registerPathBasedFactory(String backend, PathBasedDataProviderFactory factory) {
        Objects.requireNonNull(factory, "factory");
        if (factory.getVersion() != 1 && factory.getVersion() != 2) {
            throw new IllegalArgumentException("Unsupported data provider factory version " + factory.getVersion()
                    + " for backend " + backend);
        }
        put(pathBasedFactories, backend, factory, "Path based data provider factory");
    }

    /** Factory for a version 4 backend, or null. */
    public PathBasedDataProviderFactory getPathBasedFactory(String backend) {
        return backend != null ? pathBasedFactories.get(backend) : null;
    }

    /** Registers a module data provider selectable by name (metadata {@code data_provider} or a binding). */
    public void registerModuleDataProvider(String name, Supplier<? extends DataProvider> supplier) {
        put(moduleProviders, name, supplier, "Module data provider");
    }

    public boolean hasModuleDataProvider(String name) {
        return name != null && moduleProviders.containsKey(name);
    }

    /** New instance of a named module data provider, or null if none is registered. */
    public DataProvider createModuleDataProvider(String name) {
        Supplier<? extends DataProvider> supplier = name != null ? moduleProviders.get(name) : null;
        return supplier != null ? supplier.get() : null;
    }

    /** Registers an environment data provider selectable by {@code environment_data_provider}. */
    public void registerEnvironmentDataProvider(String name, Supplier<? extends DataProvider> supplier) {
        put(environmentProviders, name, supplier, "Environment data provider");
    }

    /** New instance of a named environment data provider, or null if none is registered. */
    public DataProvider createEnvironmentDataProvider(String name) {
        Supplier<? extends DataProvider> supplier = name != null ? environmentProviders.get(name) : null;
        return supplier != null ? supplier.get() : null;
    }

    /** Binds a module to a provider name ({@code none}, {@code hiera}, {@code function} or a registered name). */
    public void bindModuleDataProvider(String moduleName, String providerName) {
        Objects.requireNonNull(moduleName, "moduleName");
        Objects.requireNonNull(providerName, "providerName");
        moduleBindings.put(moduleName, providerName);
        log.debug("Bound module {} to data provider {}", moduleName, providerName);
    }

    /** Provider name bound to the module, or null. */
    public String getModuleBinding(String moduleName) {
        return moduleName != null ? moduleBindings.get(moduleName) : null;
    }

    private static <T> void put(Map<String, T> map, String name, T value, String what) {
        Objects.requireNonNull(value, "value");
        String n = Objects.requireNonNull(name, "name").trim();
        if (n.isEmpty()) {
            throw new IllegalArgumentException(what + " name must be non-blank");
        }
        if (map.putIfAbsent(n, value) != null) {
            throw new IllegalArgumentException(what + " already registered: " + n);
        }
        log.debug("Registered {} {}", what, n);
    }
}
