package com.strata.provider.legacy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Legacy backends by name (case-insensitive). Instantiation failures surface as the checked
 * {@link BackendLoadException} so callers decide how to report them.
 */
public final class LegacyBackendRegistry {

    private static final Logger log = LoggerFactory.getLogger(LegacyBackendRegistry.class);

    private final Map<String, LegacyBackendFactory> factories = new ConcurrentHashMap<>();

    /**
     * @throws IllegalArgumentException if the name is blank or already registered
     */
    public void register(String name, LegacyBackendFactory factory) {
        Objects.requireNonNull(factory, "factory");
        String key = normalize(name);
        if (key.isEmpty()) {
            throw new IllegalArgumentException("Backend name must be non-blank");
        }
        if (factories.putIfAbsent(key, factory) != null) {
            throw new IllegalArgumentException("Legacy backend already registered: " + name);
        }
        log.debug("Registered legacy backend {}", key);
    }

    public boolean contains(String name) {
        return name != null && factories.containsKey(normalize(name));
    }

    public Set<String> getNames() {
        return Set.copyOf(factories.keySet());
    }

    /**
     * Creates the backend, wrapping a 1.x backend in {@link Backend1xWrapper}.
     *
     * @throws BackendLoadException if the name is unknown, the factory fails or returns no backend
     */
    public LegacyBackend instantiate(String name, Map<String, Object> config) throws BackendLoadException {
        LegacyBackendFactory factory = name != null ? factories.get(normalize(name)) : null;
        if (factory == null) {
            throw BackendLoadException.notLoadable(name);
        }
        Object backend;
        try {
            backend = factory.create(config != null ? config : Map.of());
        } catch (RuntimeException e) {
            throw BackendLoadException.notInstantiable(name, e);
        }
        if (backend instanceof LegacyBackend) {
            return (LegacyBackend) backend;
        }
        if (backend instanceof LegacyBackend1x) {
            return new Backend1xWrapper((LegacyBackend1x) backend);
        }
        throw BackendLoadException.notInstantiable(name,
                new IllegalStateException("factory returned " + (backend == null ? "null" : backend.getClass().getName())));
    }

    private static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
