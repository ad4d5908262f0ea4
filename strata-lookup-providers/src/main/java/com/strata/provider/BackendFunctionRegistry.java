package com.strata.provider;

import com.strata.lookup.ConfigurationException;
import com.strata.provider.builtin.JsonDataFunction;
import com.strata.provider.builtin.YamlDataFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Backend functions by kind and name. Built-in {@code yaml_data} and {@code json_data} are registered by
 * {@link #withBuiltins()}; {@link #withInstalledFunctions()} additionally loads every
 * {@link BackendFunctionProvider} on the class path.
 */
public final class BackendFunctionRegistry {

    private static final Logger log = LoggerFactory.getLogger(BackendFunctionRegistry.class);

    private final Map<FunctionKind, Map<String, Object>> functions = new EnumMap<>(FunctionKind.class);

    public BackendFunctionRegistry() {
        for (FunctionKind kind : FunctionKind.USER_KINDS) {
            functions.put(kind, new ConcurrentHashMap<>());
        }
    }

    /** Registry holding the built-in functions. */
    public static BackendFunctionRegistry withBuiltins() {
        BackendFunctionRegistry registry = new BackendFunctionRegistry();
        registry.registerDataHash(YamlDataFunction.NAME, new YamlDataFunction());
        registry.registerDataHash(JsonDataFunction.NAME, new JsonDataFunction());
        return registry;
    }

    /** Registry holding the built-in functions and all functions contributed through {@link ServiceLoader}. */
    public static BackendFunctionRegistry withInstalledFunctions() {
        BackendFunctionRegistry registry = withBuiltins();
        registry.loadInstalled(BackendFunctionRegistry.class.getClassLoader());
        return registry;
    }

    /**
     * Registers the functions of every {@link BackendFunctionProvider} visible to the class loader.
     *
     * @return number of functions registered
     */
    public int loadInstalled(ClassLoader loader) {
        int n = 0;
        for (BackendFunctionProvider provider : ServiceLoader.load(BackendFunctionProvider.class, loader)) {
            register(provider);
            n++;
        }
        if (n > 0) {
            log.info("Loaded {} backend function(s) from service providers", n);
        }
        return n;
    }

    /**
     * @throws IllegalArgumentException if the kind is not a user kind, the function does not match it, or
     *                                  the name is taken
     */
    public void register(BackendFunctionProvider provider) {
        Objects.requireNonNull(provider, "provider");
        Object function = provider.createFunction();
        FunctionKind kind = provider.getKind();
        boolean matches = (kind == FunctionKind.DATA_HASH && function instanceof DataHashFunction)
                || (kind == FunctionKind.LOOKUP_KEY && function instanceof LookupKeyFunction)
                || (kind == FunctionKind.DATA_DIG && function instanceof DataDigFunction);
        if (!matches) {
            throw new IllegalArgumentException("Function '" + provider.getFunctionName() + "' from "
                    + provider.getClass().getName() + " is not a " + kind + " function");
        }
        put(kind, provider.getFunctionName(), function);
    }

    public void registerDataHash(String name, DataHashFunction function) {
        put(FunctionKind.DATA_HASH, name, function);
    }

    public void registerLookupKey(String name, LookupKeyFunction function) {
        put(FunctionKind.LOOKUP_KEY, name, function);
    }

    public void registerDataDig(String name, DataDigFunction function) {
        put(FunctionKind.DATA_DIG, name, function);
    }

    private void put(FunctionKind kind, String name, Object function) {
        Objects.requireNonNull(function, "function");
        String n = Objects.requireNonNull(name, "name").trim();
        if (n.isEmpty()) {
            throw new IllegalArgumentException("Function name must be non-blank");
        }
        if (functions.get(kind).putIfAbsent(n, function) != null) {
            throw new IllegalArgumentException(kind + " function already registered: " + n);
        }
        log.debug("Registered {} function {}", kind, n);
    }

    public boolean contains(FunctionKind kind, String name) {
        Map<String, Object> byName = functions.get(kind);
        return byName != null && name != null && byName.containsKey(name);
    }

    public Set<String> getNames(FunctionKind kind) {
        Map<String, Object> byName = functions.get(kind);
        return byName != null ? Set.copyOf(byName.keySet()) : Set.of();
    }

    /** @throws ConfigurationException if no such function is registered */
    public DataHashFunction getDataHash(String name) {
        return (DataHashFunction) get(FunctionKind.DATA_HASH, name);
    }

    /** @throws ConfigurationException if no such function is registered */
    public LookupKeyFunction getLookupKey(String name) {
        return (LookupKeyFunction) get(FunctionKind.LOOKUP_KEY, name);
    }

    /** @throws ConfigurationException if no such function is registered */
    public DataDigFunction getDataDig(String name) {
        return (DataDigFunction) get(FunctionKind.DATA_DIG, name);
    }

    private Object get(FunctionKind kind, String name) {
        Object function = name != null ? functions.get(kind).get(name) : null;
        if (function == null) {
            throw new ConfigurationException("Unable to find '" + kind + "' function named '" + name + "'");
        }
        return function;
    }
}
