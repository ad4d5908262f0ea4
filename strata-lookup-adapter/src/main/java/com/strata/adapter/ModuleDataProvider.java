package com.strata.adapter;

import com.strata.hiera.HieraConfig;
import com.strata.hiera.HieraServices;
import com.strata.lookup.ConfigurationException;
import com.strata.lookup.LookupKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * The tier of one module, configured by {@code <module>/hiera.yaml}. Version 3 is not allowed here.
 * Data keys must be qualified with the module name; other keys are dropped with a warning.
 */
public final class ModuleDataProvider extends ConfiguredDataProvider {

    private static final Logger log = LoggerFactory.getLogger(ModuleDataProvider.class);

    private final ModuleInfo module;
    private final String prefix;

    public ModuleDataProvider(ModuleInfo module, HieraServices services, LookupMetrics metrics) {
        this(module, services, metrics, null);
    }

    public ModuleDataProvider(ModuleInfo module, HieraServices services, LookupMetrics metrics, HieraConfig config) {
        super(services, metrics, config);
        this.module = Objects.requireNonNull(module, "module");
        this.prefix = module.getName() + "::";
    }

    public String getModuleName() {
        return module.getName();
    }

    @Override
    public String getPlace() {
        return "Module";
    }

    @Override
    protected Path configurationPath() {
        return module.getPath().resolve(HieraConfig.CONFIG_FILE_NAME);
    }

    @Override
    protected HieraConfig assertConfigVersion(HieraConfig config) {
        if (config.getVersion() == 3) {
            throw new ConfigurationException(config.getName() + " cannot be used in a module");
        }
        return config;
    }

    @Override
    public Map<String, Object> validateDataHash(Map<String, Object> dataHash, Supplier<String> label) {
        Map<String, Object> result = dataHash;
        for (String key : dataHash.keySet()) {
            if (LookupKey.LOOKUP_OPTIONS.equals(key) || key.startsWith(prefix)) {
                continue;
            }
            if (result == dataHash) {
                result = new LinkedHashMap<>(dataHash);
            }
            result.remove(key);
            log.warn("Module '{}': {} must use keys qualified with the name of the module", module.getName(), label.get());
        }
        Object options = result.get(LookupKey.LOOKUP_OPTIONS);
        if (options instanceof Map) {
            Map<?, ?> qualified = qualifiedOptions((Map<?, ?>) options, label);
            if (qualified != options) {
                if (result == dataHash) {
                    result = new LinkedHashMap<>(dataHash);
                }
                result.put(LookupKey.LOOKUP_OPTIONS, qualified);
            }
        }
        return result;
    }

    private Map<?, ?> qualifiedOptions(Map<?, ?> options, Supplier<String> label) {
        Map<Object, Object> result = null;
        for (Object key : options.keySet()) {
            if (String.valueOf(key).startsWith(prefix)) {
                continue;
            }
            if (result == null) {
                result = new LinkedHashMap<>(options);
            }
            result.remove(key);
            log.warn("Module '{}': {} must use keys qualified with the name of the module in {}",
                    module.getName(), label.get(), LookupKey.LOOKUP_OPTIONS);
        }
        return result != null ? result : options;
    }
}
