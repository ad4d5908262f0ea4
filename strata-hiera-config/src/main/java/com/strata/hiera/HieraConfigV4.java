package com.strata.hiera;

import com.strata.hiera.schema.SchemaValidator;
import com.strata.hiera.schema.Schemas;
import com.strata.hiera.schema.StructSchema;
import com.strata.lookup.ConfigurationException;
import com.strata.lookup.DataProvider;
import com.strata.lookup.Deprecations;
import com.strata.lookup.Invocation;
import com.strata.provider.FunctionKind;
import com.strata.provider.ResolvedLocation;
import com.strata.provider.registry.PathBasedDataProviderFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * hiera.yaml version 4: named entries, each with a {@code backend}. {@code yaml} and {@code json} are
 * built in; other backends come from a {@link PathBasedDataProviderFactory} in the data provider registry.
 */
public final class HieraConfigV4 extends HieraConfig {

    public static final String KEY_BACKEND = "backend";

    private static final StructSchema CONFIG_TYPE = StructSchema.builder()
            .required(KEY_VERSION, Schemas.integerRange(4, 4))
            .optional(KEY_DATADIR, Schemas.nonEmptyString())
            .optional(KEY_HIERARCHY, Schemas.arrayOf(StructSchema.builder()
                    .required(KEY_BACKEND, Schemas.nonEmptyString())
                    .required(KEY_NAME, Schemas.nonEmptyString())
                    .optional(KEY_DATADIR, Schemas.nonEmptyString())
                    .optional(KEY_PATH, Schemas.nonEmptyString())
                    .optional(KEY_PATHS, Schemas.arrayOf(Schemas.nonEmptyString()))
                    .build()))
            .build();

    HieraConfigV4(Path configRoot, Path configPath, Map<String, Object> loaded, HieraServices services) {
        super(configRoot, configPath, loaded, services);
    }

    @Override
    protected Map<String, Object> validateConfig(Map<String, Object> config) {
        Deprecations.warnOnce(getServices().getStrictMode(), "hiera.yaml.v4",
                label() + ": Use of 'hiera.yaml' version 4 is deprecated. It should be converted to version 5",
                getConfigPath());
        config.putIfAbsent(KEY_DATADIR, "data");
        Map<String, Object> common = new LinkedHashMap<>();
        common.put(KEY_NAME, "common");
        common.put(KEY_BACKEND, "yaml");
        config.putIfAbsent(KEY_HIERARCHY, List.of(common));
        SchemaValidator.assertInstanceOf("The Lookup Configuration at '" + label() + "'", CONFIG_TYPE, config);
        return config;
    }

    @Override
    protected List<DataProvider> createConfiguredDataProviders(Invocation invocation, DataProvider parent) {
        String defaultDatadir = getConfig().get(KEY_DATADIR).toString();
        Map<String, DataProvider> providers = new LinkedHashMap<>();

        for (Object element : (List<?>) getConfig().get(KEY_HIERARCHY)) {
            Map<String, Object> entry = mapOrEmpty(element);
            String name = entry.get(KEY_NAME).toString();
            if (providers.containsKey(name)) {
                throw duplicate("Name", name);
            }
            List<String> originalPaths = entry.containsKey(KEY_PATHS)
                    ? stringList(entry.get(KEY_PATHS))
                    : List.of(String.valueOf(entry.getOrDefault(KEY_PATH, name)));
            Path datadir = getConfigRoot().resolve(String.valueOf(entry.getOrDefault(KEY_DATADIR, defaultDatadir)));
            String backend = entry.get(KEY_BACKEND).toString();
            DataProvider provider;
            if ("json".equals(backend) || "yaml".equals(backend)) {
                List<ResolvedLocation> paths = getServices().getLocationResolver()
                        .resolvePaths(datadir, originalPaths, invocation, isSynthesized(), "." + backend);
                provider = createDataProvider(name, parent, FunctionKind.DATA_HASH, backend + "_data", Map.of(), paths);
            } else {
                provider = factoryCreateDataProvider(invocation, name, parent, backend, datadir, originalPaths);
            }
            providers.put(name, provider);
        }
        return new ArrayList<>(providers.values());
    }

    private DataProvider factoryCreateDataProvider(Invocation invocation, String name, DataProvider parent,
                                                   String backend, Path datadir, List<String> originalPaths) {
        PathBasedDataProviderFactory factory = getServices().getDataProviders().getPathBasedFactory(backend);
        if (factory == null) {
            throw new ConfigurationException(label() + ": No data provider is registered for backend '" + backend + "'");
        }
        List<String> paths = new ArrayList<>(originalPaths.size());
        for (String path : originalPaths) {
            paths.add(interpolate(path, invocation));
        }
        List<ResolvedLocation> locations = factory.resolvePaths(datadir, originalPaths, paths);
        return factory.getVersion() == 1
                ? factory.create(name, locations)
                : factory.create(name, locations, parent);
    }

    @Override
    public int getVersion() {
        return 4;
    }
}
