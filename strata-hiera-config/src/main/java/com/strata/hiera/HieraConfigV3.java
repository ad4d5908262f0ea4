package com.strata.hiera;

import com.strata.hiera.schema.Schema;
import com.strata.hiera.schema.SchemaValidator;
import com.strata.hiera.schema.Schemas;
import com.strata.hiera.schema.StructSchema;
import com.strata.lookup.DataProvider;
import com.strata.lookup.Deprecations;
import com.strata.lookup.Invocation;
import com.strata.lookup.merge.MergeStrategy;
import com.strata.provider.FunctionKind;
import com.strata.provider.ResolvedLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * hiera.yaml version 3: a list of backends sharing one hierarchy of path templates. {@code yaml} and
 * {@code json} are read with the built-in data functions; any other backend is a legacy backend.
 */
public final class HieraConfigV3 extends HieraConfig {

    private static final Logger log = LoggerFactory.getLogger(HieraConfigV3.class);

    public static final String KEY_BACKENDS = "backends";
    public static final String KEY_LOGGER = "logger";
    public static final String KEY_MERGE_BEHAVIOR = "merge_behavior";
    public static final String KEY_DEEP_MERGE_OPTIONS = "deep_merge_options";

    private static final Set<String> DEEP_MERGE_OPTIONS =
            Set.of("knockout_prefix", "merge_debug", "merge_hash_arrays", "sort_merge_arrays");

    private static final StructSchema CONFIG_TYPE = StructSchema.builder()
            .optional(KEY_VERSION, Schemas.integerRange(3, 3))
            .optional(KEY_BACKENDS, Schemas.variant(Schemas.nonEmptyString(), Schemas.arrayOf(Schemas.nonEmptyString())))
            .optional(KEY_LOGGER, Schemas.nonEmptyString())
            .optional(KEY_MERGE_BEHAVIOR, Schemas.enumOf("deep", "deeper", "native", "array"))
            .optional(KEY_DEEP_MERGE_OPTIONS, Schemas.hashOf(Schemas.nonEmptyString(),
                    Schemas.variant(Schemas.string(), Schemas.bool())))
            .optional(KEY_HIERARCHY, Schemas.variant(Schemas.nonEmptyString(), Schemas.arrayOf(Schemas.nonEmptyString())))
            .build();

    private MergeStrategy mergeStrategy;

    HieraConfigV3(Path configRoot, Path configPath, Map<String, Object> loaded, HieraServices services) {
        super(configRoot, configPath, loaded, services);
    }

    @Override
    protected Map<String, Object> validateConfig(Map<String, Object> config) {
        Deprecations.warnOnce(getServices().getStrictMode(), "hiera.yaml.v3",
                label() + ": Use of 'hiera.yaml' version 3 is deprecated. It should be converted to version 5",
                getConfigPath());
        config.putIfAbsent(KEY_VERSION, 3);
        config.putIfAbsent(KEY_BACKENDS, "yaml");
        config.putIfAbsent(KEY_HIERARCHY, List.of("nodes/%{::trusted.certname}", "common"));
        config.putIfAbsent(KEY_LOGGER, "console");
        config.putIfAbsent(KEY_MERGE_BEHAVIOR, "native");
        config.putIfAbsent(KEY_DEEP_MERGE_OPTIONS, new LinkedHashMap<>());

        Map<String, Schema> backendSections = new LinkedHashMap<>();
        for (String backend : stringList(config.get(KEY_BACKENDS))) {
            backendSections.put(backend, Schemas.hashOf(Schemas.nonEmptyString(), Schemas.any()));
        }
        SchemaValidator.assertInstanceOf("The Lookup Configuration at '" + label() + "'",
                CONFIG_TYPE.withOptional(backendSections), config);
        return config;
    }

    @Override
    protected List<DataProvider> createConfiguredDataProviders(Invocation invocation, DataProvider parent) {
        Map<String, Object> config = getConfig();
        String defaultDatadir = getServices().getCodedir().resolve("environments").resolve("%{::environment}")
                .resolve("hieradata").toString();
        List<String> originalPaths = stringList(config.get(KEY_HIERARCHY));
        Map<String, DataProvider> providers = new LinkedHashMap<>();

        for (String backend : stringList(config.get(KEY_BACKENDS))) {
            if (providers.containsKey(backend)) {
                throw duplicate("Backend", backend);
            }
            Map<String, Object> backendConfig = mapOrEmpty(config.get(backend));
            Object datadirSetting = backendConfig.get(KEY_DATADIR);
            Path datadir = getConfigRoot().resolve(
                    interpolate(datadirSetting != null ? datadirSetting.toString() : defaultDatadir, invocation));
            List<ResolvedLocation> paths = getServices().getLocationResolver()
                    .resolvePaths(datadir, originalPaths, invocation, isSynthesized(), "." + backend);
            DataProvider provider;
            if ("json".equals(backend) || "yaml".equals(backend)) {
                provider = createDataProvider(backend, parent, FunctionKind.DATA_HASH, backend + "_data",
                        Map.of(), paths);
            } else {
                provider = createDataProvider(backend, parent, FunctionKind.V3_BACKEND, backend, backendConfig,
                        paths.isEmpty() ? null : paths);
            }
            providers.put(backend, provider);
        }
        return new ArrayList<>(providers.values());
    }

    /**
     * Strategy derived from {@code merge_behavior}: {@code native} is first found, {@code array} is unique,
     * {@code deep} is reverse deep and {@code deeper} is deep. Deep variants take the recognized
     * {@code deep_merge_options}; others are logged and ignored.
     */
    @Override
    public MergeStrategy getMergeStrategy() {
        if (mergeStrategy == null) {
            mergeStrategy = createMergeStrategy();
        }
        return mergeStrategy;
    }

    private MergeStrategy createMergeStrategy() {
        Object behavior = getConfig().get(KEY_MERGE_BEHAVIOR);
        if (behavior == null) {
            return MergeStrategy.strategy(null);
        }
        switch (behavior.toString()) {
            case "native":
                return MergeStrategy.strategy(MergeStrategy.FIRST);
            case "array":
                return MergeStrategy.strategy(MergeStrategy.UNIQUE);
            case "deep":
            case "deeper":
                Map<String, Object> merge = new LinkedHashMap<>();
                merge.put(MergeStrategy.STRATEGY, "deep".equals(behavior) ? MergeStrategy.REVERSE_DEEP : MergeStrategy.DEEP);
                mapOrEmpty(getConfig().get(KEY_DEEP_MERGE_OPTIONS)).forEach((option, value) -> {
                    if (DEEP_MERGE_OPTIONS.contains(option)) {
                        merge.put(option, value);
                    } else {
                        log.warn("{}: merge_option '{}' is not recognized. Option is ignored", label(), option);
                    }
                });
                return MergeStrategy.strategy(merge);
            default:
                return MergeStrategy.strategy(null);
        }
    }

    @Override
    public int getVersion() {
        return 3;
    }
}
