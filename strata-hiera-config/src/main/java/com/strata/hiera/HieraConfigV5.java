package com.strata.hiera;

import com.strata.hiera.schema.Schema;
import com.strata.hiera.schema.SchemaValidator;
import com.strata.hiera.schema.Schemas;
import com.strata.hiera.schema.StructSchema;
import com.strata.lookup.ConfigurationException;
import com.strata.lookup.DataProvider;
import com.strata.lookup.Invocation;
import com.strata.provider.FunctionKind;
import com.strata.provider.ResolvedLocation;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * hiera.yaml version 5. Each hierarchy entry names one function ({@code data_hash}, {@code lookup_key},
 * {@code data_dig}, or the internal {@code v4_data_hash}) and at most one kind of location. Entries without
 * a function inherit the one in {@code defaults}.
 */
public final class HieraConfigV5 extends HieraConfig {

    private static final Schema OPTION_NAME = Schemas.pattern("[A-Za-z](:?[0-9A-Za-z_-]*[0-9A-Za-z])?");

    private static final StructSchema CONFIG_TYPE = StructSchema.builder()
            .required(KEY_VERSION, Schemas.integerRange(5, 5))
            .optional(KEY_DEFAULTS, StructSchema.builder()
                    .optional(FunctionKind.DATA_HASH.getKey(), Schemas.nonEmptyString())
                    .optional(FunctionKind.LOOKUP_KEY.getKey(), Schemas.nonEmptyString())
                    .optional(FunctionKind.DATA_DIG.getKey(), Schemas.nonEmptyString())
                    .optional(KEY_DATADIR, Schemas.nonEmptyString())
                    .build())
            .optional(KEY_HIERARCHY, Schemas.arrayOf(StructSchema.builder()
                    .required(KEY_NAME, Schemas.nonEmptyString())
                    .optional(KEY_OPTIONS, Schemas.hashOf(OPTION_NAME, Schemas.data()))
                    .optional(FunctionKind.DATA_HASH.getKey(), Schemas.nonEmptyString())
                    .optional(FunctionKind.LOOKUP_KEY.getKey(), Schemas.nonEmptyString())
                    .optional(FunctionKind.V4_DATA_HASH.getKey(), Schemas.nonEmptyString())
                    .optional(FunctionKind.DATA_DIG.getKey(), Schemas.nonEmptyString())
                    .optional(KEY_PATH, Schemas.nonEmptyString())
                    .optional(KEY_PATHS, Schemas.arrayOf(Schemas.nonEmptyString(), 1))
                    .optional(KEY_GLOB, Schemas.nonEmptyString())
                    .optional(KEY_GLOBS, Schemas.arrayOf(Schemas.nonEmptyString(), 1))
                    .optional(KEY_URI, Schemas.uri())
                    .optional(KEY_URIS, Schemas.arrayOf(Schemas.uri(), 1))
                    .optional(KEY_DATADIR, Schemas.nonEmptyString())
                    .build()))
            .build();

    HieraConfigV5(Path configRoot, Path configPath, Map<String, Object> loaded, HieraServices services) {
        super(configRoot, configPath, loaded, services);
    }

    /** The document used when no hiera.yaml exists: one {@code Common} entry reading {@code data/common.yaml}. */
    static Map<String, Object> defaultDocument() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put(KEY_VERSION, 5);
        document.put(KEY_DEFAULTS, defaultDefaults());
        Map<String, Object> common = new LinkedHashMap<>();
        common.put(KEY_NAME, "Common");
        common.put(KEY_PATH, "common.yaml");
        document.put(KEY_HIERARCHY, List.of(common));
        return document;
    }

    private static Map<String, Object> defaultDefaults() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put(KEY_DATADIR, "data");
        defaults.put(FunctionKind.DATA_HASH.getKey(), "yaml_data");
        return defaults;
    }

    @Override
    protected Map<String, Object> validateConfig(Map<String, Object> config) {
        config.putIfAbsent(KEY_DEFAULTS, defaultDefaults());
        config.putIfAbsent(KEY_HIERARCHY, defaultDocument().get(KEY_HIERARCHY));
        SchemaValidator.assertInstanceOf("The Lookup Configuration at '" + label() + "'", CONFIG_TYPE, config);

        Map<String, Object> defaults = mapOrEmpty(config.get(KEY_DEFAULTS));
        if (countKinds(defaults, FunctionKind.USER_KINDS) > 1) {
            throw new ConfigurationException(label() + ": Only one of " + combineKinds(FunctionKind.USER_KINDS)
                    + " can be defined in defaults");
        }
        for (Object element : (List<?>) config.get(KEY_HIERARCHY)) {
            Map<String, Object> entry = mapOrEmpty(element);
            Object name = entry.get(KEY_NAME);
            int kinds = countKinds(entry, FunctionKind.ENTRY_KINDS);
            if (kinds == 0 && countKinds(defaults, FunctionKind.USER_KINDS) == 0) {
                throw new ConfigurationException(label() + ": One of " + combineKinds(FunctionKind.USER_KINDS)
                        + " must be defined in hierarchy '" + name + "'");
            }
            if (kinds > 1) {
                throw new ConfigurationException(label() + ": Only one of " + combineKinds(FunctionKind.USER_KINDS)
                        + " can be defined in hierarchy '" + name + "'");
            }
            if (LOCATION_KEYS.stream().filter(entry::containsKey).count() > 1) {
                throw new ConfigurationException(label() + ": Only one of " + combineStrings(LOCATION_KEYS)
                        + " can be defined in hierarchy '" + name + "'");
            }
        }
        return config;
    }

    @Override
    protected List<DataProvider> createConfiguredDataProviders(Invocation invocation, DataProvider parent) {
        Map<String, Object> defaults = mapOrEmpty(getConfig().get(KEY_DEFAULTS));
        String datadir = String.valueOf(defaults.getOrDefault(KEY_DATADIR, "data"));
        LocationResolver resolver = getServices().getLocationResolver();
        Map<String, DataProvider> providers = new LinkedHashMap<>();

        for (Object element : (List<?>) getConfig().get(KEY_HIERARCHY)) {
            Map<String, Object> entry = mapOrEmpty(element);
            String name = entry.get(KEY_NAME).toString();
            if (providers.containsKey(name)) {
                throw duplicate("Name", name);
            }
            FunctionKind kind = firstKind(entry, FunctionKind.ENTRY_KINDS);
            String functionName;
            if (kind == null) {
                kind = firstKind(defaults, FunctionKind.USER_KINDS);
                functionName = defaults.get(kind.getKey()).toString();
            } else {
                functionName = entry.get(kind.getKey()).toString();
            }

            Path entryDatadir = getConfigRoot().resolve(String.valueOf(entry.getOrDefault(KEY_DATADIR, datadir)));
            String locationKey = LOCATION_KEYS.stream().filter(entry::containsKey).findFirst().orElse(null);
            List<ResolvedLocation> locations;
            if (locationKey == null) {
                locations = null;
            } else {
                List<String> declared = stringList(entry.get(locationKey));
                switch (locationKey) {
                    case KEY_PATH:
                    case KEY_PATHS:
                        locations = resolver.resolvePaths(entryDatadir, declared, invocation, isSynthesized(), null);
                        break;
                    case KEY_GLOB:
                    case KEY_GLOBS:
                        locations = resolver.expandGlobs(entryDatadir, declared, invocation);
                        break;
                    default:
                        locations = resolver.expandUris(declared, invocation);
                        break;
                }
            }
            if (isSynthesized() && locations != null && locations.isEmpty()) {
                continue;
            }
            providers.put(name, createDataProvider(name, parent, kind, functionName,
                    interpolateOptions(entry.get(KEY_OPTIONS), invocation), locations));
        }
        return new ArrayList<>(providers.values());
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> interpolateOptions(Object options, Invocation invocation) {
        if (options == null) {
            return Map.of();
        }
        return (Map<String, Object>) getServices().getProviderServices().getInterpolator()
                .interpolateValue(options, invocation, false);
    }

    private static int countKinds(Map<String, Object> map, List<FunctionKind> kinds) {
        return (int) kinds.stream().filter(k -> map.containsKey(k.getKey())).count();
    }

    private static FunctionKind firstKind(Map<String, Object> map, List<FunctionKind> kinds) {
        return kinds.stream().filter(k -> map.containsKey(k.getKey())).findFirst().orElse(null);
    }

    private static String combineKinds(List<FunctionKind> kinds) {
        return combineStrings(kinds.stream().map(FunctionKind::getKey).collect(Collectors.toList()));
    }

    /** {@code 'a', 'b', or 'c'} */
    static String combineStrings(List<String> strings) {
        List<String> quoted = strings.stream().map(s -> "'" + s + "'").collect(Collectors.toList());
        int last = quoted.size() - 1;
        if (last == 0) {
            return quoted.get(0);
        }
        if (last == 1) {
            return quoted.get(0) + " or " + quoted.get(1);
        }
        return String.join(", ", quoted.subList(0, last)) + ", or " + quoted.get(last);
    }

    @Override
    public int getVersion() {
        return 5;
    }
}
