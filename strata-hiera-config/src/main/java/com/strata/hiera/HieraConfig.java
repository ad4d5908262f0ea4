package com.strata.hiera;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.strata.lookup.ConfigurationException;
import com.strata.lookup.DataProvider;
import com.strata.lookup.Deprecations;
import com.strata.lookup.Invocation;
import com.strata.lookup.Scope;
import com.strata.lookup.ScopeLookupCollectingInvocation;
import com.strata.lookup.merge.MergeStrategy;
import com.strata.provider.DataDigFunctionProvider;
import com.strata.provider.DataHashFunctionProvider;
import com.strata.provider.FunctionKind;
import com.strata.provider.LookupKeyFunctionProvider;
import com.strata.provider.ProviderServices;
import com.strata.provider.ResolvedLocation;
import com.strata.provider.V3BackendFunctionProvider;
import com.strata.provider.V4DataHashFunctionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A parsed hiera.yaml. The {@code version} field selects the variant ({@link HieraConfigV3},
 * {@link HieraConfigV4}, {@link HieraConfigV5}); a document without it is version 3.
 * <p>
 * {@link #configuredDataProviders} turns the document into the ordered list of hierarchy entry providers.
 * The list is kept until one of the scope variables read while building it changes value.
 */
public abstract class HieraConfig {

    private static final Logger log = LoggerFactory.getLogger(HieraConfig.class);

    public static final String CONFIG_FILE_NAME = "hiera.yaml";

    public static final String KEY_NAME = "name";
    public static final String KEY_VERSION = "version";
    public static final String KEY_DATADIR = "datadir";
    public static final String KEY_HIERARCHY = "hierarchy";
    public static final String KEY_OPTIONS = "options";
    public static final String KEY_PATH = "path";
    public static final String KEY_PATHS = "paths";
    public static final String KEY_GLOB = "glob";
    public static final String KEY_GLOBS = "globs";
    public static final String KEY_URI = "uri";
    public static final String KEY_URIS = "uris";
    public static final String KEY_DEFAULTS = "defaults";

    public static final List<String> LOCATION_KEYS = List.of(KEY_PATH, KEY_PATHS, KEY_GLOB, KEY_GLOBS, KEY_URI, KEY_URIS);

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {};

    @FunctionalInterface
    private interface Variant {
        HieraConfig create(Path configRoot, Path configPath, Map<String, Object> loaded, HieraServices services);
    }

    private static final Map<Integer, Variant> VARIANTS = Map.of(
            3, HieraConfigV3::new,
            4, HieraConfigV4::new,
            5, HieraConfigV5::new);

    private final Path configRoot;
    private final Path configPath;
    private final Map<String, Object> loaded;
    private final HieraServices services;
    private Map<String, Object> config;

    private List<DataProvider> dataProviders;
    private Map<String, Object> scopeInterpolations = Map.of();

    protected HieraConfig(Path configRoot, Path configPath, Map<String, Object> loaded, HieraServices services) {
        this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
        this.configPath = configPath;
        this.loaded = loaded;
        this.services = Objects.requireNonNull(services, "services");
    }

    /**
     * Reads {@code configPath}. When the file does not exist the default version 5 document is used and
     * the configuration counts as synthesized.
     *
     * @throws ConfigurationException if the document cannot be parsed, has an unsupported version or is invalid
     */
    public static HieraConfig create(Path configPath, HieraServices services) {
        Path absolute = configPath.toAbsolutePath();
        Path root = absolute.getParent();
        if (Files.exists(absolute)) {
            return create(root, absolute, load(absolute), services);
        }
        log.debug("No {} at {}; using the default configuration", CONFIG_FILE_NAME, absolute);
        return create(root, null, HieraConfigV5.defaultDocument(), services);
    }

    /**
     * Creates a synthesized configuration from an in-memory document.
     *
     * @param configRoot directory relative data directories are resolved against
     */
    public static HieraConfig create(Path configRoot, Map<String, ?> document, HieraServices services) {
        return create(configRoot.toAbsolutePath(), null, document, services);
    }

    private static HieraConfig create(Path root, Path path, Map<String, ?> document, HieraServices services) {
        Map<String, Object> normalized = stringKeys(document);
        int version = versionOf(normalized, path);
        Variant variant = VARIANTS.get(version);
        if (variant == null) {
            throw new ConfigurationException(label(path) + ": This runtime does not support " + CONFIG_FILE_NAME
                    + " version '" + version + "'");
        }
        HieraConfig config = variant.create(root, path, normalized, services);
        config.config = config.validateConfig(new LinkedHashMap<>(normalized));
        log.debug("Loaded {} from {}", config.getName(), label(path));
        return config;
    }

    /** Whether a hiera.yaml exists in the directory. */
    public static boolean configExists(Path configRoot) {
        return Files.exists(configRoot.resolve(CONFIG_FILE_NAME));
    }

    /**
     * Synthesized version 5 configuration with one {@code v4_data_hash} entry calling a legacy data function.
     */
    public static HieraConfig v4FunctionConfig(Path configRoot, String functionName, HieraServices services) {
        Deprecations.warnOnce(services.getStrictMode(), "legacy_provider_function",
                "Using of legacy data provider function '" + functionName + "'. Please convert to a 'data_hash' function");
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put(KEY_NAME, "Legacy function '" + functionName + "'");
        entry.put(FunctionKind.V4_DATA_HASH.getKey(), functionName);
        Map<String, Object> document = new LinkedHashMap<>();
        document.put(KEY_VERSION, 5);
        document.put(KEY_HIERARCHY, List.of(entry));
        return create(configRoot, document, services);
    }

    static Map<String, Object> load(Path path) {
        try {
            JsonNode root = YAML.readTree(Files.readString(path));
            if (root == null || root.isMissingNode() || root.isNull()) {
                return new LinkedHashMap<>();
            }
            if (!root.isObject()) {
                throw new ConfigurationException(path + ": " + CONFIG_FILE_NAME + " must contain a hash");
            }
            return YAML.convertValue(root, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Unable to parse " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read " + path + ": " + e.getMessage(), e);
        }
    }

    private static int versionOf(Map<String, Object> document, Path path) {
        Object version = document.get(KEY_VERSION);
        if (version == null) {
            return 3;
        }
        if (version instanceof Number) {
            return ((Number) version).intValue();
        }
        try {
            return Integer.parseInt(version.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(label(path) + ": This runtime does not support " + CONFIG_FILE_NAME
                    + " version '" + version + "'", e);
        }
    }

    /** Copies the document with every map key as a string; hiera 3 style {@code :key} names lose the colon. */
    @SuppressWarnings("unchecked")
    static <T> T stringKeys(Object value) {
        if (value instanceof Map) {
            Map<String, Object> result = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> {
                String key = String.valueOf(k);
                result.put(key.startsWith(":") && key.length() > 1 ? key.substring(1) : key, stringKeys(v));
            });
            return (T) result;
        }
        if (value instanceof List) {
            List<Object> result = new ArrayList<>();
            for (Object element : (List<?>) value) {
                result.add(stringKeys(element));
            }
            return (T) result;
        }
        return (T) value;
    }

    /**
     * The hierarchy entry providers, rebuilt when a scope variable used during the previous build changed.
     *
     * @param invocation current invocation (scope and explanation)
     * @param parent     tier provider owning the entries
     */
    public List<DataProvider> configuredDataProviders(Invocation invocation, DataProvider parent) {
        Scope scope = invocation.getScope();
        if (dataProviders == null || !scopeInterpolationsStable(scope)) {
            if (dataProviders != null) {
                invocation.reportText(() -> "Hiera configuration recreated due to change of scope variables used in interpolation expressions");
                log.debug("Rebuilding {} from {}: scope variables changed", getName(), label(configPath));
            }
            ScopeLookupCollectingInvocation collecting = new ScopeLookupCollectingInvocation(scope);
            dataProviders = Collections.unmodifiableList(createConfiguredDataProviders(collecting, parent));
            scopeInterpolations = collecting.getScopeInterpolations();
            services.notifyBuilt(this);
        }
        return dataProviders;
    }

    private boolean scopeInterpolationsStable(Scope scope) {
        for (Map.Entry<String, Object> e : scopeInterpolations.entrySet()) {
            if (!Objects.equals(scope.get(e.getKey()), e.getValue())) {
                return false;
            }
        }
        return true;
    }

    /** Builds the providers; scope reads are collected on {@code invocation}. */
    protected abstract List<DataProvider> createConfiguredDataProviders(Invocation invocation, DataProvider parent);

    /**
     * Applies defaults to the document and validates it.
     *
     * @param config mutable copy of the loaded document
     * @return the document to use
     * @throws ConfigurationException if the document is invalid
     */
    protected abstract Map<String, Object> validateConfig(Map<String, Object> config);

    public abstract int getVersion();

    /** Strategy configured in the document for hash merges, or null. Only version 3 documents have one. */
    public MergeStrategy getMergeStrategy() {
        return null;
    }

    public String getName() {
        return "hiera configuration version " + getVersion();
    }

    /** Directory of the configuration file. */
    public Path getConfigRoot() {
        return configRoot;
    }

    /** The configuration file, or null for a synthesized configuration. */
    public Path getConfigPath() {
        return configPath;
    }

    public boolean isSynthesized() {
        return configPath == null;
    }

    /** Validated document with defaults applied. */
    public Map<String, Object> getConfig() {
        return config;
    }

    protected Map<String, Object> getLoaded() {
        return loaded;
    }

    protected HieraServices getServices() {
        return services;
    }

    protected String label() {
        return label(configPath);
    }

    private static String label(Path path) {
        return path != null ? path.toString() : "(default " + CONFIG_FILE_NAME + ")";
    }

    protected String interpolate(String value, Invocation invocation) {
        return services.getProviderServices().getInterpolator().interpolate(value, invocation, false);
    }

    protected ConfigurationException duplicate(String what, String name) {
        return new ConfigurationException(label() + ": " + what + " '" + name + "' defined more than once");
    }

    protected DataProvider createDataProvider(String name, DataProvider parent, FunctionKind kind, String functionName,
                                              Map<String, Object> options, List<ResolvedLocation> locations) {
        ProviderServices ps = services.getProviderServices();
        switch (kind) {
            case DATA_HASH:
                return new DataHashFunctionProvider(name, parent, functionName, options, locations, ps);
            case LOOKUP_KEY:
                return new LookupKeyFunctionProvider(name, parent, functionName, options, locations, ps);
            case DATA_DIG:
                return new DataDigFunctionProvider(name, parent, functionName, options, locations, ps);
            case V3_BACKEND:
                return new V3BackendFunctionProvider(name, parent, functionName, options, locations, ps);
            case V4_DATA_HASH:
                return new V4DataHashFunctionProvider(name, parent, functionName, ps);
            default:
                throw new IllegalStateException("Unhandled function kind " + kind);
        }
    }

    @SuppressWarnings("unchecked")
    protected static List<String> stringList(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof List) {
            List<String> result = new ArrayList<>();
            for (Object o : (List<Object>) value) {
                result.add(String.valueOf(o));
            }
            return result;
        }
        return List.of(value.toString());
    }

    @SuppressWarnings("unchecked")
    protected static Map<String, Object> mapOrEmpty(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : Map.of();
    }

    @Override
    public String toString() {
        return getName() + " (" + label() + ")";
    }
}
