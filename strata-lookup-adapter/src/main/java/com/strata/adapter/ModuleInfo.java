package com.strata.adapter;

import com.strata.hiera.HieraConfig;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A module of the environment: its name, its directory and the metadata the lookup cares about.
 */
public final class ModuleInfo {

    public static final String METADATA_DATA_PROVIDER = "data_provider";

    private final String name;
    private final Path path;
    private final Map<String, Object> metadata;
    private final Path metadataFile;

    /**
     * @param metadata parsed module metadata; null when the module has none
     */
    public ModuleInfo(String name, Path path, Map<String, Object> metadata) {
        this.name = Objects.requireNonNull(name, "name");
        this.path = Objects.requireNonNull(path, "path");
        this.metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : null;
        this.metadataFile = path.resolve("metadata.json");
    }

    public ModuleInfo(String name, Path path) {
        this(name, path, null);
    }

    public String getName() {
        return name;
    }

    public Path getPath() {
        return path;
    }

    /** Metadata, or null. */
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Path getMetadataFile() {
        return metadataFile;
    }

    /** The {@code data_provider} named in the metadata, or null. */
    public String getDataProviderName() {
        Object value = metadata != null ? metadata.get(METADATA_DATA_PROVIDER) : null;
        return value != null ? value.toString() : null;
    }

    public boolean hasHieraConfig() {
        return HieraConfig.configExists(path);
    }

    @Override
    public String toString() {
        return "ModuleInfo{" + name + " at " + path + "}";
    }
}
