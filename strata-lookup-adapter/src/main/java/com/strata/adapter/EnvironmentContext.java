package com.strata.adapter;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The environment a session compiles in: its name, its directory, the {@code environment_data_provider}
 * setting and the modules it contains.
 */
public final class EnvironmentContext {

    private final String name;
    private final Path path;
    private final String environmentDataProvider;
    private final Map<String, ModuleInfo> modules;

    private EnvironmentContext(Builder b) {
        this.name = Objects.requireNonNull(b.name, "name");
        this.path = b.path;
        this.environmentDataProvider = b.environmentDataProvider;
        this.modules = Collections.unmodifiableMap(new LinkedHashMap<>(b.modules));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    /** Environment directory, or null when the environment has no directory (no environment tier). */
    public Path getPath() {
        return path;
    }

    /** Location of environment.conf, used in deprecation notices. */
    public Path getConfigurationFile() {
        return path != null ? path.resolve("environment.conf") : null;
    }

    /** The {@code environment_data_provider} setting, or null. */
    public String getEnvironmentDataProvider() {
        return environmentDataProvider;
    }

    /** Module by name, or null. */
    public ModuleInfo getModule(String moduleName) {
        return moduleName != null ? modules.get(moduleName) : null;
    }

    public Map<String, ModuleInfo> getModules() {
        return modules;
    }

    @Override
    public String toString() {
        return "EnvironmentContext{" + name + (path != null ? " at " + path : "") + ", modules=" + modules.keySet() + "}";
    }

    public static final class Builder {
        private final String name;
        private Path path;
        private String environmentDataProvider;
        private final Map<String, ModuleInfo> modules = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder path(Path path) {
            this.path = path;
            return this;
        }

        public Builder environmentDataProvider(String environmentDataProvider) {
            this.environmentDataProvider = environmentDataProvider;
            return this;
        }

        public Builder module(ModuleInfo module) {
            modules.put(module.getName(), module);
            return this;
        }

        public EnvironmentContext build() {
            return new EnvironmentContext(this);
        }
    }
}
