package com.strata.adapter;

import com.strata.lookup.StrictMode;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Settings of a {@link LookupAdapter}, loaded from environment variables with system property fallback.
 * <p>
 * Data binding terminus: STRATA_DATA_BINDING_TERMINUS ({@code hiera} by default; {@code none} or empty
 * disables the global tier; any other name routes global lookups to a {@link DataBinding}).
 * Directories: STRATA_CONFDIR, STRATA_CODEDIR. Global hierarchy: STRATA_HIERA_CONFIG.
 * Deprecations: STRATA_STRICT ({@code off}, {@code warning}, {@code error}).
 */
public final class LookupSettings {

    private static final String ENV_DATA_BINDING_TERMINUS = "STRATA_DATA_BINDING_TERMINUS";
    private static final String ENV_HIERA_CONFIG = "STRATA_HIERA_CONFIG";
    private static final String ENV_CONFDIR = "STRATA_CONFDIR";
    private static final String ENV_CODEDIR = "STRATA_CODEDIR";
    private static final String ENV_STRICT = "STRATA_STRICT";

    public static final String TERMINUS_HIERA = "hiera";
    public static final String TERMINUS_NONE = "none";

    private static final String DEFAULT_CONFDIR = "/etc/strata";

    private final String dataBindingTerminus;
    private final Path confdir;
    private final Path codedir;
    private final Path hieraConfig;
    private final StrictMode strictMode;

    private LookupSettings(Builder b) {
        this.dataBindingTerminus = b.dataBindingTerminus != null ? b.dataBindingTerminus.trim() : TERMINUS_HIERA;
        this.confdir = b.confdir != null ? b.confdir : Paths.get(DEFAULT_CONFDIR);
        this.codedir = b.codedir != null ? b.codedir : confdir.resolve("code");
        this.hieraConfig = b.hieraConfig != null ? b.hieraConfig : confdir.resolve("hiera.yaml");
        this.strictMode = b.strictMode != null ? b.strictMode : StrictMode.WARNING;
    }

    public static LookupSettings fromEnvironment() {
        Builder b = builder()
                .dataBindingTerminus(getSetting(ENV_DATA_BINDING_TERMINUS, TERMINUS_HIERA))
                .strictMode(StrictMode.fromString(getSetting(ENV_STRICT, null)));
        String confdir = getSetting(ENV_CONFDIR, null);
        if (confdir != null) b.confdir(Paths.get(confdir));
        String codedir = getSetting(ENV_CODEDIR, null);
        if (codedir != null) b.codedir(Paths.get(codedir));
        String hieraConfig = getSetting(ENV_HIERA_CONFIG, null);
        if (hieraConfig != null) b.hieraConfig(Paths.get(hieraConfig));
        return b.build();
    }

    /** Environment variable, then the system property of the same name, then {@code defaultValue}. */
    private static String getSetting(String key, String defaultValue) {
        String v = System.getenv(key);
        if (v == null || v.isBlank()) {
            v = System.getProperty(key);
        }
        return v != null && !v.isBlank() ? v.trim() : defaultValue;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getDataBindingTerminus() {
        return dataBindingTerminus;
    }

    /** True when global lookups are switched off ({@code none} or empty terminus). */
    public boolean isGlobalLookupDisabled() {
        return dataBindingTerminus.isEmpty() || TERMINUS_NONE.equals(dataBindingTerminus);
    }

    public boolean isHieraTerminus() {
        return TERMINUS_HIERA.equals(dataBindingTerminus);
    }

    public Path getConfdir() {
        return confdir;
    }

    public Path getCodedir() {
        return codedir;
    }

    /** Path of the global hiera.yaml. */
    public Path getHieraConfig() {
        return hieraConfig;
    }

    public StrictMode getStrictMode() {
        return strictMode;
    }

    @Override
    public String toString() {
        return "LookupSettings{terminus=" + dataBindingTerminus + ", hieraConfig=" + hieraConfig
                + ", codedir=" + codedir + ", strict=" + strictMode + "}";
    }

    public static final class Builder {
        private String dataBindingTerminus;
        private Path confdir;
        private Path codedir;
        private Path hieraConfig;
        private StrictMode strictMode;

        private Builder() {
        }

        public Builder dataBindingTerminus(String dataBindingTerminus) {
            this.dataBindingTerminus = dataBindingTerminus;
            return this;
        }

        public Builder confdir(Path confdir) {
            this.confdir = Objects.requireNonNull(confdir, "confdir");
            return this;
        }

        public Builder codedir(Path codedir) {
            this.codedir = Objects.requireNonNull(codedir, "codedir");
            return this;
        }

        public Builder hieraConfig(Path hieraConfig) {
            this.hieraConfig = Objects.requireNonNull(hieraConfig, "hieraConfig");
            return this;
        }

        public Builder strictMode(StrictMode strictMode) {
            this.strictMode = strictMode;
            return this;
        }

        public LookupSettings build() {
            return new LookupSettings(this);
        }
    }
}
