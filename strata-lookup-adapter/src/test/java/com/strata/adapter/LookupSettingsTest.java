package com.strata.adapter;

import com.strata.lookup.StrictMode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LookupSettingsTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("STRATA_DATA_BINDING_TERMINUS");
        System.clearProperty("STRATA_CONFDIR");
        System.clearProperty("STRATA_STRICT");
    }

    @Test
    void builderDefaults() {
        LookupSettings settings = LookupSettings.builder().build();

        assertEquals("hiera", settings.getDataBindingTerminus());
        assertTrue(settings.isHieraTerminus());
        assertFalse(settings.isGlobalLookupDisabled());
        assertEquals(Paths.get("/etc/strata/code"), settings.getCodedir());
        assertEquals(Paths.get("/etc/strata/hiera.yaml"), settings.getHieraConfig());
        assertEquals(StrictMode.WARNING, settings.getStrictMode());
    }

    @Test
    void pathsFollowConfdir() {
        Path confdir = Paths.get("/srv/conf");
        LookupSettings settings = LookupSettings.builder().confdir(confdir).codedir(Paths.get("/srv/code")).build();

        assertEquals(confdir.resolve("hiera.yaml"), settings.getHieraConfig());
        assertEquals(Paths.get("/srv/code"), settings.getCodedir());
    }

    @Test
    void noneOrEmptyTerminusDisablesGlobalTier() {
        assertTrue(LookupSettings.builder().dataBindingTerminus("none").build().isGlobalLookupDisabled());
        assertTrue(LookupSettings.builder().dataBindingTerminus(" ").build().isGlobalLookupDisabled());
        LookupSettings custom = LookupSettings.builder().dataBindingTerminus("legacy").build();
        assertFalse(custom.isGlobalLookupDisabled());
        assertFalse(custom.isHieraTerminus());
    }

    @Test
    void fromEnvironmentFallsBackToSystemProperties() {
        System.setProperty("STRATA_DATA_BINDING_TERMINUS", "none");
        System.setProperty("STRATA_CONFDIR", "/opt/strata");
        System.setProperty("STRATA_STRICT", "error");

        LookupSettings settings = LookupSettings.fromEnvironment();

        assertTrue(settings.isGlobalLookupDisabled());
        assertEquals(Paths.get("/opt/strata/hiera.yaml"), settings.getHieraConfig());
        assertEquals(StrictMode.ERROR, settings.getStrictMode());
    }
}
