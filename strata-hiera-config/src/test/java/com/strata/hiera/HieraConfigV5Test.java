package com.strata.hiera;

import com.strata.lookup.ConfigurationException;
import com.strata.lookup.DataProvider;
import com.strata.lookup.Invocation;
import com.strata.lookup.LookupKey;
import com.strata.lookup.LookupResult;
import com.strata.lookup.MapScope;
import com.strata.lookup.Scope;
import com.strata.provider.DataDigFunctionProvider;
import com.strata.provider.DataHashFunctionProvider;
import com.strata.provider.FunctionProvider;
import com.strata.provider.LookupKeyFunctionProvider;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HieraConfigV5Test {

    @TempDir
    Path dir;

    private final HieraServices services = HieraServices.defaults();
    private final TierStub parent = new TierStub();

    private HieraConfig config(String yaml) throws IOException {
        Path path = dir.resolve("hiera.yaml");
        Files.writeString(path, yaml);
        return HieraConfig.create(path, services);
    }

    private List<DataProvider> providers(String yaml) throws IOException {
        return config(yaml).configuredDataProviders(new Invocation(Scope.empty()), parent);
    }

    private static void assertFails(String expected, ThrowingBuild build) {
        ConfigurationException e = assertThrows(ConfigurationException.class, build::run);
        assertTrue(e.getMessage().endsWith(expected), e.getMessage());
    }

    @FunctionalInterface
    private interface ThrowingBuild {
        void run() throws Exception;
    }

    @Test
    void entryWithoutFunctionUsesDefaults() throws IOException {
        List<DataProvider> providers = providers("version: 5\n"
                + "defaults:\n  lookup_key: custom\n"
                + "hierarchy:\n  - name: a\n  - name: b\n    data_dig: digger\n");

        assertInstanceOf(LookupKeyFunctionProvider.class, providers.get(0));
        assertEquals("custom", ((FunctionProvider) providers.get(0)).getFunctionName());
        assertInstanceOf(DataDigFunctionProvider.class, providers.get(1));
    }

    @Test
    void missingDefaultsMeansYamlData() throws IOException {
        Files.createDirectories(dir.resolve("data"));
        Files.writeString(dir.resolve("data/common.yaml"), "greeting: hello\n");

        List<DataProvider> providers = providers("version: 5\nhierarchy:\n  - name: common\n    path: common.yaml\n");

        assertInstanceOf(DataHashFunctionProvider.class, providers.get(0));
        assertEquals(LookupResult.found("hello"),
                providers.get(0).keyLookup(LookupKey.parse("greeting"), new Invocation(Scope.empty()), null));
    }

    @Test
    void duplicateNamesAreRejected() {
        assertFails("Name 'common' defined more than once",
                () -> providers("version: 5\nhierarchy:\n  - name: common\n  - name: common\n"));
    }

    @Test
    void twoFunctionsInEntryAreRejected() {
        assertFails("Only one of 'data_hash', 'lookup_key', or 'data_dig' can be defined in hierarchy 'x'",
                () -> config("version: 5\nhierarchy:\n  - name: x\n    data_hash: yaml_data\n    lookup_key: other\n"));
    }

    @Test
    void twoFunctionsInDefaultsAreRejected() {
        assertFails("Only one of 'data_hash', 'lookup_key', or 'data_dig' can be defined in defaults",
                () -> config("version: 5\ndefaults:\n  data_hash: yaml_data\n  data_dig: other\n"));
    }

    @Test
    void entryWithoutAnyFunctionIsRejected() {
        assertFails("One of 'data_hash', 'lookup_key', or 'data_dig' must be defined in hierarchy 'x'",
                () -> config("version: 5\ndefaults:\n  datadir: other\nhierarchy:\n  - name: x\n"));
    }

    @Test
    void twoLocationKindsAreRejected() {
        assertFails("Only one of 'path', 'paths', 'glob', 'globs', 'uri', or 'uris' can be defined in hierarchy 'x'",
                () -> config("version: 5\nhierarchy:\n  - name: x\n    path: a.yaml\n    glob: '*.yaml'\n"));
    }

    @Test
    void invalidOptionNameIsRejected() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> config("version: 5\nhierarchy:\n  - name: x\n    options:\n      _bad: 1\n"));
        assertTrue(e.getMessage().contains("has wrong type"), e.getMessage());
    }

    @Test
    void entryWithoutLocationHasNoLocations() throws IOException {
        List<DataProvider> providers = providers("version: 5\nhierarchy:\n  - name: x\n    lookup_key: custom\n");

        assertNull(((FunctionProvider) providers.get(0)).getLocations());
    }

    @Test
    void globsAndUrisBecomeLocations() throws IOException {
        Files.createDirectories(dir.resolve("data/nodes"));
        Files.writeString(dir.resolve("data/nodes/b.yaml"), "x: b\n");
        Files.writeString(dir.resolve("data/nodes/a.yaml"), "x: a\n");
        List<DataProvider> providers = providers("version: 5\nhierarchy:\n"
                + "  - name: nodes\n    glob: 'nodes/*.yaml'\n"
                + "  - name: remote\n    lookup_key: remote\n    uris:\n      - 'https://config.example.com/a'\n");

        List<?> globbed = ((FunctionProvider) providers.get(0)).getLocations();
        assertEquals(2, globbed.size());
        assertEquals(LookupResult.found("a"),
                providers.get(0).keyLookup(LookupKey.parse("x"), new Invocation(Scope.empty()), null));
        assertTrue(((FunctionProvider) providers.get(1)).getLocations().get(0).isUri());
    }

    @Test
    void optionsAreInterpolated() throws IOException {
        AtomicReference<Map<String, Object>> seen = new AtomicReference<>();
        services.getProviderServices().getFunctions().registerLookupKey("capture", (key, options, ctx) -> {
            seen.set(options);
            return ctx.notFound();
        });
        HieraConfig config = config("version: 5\nhierarchy:\n"
                + "  - name: x\n    lookup_key: capture\n    options:\n      region: '%{region}'\n");
        List<DataProvider> providers =
                config.configuredDataProviders(new Invocation(new MapScope().put("region", "eu")), parent);

        providers.get(0).keyLookup(LookupKey.parse("k"), new Invocation(Scope.empty()), null);

        assertEquals("eu", seen.get().get("region"));
    }

    @Test
    void combineStrings() {
        assertEquals("'a'", HieraConfigV5.combineStrings(List.of("a")));
        assertEquals("'a' or 'b'", HieraConfigV5.combineStrings(List.of("a", "b")));
        assertEquals("'a', 'b', or 'c'", HieraConfigV5.combineStrings(List.of("a", "b", "c")));
    }
}
