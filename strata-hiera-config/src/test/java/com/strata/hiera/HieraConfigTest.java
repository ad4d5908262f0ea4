package com.strata.hiera;

import com.strata.lookup.ConfigurationException;
import com.strata.lookup.DataProvider;
import com.strata.lookup.Explainer;
import com.strata.lookup.Invocation;
import com.strata.lookup.LookupKey;
import com.strata.lookup.LookupResult;
import com.strata.lookup.MapScope;
import com.strata.lookup.Scope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HieraConfigTest {

    @TempDir
    Path dir;

    private final AtomicInteger builds = new AtomicInteger();
    private final TierStub parent = new TierStub();
    private HieraServices services;

    @BeforeEach
    void setUp() {
        services = HieraServices.builder()
                .codedir(dir)
                .buildListener(config -> builds.incrementAndGet())
                .build();
    }

    private Path write(String relative, String content) throws IOException {
        Path file = dir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Test
    void create_dispatchesOnVersion() throws IOException {
        Path v5 = write("v5/hiera.yaml", "version: 5\nhierarchy:\n  - name: common\n    path: common.yaml\n");
        Path v4 = write("v4/hiera.yaml", "version: 4\n");
        Path v3 = write("v3/hiera.yaml", ":backends:\n  - yaml\n");

        assertEquals(5, HieraConfig.create(v5, services).getVersion());
        assertEquals(4, HieraConfig.create(v4, services).getVersion());
        assertEquals(3, HieraConfig.create(v3, services).getVersion());
    }

    @Test
    void create_rejectsUnsupportedVersion() throws IOException {
        Path path = write("hiera.yaml", "version: 6\n");

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> HieraConfig.create(path, services));
        assertTrue(e.getMessage().contains("This runtime does not support hiera.yaml version '6'"), e.getMessage());
    }

    @Test
    void create_reportsSchemaViolations() throws IOException {
        Path path = write("hiera.yaml", "version: 5\nhierarchy:\n  - path: common.yaml\n  - name: x\n    colour: red\n");

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> HieraConfig.create(path, services));
        assertTrue(e.getMessage().startsWith("The Lookup Configuration at '" + path + "' has wrong type"), e.getMessage());
        assertTrue(e.getProblems().size() >= 2, e.getProblems().toString());
    }

    @Test
    void create_missingFileUsesDefaultAndSkipsMissingData() throws IOException {
        HieraConfig config = HieraConfig.create(dir.resolve("hiera.yaml"), services);

        assertTrue(config.isSynthesized());
        assertNull(config.getConfigPath());
        assertEquals(5, config.getVersion());
        assertTrue(config.configuredDataProviders(new Invocation(Scope.empty()), parent).isEmpty());

        write("data/common.yaml", "x: 1\n");
        HieraConfig withData = HieraConfig.create(dir.resolve("hiera.yaml"), services);
        List<DataProvider> providers = withData.configuredDataProviders(new Invocation(Scope.empty()), parent);
        assertEquals(1, providers.size());
        assertEquals(LookupResult.found(1),
                providers.get(0).keyLookup(LookupKey.parse("x"), new Invocation(Scope.empty()), null));
    }

    @Test
    void configuredDataProviders_rebuiltOnlyWhenInterpolatedVariableChanges() throws IOException {
        write("data/nodes/a.yaml", "x: from a\n");
        write("data/nodes/b.yaml", "x: from b\n");
        Path path = write("hiera.yaml", "version: 5\nhierarchy:\n  - name: node\n    path: nodes/%{certname}.yaml\n");
        HieraConfig config = HieraConfig.create(path, services);
        MapScope scope = new MapScope().put("certname", "a").put("unused", 1);

        List<DataProvider> first = config.configuredDataProviders(new Invocation(scope), parent);
        scope.put("unused", 2);
        assertSame(first, config.configuredDataProviders(new Invocation(scope), parent));
        assertEquals(1, builds.get());

        scope.put("certname", "b");
        Explainer explainer = new Explainer();
        List<DataProvider> second = config.configuredDataProviders(new Invocation(scope, explainer), parent);
        assertEquals(2, builds.get());
        assertTrue(explainer.explain().contains("Hiera configuration recreated"), explainer.explain());
        assertEquals(LookupResult.found("from b"),
                second.get(0).keyLookup(LookupKey.parse("x"), new Invocation(scope), null));
    }

    @Test
    void v4FunctionConfig_createsSingleLegacyEntry() {
        services.getProviderServices().getFunctions()
                .registerDataHash("legacy", (options, ctx) -> Map.of("x", "legacy value"));

        HieraConfig config = HieraConfig.v4FunctionConfig(dir, "legacy", services);
        List<DataProvider> providers = config.configuredDataProviders(new Invocation(Scope.empty()), parent);

        assertEquals(1, providers.size());
        assertEquals("Legacy function 'legacy'", providers.get(0).getName());
        assertEquals(LookupResult.found("legacy value"),
                providers.get(0).keyLookup(LookupKey.parse("x"), new Invocation(Scope.empty()), null));
    }

    @Test
    void stringKeys_dropsLeadingColon() {
        Map<String, Object> normalized = HieraConfig.stringKeys(Map.of(":backends", List.of(Map.of(":a", 1))));

        assertEquals(Map.of("backends", List.of(Map.of("a", 1))), normalized);
    }

    @Test
    void configExists() throws IOException {
        assertFalse(HieraConfig.configExists(dir));
        write("hiera.yaml", "version: 5\n");
        assertTrue(HieraConfig.configExists(dir));
    }
}
