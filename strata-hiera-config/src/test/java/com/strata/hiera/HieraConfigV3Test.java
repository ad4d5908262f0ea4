package com.strata.hiera;

import com.strata.lookup.ConfigurationException;
import com.strata.lookup.DataProvider;
import com.strata.lookup.Invocation;
import com.strata.lookup.LookupKey;
import com.strata.lookup.LookupResult;
import com.strata.lookup.MapScope;
import com.strata.lookup.merge.MergeStrategy;
import com.strata.provider.DataHashFunctionProvider;
import com.strata.provider.FunctionProvider;
import com.strata.provider.V3BackendFunctionProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HieraConfigV3Test {

    @TempDir
    Path dir;

    private HieraServices services;
    private final TierStub parent = new TierStub();

    @BeforeEach
    void setUp() {
        services = HieraServices.builder().codedir(dir.resolve("code")).build();
    }

    private HieraConfig config(String yaml) throws IOException {
        Path path = dir.resolve("hiera.yaml");
        Files.writeString(path, yaml);
        return HieraConfig.create(path, services);
    }

    @Test
    void defaultsApplied() throws IOException {
        HieraConfig config = config("---\n");

        assertEquals(3, config.getVersion());
        assertEquals("yaml", config.getConfig().get("backends"));
        assertEquals(List.of("nodes/%{::trusted.certname}", "common"), config.getConfig().get("hierarchy"));
        assertEquals(MergeStrategy.FIRST, config.getMergeStrategy().getName());
    }

    @Test
    void defaultDatadirIsUnderCodedirEnvironment() throws IOException {
        Path datadir = dir.resolve("code/environments/production/hieradata");
        Files.createDirectories(datadir);
        Files.writeString(datadir.resolve("common.yaml"), "x: from production\n");
        HieraConfig config = config(":backends: yaml\n:hierarchy: common\n");
        MapScope scope = new MapScope().put("environment", "production");

        List<DataProvider> providers = config.configuredDataProviders(new Invocation(scope), parent);

        assertEquals(1, providers.size());
        assertInstanceOf(DataHashFunctionProvider.class, providers.get(0));
        assertEquals("yaml_data", ((FunctionProvider) providers.get(0)).getFunctionName());
        assertEquals(LookupResult.found("from production"),
                providers.get(0).keyLookup(LookupKey.parse("x"), new Invocation(scope), null));
    }

    @Test
    void backendSectionSetsDatadirAndOptions() throws IOException {
        Files.createDirectories(dir.resolve("hieradata"));
        Files.writeString(dir.resolve("hieradata/common.json"), "{\"x\": 1}");
        HieraConfig config = config(":backends:\n  - json\n  - custom\n"
                + ":json:\n  :datadir: hieradata\n"
                + ":custom:\n  :endpoint: http://localhost\n"
                + ":hierarchy:\n  - common\n");

        List<DataProvider> providers = config.configuredDataProviders(new Invocation(new MapScope()), parent);

        assertEquals(LookupResult.found(1),
                providers.get(0).keyLookup(LookupKey.parse("x"), new Invocation(new MapScope()), null));
        assertInstanceOf(V3BackendFunctionProvider.class, providers.get(1));
        assertEquals(Map.of("endpoint", "http://localhost"), ((FunctionProvider) providers.get(1)).getOptions());
    }

    @Test
    void interpolatedDatadirRebuildsOnlyWhenItsVariableChanges() throws IOException {
        Files.createDirectories(dir.resolve("one"));
        Files.createDirectories(dir.resolve("two"));
        Files.writeString(dir.resolve("one/common.yaml"), "x: one\n");
        Files.writeString(dir.resolve("two/common.yaml"), "x: two\n");
        HieraConfig config = config(":backends: yaml\n:yaml:\n  :datadir: '%{dc}'\n:hierarchy: common\n");
        MapScope scope = new MapScope().put("dc", "one").put("other", 1);

        List<DataProvider> first = config.configuredDataProviders(new Invocation(scope), parent);
        assertEquals(LookupResult.found("one"), first.get(0).keyLookup(LookupKey.parse("x"), new Invocation(scope), null));

        scope.put("other", 2);
        assertSame(first, config.configuredDataProviders(new Invocation(scope), parent));

        scope.put("dc", "two");
        List<DataProvider> rebuilt = config.configuredDataProviders(new Invocation(scope), parent);
        assertNotSame(first, rebuilt);
        assertEquals(LookupResult.found("two"), rebuilt.get(0).keyLookup(LookupKey.parse("x"), new Invocation(scope), null));
    }

    @Test
    void duplicateBackendIsRejected() throws IOException {
        HieraConfig config = config(":backends:\n  - yaml\n  - yaml\n");

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> config.configuredDataProviders(new Invocation(new MapScope()), parent));
        assertTrue(e.getMessage().endsWith("Backend 'yaml' defined more than once"), e.getMessage());
    }

    @Test
    void mergeBehaviorMapping() throws IOException {
        assertEquals(MergeStrategy.FIRST, config(":merge_behavior: native\n").getMergeStrategy().getName());
        assertEquals(MergeStrategy.UNIQUE, config(":merge_behavior: array\n").getMergeStrategy().getName());
        // hiera 3 'deep' lets lower priority values win; 'deeper' is the regular deep merge
        assertEquals(MergeStrategy.REVERSE_DEEP, config(":merge_behavior: deep\n").getMergeStrategy().getName());
        assertEquals(MergeStrategy.DEEP, config(":merge_behavior: deeper\n").getMergeStrategy().getName());
    }

    @Test
    void deepMergeOptionsKeepOnlyRecognizedOptions() throws IOException {
        MergeStrategy strategy = config(":merge_behavior: deeper\n"
                + ":deep_merge_options:\n  :knockout_prefix: '--'\n  :colour: blue\n").getMergeStrategy();

        assertEquals(Map.of("knockout_prefix", "--"), strategy.getOptions());
    }

    @Test
    void unknownMergeBehaviorIsRejected() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> config(":merge_behavior: fancy\n"));
        assertTrue(e.getMessage().contains("has wrong type"), e.getMessage());
    }
}
