package com.strata.adapter;

import com.strata.hiera.HieraServices;
import com.strata.lookup.ConfigurationException;
import com.strata.lookup.Invocation;
import com.strata.lookup.LookupKey;
import com.strata.lookup.LookupResult;
import com.strata.lookup.Scope;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModuleDataProviderTest {

    @TempDir
    Path dir;

    private ModuleDataProvider provider(Path moduleDir) {
        return new ModuleDataProvider(new ModuleInfo("web", moduleDir), HieraServices.defaults(), new LookupMetrics());
    }

    @Test
    void qualifiedDataIsKept() {
        Map<String, Object> data = Map.of("web::port", 80, "lookup_options", Map.of("web::port", Map.of("merge", "first")));

        assertSame(data, provider(dir).validateDataHash(data, () -> "data.yaml"));
    }

    @Test
    void unqualifiedKeysAreDropped() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("web::port", 80);
        data.put("port", 81);
        data.put("other::port", 82);
        data.put("lookup_options", Map.of("web::port", Map.of("merge", "first"), "port", Map.of("merge", "hash")));

        Map<String, Object> validated = provider(dir).validateDataHash(data, () -> "data.yaml");

        assertEquals(Map.of("web::port", 80,
                "lookup_options", Map.of("web::port", Map.of("merge", "first"))), validated);
        assertEquals(4, data.size());
    }

    @Test
    void readsModuleHierarchy() throws IOException {
        Files.createDirectories(dir.resolve("data"));
        Files.writeString(dir.resolve("hiera.yaml"), "version: 5\n");
        Files.writeString(dir.resolve("data/common.yaml"), "web::port: 80\nport: 81\n");
        ModuleDataProvider provider = provider(dir);

        assertEquals(LookupResult.found(80), provider.keyLookup(LookupKey.parse("web::port"), new Invocation(Scope.empty()), null));
        assertEquals(LookupResult.notFound(), provider.keyLookup(LookupKey.parse("port"), new Invocation(Scope.empty()), null));
        assertTrue(provider.getName().startsWith("Module Data Provider"));
    }

    @Test
    void version3IsRejected() throws IOException {
        Files.writeString(dir.resolve("hiera.yaml"), ":backends: yaml\n");

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> provider(dir).getConfig());
        assertEquals("hiera configuration version 3 cannot be used in a module", e.getMessage());
    }
}
