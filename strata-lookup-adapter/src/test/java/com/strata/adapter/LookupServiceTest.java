package com.strata.adapter;

import com.strata.hiera.HieraServices;
import com.strata.lookup.Explainer;
import com.strata.lookup.Invocation;
import com.strata.lookup.KeyNotFoundException;
import com.strata.lookup.Scope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LookupServiceTest {

    @TempDir
    Path dir;

    private LookupService service;

    @BeforeEach
    void setUp() throws IOException {
        Path confdir = dir.resolve("conf");
        Files.createDirectories(confdir.resolve("data"));
        Files.writeString(confdir.resolve("hiera.yaml"), "version: 5\n");
        Files.writeString(confdir.resolve("data/common.yaml"), "port: 8080\nhost: db.local\n");
        LookupAdapter adapter = LookupAdapter.builder(EnvironmentContext.builder("production").build())
                .settings(LookupSettings.builder().confdir(confdir).build())
                .services(HieraServices.builder().codedir(dir.resolve("code")).build())
                .build();
        service = new LookupService(adapter);
    }

    @Test
    void returnsTierValue() {
        assertEquals(8080, service.lookup("port", new Invocation(Scope.empty())));
    }

    @Test
    void overridesWinOverTiers() {
        Explainer explainer = new Explainer();
        Invocation invocation = new Invocation(Scope.empty(), Map.of("port", 9090), null, explainer);

        assertEquals(9090, service.lookup("port", invocation));
        assertTrue(explainer.hasEvent("found_in_overrides"));
    }

    @Test
    void defaultsOnlyWhenNoNameIsFound() {
        Invocation invocation = new Invocation(Scope.empty(), null, Map.of("port", 1, "missing", 2), null);

        assertEquals(8080, service.lookup(List.of("missing", "port"), invocation, null));
        assertEquals(2, service.lookup(List.of("missing", "other"), invocation, null));
    }

    @Test
    void namesAreTriedInOrder() {
        assertEquals("db.local", service.lookup(List.of("missing", "host", "port"), new Invocation(Scope.empty()), null));
    }

    @Test
    void explicitDefault() {
        assertEquals("fallback", service.lookupOrDefault(List.of("missing"), new Invocation(Scope.empty()), null, "fallback"));
    }

    @Test
    void notFoundNamesAllKeys() {
        KeyNotFoundException single = assertThrows(KeyNotFoundException.class,
                () -> service.lookup("missing", new Invocation(Scope.empty())));
        assertEquals("Function lookup() did not find a value for the name 'missing'", single.getMessage());

        KeyNotFoundException several = assertThrows(KeyNotFoundException.class,
                () -> service.lookup(List.of("a", "b"), new Invocation(Scope.empty()), null));
        assertEquals("Function lookup() did not find a value for any of the names [a, b]", several.getMessage());
        assertEquals(List.of("a", "b"), several.getNames());
    }

    @Test
    void namesRequired() {
        assertThrows(IllegalArgumentException.class, () -> service.search(List.of(), new Invocation(Scope.empty()), null));
    }
}
