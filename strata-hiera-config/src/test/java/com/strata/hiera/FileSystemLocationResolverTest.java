package com.strata.hiera;

import com.strata.lookup.ConfigurationException;
import com.strata.lookup.Invocation;
import com.strata.lookup.MapScope;
import com.strata.lookup.ScopeInterpolator;
import com.strata.provider.ResolvedLocation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileSystemLocationResolverTest {

    @TempDir
    Path dir;

    private final FileSystemLocationResolver resolver = new FileSystemLocationResolver(new ScopeInterpolator());
    private final Invocation invocation = new Invocation(new MapScope().put("env", "prod"));

    @Test
    void resolvePaths_interpolatesAndAppendsExtension() {
        List<ResolvedLocation> locations =
                resolver.resolvePaths(dir, List.of("%{env}/common", "other.yaml"), invocation, false, ".yaml");

        assertEquals(dir.resolve("prod/common.yaml"), locations.get(0).getPath());
        assertEquals("%{env}/common", locations.get(0).getOriginalLocation());
        assertEquals(dir.resolve("other.yaml"), locations.get(1).getPath());
        assertFalse(locations.get(0).exists());
    }

    @Test
    void resolvePaths_skipMissingDropsAbsentFiles() throws IOException {
        Files.writeString(dir.resolve("present.yaml"), "");

        List<ResolvedLocation> locations =
                resolver.resolvePaths(dir, List.of("absent.yaml", "present.yaml"), invocation, true, null);

        assertEquals(1, locations.size());
        assertTrue(locations.get(0).exists());
    }

    @Test
    void expandGlobs_sortedAndDistinct() throws IOException {
        Files.createDirectories(dir.resolve("nodes/deep"));
        Files.writeString(dir.resolve("nodes/b.yaml"), "");
        Files.writeString(dir.resolve("nodes/a.yaml"), "");
        Files.writeString(dir.resolve("nodes/deep/c.yaml"), "");
        Files.writeString(dir.resolve("nodes/a.json"), "");

        List<Path> paths = resolver.expandGlobs(dir, List.of("nodes/*.yaml", "nodes/a.*"), invocation).stream()
                .map(ResolvedLocation::getPath)
                .collect(Collectors.toList());

        assertEquals(List.of(dir.resolve("nodes/a.yaml"), dir.resolve("nodes/b.yaml"), dir.resolve("nodes/a.json")),
                paths);
    }

    @Test
    void expandGlobs_missingDatadirMatchesNothing() {
        assertTrue(resolver.expandGlobs(dir.resolve("nope"), List.of("*.yaml"), invocation).isEmpty());
    }

    @Test
    void expandUris_interpolates() {
        List<ResolvedLocation> locations =
                resolver.expandUris(List.of("https://config.example.com/%{env}"), invocation);

        assertTrue(locations.get(0).isUri());
        assertEquals(URI.create("https://config.example.com/prod"), locations.get(0).getUri());
    }

    @Test
    void expandUris_rejectsInvalidUri() {
        assertThrows(ConfigurationException.class,
                () -> resolver.expandUris(List.of("http://bad host/%{env}"), invocation));
    }
}
