package com.strata.hiera;

import com.strata.lookup.ConfigurationException;
import com.strata.lookup.Interpolator;
import com.strata.lookup.Invocation;
import com.strata.provider.ResolvedLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link LocationResolver} for the local file system.
 */
public final class FileSystemLocationResolver implements LocationResolver {

    private static final Logger log = LoggerFactory.getLogger(FileSystemLocationResolver.class);

    private final Interpolator interpolator;

    public FileSystemLocationResolver(Interpolator interpolator) {
        this.interpolator = Objects.requireNonNull(interpolator, "interpolator");
    }

    @Override
    public List<ResolvedLocation> resolvePaths(Path datadir, List<String> declaredPaths, Invocation invocation,
                                               boolean skipMissing, String extension) {
        List<ResolvedLocation> result = new ArrayList<>(declaredPaths.size());
        for (String declared : declaredPaths) {
            String path = interpolator.interpolate(declared, invocation, false);
            if (extension != null && !path.endsWith(extension)) {
                path = path + extension;
            }
            Path resolved = datadir.resolve(path).normalize();
            if (skipMissing && !Files.exists(resolved)) {
                log.debug("Skipping missing path {}", resolved);
                continue;
            }
            result.add(ResolvedLocation.ofPath(declared, resolved));
        }
        return result;
    }

    @Override
    public List<ResolvedLocation> expandGlobs(Path datadir, List<String> declaredGlobs, Invocation invocation) {
        Set<ResolvedLocation> result = new LinkedHashSet<>();
        for (String declared : declaredGlobs) {
            String pattern = interpolator.interpolate(declared, invocation, false);
            PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
            if (!Files.isDirectory(datadir)) {
                continue;
            }
            try (Stream<Path> files = Files.walk(datadir)) {
                List<Path> matches = files.filter(Files::isRegularFile)
                        .filter(p -> matcher.matches(datadir.relativize(p)))
                        .sorted()
                        .collect(Collectors.toList());
                for (Path match : matches) {
                    result.add(ResolvedLocation.ofPath(declared, match));
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Unable to expand glob '" + pattern + "' in " + datadir, e);
            }
        }
        return new ArrayList<>(result);
    }

    @Override
    public List<ResolvedLocation> expandUris(List<String> declaredUris, Invocation invocation) {
        List<ResolvedLocation> result = new ArrayList<>(declaredUris.size());
        for (String declared : declaredUris) {
            String uri = interpolator.interpolate(declared, invocation, false);
            try {
                result.add(ResolvedLocation.ofUri(declared, new URI(uri)));
            } catch (URISyntaxException e) {
                throw new ConfigurationException("Invalid uri '" + uri + "' (declared as '" + declared + "')", e);
            }
        }
        return result;
    }
}
