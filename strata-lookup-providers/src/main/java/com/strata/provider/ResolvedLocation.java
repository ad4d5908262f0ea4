package com.strata.provider;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * One concrete location of a hierarchy entry: a file path or a URI, together with the declaration it was
 * expanded from. Existence of a path is checked when the location is consulted.
 */
public final class ResolvedLocation {

    private final String originalLocation;
    private final Path path;
    private final URI uri;

    private ResolvedLocation(String originalLocation, Path path, URI uri) {
        this.originalLocation = originalLocation;
        this.path = path;
        this.uri = uri;
    }

    public static ResolvedLocation ofPath(String originalLocation, Path path) {
        return new ResolvedLocation(originalLocation, Objects.requireNonNull(path, "path"), null);
    }

    public static ResolvedLocation ofUri(String originalLocation, URI uri) {
        return new ResolvedLocation(originalLocation, null, Objects.requireNonNull(uri, "uri"));
    }

    /** Declaration before interpolation (e.g. {@code nodes/%{trusted.certname}.yaml}). */
    public String getOriginalLocation() {
        return originalLocation;
    }

    /** Resolved path, or null for a URI location. */
    public Path getPath() {
        return path;
    }

    /** Resolved URI, or null for a path location. */
    public URI getUri() {
        return uri;
    }

    public boolean isUri() {
        return uri != null;
    }

    /** URIs always exist; paths exist when the file is present right now. */
    public boolean exists() {
        return uri != null || Files.exists(path);
    }

    /** The location in string form (path or URI). */
    public String getLocation() {
        return uri != null ? uri.toString() : path.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResolvedLocation)) return false;
        ResolvedLocation that = (ResolvedLocation) o;
        return Objects.equals(path, that.path) && Objects.equals(uri, that.uri);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, uri);
    }

    @Override
    public String toString() {
        return getLocation();
    }
}
