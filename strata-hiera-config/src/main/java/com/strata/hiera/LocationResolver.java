package com.strata.hiera;

import com.strata.lookup.Invocation;
import com.strata.provider.ResolvedLocation;

import java.nio.file.Path;
import java.util.List;

/**
 * Turns the declared locations of a hierarchy entry into concrete locations. Declarations are interpolated
 * against the invocation scope first.
 */
public interface LocationResolver {

    /**
     * @param datadir       directory relative paths are resolved against
     * @param declaredPaths paths as written in hiera.yaml
     * @param skipMissing   drop paths that do not exist (used for synthesized configurations)
     * @param extension     extension (with dot) appended when a path lacks it; null = none
     */
    List<ResolvedLocation> resolvePaths(Path datadir, List<String> declaredPaths, Invocation invocation,
                                        boolean skipMissing, String extension);

    /** Files under {@code datadir} matching any of the glob patterns, in sorted order per pattern. */
    List<ResolvedLocation> expandGlobs(Path datadir, List<String> declaredGlobs, Invocation invocation);

    List<ResolvedLocation> expandUris(List<String> declaredUris, Invocation invocation);
}
