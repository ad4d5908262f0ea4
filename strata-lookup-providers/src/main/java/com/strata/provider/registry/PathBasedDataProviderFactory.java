package com.strata.provider.registry;

import com.strata.lookup.DataProvider;
import com.strata.provider.ResolvedLocation;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Factory behind a custom {@code backend} of a version 4 hierarchy entry. Version 1 factories create
 * providers without knowing their parent; version 2 factories receive it.
 */
public interface PathBasedDataProviderFactory {

    /** Contract version: 1 or 2. */
    default int getVersion() {
        return 1;
    }

    /** File extension (without the dot) appended to declared paths that have none; null = append nothing. */
    default String getExtension() {
        return null;
    }

    /**
     * Resolves interpolated paths against the data directory.
     *
     * @param datadir           entry data directory
     * @param declaredPaths     paths as written in hiera.yaml
     * @param interpolatedPaths the same paths after interpolation
     * @return locations in declaration order
     */
    default List<ResolvedLocation> resolvePaths(Path datadir, List<String> declaredPaths, List<String> interpolatedPaths) {
        List<ResolvedLocation> result = new ArrayList<>(interpolatedPaths.size());
        String ext = getExtension();
        for (int i = 0; i < interpolatedPaths.size(); i++) {
            String path = interpolatedPaths.get(i);
            if (ext != null && !path.endsWith("." + ext)) {
                path = path + "." + ext;
            }
            result.add(ResolvedLocation.ofPath(declaredPaths.get(i), datadir.resolve(path)));
        }
        return result;
    }

    /** Creates the provider (version 1 contract). */
    DataProvider create(String name, List<ResolvedLocation> locations);

    /** Creates the provider (version 2 contract); version 1 factories ignore the parent. */
    default DataProvider create(String name, List<ResolvedLocation> locations, DataProvider parent) {
        return create(name, locations);
    }
}
