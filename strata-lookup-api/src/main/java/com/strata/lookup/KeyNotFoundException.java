package com.strata.lookup;

import java.util.List;

/**
 * Raised by callers that require a value (e.g. {@code LookupService}) when no tier, override or
 * default produced one. The core lookup itself reports absence as {@link LookupResult#notFound()}.
 */
public final class KeyNotFoundException extends LookupException {

    private final List<String> names;

    public KeyNotFoundException(String name) {
        super("Function lookup() did not find a value for the name '" + name + "'");
        this.names = List.of(name);
    }

    /** For a lookup that tried several names in turn. */
    public KeyNotFoundException(List<String> names) {
        super(names.size() == 1
                ? "Function lookup() did not find a value for the name '" + names.get(0) + "'"
                : "Function lookup() did not find a value for any of the names " + names);
        this.names = List.copyOf(names);
    }

    /** First name tried. */
    public String getName() {
        return names.get(0);
    }

    public List<String> getNames() {
        return names;
    }
}
