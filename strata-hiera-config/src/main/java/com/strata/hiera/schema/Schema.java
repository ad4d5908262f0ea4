package com.strata.hiera.schema;

import java.util.List;

/**
 * Shape of a parsed configuration value. Build instances with {@link Schemas}.
 */
public interface Schema {

    /**
     * Adds a problem for every mismatch between {@code value} and this schema.
     *
     * @param value    value to check (may be null)
     * @param path     location of the value in the document (e.g. {@code hierarchy[0].name})
     * @param problems receives one message per mismatch
     */
    void check(Object value, String path, List<String> problems);

    /** Short type description used in messages (e.g. {@code Array[String[1]]}). */
    String describe();
}
