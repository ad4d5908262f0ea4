package com.strata.lookup;

import java.util.List;

/**
 * Invalid hierarchy configuration: schema violations, duplicate hierarchy names, ambiguous or missing
 * function/location kinds, unsupported versions and unresolvable backends. Aborts the whole session.
 */
public class ConfigurationException extends LookupException {

    private final List<String> problems;

    public ConfigurationException(String message) {
        super(message);
        this.problems = List.of();
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of();
    }

    /**
     * @param message  summary (e.g. "The Lookup Configuration at '/etc/hiera.yaml' has wrong type")
     * @param problems one entry per violated constraint, in document order
     */
    public ConfigurationException(String message, List<String> problems) {
        super(problems == null || problems.isEmpty() ? message : message + ":\n  " + String.join("\n  ", problems));
        this.problems = problems != null ? List.copyOf(problems) : List.of();
    }

    /** Individual schema violations; empty when the error is not a schema validation error. */
    public List<String> getProblems() {
        return problems;
    }
}
