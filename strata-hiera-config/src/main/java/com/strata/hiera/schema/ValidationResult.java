package com.strata.hiera.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of checking a document against a {@link Schema}.
 */
public final class ValidationResult {

    private final List<String> problems;

    private ValidationResult(List<String> problems) {
        this.problems = Collections.unmodifiableList(new ArrayList<>(problems));
    }

    public static ValidationResult of(List<String> problems) {
        return new ValidationResult(problems != null ? problems : List.of());
    }

    public boolean isValid() {
        return problems.isEmpty();
    }

    public List<String> getProblems() {
        return problems;
    }
}
