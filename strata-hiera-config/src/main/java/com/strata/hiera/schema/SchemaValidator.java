package com.strata.hiera.schema;

import com.strata.lookup.ConfigurationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks documents against schemas.
 */
public final class SchemaValidator {

    private SchemaValidator() {
    }

    public static ValidationResult validate(Schema schema, Object document) {
        List<String> problems = new ArrayList<>();
        schema.check(document, "", problems);
        return ValidationResult.of(problems);
    }

    /**
     * @param label names the document in the error message
     * @throws ConfigurationException listing every problem when the document does not match
     */
    public static void assertInstanceOf(String label, Schema schema, Object document) {
        ValidationResult result = validate(schema, document);
        if (!result.isValid()) {
            throw new ConfigurationException(label + " has wrong type: " + String.join("; ", result.getProblems()),
                    result.getProblems());
        }
    }
}
