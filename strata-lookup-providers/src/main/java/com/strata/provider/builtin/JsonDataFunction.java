package com.strata.provider.builtin;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Built-in {@code json_data} function.
 */
public final class JsonDataFunction extends DataFileFunction {

    public static final String NAME = "json_data";

    public JsonDataFunction() {
        super(new ObjectMapper(), "json");
    }
}
