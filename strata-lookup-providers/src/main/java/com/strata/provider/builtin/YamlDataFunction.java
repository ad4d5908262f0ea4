package com.strata.provider.builtin;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Built-in {@code yaml_data} function.
 */
public final class YamlDataFunction extends DataFileFunction {

    public static final String NAME = "yaml_data";

    public YamlDataFunction() {
        super(new ObjectMapper(new YAMLFactory()), "yaml");
    }
}
