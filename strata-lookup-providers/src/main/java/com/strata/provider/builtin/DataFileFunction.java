package com.strata.provider.builtin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strata.lookup.LookupException;
import com.strata.provider.DataHashFunction;
import com.strata.provider.FunctionProvider;
import com.strata.provider.ProviderContext;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.Map;

/**
 * Reads the file named by the {@code path} option as a map. An empty document is an empty map; a
 * document that is not a map, or cannot be parsed, fails the lookup.
 */
abstract class DataFileFunction implements DataHashFunction {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {};

    private final ObjectMapper mapper;
    private final String format;

    DataFileFunction(ObjectMapper mapper, String format) {
        this.mapper = mapper;
        this.format = format;
    }

    @Override
    public Map<String, Object> dataHash(Map<String, Object> options, ProviderContext context) {
        Object pathOption = options.get(FunctionProvider.PATH);
        if (pathOption == null) {
            throw new LookupException("The " + format + " data function requires a 'path' option (hierarchy entry '"
                    + context.getProviderName() + "')");
        }
        Path path = Paths.get(pathOption.toString());
        JsonNode root;
        try {
            String text = Files.readString(path);
            if (text.isBlank()) {
                return Collections.emptyMap();
            }
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new LookupException("Unable to parse " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new LookupException("Unable to read " + path + ": " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return Collections.emptyMap();
        }
        if (!root.isObject()) {
            throw new LookupException(path + ": file does not contain a valid " + format + " hash");
        }
        return mapper.convertValue(root, MAP_TYPE);
    }
}
