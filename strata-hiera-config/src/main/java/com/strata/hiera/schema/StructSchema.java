package com.strata.hiera.schema;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A map with a fixed set of string keys, each required or optional. Keys outside the set are problems.
 */
public final class StructSchema implements Schema {

    private final Map<String, Schema> members;
    private final Set<String> required;

    private StructSchema(Builder b) {
        this.members = Collections.unmodifiableMap(new LinkedHashMap<>(b.members));
        this.required = Set.copyOf(b.required);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void check(Object value, String path, List<String> problems) {
        if (!(value instanceof Map)) {
            problems.add(Schemas.mismatch(path, describe(), value));
            return;
        }
        Map<?, ?> map = (Map<?, ?>) value;
        for (Object key : map.keySet()) {
            if (!(key instanceof String) || !members.containsKey(key)) {
                problems.add(Schemas.at(path) + "unrecognized key '" + key + "'");
            }
        }
        for (Map.Entry<String, Schema> e : members.entrySet()) {
            String key = e.getKey();
            String memberPath = path.isEmpty() ? key : path + "." + key;
            if (!map.containsKey(key)) {
                if (required.contains(key)) {
                    problems.add(Schemas.at(path) + "expects a value for key '" + key + "'");
                }
                continue;
            }
            e.getValue().check(map.get(key), memberPath, problems);
        }
    }

    /** A copy with additional optional members. */
    public StructSchema withOptional(Map<String, Schema> extra) {
        Builder b = new Builder();
        b.members.putAll(members);
        b.required.addAll(required);
        extra.forEach(b::optional);
        return b.build();
    }

    @Override
    public String describe() {
        return "Struct" + members.keySet();
    }

    public static final class Builder {
        private final Map<String, Schema> members = new LinkedHashMap<>();
        private final Set<String> required = new HashSet<>();

        private Builder() {
        }

        public Builder required(String key, Schema schema) {
            members.put(key, schema);
            required.add(key);
            return this;
        }

        public Builder optional(String key, Schema schema) {
            members.put(key, schema);
            required.remove(key);
            return this;
        }

        public StructSchema build() {
            return new StructSchema(this);
        }
    }
}
