package com.strata.lookup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A parsed lookup key. The key is split on dots into a root key, used to query data providers, and the
 * remaining segments, used to navigate into the found value. Segments may be quoted with single or double
 * quotes to contain dots; unquoted integer segments index into lists.
 * <p>
 * Examples: {@code "ntp::servers"} (root key {@code ntp::servers}, module {@code ntp}),
 * {@code "db.hosts.0"} (root key {@code db}, segments {@code ["hosts", 0]}),
 * {@code "app.'log.level'"} (root key {@code app}, segments {@code ["log.level"]}).
 */
public final class LookupKey {

    /** Reserved root key holding per-key lookup options. Never resolvable as ordinary data. */
    public static final String LOOKUP_OPTIONS = "lookup_options";

    public static final LookupKey LOOKUP_OPTIONS_KEY = parse(LOOKUP_OPTIONS);

    private static final String LOOKUP_OPTIONS_PREFIX = LOOKUP_OPTIONS + ".";
    private static final String MODULE_SEPARATOR = "::";

    private final String key;
    private final String rootKey;
    private final String moduleName;
    private final List<Object> segments;

    private LookupKey(String key, String rootKey, String moduleName, List<Object> segments) {
        this.key = key;
        this.rootKey = rootKey;
        this.moduleName = moduleName;
        this.segments = segments;
    }

    /**
     * Parses a raw key.
     *
     * @param key raw key (e.g. {@code mymodule::settings.port})
     * @return parsed key
     * @throws InvalidKeyException if the key is empty or syntactically malformed
     */
    public static LookupKey parse(String key) {
        Objects.requireNonNull(key, "key");
        List<Object> parts = split(key);
        Object first = parts.get(0);
        String rootKey = first.toString();
        int qualifier = rootKey.indexOf(MODULE_SEPARATOR);
        String moduleName = qualifier > 0 ? rootKey.substring(0, qualifier) : null;
        List<Object> segments = parts.size() > 1
                ? Collections.unmodifiableList(new ArrayList<>(parts.subList(1, parts.size())))
                : List.of();
        return new LookupKey(key, rootKey, moduleName, segments);
    }

    /** True for {@code lookup_options} and any key navigating into it. */
    public static boolean isReserved(String key) {
        return LOOKUP_OPTIONS.equals(key) || (key != null && key.startsWith(LOOKUP_OPTIONS_PREFIX));
    }

    private static List<Object> split(String key) {
        if (key.isEmpty()) {
            throw new InvalidKeyException(key, "key is empty");
        }
        if (key.indexOf('.') < 0 && key.indexOf('\'') < 0 && key.indexOf('"') < 0) {
            return List.of(key);
        }
        List<Object> parts = new ArrayList<>();
        int i = 0;
        int len = key.length();
        while (true) {
            while (i < len && Character.isWhitespace(key.charAt(i))) i++;
            if (i >= len) {
                throw new InvalidKeyException(key, "empty segment");
            }
            char c = key.charAt(i);
            if (c == '\'' || c == '"') {
                int close = key.indexOf(c, i + 1);
                if (close < 0) {
                    throw new InvalidKeyException(key, "unterminated quote");
                }
                if (close == i + 1) {
                    throw new InvalidKeyException(key, "empty quoted segment");
                }
                parts.add(key.substring(i + 1, close));
                i = close + 1;
                while (i < len && Character.isWhitespace(key.charAt(i))) i++;
            } else {
                int start = i;
                while (i < len && key.charAt(i) != '.') {
                    char ch = key.charAt(i);
                    if (ch == '\'' || ch == '"') {
                        throw new InvalidKeyException(key, "quote inside unquoted segment");
                    }
                    i++;
                }
                String segment = key.substring(start, i).trim();
                if (segment.isEmpty()) {
                    throw new InvalidKeyException(key, "empty segment");
                }
                parts.add(parts.isEmpty() ? segment : toIndexOrName(segment));
            }
            if (i >= len) {
                return parts;
            }
            if (key.charAt(i) != '.') {
                throw new InvalidKeyException(key, "unexpected character '" + key.charAt(i) + "' after quoted segment");
            }
            i++;
        }
    }

    private static Object toIndexOrName(String segment) {
        if (segment.matches("[-+]?\\d+")) {
            try {
                return Integer.valueOf(segment.startsWith("+") ? segment.substring(1) : segment);
            } catch (NumberFormatException e) {
                return segment;
            }
        }
        return segment;
    }

    /**
     * Navigates the key's segments into a found value. A missing segment, an out-of-range index or a value
     * that cannot be indexed makes the whole lookup not-found; the failing segment is reported to the
     * invocation.
     *
     * @param invocation current invocation (for explanation)
     * @param value      value found for the root key
     * @return the nested value, or not-found
     */
    public LookupResult dig(Invocation invocation, Object value) {
        if (segments.isEmpty()) {
            return LookupResult.found(value);
        }
        return invocation.with("sub_lookup", segments, () -> {
            Object current = value;
            for (Object segment : segments) {
                LookupResult step = step(invocation, current, segment);
                if (step.isNotFound()) {
                    return step;
                }
                current = step.getValue();
            }
            return LookupResult.found(current);
        });
    }

    private static LookupResult step(Invocation invocation, Object current, Object segment) {
        return invocation.with("segment", segment, () -> {
            if (current instanceof List && segment instanceof Integer) {
                List<?> list = (List<?>) current;
                int index = (Integer) segment;
                if (index < 0 || index >= list.size()) {
                    invocation.reportNotFound(segment);
                    return LookupResult.notFound();
                }
                return LookupResult.found(invocation.reportFound(segment, list.get(index)));
            }
            if (current instanceof Map) {
                Map<?, ?> map = (Map<?, ?>) current;
                Object mapKey = segment;
                if (!map.containsKey(mapKey) && segment instanceof Integer) {
                    mapKey = segment.toString();
                }
                if (!map.containsKey(mapKey)) {
                    invocation.reportNotFound(segment);
                    return LookupResult.notFound();
                }
                return LookupResult.found(invocation.reportFound(segment, map.get(mapKey)));
            }
            invocation.reportText(() -> "Value " + describe(current) + " cannot be navigated using '" + segment + "'");
            invocation.reportNotFound(segment);
            return LookupResult.notFound();
        });
    }

    private static String describe(Object value) {
        return value == null ? "null" : "of type " + value.getClass().getSimpleName();
    }

    /** The full key as given. */
    public String getKey() {
        return key;
    }

    /** First segment; the name used to query data providers. */
    public String getRootKey() {
        return rootKey;
    }

    /** Module qualifier ({@code ntp} for {@code ntp::servers}), or null when the key is not qualified. */
    public String getModuleName() {
        return moduleName;
    }

    /** Segments after the root key; empty when the key has no dots. */
    public List<Object> getSegments() {
        return segments;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LookupKey)) return false;
        return key.equals(((LookupKey) o).key);
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        return key;
    }
}
