package com.strata.hiera.schema;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Factory of the schema types used by hiera.yaml validation.
 */
public final class Schemas {

    private static final Schema ANY = simple("Any", v -> true);
    private static final Schema STRING = simple("String", v -> v instanceof String);
    private static final Schema NON_EMPTY_STRING = simple("String[1]", v -> v instanceof String && !((String) v).isEmpty());
    private static final Schema BOOLEAN = simple("Boolean", v -> v instanceof Boolean);
    private static final Schema URI_STRING = simple("Uri", Schemas::isUri);
    private static final Schema DATA = simple("Data", Schemas::isData);

    private Schemas() {
    }

    public static Schema any() {
        return ANY;
    }

    public static Schema string() {
        return STRING;
    }

    public static Schema nonEmptyString() {
        return NON_EMPTY_STRING;
    }

    public static Schema bool() {
        return BOOLEAN;
    }

    /** A string parseable as a URI. */
    public static Schema uri() {
        return URI_STRING;
    }

    /** Strings, numbers, booleans, null, and lists or string-keyed maps of those. */
    public static Schema data() {
        return DATA;
    }

    public static Schema integerRange(int min, int max) {
        return simple("Integer[" + min + ", " + max + "]", v -> {
            if (!(v instanceof Integer) && !(v instanceof Long)) return false;
            long n = ((Number) v).longValue();
            return n >= min && n <= max;
        });
    }

    public static Schema enumOf(String... values) {
        List<String> allowed = Arrays.asList(values);
        return simple("Enum" + allowed, allowed::contains);
    }

    /** A string matching the regular expression in full. */
    public static Schema pattern(String regex) {
        Pattern p = Pattern.compile(regex);
        return simple("Pattern[/" + regex + "/]", v -> v instanceof String && p.matcher((String) v).matches());
    }

    public static Schema arrayOf(Schema element) {
        return arrayOf(element, 0);
    }

    public static Schema arrayOf(Schema element, int minSize) {
        String description = "Array[" + element.describe() + (minSize > 0 ? ", " + minSize : "") + "]";
        return new Schema() {
            @Override
            public void check(Object value, String path, List<String> problems) {
                if (!(value instanceof List)) {
                    problems.add(mismatch(path, description, value));
                    return;
                }
                List<?> list = (List<?>) value;
                if (list.size() < minSize) {
                    problems.add(at(path) + "expects at least " + minSize + " element(s), got " + list.size());
                }
                for (int i = 0; i < list.size(); i++) {
                    element.check(list.get(i), path + "[" + i + "]", problems);
                }
            }

            @Override
            public String describe() {
                return description;
            }
        };
    }

    public static Schema hashOf(Schema key, Schema value) {
        String description = "Hash[" + key.describe() + ", " + value.describe() + "]";
        return new Schema() {
            @Override
            public void check(Object v, String path, List<String> problems) {
                if (!(v instanceof Map)) {
                    problems.add(mismatch(path, description, v));
                    return;
                }
                for (Map.Entry<?, ?> e : ((Map<?, ?>) v).entrySet()) {
                    String entryPath = path.isEmpty() ? String.valueOf(e.getKey()) : path + "." + e.getKey();
                    List<String> keyProblems = new ArrayList<>();
                    key.check(e.getKey(), entryPath, keyProblems);
                    if (!keyProblems.isEmpty()) {
                        problems.add(at(path) + "key '" + e.getKey() + "' expects " + key.describe());
                    }
                    value.check(e.getValue(), entryPath, problems);
                }
            }

            @Override
            public String describe() {
                return description;
            }
        };
    }

    /** Matches when any alternative matches. */
    public static Schema variant(Schema... alternatives) {
        String description = "Variant[" + Arrays.stream(alternatives).map(Schema::describe)
                .collect(Collectors.joining(", ")) + "]";
        return new Schema() {
            @Override
            public void check(Object value, String path, List<String> problems) {
                for (Schema alternative : alternatives) {
                    List<String> attempt = new ArrayList<>();
                    alternative.check(value, path, attempt);
                    if (attempt.isEmpty()) {
                        return;
                    }
                }
                problems.add(mismatch(path, description, value));
            }

            @Override
            public String describe() {
                return description;
            }
        };
    }

    private interface Check {
        boolean matches(Object value);
    }

    private static Schema simple(String description, Check test) {
        return new Schema() {
            @Override
            public void check(Object value, String path, List<String> problems) {
                if (!test.matches(value)) {
                    problems.add(mismatch(path, description, value));
                }
            }

            @Override
            public String describe() {
                return description;
            }
        };
    }

    static String at(String path) {
        return path.isEmpty() ? "" : "entry '" + path + "' ";
    }

    static String mismatch(String path, String expected, Object actual) {
        return at(path) + "expects " + expected + ", got " + describeValue(actual);
    }

    private static String describeValue(Object value) {
        if (value == null) return "Undef";
        if (value instanceof String) return "String '" + value + "'";
        if (value instanceof Map) return "Hash";
        if (value instanceof List) return "Array";
        return value.getClass().getSimpleName() + " " + value;
    }

    private static boolean isUri(Object value) {
        if (!(value instanceof String) || ((String) value).isEmpty()) {
            return false;
        }
        try {
            new URI((String) value);
            return true;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static boolean isData(Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return true;
        }
        if (value instanceof List) {
            return ((List<?>) value).stream().allMatch(Schemas::isData);
        }
        if (value instanceof Map) {
            return ((Map<?, ?>) value).entrySet().stream()
                    .allMatch(e -> e.getKey() instanceof String && isData(e.getValue()));
        }
        return false;
    }
}
