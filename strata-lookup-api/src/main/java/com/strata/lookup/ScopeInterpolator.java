package com.strata.lookup;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link Interpolator} resolving scope variables. Supported forms:
 * <ul>
 *   <li>{@code %{name}} and {@code %{::name}} – top scope variable</li>
 *   <li>{@code %{facts.os.family}} – variable followed by dotted navigation into maps and lists</li>
 *   <li>{@code %{scope('name')}} – explicit scope access</li>
 *   <li>{@code %{literal('%')}} – literal text</li>
 * </ul>
 * Undefined variables expand to the empty string. Other method forms ({@code lookup}, {@code alias}, ...)
 * are rejected.
 */
public final class ScopeInterpolator implements Interpolator {

    private static final Pattern EXPRESSION = Pattern.compile("%\\{([^}]*)\\}");
    private static final Pattern METHOD = Pattern.compile("^(\\w+)\\(\\s*(['\"])(.*)\\2\\s*\\)$");

    @Override
    public String interpolate(String template, Invocation invocation, boolean allowMethods) {
        if (template == null || !template.contains("%{")) {
            return template;
        }
        Matcher m = EXPRESSION.matcher(template);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String expression = m.group(1).trim();
            m.appendReplacement(out, Matcher.quoteReplacement(expand(expression, template, invocation, allowMethods)));
        }
        m.appendTail(out);
        return out.toString();
    }

    private String expand(String expression, String template, Invocation invocation, boolean allowMethods) {
        if (expression.isEmpty()) {
            return "";
        }
        Matcher method = METHOD.matcher(expression);
        if (method.matches()) {
            String name = method.group(1);
            String argument = method.group(3);
            switch (name) {
                case "literal":
                    return argument;
                case "scope":
                    return stringify(scopeValue(argument, invocation));
                default:
                    if (!allowMethods) {
                        throw new ConfigurationException("Interpolation using method syntax is not allowed in this context: '"
                                + template + "'");
                    }
                    throw new ConfigurationException("Unsupported interpolation method '" + name + "' in '" + template + "'");
            }
        }
        return stringify(scopeValue(expression, invocation));
    }

    private Object scopeValue(String expression, Invocation invocation) {
        String path = expression.startsWith("::") ? expression.substring(2) : expression;
        String[] parts = path.split("\\.");
        String variable = parts[0];
        Object value = invocation.getScope().get(variable);
        invocation.rememberScopeLookup(variable, value);
        for (int i = 1; i < parts.length && value != null; i++) {
            value = navigate(value, parts[i]);
        }
        return value;
    }

    private static Object navigate(Object value, String segment) {
        if (value instanceof Map) {
            return ((Map<?, ?>) value).get(segment);
        }
        if (value instanceof List && segment.matches("\\d+")) {
            List<?> list = (List<?>) value;
            int index = Integer.parseInt(segment);
            return index < list.size() ? list.get(index) : null;
        }
        return null;
    }

    private static String stringify(Object value) {
        return value == null ? "" : value.toString();
    }
}
