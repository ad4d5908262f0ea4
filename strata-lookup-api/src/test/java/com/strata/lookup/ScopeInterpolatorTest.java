package com.strata.lookup;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ScopeInterpolatorTest {

    private final ScopeInterpolator interpolator = new ScopeInterpolator();

    @Test
    void interpolate_expandsVariablesAndDottedPaths() {
        MapScope scope = new MapScope()
                .put("environment", "production")
                .put("facts", Map.of("os", Map.of("family", "Debian")));
        Invocation invocation = new Invocation(scope);
        assertEquals("data/production/Debian.yaml",
                interpolator.interpolate("data/%{::environment}/%{facts.os.family}.yaml", invocation, false));
    }

    @Test
    void interpolate_undefinedVariableIsEmpty() {
        assertEquals("nodes/.yaml", interpolator.interpolate("nodes/%{trusted.certname}.yaml",
                new Invocation(Scope.empty()), false));
    }

    @Test
    void interpolate_scopeAndLiteralMethods() {
        Invocation invocation = new Invocation(new MapScope().put("role", "web"));
        assertEquals("web-%{x}", interpolator.interpolate("%{scope('role')}-%{literal('%')}{x}", invocation, false));
    }

    @Test
    void interpolate_rejectsLookupMethodWhereMethodsAreNotAllowed() {
        assertThrows(ConfigurationException.class, () ->
                interpolator.interpolate("%{lookup('x')}", new Invocation(Scope.empty()), false));
    }

    @Test
    void interpolate_remembersScopeReads() {
        ScopeLookupCollectingInvocation invocation = new ScopeLookupCollectingInvocation(new MapScope().put("dc", "eu"));
        interpolator.interpolate("%{dc}/%{missing}", invocation, false);
        Map<String, Object> remembered = invocation.getScopeInterpolations();
        assertEquals("eu", remembered.get("dc"));
        assertEquals(List.of("dc", "missing"), List.copyOf(remembered.keySet()));
    }

    @Test
    void interpolateValue_descendsIntoStructures() {
        Invocation invocation = new Invocation(new MapScope().put("x", "1"));
        Object value = interpolator.interpolateValue(Map.of("k", List.of("%{x}", 2)), invocation, true);
        assertEquals(Map.of("k", List.of("1", 2)), value);
    }
}
