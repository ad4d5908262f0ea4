package com.strata.lookup;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InvocationTest {

    @Test
    void lookup_sameKeyAndModuleReenteredIsCyclic() {
        Invocation invocation = new Invocation(Scope.empty());
        LookupKey a = LookupKey.parse("a");
        LookupKey b = LookupKey.parse("b");
        CyclicLookupException e = assertThrows(CyclicLookupException.class, () ->
                invocation.lookup(a, null, () ->
                        invocation.lookup(b, null, () ->
                                invocation.lookup(a, null, () -> "never"))));
        assertEquals(List.of("a", "b", "a"), e.getChain());
    }

    @Test
    void lookup_sameKeyInOtherModuleIsAllowed() {
        Invocation invocation = new Invocation(Scope.empty());
        LookupKey key = LookupKey.LOOKUP_OPTIONS_KEY;
        String value = invocation.lookup(key, "m1", () -> invocation.lookup(key, "m2", () -> "ok"));
        assertEquals("ok", value);
    }

    @Test
    void lookup_popsStackOnFailure() {
        Invocation invocation = new Invocation(Scope.empty());
        LookupKey a = LookupKey.parse("a");
        assertThrows(IllegalStateException.class, () -> invocation.lookup(a, null, () -> {
            throw new IllegalStateException("boom");
        }));
        assertEquals("again", invocation.lookup(a, null, () -> "again"));
        assertNull(invocation.getTopKey());
    }

    @Test
    void lookup_exposesTopKeyAndModuleWhileInProgress() {
        Invocation invocation = new Invocation(Scope.empty());
        LookupKey key = LookupKey.parse("mod::k");
        invocation.lookup(key, null, () -> {
            assertEquals(key, invocation.getTopKey());
            assertEquals("mod", invocation.getModuleName());
            return null;
        });
    }

    @Test
    void with_nestsExplanation() {
        Explainer explainer = new Explainer();
        Invocation invocation = new Invocation(Scope.empty(), explainer);
        invocation.with("data_provider", "Common", () -> invocation.reportFound("k", "v"));
        assertEquals("data_provider: Common\n  found: k => v", explainer.explain());
        assertTrue(explainer.hasEvent("found"));
    }
}
