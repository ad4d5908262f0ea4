package com.strata.lookup;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeprecationsTest {

    @Test
    void warnOnce_reportsEachKeyOnce() {
        assertTrue(Deprecations.warnOnce(StrictMode.WARNING, "DeprecationsTest#once", "first"));
        assertFalse(Deprecations.warnOnce(StrictMode.WARNING, "DeprecationsTest#once", "second"));
        assertTrue(Deprecations.isIssued("DeprecationsTest#once"));
    }

    @Test
    void warnOnce_strictOffIsSilent() {
        assertFalse(Deprecations.warnOnce(StrictMode.OFF, "DeprecationsTest#off", "silenced"));
        assertFalse(Deprecations.isIssued("DeprecationsTest#off"));
    }
}
