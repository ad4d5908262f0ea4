package com.strata.provider;

import com.strata.lookup.ConfigurationException;
import com.strata.lookup.Invocation;
import com.strata.lookup.LookupResult;
import com.strata.lookup.Scope;
import com.strata.provider.builtin.JsonDataFunction;
import com.strata.provider.builtin.YamlDataFunction;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BackendFunctionRegistryTest {

    @Test
    void withBuiltins_registersYamlAndJsonData() {
        BackendFunctionRegistry registry = BackendFunctionRegistry.withBuiltins();
        assertTrue(registry.contains(FunctionKind.DATA_HASH, YamlDataFunction.NAME));
        assertTrue(registry.contains(FunctionKind.DATA_HASH, JsonDataFunction.NAME));
        assertFalse(registry.contains(FunctionKind.LOOKUP_KEY, YamlDataFunction.NAME));
    }

    @Test
    void withInstalledFunctions_discoversServiceProviders() {
        BackendFunctionRegistry registry = BackendFunctionRegistry.withInstalledFunctions();
        LookupKeyFunction function = registry.getLookupKey(UpperCaseFunctionProvider.NAME);
        LookupKeyFunctionProvider provider = new LookupKeyFunctionProvider("upper", new TestParent(),
                UpperCaseFunctionProvider.NAME, null, null, ProviderServices.builder().functions(registry).build());
        assertEquals(LookupResult.found("HELLO"),
                function.lookupKey("hello", Map.of(), provider.providerContext(null, new Invocation(Scope.empty()))));
    }

    @Test
    void register_rejectsKindMismatch() {
        BackendFunctionRegistry registry = new BackendFunctionRegistry();
        BackendFunctionProvider wrongKind = new UpperCaseFunctionProvider() {
            @Override
            public FunctionKind getKind() {
                return FunctionKind.DATA_HASH;
            }
        };
        assertThrows(IllegalArgumentException.class, () -> registry.register(wrongKind));
    }

    @Test
    void register_rejectsDuplicateNames() {
        BackendFunctionRegistry registry = BackendFunctionRegistry.withBuiltins();
        assertThrows(IllegalArgumentException.class,
                () -> registry.registerDataHash(YamlDataFunction.NAME, (options, ctx) -> Map.of()));
    }

    @Test
    void get_unknownFunctionIsConfigurationError() {
        BackendFunctionRegistry registry = new BackendFunctionRegistry();
        assertThrows(ConfigurationException.class, () -> registry.getDataDig("nope"));
    }
}
