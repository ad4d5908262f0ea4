package com.strata.provider;

/**
 * Service provider contributing a backend function. Implementations are discovered with
 * {@link java.util.ServiceLoader} (list them in {@code META-INF/services/com.strata.provider.BackendFunctionProvider}).
 */
public interface BackendFunctionProvider {

    /** Name used in hiera.yaml ({@code data_hash: my_function}). */
    String getFunctionName();

    /** {@link FunctionKind#DATA_HASH}, {@link FunctionKind#LOOKUP_KEY} or {@link FunctionKind#DATA_DIG}. */
    FunctionKind getKind();

    /** A {@link DataHashFunction}, {@link LookupKeyFunction} or {@link DataDigFunction} matching {@link #getKind()}. */
    Object createFunction();
}
