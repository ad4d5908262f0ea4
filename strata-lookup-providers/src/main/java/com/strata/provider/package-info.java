/**
 * Function providers: hierarchy entries backed by a named backend function.
 * <ul>
 *   <li>{@link com.strata.provider.DataHashFunctionProvider} – {@code data_hash}, whole map per location</li>
 *   <li>{@link com.strata.provider.LookupKeyFunctionProvider} – {@code lookup_key}, one root key per call</li>
 *   <li>{@link com.strata.provider.DataDigFunctionProvider} – {@code data_dig}, every answer memoized</li>
 *   <li>{@link com.strata.provider.V3BackendFunctionProvider} – legacy hiera 3 backends ({@link com.strata.provider.legacy})</li>
 *   <li>{@link com.strata.provider.V4DataHashFunctionProvider} – deprecated parameterless data functions</li>
 * </ul>
 * Functions are looked up in a {@link com.strata.provider.BackendFunctionRegistry}; custom functions are
 * contributed through {@link com.strata.provider.BackendFunctionProvider} and {@link java.util.ServiceLoader}.
 */
package com.strata.provider;
