/**
 * hiera.yaml parsing and resolution into data providers.
 * <ul>
 *   <li>{@link com.strata.hiera.HieraConfig} – version dispatch, scope drift tracking</li>
 *   <li>{@link com.strata.hiera.HieraConfigV3}, {@link com.strata.hiera.HieraConfigV4},
 *       {@link com.strata.hiera.HieraConfigV5} – per version defaults, validation and entry building</li>
 *   <li>{@link com.strata.hiera.LocationResolver} – paths, globs and URIs to concrete locations</li>
 *   <li>{@link com.strata.hiera.HieraServices} – registries and settings shared by all configurations</li>
 * </ul>
 */
package com.strata.hiera;
