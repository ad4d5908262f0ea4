/**
 * Session level lookup over the three tiers.
 * <ul>
 *   <li>{@link com.strata.adapter.LookupAdapter} – tier stack, provider and lookup_options caches</li>
 *   <li>{@link com.strata.adapter.GlobalDataProvider}, {@link com.strata.adapter.EnvironmentDataProvider},
 *       {@link com.strata.adapter.ModuleDataProvider} – hiera.yaml backed tiers</li>
 *   <li>{@link com.strata.adapter.LookupService} – overrides, defaults and multiple names</li>
 *   <li>{@link com.strata.adapter.LookupSettings} – settings from the environment</li>
 * </ul>
 */
package com.strata.adapter;
