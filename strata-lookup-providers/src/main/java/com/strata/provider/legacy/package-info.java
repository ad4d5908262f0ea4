/**
 * Legacy (hiera 3) backend contracts and their registry.
 */
package com.strata.provider.legacy;
