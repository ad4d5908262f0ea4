/**
 * Custom data providers and version 4 backend factories, looked up by name.
 */
package com.strata.provider.registry;
