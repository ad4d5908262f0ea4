/**
 * Small structural schema language for validating parsed YAML documents: strings, ranges, enums,
 * patterns, arrays, hashes, variants and structs. {@link com.strata.hiera.schema.SchemaValidator#assertInstanceOf}
 * reports every problem at once.
 */
package com.strata.hiera.schema;
