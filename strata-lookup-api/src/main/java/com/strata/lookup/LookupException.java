package com.strata.lookup;

/**
 * Base type of every fatal lookup error. A key that is simply not found is never reported
 * through an exception; see {@link LookupResult#notFound()}.
 */
public class LookupException extends RuntimeException {

    public LookupException(String message) {
        super(message);
    }

    public LookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
