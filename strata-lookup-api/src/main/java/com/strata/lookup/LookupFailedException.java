package com.strata.lookup;

/**
 * A failure raised by a legacy data binding or legacy backend while answering a lookup. The original
 * error is kept as the cause.
 */
public final class LookupFailedException extends LookupException {

    private final String topKey;

    public LookupFailedException(String topKey, Throwable cause) {
        super("Lookup of key '" + topKey + "' failed: " + cause.getMessage(), cause);
        this.topKey = topKey;
    }

    public LookupFailedException(String topKey, String message) {
        super("Lookup of key '" + topKey + "' failed: " + message);
        this.topKey = topKey;
    }

    /** Key of the top-level lookup that failed. */
    public String getTopKey() {
        return topKey;
    }
}
