package com.strata.lookup;

/** Thrown when a merge argument names no known merge strategy. */
public final class UnrecognizedMergeException extends ConfigurationException {

    private final Object merge;

    public UnrecognizedMergeException(Object merge) {
        super("Unrecognized merge strategy: '" + merge + "'");
        this.merge = merge;
    }

    public UnrecognizedMergeException(Object merge, String message) {
        super(message);
        this.merge = merge;
    }

    /** The rejected merge argument as given by the caller. */
    public Object getMerge() {
        return merge;
    }
}
