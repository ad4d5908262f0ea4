package com.strata.lookup;

import java.util.List;

/**
 * Thrown when a key is looked up again while its own lookup is still in progress in the same call chain.
 */
public final class CyclicLookupException extends LookupException {

    private final List<String> chain;

    public CyclicLookupException(List<String> chain) {
        super("Recursive lookup detected in [" + String.join(", ", chain) + "]");
        this.chain = List.copyOf(chain);
    }

    /** Keys in progress, outermost first, ending with the key that closed the cycle. */
    public List<String> getChain() {
        return chain;
    }
}
