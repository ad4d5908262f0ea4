package com.strata.lookup;

/** Malformed lookup key (empty key, empty segment, unterminated quote). */
public final class InvalidKeyException extends LookupException {

    private final String key;

    public InvalidKeyException(String key, String problem) {
        super("Syntax error in lookup key '" + key + "': " + problem);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
