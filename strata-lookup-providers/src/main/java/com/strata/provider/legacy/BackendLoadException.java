package com.strata.provider.legacy;

/**
 * A legacy backend could not be loaded (unknown name) or constructed.
 */
public class BackendLoadException extends Exception {

    private final boolean loadFailure;

    private BackendLoadException(String message, Throwable cause, boolean loadFailure) {
        super(message, cause);
        this.loadFailure = loadFailure;
    }

    public static BackendLoadException notLoadable(String backendName) {
        return new BackendLoadException("no backend is registered under '" + backendName + "'", null, true);
    }

    public static BackendLoadException notInstantiable(String backendName, Throwable cause) {
        return new BackendLoadException("constructor of backend '" + backendName + "' failed: " + cause.getMessage(),
                cause, false);
    }

    /** True when no backend exists under the name; false when construction failed. */
    public boolean isLoadFailure() {
        return loadFailure;
    }
}
