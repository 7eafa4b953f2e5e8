package com.kconfig.semantics.loader;

/** Checked exception signalling that the root Kconfig file could not be read. */
public final class LoaderException extends Exception {
    public LoaderException(String message) {
        super(message);
    }

    public LoaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
