package com.kconfig.semantics;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runtime switches read from system properties, with environment variables as a fallback. Values
 * are read on every call so tests and long-running hosts can flip them without a restart.
 */
public final class KconfigSettings {
    private static final Logger LOGGER = Logger.getLogger(KconfigSettings.class.getName());

    private static final String TOKENS_PROPERTY = "kconfig.debugTokens";
    private static final String DEBOUNCE_PROPERTY = "kconfig.lint.debounceMillis";
    /** Environment fallback kept for convenience; prefer using system properties. */
    private static final String TOKENS_ENV = "KCONFIG_DEBUG_TOKENS";
    private static final String DEBOUNCE_ENV = "KCONFIG_LINT_DEBOUNCE_MS";

    public static final long DEFAULT_DEBOUNCE_MILLIS = 100;

    private KconfigSettings() {}

    public static boolean isTokenDebugEnabled() {
        String value = System.getProperty(TOKENS_PROPERTY);
        if (value != null) {
            return Boolean.parseBoolean(value);
        }
        return Boolean.parseBoolean(System.getenv(TOKENS_ENV));
    }

    public static long lintDebounceMillis() {
        String value = System.getProperty(DEBOUNCE_PROPERTY);
        if (value == null) {
            value = System.getenv(DEBOUNCE_ENV);
        }
        if (value == null || value.isBlank()) {
            return DEFAULT_DEBOUNCE_MILLIS;
        }
        try {
            long millis = Long.parseLong(value.trim());
            return millis < 0 ? DEFAULT_DEBOUNCE_MILLIS : millis;
        } catch (NumberFormatException ex) {
            LOGGER.log(Level.WARNING, "Ignoring invalid lint debounce value: " + value, ex);
            return DEFAULT_DEBOUNCE_MILLIS;
        }
    }
}
