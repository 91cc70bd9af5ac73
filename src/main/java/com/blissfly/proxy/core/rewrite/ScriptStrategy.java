package com.blissfly.proxy.core.rewrite;

import java.util.Locale;

/**
 * How script bodies are made proxy-aware.
 */
public enum ScriptStrategy {
    /** Prepend the client runtime and leave the script itself untouched. */
    SHIM_FIRST,
    /** Additionally replace bare window/document/location identifiers with {@code __bf.*}. */
    IDENTIFIER_SUBSTITUTION;

    /**
     * Parses a configuration value, case-insensitively.
     *
     * @param value The configured name; null yields {@link #SHIM_FIRST}.
     * @return The strategy.
     */
    public static ScriptStrategy fromConfig(String value) {
        return value == null ? SHIM_FIRST : valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
