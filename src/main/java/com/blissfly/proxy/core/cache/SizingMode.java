package com.blissfly.proxy.core.cache;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * How the cache accounts the memory taken by an entry.
 */
public enum SizingMode {
    /** Body byte length plus the UTF-8 length of key and content type. */
    EXACT {
        @Override
        long sizeOf(String key, CachedResponse value) {
            return value.body().length + utf8Length(key) + utf8Length(value.contentType());
        }
    },
    /** Text bodies by length, everything else by a fixed estimate. */
    ESTIMATED {
        @Override
        long sizeOf(String key, CachedResponse value) {
            return isTextual(value.contentType()) ? value.body().length : NON_TEXT_ESTIMATE;
        }
    };

    /** Assumed size of a binary payload in {@link #ESTIMATED} mode. */
    public static final long NON_TEXT_ESTIMATE = 1024;

    abstract long sizeOf(String key, CachedResponse value);

    /**
     * Parses a configuration value, case-insensitively.
     *
     * @param value EXACT or ESTIMATED; null yields EXACT.
     * @return The mode.
     */
    public static SizingMode fromConfig(String value) {
        return value == null ? EXACT : valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    private static long utf8Length(String s) {
        return s == null ? 0 : s.getBytes(StandardCharsets.UTF_8).length;
    }

    private static boolean isTextual(String contentType) {
        if (contentType == null) {
            return false;
        }
        String ct = contentType.toLowerCase(Locale.ROOT);
        return ct.startsWith("text/") || ct.contains("json") || ct.contains("javascript")
                || ct.contains("xml");
    }
}
