package com.motionindex.util;

import javax.annotation.Nonnull;

/**
 * Null-safe string helpers for log lines, span attributes and metric tags.
 */
public final class Strings {

    private Strings() {
        // Utility class
    }

    /**
     * Returns the value, or "unknown" when it is null or blank.
     */
    @Nonnull
    public static String safe(String value) {
        return safe(value, "unknown");
    }

    /**
     * Returns the value, or the given default when it is null or blank.
     */
    @Nonnull
    public static String safe(String value, String defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue != null ? defaultValue : "unknown";
        }
        return value;
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Cuts a string down to at most {@code maxLength} characters.
     */
    @Nonnull
    public static String truncate(String value, int maxLength) {
        if (value == null) {
            return "";
        }
        return value.length() > maxLength ? value.substring(0, maxLength) : value;
    }
}
