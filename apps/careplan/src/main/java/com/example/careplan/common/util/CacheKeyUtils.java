package com.example.careplan.common.util;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

/**
 * Utility methods for cache key handling.
 * Provides sanitization to prevent cache injection attacks.
 */
public final class CacheKeyUtils {

    private static final String DELIMITER = ":";
    private static final String NULL_PART = "-";

    private CacheKeyUtils() {}

    /**
     * Sanitizes a cache key part by replacing potentially dangerous characters.
     * Removes colons (the delimiter), whitespace and control characters.
     *
     * @param part the raw key part
     * @return sanitized part, or a placeholder for null or blank parts
     */
    @NonNull
    public static String sanitize(@Nullable String part) {
        if (part == null || part.isBlank()) {
            return NULL_PART;
        }
        return part.replaceAll("[:\\s\\p{Cntrl}]", "_");
    }

    /**
     * Builds a delimited cache key from sanitized parts. Null parts keep their position.
     */
    @NonNull
    public static String key(@Nullable String... parts) {
        if (parts == null || parts.length == 0) {
            throw new IllegalArgumentException("Cache key needs at least one part");
        }
        StringBuilder key = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                key.append(DELIMITER);
            }
            key.append(sanitize(parts[i]));
        }
        return key.toString();
    }
}
