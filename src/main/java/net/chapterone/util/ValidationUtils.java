package net.chapterone.util;

import java.util.Collection;
import java.util.Locale;

/**
 * Null, blank and range checks shared by the request boundary and the recorders.
 */
public final class ValidationUtils {
    private ValidationUtils() {
    }

    public static boolean isNullOrEmpty(Collection<?> collection) {
        return collection == null || collection.isEmpty();
    }

    public static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    /**
     * Trims the value and returns null when nothing is left.
     */
    public static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * Canonical vocabulary key: trimmed, lower-case, with spaces and hyphens folded to underscores.
     *
     * @param value raw categorical input from a caller
     * @return the canonical key, or null for null/blank input
     */
    public static String normalizeKey(String value) {
        String trimmed = trimToNull(value);
        if (trimmed == null) {
            return null;
        }
        return trimmed.toLowerCase(Locale.ROOT).replace('-', '_').replaceAll("\\s+", "_");
    }

    public static boolean isFinite(double value) {
        return !Double.isNaN(value) && !Double.isInfinite(value);
    }
}
