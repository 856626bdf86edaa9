package com.esports.dashboard.infrastructure.query;

/**
 * Escapes user search input before it is bound to an ILIKE pattern.
 */
public final class SearchSanitizer {

    public static final int DEFAULT_MAX_LENGTH = 100;

    private SearchSanitizer() {
    }

    /**
     * Trim, cut to {@code maxLength}, then escape backslash before {@code %} and {@code _}.
     * Escaping the backslash first keeps the escapes added for wildcards from being doubled.
     */
    public static String sanitize(String input, int maxLength) {
        String sanitized = input.trim();
        if (sanitized.length() > maxLength) {
            sanitized = sanitized.substring(0, maxLength);
        }
        return sanitized
                .replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }

    /**
     * Sanitized term wrapped for substring matching, or null for blank input.
     */
    public static String containsPattern(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        return "%" + sanitize(input, DEFAULT_MAX_LENGTH) + "%";
    }
}
