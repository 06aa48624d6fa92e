package com.libragraph.evidence.util;

/**
 * Turns an arbitrary display name into a single, file-system safe path segment.
 *
 * <p>Never fails: a name that is empty after cleaning is replaced by the fallback.
 */
public final class NameSanitizer {

    public static final int DEFAULT_MAX_LENGTH = 255;
    public static final String LAST_RESORT = "unnamed";

    private static final String ILLEGAL = "\\/:*?\"<>|";

    private NameSanitizer() {
    }

    public static String sanitize(String raw, String fallback) {
        return sanitize(raw, fallback, DEFAULT_MAX_LENGTH);
    }

    /**
     * @param raw       display name, may be null
     * @param fallback  used when nothing survives cleaning; itself cleaned
     * @param maxLength maximum length of the result
     */
    public static String sanitize(String raw, String fallback, int maxLength) {
        String cleaned = clean(raw, maxLength);
        if (!cleaned.isEmpty()) {
            return cleaned;
        }
        String cleanedFallback = clean(fallback, maxLength);
        return cleanedFallback.isEmpty() ? LAST_RESORT : cleanedFallback;
    }

    /**
     * True when {@code name} is already a valid segment (sanitizing it would not change it).
     */
    public static boolean isSafe(String name) {
        return name != null && !name.isEmpty() && name.equals(clean(name, Integer.MAX_VALUE));
    }

    private static String clean(String raw, int maxLength) {
        if (raw == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c < 0x20 || c == 0x7F || ILLEGAL.indexOf(c) >= 0) {
                sb.append('_');
            } else {
                sb.append(c);
            }
        }

        String result = stripTrailingDots(sb.toString().strip());
        if (result.equals(".") || result.equals("..")) {
            result = "";
        }

        int limit = Math.max(1, maxLength);
        if (result.length() > limit) {
            result = stripTrailingDots(result.substring(0, limit).strip());
        }
        return result;
    }

    private static String stripTrailingDots(String s) {
        int end = s.length();
        while (end > 0 && (s.charAt(end - 1) == '.' || Character.isWhitespace(s.charAt(end - 1)))) {
            end--;
        }
        return s.substring(0, end);
    }
}
