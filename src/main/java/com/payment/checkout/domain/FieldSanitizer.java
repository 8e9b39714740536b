package com.payment.checkout.domain;

/**
 * Trimming and bounding for free-form values that reach the database or a response.
 */
public final class FieldSanitizer {

    private FieldSanitizer() {}

    /** Trimmed text cut to {@code maxLen}; null when blank. Maps and lists are not text and yield null. */
    public static String clean(Object value, int maxLen) {
        String text = asText(value).trim();
        if (text.isEmpty()) return null;
        return text.length() > maxLen ? text.substring(0, maxLen) : text;
    }

    public static String onlyDigits(Object value) {
        return asText(value).replaceAll("\\D+", "");
    }

    public static String asText(Object value) {
        if (value == null) return "";
        if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        return "";
    }
}
