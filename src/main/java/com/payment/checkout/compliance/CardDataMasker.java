package com.payment.checkout.compliance;

import java.util.regex.Pattern;

/**
 * Redacts card data so it is safe to include in logs and stored diagnostics.
 * Never log a PAN or CVV; use these masks instead.
 */
public final class CardDataMasker {

    private static final Pattern PAN_LIKE = Pattern.compile("\\d{13,19}");

    private CardDataMasker() {}

    /** First 6 and last 4 digits with the middle masked, e.g. {@code 424242******4242}. Empty for no digits. */
    public static String maskCard(String cardNumber) {
        if (cardNumber == null) return "";
        String digits = cardNumber.replaceAll("\\D+", "");
        if (digits.isEmpty()) return "";
        String head = digits.substring(0, Math.min(6, digits.length()));
        String tail = digits.substring(Math.max(0, digits.length() - 4));
        return head + "******" + tail;
    }

    /** Replaces any run of 13 to 19 digits (a possible PAN) inside free text. */
    public static String redactDigits(String text) {
        if (text == null) return null;
        return PAN_LIKE.matcher(text).replaceAll(m -> maskCard(m.group()));
    }
}
