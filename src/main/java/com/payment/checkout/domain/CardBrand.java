package com.payment.checkout.domain;

/**
 * Card brand inferred from leading digits. Display only; the gateway's own brand wins when it reports one.
 */
public enum CardBrand {
    VISA("Visa"),
    MASTERCARD("Mastercard"),
    AMEX("Amex"),
    DISCOVER("Discover"),
    UNKNOWN("Unknown");

    private final String displayName;

    CardBrand(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public static CardBrand infer(String digits) {
        if (digits == null || digits.isEmpty()) return UNKNOWN;
        if (digits.startsWith("4")) return VISA;
        if (digits.length() >= 2 && digits.charAt(0) == '5' && digits.charAt(1) >= '1' && digits.charAt(1) <= '5') {
            return MASTERCARD;
        }
        if (digits.startsWith("34") || digits.startsWith("37")) return AMEX;
        if (digits.startsWith("6")) return DISCOVER;
        return UNKNOWN;
    }
}
