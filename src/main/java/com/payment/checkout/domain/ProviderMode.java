package com.payment.checkout.domain;

import java.util.Locale;

/**
 * Which transaction gateway handles charges. {@link #LIVE} is the Rede e-commerce API.
 */
public enum ProviderMode {
    MOCK("mock"),
    LIVE("rede");

    private final String wireValue;

    ProviderMode(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * Parses an already-normalized configuration value. Blank means mock; {@code real} is accepted for live.
     *
     * @throws IllegalArgumentException for any other value
     */
    public static ProviderMode parse(String value) {
        String v = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        switch (v) {
            case "":
            case "mock":
                return MOCK;
            case "rede":
            case "real":
                return LIVE;
            default:
                throw new IllegalArgumentException("Invalid payment provider mode '" + value + "'. Use 'mock' or 'rede'.");
        }
    }
}
