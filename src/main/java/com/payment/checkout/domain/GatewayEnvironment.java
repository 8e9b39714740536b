package com.payment.checkout.domain;

import java.util.Locale;

/** Rede credential environment. */
public enum GatewayEnvironment {
    PRODUCTION("production"),
    SANDBOX("sandbox");

    private final String wireValue;

    GatewayEnvironment(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static GatewayEnvironment parse(String value) {
        String v = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        switch (v) {
            case "production":
            case "prod":
                return PRODUCTION;
            case "sandbox":
            case "sdb":
            case "hml":
                return SANDBOX;
            default:
                throw new IllegalArgumentException("Invalid gateway environment '" + value + "'. Use 'sandbox' or 'production'.");
        }
    }
}
