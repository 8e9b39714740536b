package com.payment.checkout.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Lifecycle of a checkout record. Stored in {@code payment_checkouts.status} by wire value.
 * A record is created as {@link #PROCESSING} and moves exactly once to one of the other states.
 */
public enum CheckoutStatus {
    /** Inserted before the gateway call; no gateway outcome yet. */
    PROCESSING("processing"),
    /** Gateway returned code 00. */
    APPROVED("approved"),
    /** Gateway answered without approval and without a 3-D Secure challenge. */
    DECLINED("declined"),
    /** Gateway asked for a 3-D Secure challenge. Not retried here. */
    PENDING_AUTHENTICATION("pending_authentication"),
    /** Gateway could not be reached or timed out. A retry with the same key is safe. */
    PROVIDER_UNAVAILABLE("provider_unavailable");

    private final String wireValue;

    CheckoutStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public boolean isTerminal() {
        return this == APPROVED || this == DECLINED || this == PROVIDER_UNAVAILABLE;
    }

    public static Optional<CheckoutStatus> fromWire(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values()).filter(s -> s.wireValue.equals(value)).findFirst();
    }

    /**
     * HTTP status used when answering with a checkout in the given stored status.
     * Unknown statuses (legacy rows) answer 200 like any settled checkout.
     */
    public static int httpStatusOf(String storedStatus) {
        if (PROCESSING.wireValue.equals(storedStatus)) return 202;
        if (PROVIDER_UNAVAILABLE.wireValue.equals(storedStatus)) return 502;
        return 200;
    }
}
