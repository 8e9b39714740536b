package com.payment.checkout.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Gateway response body with typed, bounded accessors over the raw JSON object.
 * The raw map is what gets persisted as {@code provider_response}; it never holds the card number or CVV.
 */
public final class GatewayResponse {

    private static final GatewayResponse EMPTY = new GatewayResponse(Collections.emptyMap());

    private final Map<String, Object> raw;

    private GatewayResponse(Map<String, Object> raw) {
        this.raw = raw;
    }

    public static GatewayResponse of(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) return EMPTY;
        return new GatewayResponse(Collections.unmodifiableMap(new LinkedHashMap<>(raw)));
    }

    public static GatewayResponse empty() {
        return EMPTY;
    }

    public Map<String, Object> raw() {
        return raw;
    }

    public String tid() {
        return FieldSanitizer.clean(raw.get("tid"), 120);
    }

    /** Return code trimmed; empty string when absent. */
    public String returnCode() {
        return FieldSanitizer.asText(raw.get("returnCode")).trim();
    }

    public String returnMessage() {
        return FieldSanitizer.asText(raw.get("returnMessage")).trim();
    }

    public String authorizationCode() {
        return FieldSanitizer.clean(raw.get("authorizationCode"), 40);
    }

    public String threeDSecureUrl() {
        Object threeDSecure = raw.get("threeDSecure");
        if (threeDSecure instanceof Map) {
            return FieldSanitizer.clean(((Map<?, ?>) threeDSecure).get("url"), 500);
        }
        return null;
    }

    /** Brand as reported either as a plain string or as {@code {"name": ...}}. */
    public String brandName() {
        Object brand = raw.get("brand");
        if (brand instanceof Map) {
            return FieldSanitizer.clean(((Map<?, ?>) brand).get("name"), 80);
        }
        return FieldSanitizer.clean(brand, 80);
    }

    @Override
    public String toString() {
        return "GatewayResponse{tid=" + tid() + ", returnCode=" + returnCode() + "}";
    }
}
