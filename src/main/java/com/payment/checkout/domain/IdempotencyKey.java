package com.payment.checkout.domain;

import lombok.Value;

/**
 * Effective idempotency key of a checkout: either the client's normalized key or an {@code auto-} key.
 */
@Value
public class IdempotencyKey {

    String value;
    boolean explicit;

    public static IdempotencyKey explicit(String value) {
        return new IdempotencyKey(value, true);
    }

    public static IdempotencyKey automatic(String value) {
        return new IdempotencyKey(value, false);
    }
}
