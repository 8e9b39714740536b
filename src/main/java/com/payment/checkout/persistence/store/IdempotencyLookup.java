package com.payment.checkout.persistence.store;

import com.payment.checkout.domain.CheckoutRecord;
import lombok.Value;

import java.util.Optional;

/** Result of a lookup by idempotency key. {@code keyColumnAvailable=false} means the column does not exist. */
@Value
public class IdempotencyLookup {

    boolean keyColumnAvailable;
    CheckoutRecord record;

    public static IdempotencyLookup unavailable() {
        return new IdempotencyLookup(false, null);
    }

    public static IdempotencyLookup found(CheckoutRecord record) {
        return new IdempotencyLookup(true, record);
    }

    public Optional<CheckoutRecord> existing() {
        return Optional.ofNullable(record);
    }
}
