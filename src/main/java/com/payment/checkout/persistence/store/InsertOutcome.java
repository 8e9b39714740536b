package com.payment.checkout.persistence.store;

import com.payment.checkout.domain.CheckoutRecord;
import lombok.Value;

/**
 * Either a fresh checkout id, or the record a concurrent request inserted first under the same key.
 */
@Value
public class InsertOutcome {

    String checkoutId;
    CheckoutRecord reusedRecord;
    boolean idempotencyPersisted;

    public static InsertOutcome created(String checkoutId, boolean idempotencyPersisted) {
        return new InsertOutcome(checkoutId, null, idempotencyPersisted);
    }

    public static InsertOutcome reused(CheckoutRecord record) {
        return new InsertOutcome(record.getId(), record, true);
    }

    public boolean isReused() {
        return reusedRecord != null;
    }
}
