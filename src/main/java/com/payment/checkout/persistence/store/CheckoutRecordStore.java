package com.payment.checkout.persistence.store;

import com.payment.checkout.domain.CheckoutRecord;
import com.payment.checkout.domain.CheckoutSettlement;
import com.payment.checkout.domain.NewCheckout;

import java.util.Optional;

/**
 * Append-and-update log of checkout attempts that tolerates partially migrated schemas.
 * Every write is a single-row statement; nothing spans a transaction.
 */
public interface CheckoutRecordStore {

    /** Latest checkout with this key. Reports an unavailable key column instead of failing. */
    IdempotencyLookup findByIdempotencyKey(String idempotencyKey);

    /**
     * Latest checkout with this reference for the lead, or for the reference alone when the table has no {@code lead_id}.
     */
    Optional<CheckoutRecord> findByReference(String reference, String leadId);

    /**
     * Inserts a {@code processing} row. A unique-key race returns the winner's record instead.
     *
     * @throws CheckoutSchemaIncompatibleException when no column set is accepted
     */
    InsertOutcome insertProcessing(NewCheckout checkout, boolean keyColumnAvailable);

    /** Make sure the key column exists, repairing the schema if allowed. */
    boolean ensureIdempotencySchema();

    /** Writes the gateway outcome. Only a checkout still in {@code processing} changes; others are left as they are. */
    void updateResult(String checkoutId, CheckoutSettlement settlement);

    /** Same {@code processing}-only rule as {@link #updateResult}. */
    void markProviderUnavailable(String checkoutId, String message);
}
