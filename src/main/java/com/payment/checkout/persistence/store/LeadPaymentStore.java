package com.payment.checkout.persistence.store;

import com.payment.checkout.domain.LeadRecord;
import com.payment.checkout.domain.PaymentProjection;

import java.util.Optional;

/**
 * Read access to enrollment leads and write access to their payment columns only.
 */
public interface LeadPaymentStore {

    Optional<LeadRecord> findById(String leadId);

    /**
     * Mirrors a checkout outcome onto the lead. {@code paid_at} is set by the first approval and never moved.
     */
    void recordPayment(String leadId, PaymentProjection projection);
}
