package com.payment.checkout.domain;

import lombok.Builder;
import lombok.Value;

/**
 * The fields that identify one logical payment attempt when the client sends no idempotency key.
 */
@Value
@Builder
public class PaymentIntent {

    String leadId;
    String courseSlug;
    int amountCents;
    int installments;
    String cardBin;
    String cardLast4;
    String expirationMonth;
    String expirationYear;
}
