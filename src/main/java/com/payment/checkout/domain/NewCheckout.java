package com.payment.checkout.domain;

import lombok.Builder;
import lombok.Value;

/** Everything written when a checkout is created in {@link CheckoutStatus#PROCESSING}. */
@Value
@Builder
public class NewCheckout {

    String leadId;
    CourseOffer course;
    int amountCents;
    int installments;
    String reference;
    CustomerContact customer;
    String cardHolderName;
    String cardLast4;
    String cardBin;
    String sourceUrl;
    String idempotencyKey;
}
