package com.payment.checkout.domain;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * A checkout request after alias resolution at the HTTP boundary. Values are trimmed and bounded
 * but not yet validated; card fields are raw so validation can report precise error codes.
 */
@Value
@Builder
public class CheckoutCommand {

    String courseSlug;
    String leadId;

    String customerName;
    String customerEmail;
    String customerPhone;
    String customerCpf;

    String cardHolderName;
    @ToString.Exclude
    String cardNumber;
    @ToString.Exclude
    String cardCvv;
    String cardExpirationMonth;
    String cardExpirationYear;
    String installments;

    String reference;
    /** Client key from the header or body, before normalization; null when the client sent none. */
    String idempotencyKey;
    String sourceUrl;
}
