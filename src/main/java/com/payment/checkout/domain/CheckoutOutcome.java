package com.payment.checkout.domain;

import lombok.Builder;
import lombok.Value;

/**
 * What a checkout request produced, fresh or replayed, together with the HTTP status to answer with.
 */
@Value
@Builder(toBuilder = true)
public class CheckoutOutcome {

    int httpStatus;
    String status;
    String checkoutId;
    LeadRecord lead;
    String courseSlug;
    String courseName;
    int amountCents;
    int installments;
    String reference;
    String tid;
    String authorizationCode;
    String returnCode;
    String returnMessage;
    String redirectUrl;
    CustomerContact customer;
    String idempotencyKey;
    boolean idempotentReused;
    boolean idempotencyPersisted;
    ProviderMode providerMode;
    boolean leadAlreadyPaid;

    public boolean isApproved() {
        return CheckoutStatus.APPROVED.wireValue().equals(status);
    }

    public boolean isRequiresAction() {
        return CheckoutStatus.PENDING_AUTHENTICATION.wireValue().equals(status);
    }
}
