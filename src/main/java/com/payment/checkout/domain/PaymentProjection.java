package com.payment.checkout.domain;

import lombok.Builder;
import lombok.Value;

/** Payment columns mirrored onto the lead after a checkout settles or fails. */
@Value
@Builder
public class PaymentProjection {

    String status;
    String reference;
    String tid;
    String returnCode;
    String returnMessage;
}
