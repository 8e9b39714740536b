package com.payment.checkout.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Stored state of one checkout attempt, as read back for replay.
 * {@code status} is the raw stored value so rows written by older releases still replay.
 */
@Value
@Builder(toBuilder = true)
public class CheckoutRecord {

    String id;
    String leadId;
    String reference;
    String status;
    Integer amountCents;
    Integer installments;
    String tid;
    String returnCode;
    String returnMessage;
    String authorizationCode;
    String threeDSecureUrl;

    public boolean belongsToAnotherLead(String otherLeadId) {
        return leadId != null && !leadId.equals(otherLeadId);
    }
}
