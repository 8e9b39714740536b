package com.payment.checkout.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Credit transaction as sent to the gateway. Serialized as-is for the live API.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GatewayChargeRequest {

    int amount;
    String reference;
    int installments;
    String cardHolderName;
    @ToString.Exclude
    String cardNumber;
    String expirationMonth;
    String expirationYear;
    @ToString.Exclude
    String securityCode;
    @Builder.Default
    String kind = "credit";
    @Builder.Default
    boolean capture = true;
    String softDescriptor;
}
