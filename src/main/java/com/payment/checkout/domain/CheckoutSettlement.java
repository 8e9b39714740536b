package com.payment.checkout.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Gateway outcome as written onto a checkout row. Text fields are already bounded.
 */
@Value
@Builder
public class CheckoutSettlement {

    CheckoutStatus status;
    int providerHttpStatus;
    String returnCode;
    String returnMessage;
    String tid;
    String authorizationCode;
    String threeDSecureUrl;
    String brandName;
    Map<String, Object> providerResponse;

    /** Maps a gateway answer to a status: 00 approves, a 3-D Secure URL means pending, anything else declines. */
    public static CheckoutSettlement from(GatewayChargeResult result) {
        GatewayResponse data = result.getData();
        String returnCode = data.returnCode();
        String threeDSecureUrl = data.threeDSecureUrl();
        CheckoutStatus status;
        if ("00".equals(returnCode)) {
            status = CheckoutStatus.APPROVED;
        } else if (threeDSecureUrl != null) {
            status = CheckoutStatus.PENDING_AUTHENTICATION;
        } else {
            status = CheckoutStatus.DECLINED;
        }
        String returnMessage = data.returnMessage();
        return CheckoutSettlement.builder()
                .status(status)
                .providerHttpStatus(result.getHttpStatus())
                .returnCode(returnCode.isEmpty() ? null : returnCode)
                .returnMessage(returnMessage.isEmpty() ? null : returnMessage)
                .tid(data.tid())
                .authorizationCode(data.authorizationCode())
                .threeDSecureUrl(threeDSecureUrl)
                .brandName(data.brandName())
                .providerResponse(data.raw())
                .build();
    }
}
