package com.payment.checkout.domain;

import lombok.Value;

/**
 * What the gateway answered. {@code ok} mirrors a 2xx status; non-2xx answers are results, not errors.
 */
@Value
public class GatewayChargeResult {

    boolean ok;
    int httpStatus;
    GatewayResponse data;
}
