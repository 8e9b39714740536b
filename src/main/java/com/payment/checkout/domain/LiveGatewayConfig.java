package com.payment.checkout.domain;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/** Resolved credentials and endpoint for the live Rede gateway. */
@Value
@Builder
public class LiveGatewayConfig {

    String pv;
    @ToString.Exclude
    String token;
    GatewayEnvironment environment;
    String endpoint;
    int timeoutMs;
    String softDescriptor;
}
