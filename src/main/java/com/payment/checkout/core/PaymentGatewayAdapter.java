package com.payment.checkout.core;

import com.payment.checkout.domain.GatewayChargeRequest;
import com.payment.checkout.domain.GatewayChargeResult;
import com.payment.checkout.domain.LiveGatewayConfig;
import com.payment.checkout.domain.ProviderMode;

/**
 * Contract for a transaction gateway. Implementations must:
 * <ul>
 *   <li>return declines and non-2xx answers as a {@link GatewayChargeResult}, never as an exception</li>
 *   <li>throw {@link GatewayUnavailableException} only when no answer was obtained (network, timeout, open circuit)</li>
 *   <li>never log or return the raw card number or security code</li>
 * </ul>
 * No automatic retry happens at this level: a retried charge could be a second charge.
 */
public interface PaymentGatewayAdapter {

    /** Mode this adapter serves. {@link TransactionGateway} picks adapters by it. */
    ProviderMode getMode();

    /**
     * Submit one credit transaction with capture.
     *
     * @param request charge payload
     * @param config  live credentials; null for adapters that need none
     * @return gateway answer (never null)
     */
    GatewayChargeResult charge(GatewayChargeRequest request, LiveGatewayConfig config);
}
