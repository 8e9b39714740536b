package com.payment.checkout.core;

import com.payment.checkout.domain.GatewayChargeRequest;
import com.payment.checkout.domain.GatewayChargeResult;
import com.payment.checkout.domain.LiveGatewayConfig;
import com.payment.checkout.domain.ProviderMode;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Single entry point for charging a card in either mode. The orchestrator never sees which adapter ran.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransactionGateway {

    private final List<PaymentGatewayAdapter> adapters;

    private final Map<ProviderMode, PaymentGatewayAdapter> adapterByMode = new EnumMap<>(ProviderMode.class);

    @PostConstruct
    void init() {
        for (PaymentGatewayAdapter adapter : adapters) {
            PaymentGatewayAdapter previous = adapterByMode.putIfAbsent(adapter.getMode(), adapter);
            if (previous != null) {
                log.warn("Duplicate gateway adapter for mode={}: keeping {} and ignoring {}",
                        adapter.getMode(), previous.getClass().getSimpleName(), adapter.getClass().getSimpleName());
            }
        }
        log.info("Registered gateway adapters: {}", adapterByMode.keySet());
    }

    /**
     * @throws GatewayUnavailableException when the gateway gave no answer or no adapter serves the mode
     */
    public GatewayChargeResult charge(ProviderMode mode, LiveGatewayConfig config, GatewayChargeRequest request) {
        PaymentGatewayAdapter adapter = adapterByMode.get(mode);
        if (adapter == null) {
            throw new GatewayUnavailableException("No gateway adapter registered for mode " + mode.wireValue());
        }
        long start = System.currentTimeMillis();
        GatewayChargeResult result = adapter.charge(request, config);
        log.info("Gateway answered: mode={} reference={} httpStatus={} returnCode={} latencyMs={}",
                mode.wireValue(), request.getReference(), result.getHttpStatus(),
                result.getData().returnCode(), System.currentTimeMillis() - start);
        return result;
    }
}
