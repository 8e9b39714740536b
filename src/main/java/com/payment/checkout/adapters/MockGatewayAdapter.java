package com.payment.checkout.adapters;

import com.payment.checkout.compliance.CardDataMasker;
import com.payment.checkout.core.PaymentGatewayAdapter;
import com.payment.checkout.domain.CardBrand;
import com.payment.checkout.domain.GatewayChargeRequest;
import com.payment.checkout.domain.GatewayChargeResult;
import com.payment.checkout.domain.GatewayResponse;
import com.payment.checkout.domain.LiveGatewayConfig;
import com.payment.checkout.domain.ProviderMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Deterministic stand-in for the live gateway. The outcome depends only on the card number:
 * <ul>
 *   <li>fewer than 13 digits: rejected, HTTP 422, code 14</li>
 *   <li>ending in 0000: declined, code 05</li>
 *   <li>ending in 1111: 3-D Secure challenge, code 220</li>
 *   <li>anything else: approved, code 00</li>
 * </ul>
 * Only the TID and authorization code are random.
 */
@Slf4j
@Component
public class MockGatewayAdapter implements PaymentGatewayAdapter {

    static final String THREE_DS_BASE_URL = "https://mock-gateway.local/3ds/";

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public MockGatewayAdapter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ProviderMode getMode() {
        return ProviderMode.MOCK;
    }

    @Override
    public GatewayChargeResult charge(GatewayChargeRequest request, LiveGatewayConfig config) {
        String digits = request.getCardNumber() == null ? "" : request.getCardNumber().replaceAll("\\D+", "");
        String suffix = digits.length() >= 4 ? digits.substring(digits.length() - 4) : digits;
        log.debug("MockGatewayAdapter charging reference={} amount={} card={}",
                request.getReference(), request.getAmount(), CardDataMasker.maskCard(digits));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("tid", "MOCK" + Long.toString(clock.millis(), 36).toUpperCase(Locale.ROOT) + randomHex(2));
        data.put("reference", request.getReference());

        if (digits.length() < 13) {
            data.put("returnCode", "14");
            data.put("returnMessage", "Invalid card number");
            return result(false, 422, data, digits);
        }

        if ("0000".equals(suffix)) {
            data.put("returnCode", "05");
            data.put("returnMessage", "Transaction denied (mock)");
            data.put("authorizationCode", "");
            return result(true, 200, data, digits);
        }

        if ("1111".equals(suffix)) {
            data.put("returnCode", "220");
            data.put("returnMessage", "Authentication required (mock)");
            data.put("authorizationCode", "");
            data.put("threeDSecure", Map.of("url", THREE_DS_BASE_URL + request.getReference()));
            return result(true, 200, data, digits);
        }

        data.put("returnCode", "00");
        data.put("returnMessage", "Approved (mock)");
        data.put("authorizationCode", randomHex(3));
        return result(true, 200, data, digits);
    }

    private GatewayChargeResult result(boolean ok, int httpStatus, Map<String, Object> data, String digits) {
        data.put("brand", CardBrand.infer(digits).displayName());
        data.put("mock", true);
        data.put("mockMaskedCard", CardDataMasker.maskCard(digits));
        return new GatewayChargeResult(ok, httpStatus, GatewayResponse.of(data));
    }

    private String randomHex(int bytes) {
        byte[] buf = new byte[bytes];
        random.nextBytes(buf);
        return HexFormat.of().withUpperCase().formatHex(buf);
    }
}
