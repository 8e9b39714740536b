package com.payment.checkout.config;

import com.payment.checkout.api.CheckoutErrorCode;
import com.payment.checkout.api.CheckoutException;
import com.payment.checkout.domain.GatewayEnvironment;
import com.payment.checkout.domain.LiveGatewayConfig;
import com.payment.checkout.domain.ProviderMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Gateway configuration as read from the environment. Values are resolved per request so a bad setting
 * fails the checkout with a configuration error instead of preventing startup.
 * <p>
 * Environment values are often pasted with stray quotes or a literal {@code \n}; those are stripped first.
 */
@Slf4j
@Component
public class GatewaySettings {

    static final int DEFAULT_TIMEOUT_MS = 15_000;
    static final int MIN_TIMEOUT_MS = 1_000;
    static final int MAX_TIMEOUT_MS = 60_000;
    static final int MAX_SOFT_DESCRIPTOR = 22;

    private final String mode;
    private final String pv;
    private final String token;
    private final String environment;
    private final String timeoutMs;
    private final String softDescriptor;
    private final String productionUrl;
    private final String sandboxUrl;
    private final String runtimeEnvironment;

    public GatewaySettings(
            @Value("${payment.gateway.mode:mock}") String mode,
            @Value("${payment.gateway.rede.pv:}") String pv,
            @Value("${payment.gateway.rede.token:}") String token,
            @Value("${payment.gateway.rede.environment:sandbox}") String environment,
            @Value("${payment.gateway.rede.timeout-ms:15000}") String timeoutMs,
            @Value("${payment.gateway.rede.soft-descriptor:}") String softDescriptor,
            @Value("${payment.gateway.rede.production-url:https://api.userede.com.br/erede/v1/transactions}") String productionUrl,
            @Value("${payment.gateway.rede.sandbox-url:https://api.userede.com.br/desenvolvedores/v1/transactions}") String sandboxUrl,
            @Value("${payment.runtime.environment:development}") String runtimeEnvironment) {
        this.mode = mode;
        this.pv = pv;
        this.token = token;
        this.environment = environment;
        this.timeoutMs = timeoutMs;
        this.softDescriptor = softDescriptor;
        this.productionUrl = productionUrl;
        this.sandboxUrl = sandboxUrl;
        this.runtimeEnvironment = runtimeEnvironment;
    }

    /**
     * @throws CheckoutException {@code payment_provider_mode_invalid}
     */
    public ProviderMode providerMode() {
        try {
            return ProviderMode.parse(normalizeEnvValue(mode));
        } catch (IllegalArgumentException e) {
            log.error("Payment provider mode error: {}", e.getMessage());
            throw new CheckoutException(CheckoutErrorCode.PAYMENT_PROVIDER_MODE_INVALID, e);
        }
    }

    /**
     * Credentials for the live gateway.
     *
     * @throws CheckoutException {@code payment_provider_not_configured} when PV, token or environment is unusable;
     *                           {@code payment_provider_environment_mismatch} when a production runtime holds sandbox credentials
     */
    public LiveGatewayConfig liveConfig() {
        String normalizedPv = normalizeEnvValue(pv).replaceAll("\\D+", "");
        String normalizedToken = normalizeEnvValue(token);
        if (normalizedPv.isEmpty() || normalizedToken.isEmpty()) {
            log.error("Rede config error: missing or invalid {}", normalizedPv.isEmpty() ? "PV" : "token");
            throw new CheckoutException(CheckoutErrorCode.PAYMENT_PROVIDER_NOT_CONFIGURED);
        }

        GatewayEnvironment env;
        try {
            env = GatewayEnvironment.parse(normalizeEnvValue(environment));
        } catch (IllegalArgumentException e) {
            log.error("Rede config error: {}", e.getMessage());
            throw new CheckoutException(CheckoutErrorCode.PAYMENT_PROVIDER_NOT_CONFIGURED, e);
        }

        if (isProductionRuntime() && env != GatewayEnvironment.PRODUCTION) {
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("expected_env", GatewayEnvironment.PRODUCTION.wireValue());
            attributes.put("current_env", env.wireValue());
            throw new CheckoutException(CheckoutErrorCode.PAYMENT_PROVIDER_ENVIRONMENT_MISMATCH, attributes);
        }

        String descriptor = normalizeEnvValue(softDescriptor);
        return LiveGatewayConfig.builder()
                .pv(normalizedPv)
                .token(normalizedToken)
                .environment(env)
                .endpoint(env == GatewayEnvironment.PRODUCTION ? productionUrl : sandboxUrl)
                .timeoutMs(parseTimeoutMs(normalizeEnvValue(timeoutMs)))
                .softDescriptor(descriptor.isEmpty() ? null
                        : descriptor.substring(0, Math.min(MAX_SOFT_DESCRIPTOR, descriptor.length())))
                .build();
    }

    public boolean isProductionRuntime() {
        return "production".equalsIgnoreCase(normalizeEnvValue(runtimeEnvironment));
    }

    /** Trim, drop literal {@code \n}/{@code \r} escapes, strip one pair of wrapping quotes, trim again. */
    public static String normalizeEnvValue(String raw) {
        if (raw == null) return "";
        String value = raw.trim()
                .replace("\\n", "")
                .replace("\\r", "")
                .replaceAll("^['\"]|['\"]$", "");
        return value.trim();
    }

    /** Default 15 s for unparseable or sub-second values, capped at 60 s. */
    static int parseTimeoutMs(String raw) {
        double parsed;
        try {
            parsed = Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            return DEFAULT_TIMEOUT_MS;
        }
        if (Double.isNaN(parsed) || Double.isInfinite(parsed) || parsed < MIN_TIMEOUT_MS) return DEFAULT_TIMEOUT_MS;
        if (parsed > MAX_TIMEOUT_MS) return MAX_TIMEOUT_MS;
        return (int) parsed;
    }
}
