package com.payment.checkout.adapters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.checkout.core.GatewayUnavailableException;
import com.payment.checkout.core.PaymentGatewayAdapter;
import com.payment.checkout.domain.GatewayChargeRequest;
import com.payment.checkout.domain.GatewayChargeResult;
import com.payment.checkout.domain.GatewayResponse;
import com.payment.checkout.domain.LiveGatewayConfig;
import com.payment.checkout.domain.ProviderMode;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.DefaultResponseErrorHandler;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rede e-commerce credit transactions over HTTPS. Basic auth is {@code pv:token}.
 * <p>
 * Every HTTP answer, including 4xx and 5xx, comes back as a result so the orchestrator can
 * persist what the gateway said. Only the absence of an answer is an exception. Calls go through
 * the {@code rede-gateway} circuit breaker and are never retried.
 */
@Slf4j
@Component
public class RedeGatewayAdapter implements PaymentGatewayAdapter {

    static final String CIRCUIT_BREAKER = "rede-gateway";
    static final String TRANSACTION_RESPONSE_HEADER = "Transaction-Response";
    static final String TRANSACTION_RESPONSE_VALUE = "brand-return-opened";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final CircuitBreaker circuitBreaker;
    private final Map<Integer, RestTemplate> restTemplateByTimeout = new ConcurrentHashMap<>();

    public RedeGatewayAdapter(ObjectMapper objectMapper, CircuitBreakerRegistry circuitBreakerRegistry) {
        this.objectMapper = objectMapper;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER);
    }

    @Override
    public ProviderMode getMode() {
        return ProviderMode.LIVE;
    }

    @Override
    public GatewayChargeResult charge(GatewayChargeRequest request, LiveGatewayConfig config) {
        if (config == null) {
            throw new IllegalStateException("Live gateway called without configuration");
        }
        HttpEntity<String> entity = new HttpEntity<>(writeBody(request), headers(config));
        try {
            ResponseEntity<String> response = circuitBreaker.executeSupplier(() -> post(config, entity));
            return new GatewayChargeResult(
                    response.getStatusCode().is2xxSuccessful(),
                    response.getStatusCode().value(),
                    parseBody(response.getBody()));
        } catch (CallNotPermittedException e) {
            log.warn("Rede circuit open, not calling gateway: reference={}", request.getReference());
            throw new GatewayUnavailableException("Rede circuit breaker is open", e);
        }
    }

    private ResponseEntity<String> post(LiveGatewayConfig config, HttpEntity<String> entity) {
        try {
            return restTemplateFor(config.getTimeoutMs())
                    .exchange(config.getEndpoint(), HttpMethod.POST, entity, String.class);
        } catch (RestClientException e) {
            log.warn("Rede request failed: environment={} error={}", config.getEnvironment().wireValue(), e.getMessage());
            throw new GatewayUnavailableException("Rede request failed", e);
        }
    }

    private HttpHeaders headers(LiveGatewayConfig config) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBasicAuth(config.getPv(), config.getToken(), StandardCharsets.UTF_8);
        headers.set(HttpHeaders.CONTENT_TYPE, "application/json; charset=utf-8");
        headers.set(TRANSACTION_RESPONSE_HEADER, TRANSACTION_RESPONSE_VALUE);
        return headers;
    }

    private String writeBody(GatewayChargeRequest request) {
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize gateway request for reference " + request.getReference(), e);
        }
    }

    /** Empty response for a blank body, invalid JSON or any JSON that is not an object. */
    GatewayResponse parseBody(String body) {
        if (body == null || body.isBlank()) return GatewayResponse.empty();
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node == null || !node.isObject()) return GatewayResponse.empty();
            return GatewayResponse.of(objectMapper.convertValue(node, MAP_TYPE));
        } catch (JsonProcessingException e) {
            log.warn("Rede answered with a body that is not JSON ({} chars); treating as empty", body.length());
            return GatewayResponse.empty();
        }
    }

    private RestTemplate restTemplateFor(int timeoutMs) {
        return restTemplateByTimeout.computeIfAbsent(timeoutMs, t -> {
            // a 401 on a streamed POST must come back as a response; HttpURLConnection throws instead
            HttpClient httpClient = HttpClient.newBuilder()
                    .version(HttpClient.Version.HTTP_1_1)
                    .connectTimeout(Duration.ofMillis(t))
                    .build();
            JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
            factory.setReadTimeout(Duration.ofMillis(t));
            RestTemplate restTemplate = new RestTemplate(factory);
            restTemplate.setErrorHandler(new PassThroughErrorHandler());
            return restTemplate;
        });
    }

    /** Hands every status code back to the caller. */
    private static final class PassThroughErrorHandler extends DefaultResponseErrorHandler {
        @Override
        public boolean hasError(ClientHttpResponse response) {
            return false;
        }
    }
}
