package com.payment.checkout.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.checkout.core.CheckoutOrchestrator;
import com.payment.checkout.domain.CheckoutCommand;
import com.payment.checkout.domain.CheckoutOutcome;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for card checkouts of enrollment leads.
 */
@Slf4j
@RestController
@RequestMapping("/api/payments")
@Tag(name = "Checkout", description = "Charge a card for a lead's course enrollment")
public class CheckoutController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    static final String RATE_LIMIT_PREFIX = "payments";

    private final CheckoutOrchestrator orchestrator;
    private final RateLimitGuard rateLimitGuard;
    private final long windowMs;
    private final int maxRequests;

    public CheckoutController(CheckoutOrchestrator orchestrator,
                              RateLimitGuard rateLimitGuard,
                              @Value("${payment.rate-limit.checkout.window-ms:60000}") long windowMs,
                              @Value("${payment.rate-limit.checkout.max:25}") int maxRequests) {
        this.orchestrator = orchestrator;
        this.rateLimitGuard = rateLimitGuard;
        this.windowMs = windowMs;
        this.maxRequests = maxRequests;
    }

    @PostMapping("/checkout")
    @Operation(
            summary = "Checkout",
            description = "Charge the card for the lead's course. Send Idempotency-Key (header or idempotency_key in the body) "
                    + "to make retries safe; without one a key is derived from the payment intent and a 10-minute window. "
                    + "The effective key is echoed in the Idempotency-Key response header. A repeated key answers with the "
                    + "stored checkout (idempotent_reused=true) and never charges twice.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Checkout settled: approved, declined or pending_authentication (see redirect_url).",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = CheckoutResponseDto.class))),
            @ApiResponse(responseCode = "202", description = "Replay of a checkout still processing.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = CheckoutResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid input. Body: { \"error\": code, \"code\": code, \"message\": ..., \"requestId\": ... }"),
            @ApiResponse(responseCode = "409", description = "payment_in_progress or idempotency_key_conflict."),
            @ApiResponse(responseCode = "429", description = "Rate limited. Retry-After header and details.retryAfterSeconds tell when to retry."),
            @ApiResponse(responseCode = "502", description = "payment_provider_unavailable. Safe to retry with the same Idempotency-Key."),
            @ApiResponse(responseCode = "500", description = "Configuration or persistence error.")
    })
    public ResponseEntity<CheckoutResponseDto> checkout(
            @RequestBody(required = false) JsonNode body,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @RequestHeader(value = HttpHeaders.REFERER, required = false) String referer,
            HttpServletRequest httpRequest,
            HttpServletResponse httpResponse) {
        httpResponse.setHeader(HttpHeaders.CACHE_CONTROL, "no-store");
        rateLimitGuard.enforce(RATE_LIMIT_PREFIX, windowMs, maxRequests, httpRequest, httpResponse);

        CheckoutCommand command = CheckoutRequestParser.parse(body, idempotencyKey, referer);
        CheckoutOutcome outcome = orchestrator.checkout(command,
                key -> httpResponse.setHeader(IDEMPOTENCY_KEY_HEADER, key));

        log.debug("Checkout completed: idempotencyKey={} status={} reused={} httpStatus={}",
                outcome.getIdempotencyKey(), outcome.getStatus(), outcome.isIdempotentReused(), outcome.getHttpStatus());
        return ResponseEntity.status(outcome.getHttpStatus()).body(CheckoutResponseDto.from(outcome));
    }
}
