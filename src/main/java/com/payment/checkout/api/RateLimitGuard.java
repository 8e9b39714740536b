package com.payment.checkout.api;

import com.payment.checkout.core.CheckoutRateLimiter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies a {@link CheckoutRateLimiter} decision to an HTTP exchange: writes the {@code X-RateLimit-*} headers
 * and, when limited, {@code Retry-After} plus a {@code rate_limited} error.
 */
@Component
@RequiredArgsConstructor
public class RateLimitGuard {

    private final CheckoutRateLimiter rateLimiter;

    public void enforce(String keyPrefix, long windowMs, int max,
                        HttpServletRequest request, HttpServletResponse response) {
        CheckoutRateLimiter.RateLimitDecision decision = rateLimiter.check(keyPrefix, getClientIp(request), windowMs, max);
        response.setHeader("X-RateLimit-Limit", String.valueOf(decision.getLimit()));
        response.setHeader("X-RateLimit-Remaining", String.valueOf(decision.getRemaining()));
        response.setHeader("X-RateLimit-Reset", String.valueOf(decision.getResetEpochSeconds()));
        if (decision.isLimited()) {
            response.setHeader("Retry-After", String.valueOf(decision.getRetryAfterSeconds()));
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("retryAfterSeconds", decision.getRetryAfterSeconds());
            throw new CheckoutException(CheckoutErrorCode.RATE_LIMITED, Map.of("details", details));
        }
    }

    static String getClientIp(HttpServletRequest request) {
        String xff = request.getHeader("X-Forwarded-For");
        if (xff != null && !xff.isBlank()) {
            return xff.split(",")[0].trim();
        }
        String xri = request.getHeader("X-Real-IP");
        if (xri != null && !xri.isBlank()) return xri.trim();
        return request.getRemoteAddr();
    }
}
