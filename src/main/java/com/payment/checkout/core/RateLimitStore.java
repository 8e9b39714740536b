package com.payment.checkout.core;

import lombok.Value;

/**
 * Fixed-window counter store for {@link CheckoutRateLimiter}.
 */
public interface RateLimitStore {

    /**
     * Count one hit for {@code key}, opening a new window of {@code windowMs} when none is active.
     */
    RateLimitState increment(String key, long windowMs, long nowMs);

    @Value
    class RateLimitState {
        long count;
        long resetAtMs;
    }
}
