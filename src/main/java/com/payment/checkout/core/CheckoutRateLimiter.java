package com.payment.checkout.core;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fixed-window request limit per client IP, checked before any checkout work.
 * <p>
 * Counts go to Redis when a {@link RedisRateLimitStore} is wired, else to memory. Any Redis failure fails
 * open to the memory store for that request; the first failure is logged as a warning, later ones at debug.
 * IPs are hashed before they become keys.
 */
@Slf4j
@Service
public class CheckoutRateLimiter {

    private final RateLimitStore sharedStore;
    private final MemoryRateLimitStore memoryStore = new MemoryRateLimitStore();
    private final Clock clock;
    private final AtomicBoolean warnedSharedFailure = new AtomicBoolean();

    @Autowired
    public CheckoutRateLimiter(ObjectProvider<RedisRateLimitStore> redisStore, Clock clock) {
        this(redisStore.getIfAvailable(), clock);
    }

    CheckoutRateLimiter(RateLimitStore sharedStore, Clock clock) {
        this.sharedStore = sharedStore;
        this.clock = clock;
        log.info("Checkout rate limiter using {} store", sharedStore != null ? "redis" : "memory");
    }

    public RateLimitDecision check(String keyPrefix, String clientIp, long windowMs, int max) {
        long now = clock.millis();
        String key = keyPrefix + ":" + Digests.sha256Hex(clientIp == null ? "unknown" : clientIp).substring(0, 32);

        RateLimitStore.RateLimitState state;
        if (sharedStore == null) {
            state = memoryStore.increment(key, windowMs, now);
        } else {
            try {
                state = sharedStore.increment(key, windowMs, now);
            } catch (RuntimeException e) {
                if (warnedSharedFailure.compareAndSet(false, true)) {
                    log.warn("Rate-limit store failed, falling back to in-memory counters: {}", e.getMessage());
                } else {
                    log.debug("Rate-limit store failed again: {}", e.getMessage());
                }
                state = memoryStore.increment(key, windowMs, now);
            }
        }

        int remaining = (int) Math.max(0, max - state.getCount());
        long resetAtSeconds = (long) Math.ceil(state.getResetAtMs() / 1000.0);
        boolean limited = state.getCount() > max;
        long retryAfterSeconds = Math.max(1, (long) Math.ceil((state.getResetAtMs() - now) / 1000.0));
        if (limited) {
            log.warn("Rate limit exceeded: prefix={} count={} max={}", keyPrefix, state.getCount(), max);
        }
        return new RateLimitDecision(max, remaining, resetAtSeconds, limited, retryAfterSeconds);
    }

    @Value
    public static class RateLimitDecision {
        int limit;
        int remaining;
        long resetEpochSeconds;
        boolean limited;
        long retryAfterSeconds;
    }
}
