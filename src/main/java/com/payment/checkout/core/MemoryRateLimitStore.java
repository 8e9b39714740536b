package com.payment.checkout.core;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-process counters. Expired windows are swept at most once a minute.
 */
public class MemoryRateLimitStore implements RateLimitStore {

    private static final long CLEANUP_INTERVAL_MS = 60_000L;

    private final Map<String, RateLimitState> buckets = new ConcurrentHashMap<>();
    private volatile long lastCleanupAt;

    @Override
    public RateLimitState increment(String key, long windowMs, long nowMs) {
        cleanupExpired(nowMs);
        return buckets.compute(key, (k, existing) -> {
            if (existing == null || existing.getResetAtMs() <= nowMs) {
                return new RateLimitState(1, nowMs + windowMs);
            }
            return new RateLimitState(existing.getCount() + 1, existing.getResetAtMs());
        });
    }

    int size() {
        return buckets.size();
    }

    private void cleanupExpired(long nowMs) {
        if (nowMs - lastCleanupAt < CLEANUP_INTERVAL_MS) return;
        lastCleanupAt = nowMs;
        buckets.entrySet().removeIf(e -> e.getValue().getResetAtMs() <= nowMs);
    }
}
