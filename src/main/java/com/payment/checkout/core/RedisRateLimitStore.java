package com.payment.checkout.core;

import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Counters in Redis: INCR, PEXPIRE on the first hit, and a PTTL check that repairs keys left without expiry.
 */
public class RedisRateLimitStore implements RateLimitStore {

    private final StringRedisTemplate redisTemplate;

    public RedisRateLimitStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public RateLimitState increment(String key, long windowMs, long nowMs) {
        Long count = redisTemplate.opsForValue().increment(key);
        if (count == null) {
            throw new IllegalStateException("Redis INCR returned no value for rate-limit key");
        }
        if (count == 1L) {
            redisTemplate.expire(key, Duration.ofMillis(windowMs));
        }
        Long ttlMs = redisTemplate.getExpire(key, TimeUnit.MILLISECONDS);
        if (ttlMs == null || ttlMs < 0) {
            redisTemplate.expire(key, Duration.ofMillis(windowMs));
            ttlMs = windowMs;
        }
        return new RateLimitState(count, nowMs + ttlMs);
    }
}
