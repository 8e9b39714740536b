package com.payment.checkout.config;

import com.payment.checkout.core.RedisRateLimitStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis-backed rate-limit counters, shared across instances. Only wired when
 * {@code payment.rate-limit.redis-enabled=true}; otherwise each instance counts in memory.
 */
@Configuration
public class RedisConfig {

    @Bean
    @ConditionalOnProperty(name = "payment.rate-limit.redis-enabled", havingValue = "true")
    public RedisRateLimitStore redisRateLimitStore(StringRedisTemplate stringRedisTemplate) {
        return new RedisRateLimitStore(stringRedisTemplate);
    }
}
