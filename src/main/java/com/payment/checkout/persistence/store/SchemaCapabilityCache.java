package com.payment.checkout.persistence.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * What this process believes about the {@code payment_checkouts.idempotency_key} column.
 * <p>
 * After a failed repair the column is treated as unavailable and no new repair starts until the
 * cooldown has passed. A successful key lookup marks it ready at any time.
 */
@Slf4j
@Component
public class SchemaCapabilityCache {

    enum State { UNKNOWN, READY, UNAVAILABLE }

    private final long cooldownMs;
    private volatile State state = State.UNKNOWN;
    private volatile long lastRepairAttemptAt;

    public SchemaCapabilityCache(@Value("${payment.idempotency.schema-retry-cooldown-ms:300000}") long cooldownMs) {
        this.cooldownMs = cooldownMs;
    }

    public boolean isReady() {
        return state == State.READY;
    }

    public void markReady() {
        if (state != State.READY) {
            log.info("Idempotency key column available");
        }
        state = State.READY;
    }

    /** A key lookup hit a missing column; a stale READY must not short-circuit the next repair. */
    public void markKeyColumnMissing() {
        if (state == State.READY) {
            state = State.UNKNOWN;
        }
    }

    public void markUnavailable(long nowMs) {
        state = State.UNAVAILABLE;
        lastRepairAttemptAt = nowMs;
    }

    public void recordRepairAttempt(long nowMs) {
        lastRepairAttemptAt = nowMs;
    }

    /** True while a failed repair is inside its cooldown. */
    public boolean inCooldown(long nowMs) {
        return state == State.UNAVAILABLE && nowMs - lastRepairAttemptAt < cooldownMs;
    }

    State state() {
        return state;
    }
}
