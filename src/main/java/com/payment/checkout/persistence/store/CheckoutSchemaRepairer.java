package com.payment.checkout.persistence.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Adds the idempotency column and its unique partial index when a deployment runs against an older schema.
 * <p>
 * All statements are {@code IF NOT EXISTS}, so instances racing on the same database are harmless. Inside one
 * process concurrent callers wait for the attempt already running instead of starting their own.
 */
@Slf4j
@Component
public class CheckoutSchemaRepairer {

    static final String COLUMN_EXISTS_SQL = """
            select exists (
                select 1
                from information_schema.columns
                where table_schema = 'public'
                  and table_name = 'payment_checkouts'
                  and column_name = 'idempotency_key'
            )""";
    static final String ADD_COLUMN_SQL =
            "alter table if exists public.payment_checkouts add column if not exists idempotency_key text";
    static final String UNIQUE_INDEX_SQL = """
            create unique index if not exists payment_checkouts_idempotency_key_uidx
                on public.payment_checkouts (idempotency_key)
                where idempotency_key is not null""";
    static final String STATUS_INDEX_SQL =
            "create index if not exists payment_checkouts_status_idx on public.payment_checkouts (status)";

    private final JdbcTemplate jdbcTemplate;
    private final SchemaCapabilityCache capabilityCache;
    private final Clock clock;
    private final AtomicReference<CompletableFuture<Boolean>> inFlight = new AtomicReference<>();

    public CheckoutSchemaRepairer(JdbcTemplate jdbcTemplate, SchemaCapabilityCache capabilityCache, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.capabilityCache = capabilityCache;
        this.clock = clock;
    }

    /**
     * @return true when the column and index exist afterwards; false when the repair failed or is cooling down
     */
    public boolean ensureIdempotencyColumn() {
        if (capabilityCache.isReady()) return true;
        if (capabilityCache.inCooldown(clock.millis())) {
            log.debug("Skipping idempotency schema repair: cooling down after a failed attempt");
            return false;
        }

        CompletableFuture<Boolean> mine = new CompletableFuture<>();
        CompletableFuture<Boolean> running = inFlight.compareAndExchange(null, mine);
        if (running != null) {
            return running.join();
        }
        try {
            boolean ready = repair();
            mine.complete(ready);
            return ready;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.set(null);
        }
    }

    private boolean repair() {
        capabilityCache.recordRepairAttempt(clock.millis());
        try {
            Boolean exists = jdbcTemplate.queryForObject(COLUMN_EXISTS_SQL, Boolean.class);
            if (!Boolean.TRUE.equals(exists)) {
                log.warn("payment_checkouts.idempotency_key missing; adding it");
                jdbcTemplate.execute(ADD_COLUMN_SQL);
            }
            jdbcTemplate.execute(UNIQUE_INDEX_SQL);
            jdbcTemplate.execute(STATUS_INDEX_SQL);
            capabilityCache.markReady();
            return true;
        } catch (DataAccessException e) {
            capabilityCache.markUnavailable(clock.millis());
            log.error("Failed to ensure idempotency schema; falling back to reference matching: {}", e.getMessage());
            return false;
        }
    }
}
