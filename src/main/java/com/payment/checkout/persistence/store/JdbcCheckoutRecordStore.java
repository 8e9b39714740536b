package com.payment.checkout.persistence.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.checkout.domain.CheckoutRecord;
import com.payment.checkout.domain.CheckoutSettlement;
import com.payment.checkout.domain.CheckoutStatus;
import com.payment.checkout.domain.NewCheckout;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link CheckoutRecordStore} over {@code payment_checkouts} with plain JDBC.
 * <p>
 * Missing columns (SQLSTATE 42703) are expected on older deployments and handled per query:
 * key lookups report the column as unavailable, reference lookups drop the lead filter, and inserts
 * fall through {@link CheckoutInsertAttempt#plan(boolean)}.
 */
@Slf4j
@Repository
public class JdbcCheckoutRecordStore implements CheckoutRecordStore {

    private static final String STATE_COLUMNS = """
            id,
            %s,
            reference,
            status,
            amount_cents,
            installments,
            provider_tid,
            provider_return_code,
            provider_return_message,
            provider_authorization_code,
            provider_three_d_secure_url""";

    static final String FIND_BY_KEY_SQL = "select " + STATE_COLUMNS.formatted("lead_id")
            + " from payment_checkouts where idempotency_key = ? order by created_at desc limit 1";
    static final String FIND_BY_REFERENCE_SQL = "select " + STATE_COLUMNS.formatted("lead_id")
            + " from payment_checkouts where reference = ? and lead_id = ? order by created_at desc limit 1";
    static final String FIND_BY_REFERENCE_ONLY_SQL = "select " + STATE_COLUMNS.formatted("null::uuid as lead_id")
            + " from payment_checkouts where reference = ? order by created_at desc limit 1";

    static final String UPDATE_RESULT_SQL = """
            update payment_checkouts
               set status = ?,
                   provider_http_status = ?,
                   provider_return_code = ?,
                   provider_return_message = ?,
                   provider_tid = ?,
                   provider_authorization_code = ?,
                   provider_three_d_secure_url = ?,
                   brand_name = ?,
                   provider_response = ?::jsonb
             where id = ?
               and status = 'processing'""";
    static final String MARK_UNAVAILABLE_SQL = """
            update payment_checkouts
               set status = ?,
                   provider_return_message = ?,
                   provider_response = ?::jsonb
             where id = ?
               and status = 'processing'""";

    private static final RowMapper<CheckoutRecord> ROW_MAPPER = (rs, rowNum) -> CheckoutRecord.builder()
            .id(rs.getString("id"))
            .leadId(rs.getString("lead_id"))
            .reference(rs.getString("reference"))
            .status(rs.getString("status"))
            .amountCents((Integer) rs.getObject("amount_cents"))
            .installments((Integer) rs.getObject("installments"))
            .tid(rs.getString("provider_tid"))
            .returnCode(rs.getString("provider_return_code"))
            .returnMessage(rs.getString("provider_return_message"))
            .authorizationCode(rs.getString("provider_authorization_code"))
            .threeDSecureUrl(rs.getString("provider_three_d_secure_url"))
            .build();

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final SchemaCapabilityCache capabilityCache;
    private final CheckoutSchemaRepairer schemaRepairer;

    public JdbcCheckoutRecordStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper,
                                   SchemaCapabilityCache capabilityCache, CheckoutSchemaRepairer schemaRepairer) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.capabilityCache = capabilityCache;
        this.schemaRepairer = schemaRepairer;
    }

    @Override
    public IdempotencyLookup findByIdempotencyKey(String idempotencyKey) {
        try {
            List<CheckoutRecord> rows = jdbcTemplate.query(FIND_BY_KEY_SQL, ROW_MAPPER, idempotencyKey);
            capabilityCache.markReady();
            return IdempotencyLookup.found(rows.isEmpty() ? null : rows.get(0));
        } catch (DataAccessException e) {
            if (!SqlStateClassifier.isUndefinedColumn(e)) throw e;
            log.warn("Idempotency key column missing on payment_checkouts; key lookup unavailable");
            capabilityCache.markKeyColumnMissing();
            return IdempotencyLookup.unavailable();
        }
    }

    @Override
    public Optional<CheckoutRecord> findByReference(String reference, String leadId) {
        List<CheckoutRecord> rows;
        try {
            rows = jdbcTemplate.query(FIND_BY_REFERENCE_SQL, ROW_MAPPER, reference, UUID.fromString(leadId));
        } catch (DataAccessException e) {
            if (!SqlStateClassifier.isUndefinedColumn(e)) throw e;
            log.warn("lead_id column missing on payment_checkouts; matching by reference only");
            rows = jdbcTemplate.query(FIND_BY_REFERENCE_ONLY_SQL, ROW_MAPPER, reference);
        }
        return rows.stream().findFirst();
    }

    @Override
    public InsertOutcome insertProcessing(NewCheckout checkout, boolean keyColumnAvailable) {
        String initialResponse = toJson(initialProviderResponse(checkout));
        DataAccessException lastMissingColumn = null;

        for (CheckoutInsertAttempt attempt : CheckoutInsertAttempt.plan(keyColumnAvailable)) {
            CheckoutInsertAttempt.InsertStatement statement = attempt.toStatement(checkout, initialResponse);
            try {
                String id = jdbcTemplate.queryForObject(statement.getSql(), String.class, statement.getParams());
                if (!attempt.isIncludeLeadId() || !attempt.isIncludeIdempotencyKey()) {
                    log.warn("Checkout inserted with reduced columns: checkoutId={} leadId={} idempotencyKey={}",
                            id, attempt.isIncludeLeadId(), attempt.isIncludeIdempotencyKey());
                }
                return InsertOutcome.created(id, attempt.isIncludeIdempotencyKey());
            } catch (DataAccessException e) {
                if (attempt.isIncludeIdempotencyKey() && SqlStateClassifier.isUniqueViolation(e)) {
                    IdempotencyLookup winner = findByIdempotencyKey(checkout.getIdempotencyKey());
                    if (winner.getRecord() != null) {
                        log.info("Concurrent checkout won the insert race: idempotencyKey={} checkoutId={}",
                                checkout.getIdempotencyKey(), winner.getRecord().getId());
                        return InsertOutcome.reused(winner.getRecord());
                    }
                }
                if (SqlStateClassifier.isUndefinedColumn(e)) {
                    lastMissingColumn = e;
                    continue;
                }
                throw e;
            }
        }
        throw new CheckoutSchemaIncompatibleException(
                "payment_checkouts rejected every insert column set", lastMissingColumn);
    }

    @Override
    public boolean ensureIdempotencySchema() {
        return schemaRepairer.ensureIdempotencyColumn();
    }

    @Override
    public void updateResult(String checkoutId, CheckoutSettlement settlement) {
        int updated = jdbcTemplate.update(UPDATE_RESULT_SQL,
                settlement.getStatus().wireValue(),
                settlement.getProviderHttpStatus(),
                settlement.getReturnCode(),
                settlement.getReturnMessage(),
                settlement.getTid(),
                settlement.getAuthorizationCode(),
                settlement.getThreeDSecureUrl(),
                settlement.getBrandName(),
                toJson(settlement.getProviderResponse()),
                UUID.fromString(checkoutId));
        if (updated == 0) {
            log.warn("Checkout not in processing, result not written: checkoutId={} status={}",
                    checkoutId, settlement.getStatus().wireValue());
        }
    }

    @Override
    public void markProviderUnavailable(String checkoutId, String message) {
        int updated = jdbcTemplate.update(MARK_UNAVAILABLE_SQL,
                CheckoutStatus.PROVIDER_UNAVAILABLE.wireValue(),
                message,
                toJson(Map.of("error", CheckoutStatus.PROVIDER_UNAVAILABLE.wireValue())),
                UUID.fromString(checkoutId));
        if (updated == 0) {
            log.warn("Checkout not in processing, provider failure not written: checkoutId={}", checkoutId);
        }
    }

    private static Map<String, Object> initialProviderResponse(NewCheckout checkout) {
        Map<String, Object> initial = new LinkedHashMap<>();
        initial.put("stage", "initiated");
        initial.put("lead_id", checkout.getLeadId());
        return initial;
    }

    private String toJson(Map<String, Object> value) {
        try {
            return objectMapper.writeValueAsString(value == null ? Map.of() : value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize provider response", e);
        }
    }
}
