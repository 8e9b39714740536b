package com.payment.checkout.persistence.store;

import com.payment.checkout.domain.LeadRecord;
import com.payment.checkout.domain.PaymentProjection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link LeadPaymentStore} over {@code lead_enrollments}. Leads created before the payment columns existed
 * are read with null payment fields.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcLeadPaymentStore implements LeadPaymentStore {

    private static final String BASE_COLUMNS = """
            id,
            course_id,
            course_slug,
            course_name,
            course_price_cents,
            customer_name,
            customer_email,
            customer_phone,
            cpf,
            nullif(trim(coalesce(address ->> 'city', '')), '') as city,
            nullif(trim(coalesce(address ->> 'state', '')), '') as state,
            """;

    static final String FIND_SQL = "select " + BASE_COLUMNS + """
            payment_status,
            payment_reference,
            payment_tid,
            payment_return_code,
            payment_return_message
            from lead_enrollments where id = ? limit 1""";

    static final String FIND_LEGACY_SQL = "select " + BASE_COLUMNS + """
            null::text as payment_status,
            null::text as payment_reference,
            null::text as payment_tid,
            null::text as payment_return_code,
            null::text as payment_return_message
            from lead_enrollments where id = ? limit 1""";

    static final String RECORD_PAYMENT_SQL = """
            update lead_enrollments
               set payment_status = ?,
                   payment_reference = ?,
                   payment_tid = ?,
                   payment_return_code = ?,
                   payment_return_message = ?,
                   payment_updated_at = now(),
                   paid_at = case when ? = 'approved' then coalesce(paid_at, now()) else paid_at end
             where id = ?""";

    private static final RowMapper<LeadRecord> ROW_MAPPER = (rs, rowNum) -> LeadRecord.builder()
            .id(rs.getString("id"))
            .courseId(rs.getString("course_id"))
            .courseSlug(rs.getString("course_slug"))
            .courseName(rs.getString("course_name"))
            .coursePriceCents((Integer) rs.getObject("course_price_cents"))
            .customerName(rs.getString("customer_name"))
            .customerEmail(rs.getString("customer_email"))
            .customerPhone(rs.getString("customer_phone"))
            .cpf(rs.getString("cpf"))
            .city(rs.getString("city"))
            .state(rs.getString("state"))
            .paymentStatus(rs.getString("payment_status"))
            .paymentReference(rs.getString("payment_reference"))
            .paymentTid(rs.getString("payment_tid"))
            .paymentReturnCode(rs.getString("payment_return_code"))
            .paymentReturnMessage(rs.getString("payment_return_message"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Optional<LeadRecord> findById(String leadId) {
        UUID id = UUID.fromString(leadId);
        List<LeadRecord> rows;
        try {
            rows = jdbcTemplate.query(FIND_SQL, ROW_MAPPER, id);
        } catch (DataAccessException e) {
            if (!SqlStateClassifier.isUndefinedColumn(e)) throw e;
            log.warn("lead_enrollments has no payment columns; reading lead without payment state");
            rows = jdbcTemplate.query(FIND_LEGACY_SQL, ROW_MAPPER, id);
        }
        return rows.stream().findFirst();
    }

    @Override
    public void recordPayment(String leadId, PaymentProjection projection) {
        jdbcTemplate.update(RECORD_PAYMENT_SQL,
                projection.getStatus(),
                projection.getReference(),
                projection.getTid(),
                projection.getReturnCode(),
                projection.getReturnMessage(),
                projection.getStatus(),
                UUID.fromString(leadId));
    }
}
