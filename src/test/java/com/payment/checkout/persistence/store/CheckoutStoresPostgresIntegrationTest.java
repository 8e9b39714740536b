package com.payment.checkout.persistence.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.checkout.domain.CheckoutRecord;
import com.payment.checkout.domain.CheckoutSettlement;
import com.payment.checkout.domain.CheckoutStatus;
import com.payment.checkout.domain.CourseOffer;
import com.payment.checkout.domain.CustomerContact;
import com.payment.checkout.domain.LeadRecord;
import com.payment.checkout.domain.NewCheckout;
import com.payment.checkout.domain.PaymentProjection;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * JDBC stores against a real Postgres whose {@code payment_checkouts} starts without the idempotency column.
 * Requires Docker. Run with: mvn test -Dtest.excludedGroups=
 */
@Tag("integration")
@Testcontainers(disabledWithoutDocker = true)
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class CheckoutStoresPostgresIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine");

    private static JdbcTemplate jdbcTemplate;
    private static JdbcCheckoutRecordStore checkoutStore;
    private static JdbcLeadPaymentStore leadStore;
    private static String courseId;
    private static String leadId;

    @BeforeAll
    static void createSchemaWithoutIdempotencyColumn() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        new ResourceDatabasePopulator(
                new ClassPathResource("db/schema/V1__courses.sql"),
                new ClassPathResource("db/schema/V2__lead_enrollments.sql"),
                new ClassPathResource("db/schema/V3__payment_checkouts.sql"),
                new ClassPathResource("db/schema/V4__lead_payment_link.sql"))
                .execute(dataSource);

        jdbcTemplate = new JdbcTemplate(dataSource);
        SchemaCapabilityCache capabilityCache = new SchemaCapabilityCache(300_000L);
        checkoutStore = new JdbcCheckoutRecordStore(jdbcTemplate, new ObjectMapper(), capabilityCache,
                new CheckoutSchemaRepairer(jdbcTemplate, capabilityCache, Clock.systemUTC()));
        leadStore = new JdbcLeadPaymentStore(jdbcTemplate);

        courseId = jdbcTemplate.queryForObject("""
                insert into public.courses (slug, name, price_cents) values ('direito-digital', 'Direito Digital', 129900)
                returning id::text
                """, String.class);
        leadId = jdbcTemplate.queryForObject("""
                insert into public.lead_enrollments
                  (course_id, course_slug, course_name, course_price_cents, customer_name, customer_email, customer_phone,
                   father_name, mother_name, address)
                values (?::uuid, 'direito-digital', 'Direito Digital', 129900, 'Maria Silva', 'maria@example.com',
                        '11987654321', 'Jose Silva', 'Ana Silva', '{"city": "Sao Paulo", "state": "SP"}'::jsonb)
                returning id::text
                """, String.class, courseId);
    }

    @BeforeEach
    void resetCheckouts() {
        jdbcTemplate.update("delete from public.payment_checkouts where reference like 'it-%'");
    }

    @Test
    @Order(1)
    @DisplayName("Without the key column, lookup reports it and insert falls back to reference-only")
    void legacyTableFallsBackToReference() {
        assertThat(checkoutStore.findByIdempotencyKey("it-key-00001").isKeyColumnAvailable()).isFalse();

        InsertOutcome outcome = checkoutStore.insertProcessing(newCheckout("it-ref-1", "it-key-00001"), false);

        assertThat(outcome.isIdempotencyPersisted()).isFalse();
        Optional<CheckoutRecord> byReference = checkoutStore.findByReference("it-ref-1", leadId);
        assertThat(byReference).isPresent();
        assertThat(byReference.get().getId()).isEqualTo(outcome.getCheckoutId());
        assertThat(byReference.get().getStatus()).isEqualTo("processing");
        assertThat(byReference.get().getLeadId()).isEqualTo(leadId);
    }

    @Test
    @Order(2)
    @DisplayName("Repair adds the key column, after which a duplicate key returns the first checkout")
    void repairedTableDeduplicatesByKey() {
        assertThat(checkoutStore.ensureIdempotencySchema()).isTrue();
        assertThat(checkoutStore.findByIdempotencyKey("it-key-00002").isKeyColumnAvailable()).isTrue();

        InsertOutcome first = checkoutStore.insertProcessing(newCheckout("it-ref-2", "it-key-00002"), true);
        InsertOutcome second = checkoutStore.insertProcessing(newCheckout("it-ref-2", "it-key-00002"), true);

        assertThat(first.isIdempotencyPersisted()).isTrue();
        assertThat(first.isReused()).isFalse();
        assertThat(second.isReused()).isTrue();
        assertThat(second.getCheckoutId()).isEqualTo(first.getCheckoutId());
    }

    @Test
    @Order(3)
    @DisplayName("Settlement is written to the checkout and projected onto the lead")
    void settlementUpdatesCheckoutAndLead() {
        InsertOutcome created = checkoutStore.insertProcessing(newCheckout("it-ref-3", "it-key-00003"), true);
        checkoutStore.updateResult(created.getCheckoutId(), CheckoutSettlement.builder()
                .status(CheckoutStatus.APPROVED)
                .providerHttpStatus(200)
                .returnCode("00")
                .returnMessage("Success.")
                .tid("T-IT-3")
                .authorizationCode("A1B2C3")
                .providerResponse(Map.of("returnCode", "00", "tid", "T-IT-3"))
                .build());
        leadStore.recordPayment(leadId, PaymentProjection.builder()
                .status("approved").reference("it-ref-3").tid("T-IT-3").returnCode("00").build());

        CheckoutRecord stored = checkoutStore.findByIdempotencyKey("it-key-00003")
                .existing().orElseThrow();
        assertThat(stored.getStatus()).isEqualTo("approved");
        assertThat(stored.getTid()).isEqualTo("T-IT-3");
        assertThat(stored.getAmountCents()).isEqualTo(129_900);

        LeadRecord lead = leadStore.findById(leadId).orElseThrow();
        assertThat(lead.isPaid()).isTrue();
        assertThat(lead.getPaymentTid()).isEqualTo("T-IT-3");
        assertThat(lead.getCity()).isEqualTo("Sao Paulo");
        assertThat(jdbcTemplate.queryForObject(
                "select paid_at is not null from public.lead_enrollments where id = ?::uuid", Boolean.class, leadId)).isTrue();
    }

    @Test
    @Order(4)
    void providerFailureIsRecorded() {
        InsertOutcome created = checkoutStore.insertProcessing(newCheckout("it-ref-4", "it-key-00004"), true);

        checkoutStore.markProviderUnavailable(created.getCheckoutId(), "Provider request failed (mock)");

        CheckoutRecord stored = checkoutStore.findByIdempotencyKey("it-key-00004")
                .existing().orElseThrow();
        assertThat(stored.getStatus()).isEqualTo("provider_unavailable");
        assertThat(stored.getReturnMessage()).isEqualTo("Provider request failed (mock)");
    }

    @Test
    @Order(5)
    @DisplayName("A settled checkout never moves again")
    void settledCheckoutIsNotOverwritten() {
        InsertOutcome created = checkoutStore.insertProcessing(newCheckout("it-ref-5", "it-key-00005"), true);
        checkoutStore.updateResult(created.getCheckoutId(), CheckoutSettlement.builder()
                .status(CheckoutStatus.DECLINED)
                .providerHttpStatus(200)
                .returnCode("05")
                .providerResponse(Map.of("returnCode", "05"))
                .build());

        checkoutStore.markProviderUnavailable(created.getCheckoutId(), "Provider request failed (rede)");
        checkoutStore.updateResult(created.getCheckoutId(), CheckoutSettlement.builder()
                .status(CheckoutStatus.APPROVED)
                .providerHttpStatus(200)
                .returnCode("00")
                .providerResponse(Map.of("returnCode", "00"))
                .build());

        CheckoutRecord stored = checkoutStore.findByIdempotencyKey("it-key-00005").existing().orElseThrow();
        assertThat(stored.getStatus()).isEqualTo("declined");
        assertThat(stored.getReturnCode()).isEqualTo("05");
    }

    private static NewCheckout newCheckout(String reference, String idempotencyKey) {
        return NewCheckout.builder()
                .leadId(leadId)
                .course(CourseOffer.builder().id(courseId).slug("direito-digital").name("Direito Digital").priceCents(129_900).build())
                .amountCents(129_900)
                .installments(3)
                .reference(reference)
                .customer(CustomerContact.builder().name("Maria Silva").email("maria@example.com").phone("11987654321").build())
                .cardHolderName("MARIA S")
                .cardLast4("4242")
                .cardBin("424242")
                .sourceUrl("https://escola.example/checkout")
                .idempotencyKey(idempotencyKey)
                .build();
    }
}
