package com.payment.checkout.persistence.store;

import com.payment.checkout.domain.CourseOffer;
import com.payment.checkout.domain.CustomerContact;
import com.payment.checkout.domain.NewCheckout;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class CheckoutInsertAttemptTest {

    static final String LEAD_ID = "3f2b8c1e-6a4d-4b7e-9c2a-1d5e8f0a7b3c";
    static final String COURSE_ID = "8d0e7a52-1c3f-4e6b-a9d8-2b4c6e8f0a1d";

    @Test
    void planNarrowsColumnsStepByStep() {
        assertThat(CheckoutInsertAttempt.plan(true)).containsExactly(
                new CheckoutInsertAttempt(true, true),
                new CheckoutInsertAttempt(true, false),
                new CheckoutInsertAttempt(false, false));
    }

    @Test
    void planWithoutKeyColumnSkipsTheKeyedAttempt() {
        assertThat(CheckoutInsertAttempt.plan(false)).containsExactly(
                new CheckoutInsertAttempt(true, false),
                new CheckoutInsertAttempt(false, false));
    }

    @Test
    void fullStatementCarriesLeadAndKey() {
        CheckoutInsertAttempt.InsertStatement statement =
                new CheckoutInsertAttempt(true, true).toStatement(newCheckout(), "{\"stage\":\"initiated\"}");

        assertThat(statement.getSql())
                .startsWith("insert into payment_checkouts (lead_id, course_id,")
                .contains("idempotency_key, source_url, provider_response)")
                .endsWith("?::jsonb) returning id");
        List<Object> params = List.of(statement.getParams());
        assertThat(params).hasSize(18);
        assertThat(params.get(0)).isEqualTo(UUID.fromString(LEAD_ID));
        assertThat(params.get(1)).isEqualTo(UUID.fromString(COURSE_ID));
        assertThat(params).contains("processing", "order:12345678", "{\"stage\":\"initiated\"}");
    }

    @Test
    void reducedStatementOmitsLeadAndKey() {
        CheckoutInsertAttempt.InsertStatement statement =
                new CheckoutInsertAttempt(false, false).toStatement(newCheckout(), "{}");

        assertThat(statement.getSql()).doesNotContain("lead_id").doesNotContain("idempotency_key");
        assertThat(statement.getParams()).hasSize(16);
        assertThat(statement.getParams()[0]).isEqualTo(UUID.fromString(COURSE_ID));
    }

    static NewCheckout newCheckout() {
        return NewCheckout.builder()
                .leadId(LEAD_ID)
                .course(CourseOffer.builder().id(COURSE_ID).slug("direito-digital").name("Direito Digital").priceCents(129_900).build())
                .amountCents(129_900)
                .installments(3)
                .reference("chk-direito-digital-0123456789abcd")
                .customer(CustomerContact.builder().name("Maria Silva").email("maria@example.com").phone("11987654321").build())
                .cardHolderName("MARIA SILVA")
                .cardLast4("4242")
                .cardBin("424242")
                .sourceUrl("https://escola.example/checkout")
                .idempotencyKey("order:12345678")
                .build();
    }
}
