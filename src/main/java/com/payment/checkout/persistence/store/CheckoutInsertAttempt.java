package com.payment.checkout.persistence.store;

import com.payment.checkout.domain.CheckoutStatus;
import com.payment.checkout.domain.NewCheckout;
import lombok.Value;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;

/**
 * One column set to try when inserting a checkout. Older schemas lack {@code lead_id} and/or
 * {@code idempotency_key}; the store walks {@link #plan(boolean)} until one set is accepted.
 */
@Value
public class CheckoutInsertAttempt {

    boolean includeLeadId;
    boolean includeIdempotencyKey;

    /**
     * Attempts in order: everything, without the key, without the lead. Duplicates are dropped, so with
     * the key column unavailable the plan starts at the second step.
     */
    public static List<CheckoutInsertAttempt> plan(boolean keyColumnAvailable) {
        LinkedHashSet<CheckoutInsertAttempt> attempts = new LinkedHashSet<>();
        attempts.add(new CheckoutInsertAttempt(true, keyColumnAvailable));
        attempts.add(new CheckoutInsertAttempt(true, false));
        attempts.add(new CheckoutInsertAttempt(false, false));
        return new ArrayList<>(attempts);
    }

    public InsertStatement toStatement(NewCheckout checkout, String initialProviderResponseJson) {
        List<String> columns = new ArrayList<>();
        List<Object> params = new ArrayList<>();

        if (includeLeadId) {
            columns.add("lead_id");
            params.add(uuidOrNull(checkout.getLeadId()));
        }
        columns.addAll(List.of("course_id", "course_slug", "course_name", "amount_cents", "installments",
                "reference", "status", "customer_name", "customer_email", "customer_phone", "customer_cpf",
                "card_holder_name", "card_last4", "card_bin"));
        params.add(uuidOrNull(checkout.getCourse().getId()));
        params.add(checkout.getCourse().getSlug());
        params.add(checkout.getCourse().getName());
        params.add(checkout.getAmountCents());
        params.add(checkout.getInstallments());
        params.add(checkout.getReference());
        params.add(CheckoutStatus.PROCESSING.wireValue());
        params.add(checkout.getCustomer().getName());
        params.add(checkout.getCustomer().getEmail());
        params.add(checkout.getCustomer().getPhone());
        params.add(checkout.getCustomer().getCpf());
        params.add(checkout.getCardHolderName());
        params.add(checkout.getCardLast4());
        params.add(checkout.getCardBin());

        if (includeIdempotencyKey) {
            columns.add("idempotency_key");
            params.add(checkout.getIdempotencyKey());
        }
        columns.add("source_url");
        params.add(checkout.getSourceUrl());
        columns.add("provider_response");
        params.add(initialProviderResponseJson);

        StringBuilder placeholders = new StringBuilder();
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) placeholders.append(", ");
            placeholders.append(i == columns.size() - 1 ? "?::jsonb" : "?");
        }
        String sql = "insert into payment_checkouts (" + String.join(", ", columns) + ") values ("
                + placeholders + ") returning id";
        return new InsertStatement(sql, params.toArray());
    }

    private static UUID uuidOrNull(String value) {
        return value == null ? null : UUID.fromString(value);
    }

    @Value
    public static class InsertStatement {
        String sql;
        Object[] params;
    }
}
