package com.payment.checkout.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.checkout.domain.CheckoutCommand;

import java.util.List;

/**
 * Resolves the accepted field aliases of a checkout body into a {@link CheckoutCommand}.
 * Each field has an ordered list of JSON pointers; the first one holding a non-blank scalar wins.
 */
public final class CheckoutRequestParser {

    static final List<String> COURSE_SLUG = List.of("/course_slug", "/courseSlug", "/course");
    static final List<String> LEAD_ID = List.of("/lead_id", "/leadId", "/lead");
    static final List<String> CUSTOMER_NAME = List.of("/customer/name", "/name");
    static final List<String> CUSTOMER_EMAIL = List.of("/customer/email", "/email");
    static final List<String> CUSTOMER_PHONE = List.of("/customer/phone", "/phone", "/telefone");
    static final List<String> CUSTOMER_CPF = List.of("/customer/cpf", "/cpf");
    static final List<String> CARD_HOLDER_NAME = List.of("/card/holder_name", "/card_holder_name", "/cardHolderName");
    static final List<String> CARD_NUMBER = List.of("/card/number", "/card_number", "/cardNumber");
    static final List<String> CARD_CVV = List.of("/card/cvv", "/card_cvv", "/cardCvv");
    static final List<String> CARD_EXP_MONTH = List.of("/card/exp_month", "/card_expiration_month", "/expirationMonth");
    static final List<String> CARD_EXP_YEAR = List.of("/card/exp_year", "/card_expiration_year", "/expirationYear");
    static final List<String> INSTALLMENTS = List.of("/installments");
    static final List<String> REFERENCE = List.of("/reference");
    static final List<String> IDEMPOTENCY_KEY = List.of("/idempotency_key", "/idempotencyKey");
    static final List<String> SOURCE_URL = List.of("/source_url", "/sourceUrl");

    private CheckoutRequestParser() {}

    /**
     * @param body               request body; null or non-object bodies yield a command with no fields
     * @param idempotencyHeader  {@code Idempotency-Key} header, preferred over the body key
     * @param referer            {@code Referer} header, used when the body has no source url
     */
    public static CheckoutCommand parse(JsonNode body, String idempotencyHeader, String referer) {
        JsonNode root = body != null && body.isObject() ? body : null;
        return CheckoutCommand.builder()
                .courseSlug(first(root, COURSE_SLUG))
                .leadId(first(root, LEAD_ID))
                .customerName(first(root, CUSTOMER_NAME))
                .customerEmail(first(root, CUSTOMER_EMAIL))
                .customerPhone(first(root, CUSTOMER_PHONE))
                .customerCpf(first(root, CUSTOMER_CPF))
                .cardHolderName(first(root, CARD_HOLDER_NAME))
                .cardNumber(first(root, CARD_NUMBER))
                .cardCvv(first(root, CARD_CVV))
                .cardExpirationMonth(first(root, CARD_EXP_MONTH))
                .cardExpirationYear(first(root, CARD_EXP_YEAR))
                .installments(first(root, INSTALLMENTS))
                .reference(first(root, REFERENCE))
                .idempotencyKey(nonBlank(idempotencyHeader) != null ? idempotencyHeader.trim() : first(root, IDEMPOTENCY_KEY))
                .sourceUrl(first(root, SOURCE_URL) != null ? first(root, SOURCE_URL) : nonBlank(referer))
                .build();
    }

    static String first(JsonNode root, List<String> pointers) {
        if (root == null) return null;
        for (String pointer : pointers) {
            JsonNode node = root.at(pointer);
            if (node.isValueNode() && !node.isNull()) {
                String text = nonBlank(node.asText());
                if (text != null) return text;
            }
        }
        return null;
    }

    private static String nonBlank(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
