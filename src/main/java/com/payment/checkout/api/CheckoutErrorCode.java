package com.payment.checkout.api;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Error codes returned by the checkout API. The code is the wire value clients branch on.
 */
@Getter
public enum CheckoutErrorCode {

    // request input
    INVALID_JSON("invalid_json", "Request body is not valid JSON.", HttpStatus.BAD_REQUEST),
    METHOD_NOT_ALLOWED("method_not_allowed", "Method is not allowed.", HttpStatus.METHOD_NOT_ALLOWED),
    INVALID_COURSE("invalid_course", "Course slug is required.", HttpStatus.BAD_REQUEST),
    MISSING_LEAD_ID("missing_lead_id", "Lead id is required.", HttpStatus.BAD_REQUEST),
    INVALID_LEAD_ID("invalid_lead_id", "Lead id must be a UUID.", HttpStatus.BAD_REQUEST),
    INVALID_LEAD("invalid_lead", "Lead not found.", HttpStatus.BAD_REQUEST),
    LEAD_COURSE_MISMATCH("lead_course_mismatch", "Lead is enrolled in a different course.", HttpStatus.BAD_REQUEST),
    INVALID_CUSTOMER_NAME("invalid_customer_name", "Customer name is required.", HttpStatus.BAD_REQUEST),
    INVALID_CUSTOMER_EMAIL("invalid_customer_email", "Customer email is invalid.", HttpStatus.BAD_REQUEST),
    INVALID_CUSTOMER_PHONE("invalid_customer_phone", "Customer phone must have 10 to 13 digits.", HttpStatus.BAD_REQUEST),
    INVALID_CUSTOMER_CPF("invalid_customer_cpf", "Customer CPF must have 11 digits.", HttpStatus.BAD_REQUEST),
    INVALID_CARD_HOLDER_NAME("invalid_card_holder_name", "Card holder name is required.", HttpStatus.BAD_REQUEST),
    INVALID_CARD_NUMBER("invalid_card_number", "Card number is invalid.", HttpStatus.BAD_REQUEST),
    INVALID_CARD_CVV("invalid_card_cvv", "Card security code must have 3 or 4 digits.", HttpStatus.BAD_REQUEST),
    INVALID_CARD_EXPIRATION("invalid_card_expiration", "Card expiration is invalid.", HttpStatus.BAD_REQUEST),
    EXPIRED_CARD("expired_card", "Card is expired.", HttpStatus.BAD_REQUEST),
    UNKNOWN_COURSE("unknown_course", "Course not found for this lead.", HttpStatus.BAD_REQUEST),
    INVALID_COURSE_AMOUNT("invalid_course_amount", "Course has no chargeable price.", HttpStatus.BAD_REQUEST),
    INVALID_IDEMPOTENCY_KEY("invalid_idempotency_key", "Idempotency key must have at least 8 valid characters.", HttpStatus.BAD_REQUEST),

    // state conflicts
    PAYMENT_IN_PROGRESS("payment_in_progress", "A payment for this lead is already in progress.", HttpStatus.CONFLICT),
    IDEMPOTENCY_KEY_CONFLICT("idempotency_key_conflict", "Idempotency key already used by another lead.", HttpStatus.CONFLICT),

    // upstream
    PAYMENT_PROVIDER_UNAVAILABLE("payment_provider_unavailable", "Payment provider is unavailable. Retry with the same idempotency key.", HttpStatus.BAD_GATEWAY),
    RATE_LIMITED("rate_limited", "Too many requests. Please retry later.", HttpStatus.TOO_MANY_REQUESTS),

    // configuration
    PAYMENT_PROVIDER_MODE_INVALID("payment_provider_mode_invalid", "Payment provider mode is misconfigured.", HttpStatus.INTERNAL_SERVER_ERROR),
    PAYMENT_PROVIDER_NOT_CONFIGURED("payment_provider_not_configured", "Payment provider credentials are missing.", HttpStatus.INTERNAL_SERVER_ERROR),
    PAYMENT_PROVIDER_ENVIRONMENT_MISMATCH("payment_provider_environment_mismatch", "Payment provider environment does not match the runtime.", HttpStatus.INTERNAL_SERVER_ERROR),
    PAYMENT_PROVIDER_CREDENTIALS_INVALID("payment_provider_credentials_invalid", "Payment provider rejected the credentials.", HttpStatus.INTERNAL_SERVER_ERROR),

    // persistence and infrastructure
    LEAD_FETCH_FAILED("lead_fetch_failed", "Failed to load lead.", HttpStatus.INTERNAL_SERVER_ERROR),
    COURSES_FETCH_FAILED("courses_fetch_failed", "Failed to fetch courses.", HttpStatus.INTERNAL_SERVER_ERROR),
    PAYMENT_IDEMPOTENCY_LOOKUP_FAILED("payment_idempotency_lookup_failed", "Failed to look up previous checkout.", HttpStatus.INTERNAL_SERVER_ERROR),
    PAYMENT_LOG_UNAVAILABLE("payment_log_unavailable", "Failed to record checkout before charging.", HttpStatus.INTERNAL_SERVER_ERROR),
    PAYMENT_CHECKOUT_SCHEMA_INCOMPATIBLE("payment_checkout_schema_incompatible", "Checkout table does not accept any known column set.", HttpStatus.INTERNAL_SERVER_ERROR),
    INTERNAL_ERROR("internal_error", "Unexpected internal error.", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String code;
    private final String message;
    private final HttpStatus status;

    CheckoutErrorCode(String code, String message, HttpStatus status) {
        this.code = code;
        this.message = message;
        this.status = status;
    }
}
