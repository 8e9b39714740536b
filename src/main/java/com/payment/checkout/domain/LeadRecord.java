package com.payment.checkout.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Enrollment lead as read for checkout, including its payment projection.
 * Payment fields are null when the lead table predates the payment columns.
 */
@Value
@Builder(toBuilder = true)
public class LeadRecord {

    String id;
    String courseId;
    String courseSlug;
    String courseName;
    Integer coursePriceCents;
    String customerName;
    String customerEmail;
    String customerPhone;
    String cpf;
    String city;
    String state;
    String paymentStatus;
    String paymentReference;
    String paymentTid;
    String paymentReturnCode;
    String paymentReturnMessage;

    public boolean isPaid() {
        return CheckoutStatus.APPROVED.wireValue().equals(paymentStatus);
    }

    public boolean hasPaymentInFlight() {
        return CheckoutStatus.fromWire(paymentStatus).map(status -> !status.isTerminal()).orElse(false);
    }

    /** Human-facing enrollment code: {@code MAT-} plus the first 8 alphanumerics of the id, upper-cased. */
    public String code() {
        if (id == null) return "";
        String normalized = id.replaceAll("[^a-zA-Z0-9]", "").toUpperCase();
        if (normalized.isEmpty()) return "";
        return "MAT-" + normalized.substring(0, Math.min(8, normalized.length()));
    }
}
