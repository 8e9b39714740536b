package com.payment.checkout.core;

import com.payment.checkout.api.CheckoutErrorCode;
import com.payment.checkout.api.CheckoutException;
import com.payment.checkout.domain.IdempotencyKey;
import com.payment.checkout.domain.PaymentIntent;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Locale;
import java.util.Optional;

/**
 * Turns whatever the client sent into the key that guards a checkout against double charging.
 * <p>
 * An explicit key is normalized to {@code [A-Za-z0-9._:-]}, at most 120 characters; if fewer than 8
 * characters survive the request is rejected rather than silently given another key. Without an explicit
 * key the payment intent is hashed together with a time bucket, so a retry of the same card for the same
 * course collapses onto one checkout within the bucket while a deliberate new attempt later gets a fresh key.
 */
@Component
public class IdempotencyKeyResolver {

    static final int MAX_KEY_LENGTH = 120;
    static final int MIN_KEY_LENGTH = 8;
    static final String AUTO_PREFIX = "auto-";

    private final Clock clock;
    private final long bucketMs;

    public IdempotencyKeyResolver(Clock clock,
                                  @Value("${payment.idempotency.bucket-ms:600000}") long bucketMs) {
        this.clock = clock;
        this.bucketMs = bucketMs;
    }

    /**
     * @param explicitRaw key from the {@code Idempotency-Key} header or body, or null
     * @throws CheckoutException {@code invalid_idempotency_key} when an explicit key normalizes to under 8 chars
     */
    public IdempotencyKey resolve(String explicitRaw, PaymentIntent intent) {
        boolean hasExplicit = explicitRaw != null && !explicitRaw.trim().isEmpty();
        if (hasExplicit) {
            return normalize(explicitRaw)
                    .map(IdempotencyKey::explicit)
                    .orElseThrow(() -> new CheckoutException(CheckoutErrorCode.INVALID_IDEMPOTENCY_KEY));
        }
        return IdempotencyKey.automatic(automaticKey(intent));
    }

    /** Normalized explicit key, or empty when blank or too short after normalization. */
    public static Optional<String> normalize(String raw) {
        if (raw == null) return Optional.empty();
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) return Optional.empty();
        String normalized = trimmed
                .replaceAll("[^a-zA-Z0-9._:-]", "-")
                .replaceAll("-+", "-");
        if (normalized.length() > MAX_KEY_LENGTH) {
            normalized = normalized.substring(0, MAX_KEY_LENGTH);
        }
        return normalized.length() < MIN_KEY_LENGTH ? Optional.empty() : Optional.of(normalized);
    }

    String automaticKey(PaymentIntent intent) {
        long bucket = Math.floorDiv(clock.millis(), bucketMs);
        String fingerprint = String.join("|",
                intent.getLeadId(),
                intent.getCourseSlug(),
                String.valueOf(intent.getAmountCents()),
                String.valueOf(intent.getInstallments()),
                intent.getCardBin(),
                intent.getCardLast4(),
                intent.getExpirationMonth(),
                intent.getExpirationYear(),
                String.valueOf(bucket));
        return AUTO_PREFIX + Digests.sha256Hex(fingerprint).substring(0, 48);
    }

    /**
     * Merchant reference sent to the gateway when the client gives none:
     * {@code chk-<course slug, max 16>-<first 14 hex of sha256(key)>}. Stable for a key, so the
     * reference doubles as a lookup handle when the key column is missing.
     */
    public String deriveReference(String courseSlug, String idempotencyKey) {
        String slug = (courseSlug == null ? "" : courseSlug)
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        if (slug.length() > 16) slug = slug.substring(0, 16);
        if (slug.isEmpty()) slug = "course";
        return "chk-" + slug + "-" + Digests.sha256Hex(idempotencyKey).substring(0, 14);
    }
}
