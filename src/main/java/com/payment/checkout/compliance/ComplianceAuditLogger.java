package com.payment.checkout.compliance;

import com.payment.checkout.domain.CardInstrument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Audit trail of checkout attempts and outcomes. Card data only ever appears masked.
 */
@Slf4j
@Component
public class ComplianceAuditLogger {

    public void logAttempt(String checkoutId, String idempotencyKey, String reference, int amountCents,
                           int installments, CardInstrument card, String providerMode) {
        log.info("[AUDIT] CHECKOUT_ATTEMPT checkoutId={} idempotencyKey={} reference={} amountCents={} installments={} card={} mode={}",
                checkoutId, idempotencyKey, reference, amountCents, installments,
                CardDataMasker.maskCard(card.getNumber()), providerMode);
    }

    public void logOutcome(String checkoutId, String idempotencyKey, String status, String returnCode, String tid) {
        log.info("[AUDIT] CHECKOUT_RESULT checkoutId={} idempotencyKey={} status={} returnCode={} tid={}",
                checkoutId, idempotencyKey, status, returnCode, tid);
    }

    public void logReplay(String checkoutId, String idempotencyKey, String status) {
        log.info("[AUDIT] CHECKOUT_REPLAY checkoutId={} idempotencyKey={} status={}", checkoutId, idempotencyKey, status);
    }
}
