package com.payment.checkout.core;

import com.payment.checkout.api.CheckoutErrorCode;
import com.payment.checkout.api.CheckoutException;
import com.payment.checkout.compliance.ComplianceAuditLogger;
import com.payment.checkout.config.GatewaySettings;
import com.payment.checkout.domain.CardInstrument;
import com.payment.checkout.domain.CheckoutCommand;
import com.payment.checkout.domain.CheckoutOutcome;
import com.payment.checkout.domain.CheckoutRecord;
import com.payment.checkout.domain.CheckoutSettlement;
import com.payment.checkout.domain.CheckoutStatus;
import com.payment.checkout.domain.CourseOffer;
import com.payment.checkout.domain.CustomerContact;
import com.payment.checkout.domain.FieldSanitizer;
import com.payment.checkout.domain.GatewayChargeRequest;
import com.payment.checkout.domain.GatewayChargeResult;
import com.payment.checkout.domain.IdempotencyKey;
import com.payment.checkout.domain.LeadRecord;
import com.payment.checkout.domain.LiveGatewayConfig;
import com.payment.checkout.domain.NewCheckout;
import com.payment.checkout.domain.PaymentIntent;
import com.payment.checkout.domain.PaymentProjection;
import com.payment.checkout.domain.ProviderMode;
import com.payment.checkout.persistence.service.CourseCatalogService;
import com.payment.checkout.persistence.store.CheckoutRecordStore;
import com.payment.checkout.persistence.store.CheckoutSchemaIncompatibleException;
import com.payment.checkout.persistence.store.IdempotencyLookup;
import com.payment.checkout.persistence.store.InsertOutcome;
import com.payment.checkout.persistence.store.LeadPaymentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Runs one checkout request from validation to settlement.
 * <p>
 * A {@code processing} record is always written before the gateway is called, keyed by the effective idempotency key.
 * A request whose key already has a record gets that record back instead of a second charge. Once the gateway has
 * answered, failures to write the result are logged and the gateway outcome is still returned, because the card
 * has been charged either way.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CheckoutOrchestrator {

    static final String LEAD_ALREADY_PAID_KEY = "lead-already-paid";

    private static final Pattern UUID_PATTERN = Pattern.compile(
            "^[0-9a-f]{8}-[0-9a-f]{4}-[1-5][0-9a-f]{3}-[89ab][0-9a-f]{3}-[0-9a-f]{12}$", Pattern.CASE_INSENSITIVE);

    private final GatewaySettings gatewaySettings;
    private final LeadPaymentStore leadPaymentStore;
    private final CourseCatalogService courseCatalogService;
    private final CheckoutRecordStore checkoutRecordStore;
    private final IdempotencyKeyResolver idempotencyKeyResolver;
    private final InstrumentValidator instrumentValidator;
    private final TransactionGateway transactionGateway;
    private final ComplianceAuditLogger auditLogger;

    /**
     * @param keyListener receives the effective idempotency key as soon as it is known, so it can be echoed
     *                    even when the request fails afterwards
     * @throws CheckoutException for every business failure; the error code decides the HTTP status
     */
    public CheckoutOutcome checkout(CheckoutCommand command, Consumer<String> keyListener) {
        ProviderMode mode = gatewaySettings.providerMode();

        String courseSlug = FieldSanitizer.clean(command.getCourseSlug(), 120);
        if (courseSlug == null) throw new CheckoutException(CheckoutErrorCode.INVALID_COURSE);
        String leadId = FieldSanitizer.clean(command.getLeadId(), 80);
        if (leadId == null) throw new CheckoutException(CheckoutErrorCode.MISSING_LEAD_ID);
        if (!UUID_PATTERN.matcher(leadId).matches()) throw new CheckoutException(CheckoutErrorCode.INVALID_LEAD_ID);

        LeadRecord lead = loadLead(leadId);
        if (!courseSlug.equals(lead.getCourseSlug())) {
            throw new CheckoutException(CheckoutErrorCode.LEAD_COURSE_MISMATCH);
        }
        if (lead.isPaid()) {
            log.info("Lead already paid, answering from lead projection: leadId={}", lead.getId());
            return leadAlreadyPaid(lead, mode);
        }
        if (lead.hasPaymentInFlight()) {
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("status", lead.getPaymentStatus());
            attributes.put("reference", lead.getPaymentReference());
            attributes.put("tid", lead.getPaymentTid());
            throw new CheckoutException(CheckoutErrorCode.PAYMENT_IN_PROGRESS, attributes);
        }

        CustomerContact customer = CustomerContactResolver.resolve(command, lead);
        CardInstrument card = instrumentValidator.validate(command);
        int installments = InstrumentValidator.clampInstallments(command.getInstallments());

        CourseOffer course = loadCourse(lead, courseSlug);
        int amountCents = course.getPriceCents() == null ? 0 : Math.max(0, course.getPriceCents());
        if (amountCents <= 0) throw new CheckoutException(CheckoutErrorCode.INVALID_COURSE_AMOUNT);

        IdempotencyKey key = idempotencyKeyResolver.resolve(command.getIdempotencyKey(), PaymentIntent.builder()
                .leadId(lead.getId())
                .courseSlug(course.getSlug())
                .amountCents(amountCents)
                .installments(installments)
                .cardBin(card.bin())
                .cardLast4(card.last4())
                .expirationMonth(card.getExpirationMonth())
                .expirationYear(card.getExpirationYear())
                .build());
        keyListener.accept(key.getValue());

        String explicitReference = FieldSanitizer.clean(command.getReference(), 80);
        String reference = explicitReference != null
                ? explicitReference
                : idempotencyKeyResolver.deriveReference(course.getSlug(), key.getValue());

        Attempt attempt = new Attempt(mode, lead, course, customer, amountCents, installments, key, reference);

        Optional<CheckoutRecord> existing = findExisting(attempt);
        if (existing.isPresent()) {
            return replay(existing.get(), attempt);
        }

        LiveGatewayConfig liveConfig = mode == ProviderMode.LIVE ? gatewaySettings.liveConfig() : null;

        NewCheckout newCheckout = NewCheckout.builder()
                .leadId(lead.getId())
                .course(course)
                .amountCents(amountCents)
                .installments(installments)
                .reference(reference)
                .customer(customer)
                .cardHolderName(card.getHolderName())
                .cardLast4(card.last4())
                .cardBin(card.bin())
                .sourceUrl(FieldSanitizer.clean(command.getSourceUrl(), 500))
                .idempotencyKey(key.getValue())
                .build();

        InsertOutcome inserted;
        try {
            inserted = checkoutRecordStore.insertProcessing(newCheckout, attempt.idempotencyPersisted);
        } catch (CheckoutSchemaIncompatibleException e) {
            log.error("No checkout insert shape accepted by the table: {}", e.getMessage());
            throw new CheckoutException(CheckoutErrorCode.PAYMENT_CHECKOUT_SCHEMA_INCOMPATIBLE, e);
        } catch (RuntimeException e) {
            log.error("Failed to create checkout record before provider call: {}", e.getMessage());
            throw new CheckoutException(CheckoutErrorCode.PAYMENT_LOG_UNAVAILABLE, e);
        }
        attempt.idempotencyPersisted = inserted.isIdempotencyPersisted();
        if (inserted.isReused()) {
            rejectIfOwnedByAnotherLead(inserted.getReusedRecord(), attempt);
            return replay(inserted.getReusedRecord(), attempt);
        }

        String checkoutId = inserted.getCheckoutId();
        auditLogger.logAttempt(checkoutId, key.getValue(), reference, amountCents, installments, card, mode.wireValue());

        GatewayChargeRequest chargeRequest = GatewayChargeRequest.builder()
                .amount(amountCents)
                .reference(reference)
                .installments(installments)
                .cardHolderName(card.getHolderName())
                .cardNumber(card.getNumber())
                .expirationMonth(card.getExpirationMonth())
                .expirationYear(card.getExpirationYear())
                .securityCode(card.getSecurityCode())
                .softDescriptor(liveConfig != null ? liveConfig.getSoftDescriptor() : null)
                .build();

        GatewayChargeResult result;
        try {
            result = transactionGateway.charge(mode, liveConfig, chargeRequest);
        } catch (RuntimeException e) {
            log.error("Provider request failed: checkoutId={} mode={} error={}", checkoutId, mode.wireValue(), e.getMessage());
            recordProviderUnavailable(checkoutId, attempt);
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("idempotency_key", key.getValue());
            attributes.put("idempotency_persisted", attempt.idempotencyPersisted);
            attributes.put("provider_mode", mode.wireValue());
            throw new CheckoutException(CheckoutErrorCode.PAYMENT_PROVIDER_UNAVAILABLE, attributes, e);
        }

        CheckoutSettlement settlement = CheckoutSettlement.from(result);
        recordSettlement(checkoutId, settlement, attempt);

        boolean authError = "25".equals(settlement.getReturnCode()) || "26".equals(settlement.getReturnCode());
        if (mode == ProviderMode.LIVE && !result.isOk() && (authError || result.getHttpStatus() == 401)) {
            log.error("Gateway rejected credentials: checkoutId={} httpStatus={} returnCode={}",
                    checkoutId, result.getHttpStatus(), settlement.getReturnCode());
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("return_code", settlement.getReturnCode());
            attributes.put("idempotency_key", key.getValue());
            attributes.put("idempotency_persisted", attempt.idempotencyPersisted);
            attributes.put("provider_mode", mode.wireValue());
            throw new CheckoutException(CheckoutErrorCode.PAYMENT_PROVIDER_CREDENTIALS_INVALID, attributes);
        }

        CheckoutStatus status = settlement.getStatus();
        return attempt.outcome()
                .httpStatus(200)
                .status(status.wireValue())
                .checkoutId(checkoutId)
                .tid(settlement.getTid())
                .authorizationCode(settlement.getAuthorizationCode())
                .returnCode(settlement.getReturnCode())
                .returnMessage(settlement.getReturnMessage())
                .redirectUrl(status == CheckoutStatus.PENDING_AUTHENTICATION ? settlement.getThreeDSecureUrl() : null)
                .idempotentReused(false)
                .build();
    }

    private LeadRecord loadLead(String leadId) {
        Optional<LeadRecord> lead;
        try {
            lead = leadPaymentStore.findById(leadId);
        } catch (RuntimeException e) {
            log.error("Failed to load lead for payment: leadId={} error={}", leadId, e.getMessage());
            throw new CheckoutException(CheckoutErrorCode.LEAD_FETCH_FAILED, e);
        }
        return lead.orElseThrow(() -> new CheckoutException(CheckoutErrorCode.INVALID_LEAD));
    }

    private CourseOffer loadCourse(LeadRecord lead, String courseSlug) {
        Optional<CourseOffer> course;
        try {
            course = courseCatalogService.findForCheckout(lead.getCourseId(), courseSlug);
        } catch (RuntimeException e) {
            log.error("Failed to load course for payment: slug={} error={}", courseSlug, e.getMessage());
            throw new CheckoutException(CheckoutErrorCode.COURSES_FETCH_FAILED, e);
        }
        return course.orElseThrow(() -> new CheckoutException(CheckoutErrorCode.UNKNOWN_COURSE));
    }

    /**
     * Looks the key up, repairing the schema once if the key column is missing, and falls back to the
     * reference when the key still cannot be stored. Sets {@code attempt.idempotencyPersisted}.
     */
    private Optional<CheckoutRecord> findExisting(Attempt attempt) {
        Optional<CheckoutRecord> existing;
        try {
            IdempotencyLookup lookup = checkoutRecordStore.findByIdempotencyKey(attempt.key.getValue());
            if (!lookup.isKeyColumnAvailable() && checkoutRecordStore.ensureIdempotencySchema()) {
                lookup = checkoutRecordStore.findByIdempotencyKey(attempt.key.getValue());
            }
            attempt.idempotencyPersisted = lookup.isKeyColumnAvailable();
            existing = lookup.existing();
            if (existing.isEmpty() && !attempt.idempotencyPersisted) {
                log.info("Idempotency key column unavailable, matching by reference={}", attempt.reference);
                existing = checkoutRecordStore.findByReference(attempt.reference, attempt.lead.getId());
            }
        } catch (RuntimeException e) {
            log.error("Failed to perform idempotency lookup: {}", e.getMessage());
            throw new CheckoutException(CheckoutErrorCode.PAYMENT_IDEMPOTENCY_LOOKUP_FAILED, e);
        }

        existing.ifPresent(record -> rejectIfOwnedByAnotherLead(record, attempt));
        return existing;
    }

    private static void rejectIfOwnedByAnotherLead(CheckoutRecord record, Attempt attempt) {
        if (record.belongsToAnotherLead(attempt.lead.getId())) {
            log.warn("Idempotency key reused across leads: key={} leadId={}", attempt.key.getValue(), attempt.lead.getId());
            throw new CheckoutException(CheckoutErrorCode.IDEMPOTENCY_KEY_CONFLICT);
        }
    }

    private CheckoutOutcome replay(CheckoutRecord record, Attempt attempt) {
        auditLogger.logReplay(record.getId(), attempt.key.getValue(), record.getStatus());
        return attempt.outcome()
                .httpStatus(CheckoutStatus.httpStatusOf(record.getStatus()))
                .status(record.getStatus())
                .checkoutId(record.getId())
                .amountCents(positiveOr(record.getAmountCents(), attempt.amountCents))
                .installments(positiveOr(record.getInstallments(), attempt.installments))
                .reference(record.getReference())
                .tid(record.getTid())
                .authorizationCode(record.getAuthorizationCode())
                .returnCode(record.getReturnCode())
                .returnMessage(record.getReturnMessage())
                .redirectUrl(record.getThreeDSecureUrl())
                .idempotentReused(true)
                .build();
    }

    private void recordProviderUnavailable(String checkoutId, Attempt attempt) {
        String message = "Provider request failed (" + attempt.mode.wireValue() + ")";
        try {
            checkoutRecordStore.markProviderUnavailable(checkoutId, message);
        } catch (RuntimeException e) {
            log.error("Failed to update checkout record after provider failure: checkoutId={} error={}", checkoutId, e.getMessage());
        }
        try {
            leadPaymentStore.recordPayment(attempt.lead.getId(), PaymentProjection.builder()
                    .status(CheckoutStatus.PROVIDER_UNAVAILABLE.wireValue())
                    .reference(attempt.reference)
                    .returnMessage(message)
                    .build());
        } catch (RuntimeException e) {
            log.error("Failed to update lead payment status after provider failure: leadId={} error={}",
                    attempt.lead.getId(), e.getMessage());
        }
        auditLogger.logOutcome(checkoutId, attempt.key.getValue(), CheckoutStatus.PROVIDER_UNAVAILABLE.wireValue(), null, null);
    }

    private void recordSettlement(String checkoutId, CheckoutSettlement settlement, Attempt attempt) {
        try {
            checkoutRecordStore.updateResult(checkoutId, settlement);
        } catch (RuntimeException e) {
            log.error("Failed to update checkout record: checkoutId={} error={}", checkoutId, e.getMessage());
        }
        try {
            leadPaymentStore.recordPayment(attempt.lead.getId(), PaymentProjection.builder()
                    .status(settlement.getStatus().wireValue())
                    .reference(attempt.reference)
                    .tid(settlement.getTid())
                    .returnCode(settlement.getReturnCode())
                    .returnMessage(settlement.getReturnMessage())
                    .build());
        } catch (RuntimeException e) {
            log.error("Failed to update lead payment status: leadId={} error={}", attempt.lead.getId(), e.getMessage());
        }
        auditLogger.logOutcome(checkoutId, attempt.key.getValue(), settlement.getStatus().wireValue(),
                settlement.getReturnCode(), settlement.getTid());
    }

    private static CheckoutOutcome leadAlreadyPaid(LeadRecord lead, ProviderMode mode) {
        int paidAmount = lead.getCoursePriceCents() == null ? 0 : Math.max(0, lead.getCoursePriceCents());
        return CheckoutOutcome.builder()
                .httpStatus(200)
                .status(CheckoutStatus.APPROVED.wireValue())
                .lead(lead)
                .courseSlug(lead.getCourseSlug())
                .courseName(lead.getCourseName())
                .amountCents(paidAmount)
                .installments(1)
                .reference(lead.getPaymentReference())
                .tid(lead.getPaymentTid())
                .returnCode(lead.getPaymentReturnCode())
                .returnMessage(lead.getPaymentReturnMessage())
                .customer(CustomerContact.builder()
                        .name(lead.getCustomerName())
                        .email(lead.getCustomerEmail())
                        .phone(lead.getCustomerPhone())
                        .build())
                .idempotencyKey(LEAD_ALREADY_PAID_KEY)
                .idempotentReused(true)
                .idempotencyPersisted(true)
                .providerMode(mode)
                .leadAlreadyPaid(true)
                .build();
    }

    private static int positiveOr(Integer stored, int fallback) {
        return stored != null && stored > 0 ? stored : fallback;
    }

    /** Per-request state shared by the lookup, insert and response steps. */
    private static final class Attempt {
        final ProviderMode mode;
        final LeadRecord lead;
        final CourseOffer course;
        final CustomerContact customer;
        final int amountCents;
        final int installments;
        final IdempotencyKey key;
        final String reference;
        boolean idempotencyPersisted = true;

        Attempt(ProviderMode mode, LeadRecord lead, CourseOffer course, CustomerContact customer,
                int amountCents, int installments, IdempotencyKey key, String reference) {
            this.mode = mode;
            this.lead = lead;
            this.course = course;
            this.customer = customer;
            this.amountCents = amountCents;
            this.installments = installments;
            this.key = key;
            this.reference = reference;
        }

        CheckoutOutcome.CheckoutOutcomeBuilder outcome() {
            return CheckoutOutcome.builder()
                    .lead(lead)
                    .courseSlug(course.getSlug())
                    .courseName(course.getName())
                    .amountCents(amountCents)
                    .installments(installments)
                    .reference(reference)
                    .customer(customer)
                    .idempotencyKey(key.getValue())
                    .idempotencyPersisted(idempotencyPersisted)
                    .providerMode(mode);
        }
    }
}
