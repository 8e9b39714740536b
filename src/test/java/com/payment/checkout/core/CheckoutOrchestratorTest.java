package com.payment.checkout.core;

import com.payment.checkout.api.CheckoutErrorCode;
import com.payment.checkout.api.CheckoutException;
import com.payment.checkout.compliance.ComplianceAuditLogger;
import com.payment.checkout.config.GatewaySettings;
import com.payment.checkout.domain.CheckoutCommand;
import com.payment.checkout.domain.CheckoutOutcome;
import com.payment.checkout.domain.CheckoutRecord;
import com.payment.checkout.domain.CheckoutSettlement;
import com.payment.checkout.domain.CourseOffer;
import com.payment.checkout.domain.GatewayChargeRequest;
import com.payment.checkout.domain.GatewayChargeResult;
import com.payment.checkout.domain.GatewayEnvironment;
import com.payment.checkout.domain.GatewayResponse;
import com.payment.checkout.domain.LeadRecord;
import com.payment.checkout.domain.LiveGatewayConfig;
import com.payment.checkout.domain.NewCheckout;
import com.payment.checkout.domain.PaymentProjection;
import com.payment.checkout.domain.ProviderMode;
import com.payment.checkout.persistence.service.CourseCatalogService;
import com.payment.checkout.persistence.store.CheckoutRecordStore;
import com.payment.checkout.persistence.store.CheckoutSchemaIncompatibleException;
import com.payment.checkout.persistence.store.IdempotencyLookup;
import com.payment.checkout.persistence.store.InsertOutcome;
import com.payment.checkout.persistence.store.LeadPaymentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for CheckoutOrchestrator: idempotent replay, schema fallback and gateway outcomes.
 * Stores and gateway are mocked; key resolution and card validation are real.
 */
@ExtendWith(MockitoExtension.class)
class CheckoutOrchestratorTest {

    private static final String LEAD_ID = "3f2b8c1e-6a4d-4b7e-9c2a-1d5e8f0a7b3c";
    private static final String OTHER_LEAD_ID = "9a8b7c6d-5e4f-4a3b-8c2d-1e0f9a8b7c6d";
    private static final String COURSE_ID = "8d0e7a52-1c3f-4e6b-a9d8-2b4c6e8f0a1d";
    private static final String SLUG = "direito-digital";
    private static final String KEY = "order:12345678";
    private static final String CHECKOUT_ID = "c0ffee00-0000-4000-8000-000000000001";

    @Mock
    private GatewaySettings gatewaySettings;
    @Mock
    private LeadPaymentStore leadPaymentStore;
    @Mock
    private CourseCatalogService courseCatalogService;
    @Mock
    private CheckoutRecordStore checkoutRecordStore;
    @Mock
    private TransactionGateway transactionGateway;
    @Mock
    private ComplianceAuditLogger auditLogger;

    private CheckoutOrchestrator orchestrator;
    private final List<String> echoedKeys = new ArrayList<>();

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-15T12:00:00Z"), ZoneOffset.UTC);
        orchestrator = new CheckoutOrchestrator(
                gatewaySettings,
                leadPaymentStore,
                courseCatalogService,
                checkoutRecordStore,
                new IdempotencyKeyResolver(clock, 600_000L),
                new InstrumentValidator(clock),
                transactionGateway,
                auditLogger);
        lenient().when(gatewaySettings.providerMode()).thenReturn(ProviderMode.MOCK);
        lenient().when(leadPaymentStore.findById(LEAD_ID)).thenReturn(Optional.of(lead().build()));
        lenient().when(courseCatalogService.findForCheckout(COURSE_ID, SLUG)).thenReturn(Optional.of(CourseOffer.builder()
                .id(COURSE_ID).slug(SLUG).name("Direito Digital").priceCents(129_900).build()));
    }

    @Test
    void freshCheckoutIsRecordedBeforeChargingAndSettled() {
        when(checkoutRecordStore.findByIdempotencyKey(KEY)).thenReturn(IdempotencyLookup.found(null));
        when(checkoutRecordStore.insertProcessing(any(NewCheckout.class), eq(true)))
                .thenReturn(InsertOutcome.created(CHECKOUT_ID, true));
        when(transactionGateway.charge(eq(ProviderMode.MOCK), isNull(), any(GatewayChargeRequest.class)))
                .thenReturn(answer(true, 200, Map.of("returnCode", "00", "tid", "T-1", "authorizationCode", "A1B2C3")));

        CheckoutOutcome outcome = checkout(command().build());

        assertThat(outcome.getHttpStatus()).isEqualTo(200);
        assertThat(outcome.getStatus()).isEqualTo("approved");
        assertThat(outcome.getCheckoutId()).isEqualTo(CHECKOUT_ID);
        assertThat(outcome.isIdempotentReused()).isFalse();
        assertThat(outcome.isIdempotencyPersisted()).isTrue();
        assertThat(outcome.getTid()).isEqualTo("T-1");
        assertThat(outcome.getRedirectUrl()).isNull();
        assertThat(outcome.getInstallments()).isEqualTo(3);
        assertThat(echoedKeys).containsExactly(KEY);

        ArgumentCaptor<NewCheckout> inserted = ArgumentCaptor.forClass(NewCheckout.class);
        verify(checkoutRecordStore).insertProcessing(inserted.capture(), eq(true));
        assertThat(inserted.getValue().getAmountCents()).isEqualTo(129_900);
        assertThat(inserted.getValue().getCardLast4()).isEqualTo("4242");
        assertThat(inserted.getValue().getReference()).matches("^chk-direito-digital-[0-9a-f]{14}$");
        assertThat(inserted.getValue().getSourceUrl()).isEqualTo("https://escola.example/checkout");

        ArgumentCaptor<CheckoutSettlement> settlement = ArgumentCaptor.forClass(CheckoutSettlement.class);
        verify(checkoutRecordStore).updateResult(eq(CHECKOUT_ID), settlement.capture());
        assertThat(settlement.getValue().getReturnCode()).isEqualTo("00");

        ArgumentCaptor<PaymentProjection> projection = ArgumentCaptor.forClass(PaymentProjection.class);
        verify(leadPaymentStore).recordPayment(eq(LEAD_ID), projection.capture());
        assertThat(projection.getValue().getStatus()).isEqualTo("approved");
        assertThat(projection.getValue().getTid()).isEqualTo("T-1");
    }

    @Test
    void repeatedKeyReplaysStoredCheckoutWithoutCharging() {
        when(checkoutRecordStore.findByIdempotencyKey(KEY)).thenReturn(IdempotencyLookup.found(CheckoutRecord.builder()
                .id(CHECKOUT_ID)
                .leadId(LEAD_ID)
                .reference("chk-stored")
                .status("declined")
                .amountCents(99_900)
                .installments(null)
                .returnCode("05")
                .build()));

        CheckoutOutcome outcome = checkout(command().build());

        assertThat(outcome.getHttpStatus()).isEqualTo(200);
        assertThat(outcome.getStatus()).isEqualTo("declined");
        assertThat(outcome.isIdempotentReused()).isTrue();
        assertThat(outcome.getAmountCents()).isEqualTo(99_900);
        assertThat(outcome.getInstallments()).isEqualTo(3);
        assertThat(outcome.getReference()).isEqualTo("chk-stored");
        verify(checkoutRecordStore, never()).insertProcessing(any(), anyBoolean());
        verifyNoInteractions(transactionGateway);
    }

    @Test
    void replayOfProcessingCheckoutAnswers202() {
        when(checkoutRecordStore.findByIdempotencyKey(KEY)).thenReturn(IdempotencyLookup.found(CheckoutRecord.builder()
                .id(CHECKOUT_ID).leadId(LEAD_ID).status("processing").build()));

        assertThat(checkout(command().build()).getHttpStatus()).isEqualTo(202);
    }

    @Test
    void replayOfUnavailableCheckoutAnswers502() {
        when(checkoutRecordStore.findByIdempotencyKey(KEY)).thenReturn(IdempotencyLookup.found(CheckoutRecord.builder()
                .id(CHECKOUT_ID).leadId(LEAD_ID).status("provider_unavailable").build()));

        assertThat(checkout(command().build()).getHttpStatus()).isEqualTo(502);
    }

    @Test
    void keyOwnedByAnotherLeadConflicts() {
        when(checkoutRecordStore.findByIdempotencyKey(KEY)).thenReturn(IdempotencyLookup.found(CheckoutRecord.builder()
                .id(CHECKOUT_ID).leadId(OTHER_LEAD_ID).status("approved").build()));

        assertCode(command().build(), CheckoutErrorCode.IDEMPOTENCY_KEY_CONFLICT);
        verify(checkoutRecordStore, never()).insertProcessing(any(), anyBoolean());
    }

    @Test
    void missingKeyColumnIsRepairedThenUsed() {
        when(checkoutRecordStore.findByIdempotencyKey(KEY))
                .thenReturn(IdempotencyLookup.unavailable())
                .thenReturn(IdempotencyLookup.found(null));
        when(checkoutRecordStore.ensureIdempotencySchema()).thenReturn(true);
        when(checkoutRecordStore.insertProcessing(any(NewCheckout.class), eq(true)))
                .thenReturn(InsertOutcome.created(CHECKOUT_ID, true));
        when(transactionGateway.charge(any(), any(), any())).thenReturn(answer(true, 200, Map.of("returnCode", "00")));

        CheckoutOutcome outcome = checkout(command().build());

        assertThat(outcome.isIdempotencyPersisted()).isTrue();
        verify(checkoutRecordStore, never()).findByReference(anyString(), anyString());
    }

    @Test
    void unrepairableSchemaFallsBackToReference() {
        when(checkoutRecordStore.findByIdempotencyKey(KEY)).thenReturn(IdempotencyLookup.unavailable());
        when(checkoutRecordStore.ensureIdempotencySchema()).thenReturn(false);
        when(checkoutRecordStore.findByReference("order-77", LEAD_ID)).thenReturn(Optional.empty());
        when(checkoutRecordStore.insertProcessing(any(NewCheckout.class), eq(false)))
                .thenReturn(InsertOutcome.created(CHECKOUT_ID, false));
        when(transactionGateway.charge(any(), any(), any())).thenReturn(answer(true, 200, Map.of("returnCode", "05")));

        CheckoutOutcome outcome = checkout(command().reference("order-77").build());

        assertThat(outcome.getStatus()).isEqualTo("declined");
        assertThat(outcome.isIdempotencyPersisted()).isFalse();
        assertThat(outcome.getReference()).isEqualTo("order-77");
    }

    @Test
    void referenceMatchReplaysWhenKeyCannotBeStored() {
        when(checkoutRecordStore.findByIdempotencyKey(KEY)).thenReturn(IdempotencyLookup.unavailable());
        when(checkoutRecordStore.ensureIdempotencySchema()).thenReturn(false);
        when(checkoutRecordStore.findByReference("order-77", LEAD_ID)).thenReturn(Optional.of(CheckoutRecord.builder()
                .id(CHECKOUT_ID).leadId(null).reference("order-77").status("approved").build()));

        CheckoutOutcome outcome = checkout(command().reference("order-77").build());

        assertThat(outcome.isIdempotentReused()).isTrue();
        assertThat(outcome.isIdempotencyPersisted()).isFalse();
        verifyNoInteractions(transactionGateway);
    }

    @Test
    void lookupFailureIsReported() {
        when(checkoutRecordStore.findByIdempotencyKey(KEY))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertCode(command().build(), CheckoutErrorCode.PAYMENT_IDEMPOTENCY_LOOKUP_FAILED);
    }

    @Test
    void concurrentInsertWinnerIsReplayed() {
        when(checkoutRecordStore.findByIdempotencyKey(KEY)).thenReturn(IdempotencyLookup.found(null));
        when(checkoutRecordStore.insertProcessing(any(NewCheckout.class), eq(true)))
                .thenReturn(InsertOutcome.reused(CheckoutRecord.builder()
                        .id(CHECKOUT_ID).leadId(LEAD_ID).status("processing").build()));

        CheckoutOutcome outcome = checkout(command().build());

        assertThat(outcome.getHttpStatus()).isEqualTo(202);
        assertThat(outcome.isIdempotentReused()).isTrue();
        verifyNoInteractions(transactionGateway);
    }

    @Test
    void concurrentInsertWinnerOfAnotherLeadConflicts() {
        when(checkoutRecordStore.findByIdempotencyKey(KEY)).thenReturn(IdempotencyLookup.found(null));
        when(checkoutRecordStore.insertProcessing(any(NewCheckout.class), eq(true)))
                .thenReturn(InsertOutcome.reused(CheckoutRecord.builder()
                        .id(CHECKOUT_ID)
                        .leadId(OTHER_LEAD_ID)
                        .status("approved")
                        .tid("T-OTHER")
                        .authorizationCode("AUTH-OTHER")
                        .build()));

        assertCode(command().build(), CheckoutErrorCode.IDEMPOTENCY_KEY_CONFLICT);
        verifyNoInteractions(transactionGateway);
        verify(auditLogger, never()).logReplay(anyString(), anyString(), anyString());
    }

    @Test
    void insertFailuresNeverReachTheGateway() {
        when(checkoutRecordStore.findByIdempotencyKey(KEY)).thenReturn(IdempotencyLookup.found(null));
        when(checkoutRecordStore.insertProcessing(any(NewCheckout.class), eq(true)))
                .thenThrow(new CheckoutSchemaIncompatibleException("no column set", null))
                .thenThrow(new DataAccessResourceFailureException("disk full"));

        assertCode(command().build(), CheckoutErrorCode.PAYMENT_CHECKOUT_SCHEMA_INCOMPATIBLE);
        assertCode(command().build(), CheckoutErrorCode.PAYMENT_LOG_UNAVAILABLE);
        verifyNoInteractions(transactionGateway);
    }

    @Test
    void gatewayFailureMarksCheckoutUnavailable() {
        when(checkoutRecordStore.findByIdempotencyKey(KEY)).thenReturn(IdempotencyLookup.found(null));
        when(checkoutRecordStore.insertProcessing(any(NewCheckout.class), eq(true)))
                .thenReturn(InsertOutcome.created(CHECKOUT_ID, true));
        when(transactionGateway.charge(any(), any(), any())).thenThrow(new GatewayUnavailableException("timeout"));

        assertThatThrownBy(() -> checkout(command().build()))
                .isInstanceOfSatisfying(CheckoutException.class, e -> {
                    assertThat(e.getErrorCode()).isEqualTo(CheckoutErrorCode.PAYMENT_PROVIDER_UNAVAILABLE);
                    assertThat(e.getAttributes())
                            .containsEntry("idempotency_key", KEY)
                            .containsEntry("idempotency_persisted", true)
                            .containsEntry("provider_mode", "mock");
                });

        verify(checkoutRecordStore).markProviderUnavailable(CHECKOUT_ID, "Provider request failed (mock)");
        ArgumentCaptor<PaymentProjection> projection = ArgumentCaptor.forClass(PaymentProjection.class);
        verify(leadPaymentStore).recordPayment(eq(LEAD_ID), projection.capture());
        assertThat(projection.getValue().getStatus()).isEqualTo("provider_unavailable");
        assertThat(projection.getValue().getTid()).isNull();
    }

    @Test
    void rejectedLiveCredentialsAreAConfigurationError() {
        when(gatewaySettings.providerMode()).thenReturn(ProviderMode.LIVE);
        LiveGatewayConfig config = LiveGatewayConfig.builder()
                .pv("123").token("t").environment(GatewayEnvironment.SANDBOX).endpoint("https://gw").timeoutMs(15_000).build();
        when(gatewaySettings.liveConfig()).thenReturn(config);
        when(checkoutRecordStore.findByIdempotencyKey(KEY)).thenReturn(IdempotencyLookup.found(null));
        when(checkoutRecordStore.insertProcessing(any(NewCheckout.class), eq(true)))
                .thenReturn(InsertOutcome.created(CHECKOUT_ID, true));
        when(transactionGateway.charge(eq(ProviderMode.LIVE), eq(config), any()))
                .thenReturn(answer(false, 401, Map.of("returnCode", "25", "returnMessage", "Unauthorized")));

        assertThatThrownBy(() -> checkout(command().build()))
                .isInstanceOfSatisfying(CheckoutException.class, e -> {
                    assertThat(e.getErrorCode()).isEqualTo(CheckoutErrorCode.PAYMENT_PROVIDER_CREDENTIALS_INVALID);
                    assertThat(e.getAttributes())
                            .containsEntry("return_code", "25")
                            .containsEntry("provider_mode", "rede");
                });
        verify(checkoutRecordStore).updateResult(eq(CHECKOUT_ID), any(CheckoutSettlement.class));
    }

    @Test
    void threeDSecureChallengeReturnsRedirect() {
        when(checkoutRecordStore.findByIdempotencyKey(KEY)).thenReturn(IdempotencyLookup.found(null));
        when(checkoutRecordStore.insertProcessing(any(NewCheckout.class), eq(true)))
                .thenReturn(InsertOutcome.created(CHECKOUT_ID, true));
        when(transactionGateway.charge(any(), any(), any())).thenReturn(answer(true, 200, Map.of(
                "returnCode", "220", "threeDSecure", Map.of("url", "https://acs.example/3ds"))));

        CheckoutOutcome outcome = checkout(command().build());

        assertThat(outcome.getStatus()).isEqualTo("pending_authentication");
        assertThat(outcome.isRequiresAction()).isTrue();
        assertThat(outcome.getRedirectUrl()).isEqualTo("https://acs.example/3ds");
    }

    @Test
    void settlementWriteFailuresDoNotHideTheGatewayAnswer() {
        when(checkoutRecordStore.findByIdempotencyKey(KEY)).thenReturn(IdempotencyLookup.found(null));
        when(checkoutRecordStore.insertProcessing(any(NewCheckout.class), eq(true)))
                .thenReturn(InsertOutcome.created(CHECKOUT_ID, true));
        when(transactionGateway.charge(any(), any(), any())).thenReturn(answer(true, 200, Map.of("returnCode", "00")));
        doThrow(new DataAccessResourceFailureException("gone")).when(checkoutRecordStore).updateResult(anyString(), any());
        doThrow(new DataAccessResourceFailureException("gone")).when(leadPaymentStore).recordPayment(anyString(), any());

        CheckoutOutcome outcome = checkout(command().build());

        assertThat(outcome.getStatus()).isEqualTo("approved");
    }

    @Test
    void paidLeadAnswersFromLeadWithoutTouchingCheckouts() {
        when(leadPaymentStore.findById(LEAD_ID)).thenReturn(Optional.of(lead()
                .paymentStatus("approved")
                .paymentReference("chk-paid")
                .paymentTid("T-9")
                .build()));

        CheckoutOutcome outcome = checkout(command().cardNumber("1").build());

        assertThat(outcome.getHttpStatus()).isEqualTo(200);
        assertThat(outcome.isLeadAlreadyPaid()).isTrue();
        assertThat(outcome.getIdempotencyKey()).isEqualTo("lead-already-paid");
        assertThat(outcome.getCheckoutId()).isNull();
        assertThat(outcome.getAmountCents()).isEqualTo(129_900);
        assertThat(outcome.getTid()).isEqualTo("T-9");
        verifyNoInteractions(checkoutRecordStore, transactionGateway);
    }

    @Test
    void leadWithPaymentInFlightConflicts() {
        when(leadPaymentStore.findById(LEAD_ID)).thenReturn(Optional.of(lead()
                .paymentStatus("pending_authentication")
                .paymentReference("chk-open")
                .build()));

        assertThatThrownBy(() -> checkout(command().build()))
                .isInstanceOfSatisfying(CheckoutException.class, e -> {
                    assertThat(e.getErrorCode()).isEqualTo(CheckoutErrorCode.PAYMENT_IN_PROGRESS);
                    assertThat(e.getAttributes())
                            .containsEntry("status", "pending_authentication")
                            .containsEntry("reference", "chk-open")
                            .containsEntry("tid", null);
                });
    }

    @Test
    void requestShapeIsCheckedBeforeLoadingTheLead() {
        assertCode(command().courseSlug(null).build(), CheckoutErrorCode.INVALID_COURSE);
        assertCode(command().leadId(null).build(), CheckoutErrorCode.MISSING_LEAD_ID);
        assertCode(command().leadId("not-a-uuid").build(), CheckoutErrorCode.INVALID_LEAD_ID);
        verifyNoInteractions(leadPaymentStore);
    }

    @Test
    void invalidProviderModeFailsFirst() {
        when(gatewaySettings.providerMode())
                .thenThrow(new CheckoutException(CheckoutErrorCode.PAYMENT_PROVIDER_MODE_INVALID));

        assertCode(command().leadId(null).build(), CheckoutErrorCode.PAYMENT_PROVIDER_MODE_INVALID);
    }

    @Test
    void leadAndCourseMustMatch() {
        when(leadPaymentStore.findById(OTHER_LEAD_ID)).thenReturn(Optional.empty());

        assertCode(command().courseSlug("outro-curso").build(), CheckoutErrorCode.LEAD_COURSE_MISMATCH);
        assertCode(command().leadId(OTHER_LEAD_ID).build(), CheckoutErrorCode.INVALID_LEAD);
    }

    @Test
    void courseProblemsAreReported() {
        when(courseCatalogService.findForCheckout(COURSE_ID, SLUG))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(CourseOffer.builder().id(COURSE_ID).slug(SLUG).name("Direito Digital").priceCents(0).build()))
                .thenThrow(new DataAccessResourceFailureException("down"));

        assertCode(command().build(), CheckoutErrorCode.UNKNOWN_COURSE);
        assertCode(command().build(), CheckoutErrorCode.INVALID_COURSE_AMOUNT);
        assertCode(command().build(), CheckoutErrorCode.COURSES_FETCH_FAILED);
    }

    @Test
    void invalidExplicitKeyIsRejectedBeforeLookup() {
        assertCode(command().idempotencyKey("abc").build(), CheckoutErrorCode.INVALID_IDEMPOTENCY_KEY);
        verifyNoInteractions(checkoutRecordStore);
    }

    @Test
    void automaticKeyIsEchoedWhenClientSendsNone() {
        when(checkoutRecordStore.findByIdempotencyKey(anyString())).thenReturn(IdempotencyLookup.found(null));
        when(checkoutRecordStore.insertProcessing(any(NewCheckout.class), eq(true)))
                .thenReturn(InsertOutcome.created(CHECKOUT_ID, true));
        when(transactionGateway.charge(any(), any(), any())).thenReturn(answer(true, 200, Map.of("returnCode", "00")));

        CheckoutOutcome outcome = checkout(command().idempotencyKey(null).build());

        assertThat(outcome.getIdempotencyKey()).startsWith("auto-");
        assertThat(echoedKeys).containsExactly(outcome.getIdempotencyKey());
    }

    private CheckoutOutcome checkout(CheckoutCommand command) {
        return orchestrator.checkout(command, echoedKeys::add);
    }

    private void assertCode(CheckoutCommand command, CheckoutErrorCode expected) {
        assertThatThrownBy(() -> checkout(command))
                .isInstanceOf(CheckoutException.class)
                .extracting(e -> ((CheckoutException) e).getErrorCode())
                .isEqualTo(expected);
    }

    private static GatewayChargeResult answer(boolean ok, int httpStatus, Map<String, Object> body) {
        return new GatewayChargeResult(ok, httpStatus, GatewayResponse.of(body));
    }

    private static LeadRecord.LeadRecordBuilder lead() {
        return LeadRecord.builder()
                .id(LEAD_ID)
                .courseId(COURSE_ID)
                .courseSlug(SLUG)
                .courseName("Direito Digital")
                .coursePriceCents(129_900)
                .customerName("Maria Silva")
                .customerEmail("maria@example.com")
                .customerPhone("11987654321")
                .paymentStatus("pending");
    }

    private static CheckoutCommand.CheckoutCommandBuilder command() {
        return CheckoutCommand.builder()
                .courseSlug(SLUG)
                .leadId(LEAD_ID)
                .cardHolderName("MARIA SILVA")
                .cardNumber("4242424242424242")
                .cardCvv("123")
                .cardExpirationMonth("12")
                .cardExpirationYear("2030")
                .installments("3")
                .idempotencyKey(KEY)
                .sourceUrl("https://escola.example/checkout");
    }
}
