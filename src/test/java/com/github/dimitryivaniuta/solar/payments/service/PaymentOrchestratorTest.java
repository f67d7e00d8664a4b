package com.github.dimitryivaniuta.solar.payments.service;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.github.dimitryivaniuta.solar.payments.client.ContractorClient;
import com.github.dimitryivaniuta.solar.payments.client.LedgerClient;
import com.github.dimitryivaniuta.solar.payments.client.ProjectGatewayClient;
import com.github.dimitryivaniuta.solar.payments.client.dto.ContractorInfo;
import com.github.dimitryivaniuta.solar.payments.client.dto.CreditOperation;
import com.github.dimitryivaniuta.solar.payments.client.dto.FlagStatus;
import com.github.dimitryivaniuta.solar.payments.client.dto.LedgerProfile;
import com.github.dimitryivaniuta.solar.payments.client.dto.ProjectInfo;
import com.github.dimitryivaniuta.solar.payments.config.AppProperties;
import com.github.dimitryivaniuta.solar.payments.domain.InstallmentPlan;
import com.github.dimitryivaniuta.solar.payments.domain.InstallmentSchedule;
import com.github.dimitryivaniuta.solar.payments.domain.Money;
import com.github.dimitryivaniuta.solar.payments.domain.OutboxCommandType;
import com.github.dimitryivaniuta.solar.payments.domain.Payment;
import com.github.dimitryivaniuta.solar.payments.domain.PaymentMethod;
import com.github.dimitryivaniuta.solar.payments.exception.BusinessRuleException;
import com.github.dimitryivaniuta.solar.payments.exception.ConflictException;
import com.github.dimitryivaniuta.solar.payments.exception.ForbiddenException;
import com.github.dimitryivaniuta.solar.payments.exception.NotFoundException;
import com.github.dimitryivaniuta.solar.payments.exception.PaymentDeclinedException;
import com.github.dimitryivaniuta.solar.payments.exception.ValidationException;
import com.github.dimitryivaniuta.solar.payments.repo.InstallmentScheduleRepository;
import com.github.dimitryivaniuta.solar.payments.repo.PaymentRepository;
import com.github.dimitryivaniuta.solar.payments.service.PaymentProcessor.GatewayResult;
import com.github.dimitryivaniuta.solar.payments.service.dto.InstallmentView;
import com.github.dimitryivaniuta.solar.payments.service.dto.PaymentDetailsView;
import com.github.dimitryivaniuta.solar.payments.service.dto.PaymentView;
import com.github.dimitryivaniuta.solar.payments.service.dto.ReleaseCommand;
import com.github.dimitryivaniuta.solar.payments.service.dto.SelectMethodCommand;
import com.github.dimitryivaniuta.solar.payments.service.dto.TxOutcome;
import com.github.dimitryivaniuta.solar.payments.service.outbox.OutboxDispatcher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PaymentOrchestratorTest {

    // 2025-03-11 in Riyadh
    private static final Instant NOW = Instant.parse("2025-03-11T09:00:00Z");
    private static final String PROJECT = "p-1";
    private static final Actor OWNER = new Actor("u-1", "user", "Bearer t");
    private static final Actor ADMIN = new Actor("a-1", "admin", null);

    @Mock
    private ProjectGatewayClient projectClient;
    @Mock
    private LedgerClient ledgerClient;
    @Mock
    private ContractorClient contractorClient;
    @Mock
    private PaymentProcessor paymentProcessor;
    @Mock
    private PaymentRepository paymentRepository;
    @Mock
    private InstallmentScheduleRepository installmentRepository;
    @Mock
    private PaymentTxService txService;
    @Mock
    private PaymentQueryService queryService;
    @Mock
    private OutboxDispatcher outboxDispatcher;

    private PaymentOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = new PaymentOrchestrator(projectClient, ledgerClient, contractorClient, paymentProcessor,
                paymentRepository, installmentRepository, txService, queryService, outboxDispatcher,
                new AppProperties(), Clock.fixed(NOW, ZoneId.of("Asia/Riyadh")), new SimpleMeterRegistry());
    }

    private static ProjectInfo project(String owner, String status) {
        return new ProjectInfo(PROJECT, owner, "c-1", status, new BigDecimal("12000.00"));
    }

    private static Payment singlePay() {
        return Payment.newSinglePay(PROJECT, "u-1", "c-1", Money.of("5000.00"), "SPY-TEST-000001", NOW);
    }

    private static Payment bnplDueOn(LocalDate firstDue) {
        InstallmentPlan plan = new InstallmentPlan(Money.of("6000.00"), Money.of("2000.00"), List.of(
                new InstallmentPlan.Item(1, Money.of("2000.00"), firstDue),
                new InstallmentPlan.Item(2, Money.of("2000.00"), firstDue.plusMonths(1)),
                new InstallmentPlan.Item(3, Money.of("2000.00"), firstDue.plusMonths(2))));
        return Payment.newBnpl(PROJECT, "u-1", "c-1", Money.of("6000.00"), Money.ZERO, plan, Money.of("6000.00"),
                "BNPL-TEST-000001", NOW);
    }

    private static <T> TxOutcome<T> outcome(T view) {
        return new TxOutcome<>(view, List.of("cmd-1", "cmd-2"));
    }

    @Test
    void singlePaySelectionCreatesPaymentThenDispatches() {
        when(projectClient.fetchProjectInfo(PROJECT)).thenReturn(Optional.of(project("u-1", "payment_pending")));
        when(paymentRepository.existsByProjectId(PROJECT)).thenReturn(false);
        PaymentView view = PaymentView.from(singlePay());
        when(txService.createPayment(any(), eq(OWNER))).thenReturn(outcome(view));
        when(outboxDispatcher.dispatchNow(List.of("cmd-1", "cmd-2"))).thenReturn(Set.of());

        PaymentView result = orchestrator.selectPaymentMethod(PROJECT, OWNER,
                new SelectMethodCommand(PaymentMethod.SINGLE_PAY, Money.of("5000.00"), null, null));

        Assertions.assertSame(view, result);
        ArgumentCaptor<PaymentTxService.SelectionPlan> plan = ArgumentCaptor.forClass(PaymentTxService.SelectionPlan.class);
        verify(txService).createPayment(plan.capture(), eq(OWNER));
        Assertions.assertEquals(Money.of("5000.00"), plan.getValue().total());
        Assertions.assertEquals(Money.ZERO, plan.getValue().creditHold());
        Assertions.assertTrue(plan.getValue().reference().startsWith("SPY-"));
        verify(queryService).evictDetails(PROJECT);
        verifyNoInteractions(ledgerClient);
    }

    @Test
    void projectCostIsUsedWhenNoTotalDeclared() {
        when(projectClient.fetchProjectInfo(PROJECT)).thenReturn(Optional.of(project("u-1", "payment_pending")));
        when(paymentRepository.existsByProjectId(PROJECT)).thenReturn(false);
        when(txService.createPayment(any(), eq(OWNER))).thenReturn(outcome(PaymentView.from(singlePay())));
        when(outboxDispatcher.dispatchNow(any())).thenReturn(Set.of());

        orchestrator.selectPaymentMethod(PROJECT, OWNER, new SelectMethodCommand(PaymentMethod.SINGLE_PAY, null, null, null));

        ArgumentCaptor<PaymentTxService.SelectionPlan> plan = ArgumentCaptor.forClass(PaymentTxService.SelectionPlan.class);
        verify(txService).createPayment(plan.capture(), eq(OWNER));
        Assertions.assertEquals(Money.of("12000.00"), plan.getValue().total());
    }

    @Test
    void unknownProjectIsNotFound() {
        when(projectClient.fetchProjectInfo(PROJECT)).thenReturn(Optional.empty());

        Assertions.assertThrows(NotFoundException.class, () -> orchestrator.selectPaymentMethod(PROJECT, OWNER,
                new SelectMethodCommand(PaymentMethod.SINGLE_PAY, Money.of("5000.00"), null, null)));
    }

    @Test
    void onlyOwnerMaySelect() {
        when(projectClient.fetchProjectInfo(PROJECT)).thenReturn(Optional.of(project("someone-else", "payment_pending")));

        Assertions.assertThrows(ForbiddenException.class, () -> orchestrator.selectPaymentMethod(PROJECT, OWNER,
                new SelectMethodCommand(PaymentMethod.SINGLE_PAY, Money.of("5000.00"), null, null)));
        verifyNoInteractions(txService);
    }

    @Test
    void projectMustAwaitPayment() {
        when(projectClient.fetchProjectInfo(PROJECT)).thenReturn(Optional.of(project("u-1", "in_progress")));

        Assertions.assertThrows(BusinessRuleException.class, () -> orchestrator.selectPaymentMethod(PROJECT, OWNER,
                new SelectMethodCommand(PaymentMethod.SINGLE_PAY, Money.of("5000.00"), null, null)));
    }

    @Test
    void secondSelectionIsConflict() {
        when(projectClient.fetchProjectInfo(PROJECT)).thenReturn(Optional.of(project("u-1", "payment_pending")));
        when(paymentRepository.existsByProjectId(PROJECT)).thenReturn(true);

        Assertions.assertThrows(ConflictException.class, () -> orchestrator.selectPaymentMethod(PROJECT, OWNER,
                new SelectMethodCommand(PaymentMethod.SINGLE_PAY, Money.of("5000.00"), null, null)));
        verifyNoInteractions(txService);
    }

    @Test
    void invalidBnplSelectionReportsEveryError() {
        when(projectClient.fetchProjectInfo(PROJECT)).thenReturn(Optional.of(project("u-1", "payment_pending")));
        when(paymentRepository.existsByProjectId(PROJECT)).thenReturn(false);

        ValidationException ex = Assertions.assertThrows(ValidationException.class,
                () -> orchestrator.selectPaymentMethod(PROJECT, OWNER, new SelectMethodCommand(
                        PaymentMethod.BNPL, Money.of("1000.00"), Money.of("1000.00"), 30)));
        Assertions.assertTrue(ex.getMessage().contains("between 3 and 24"));
        verifyNoInteractions(ledgerClient);
    }

    @Test
    void bnplWithInsufficientCreditIsRejectedBeforeAnyHold() {
        when(projectClient.fetchProjectInfo(PROJECT)).thenReturn(Optional.of(project("u-1", "payment_pending")));
        when(paymentRepository.existsByProjectId(PROJECT)).thenReturn(false);
        when(ledgerClient.fetchProfile("u-1", "Bearer t"))
                .thenReturn(new LedgerProfile("u-1", Money.of("500.00"), FlagStatus.GREEN));

        BusinessRuleException ex = Assertions.assertThrows(BusinessRuleException.class,
                () -> orchestrator.selectPaymentMethod(PROJECT, OWNER, new SelectMethodCommand(
                        PaymentMethod.BNPL, Money.of("1000.00"), Money.ZERO, 3)));

        Assertions.assertEquals("Insufficient credit. Required: 1000.00, available: 500.00", ex.getMessage());
        verify(ledgerClient, never()).adjustCredit(anyString(), any(), any(), anyString(), anyString(), anyString(), any());
        verifyNoInteractions(txService);
    }

    @Test
    void bnplRequiresGreenFlag() {
        when(projectClient.fetchProjectInfo(PROJECT)).thenReturn(Optional.of(project("u-1", "payment_pending")));
        when(paymentRepository.existsByProjectId(PROJECT)).thenReturn(false);
        when(ledgerClient.fetchProfile("u-1", "Bearer t"))
                .thenReturn(new LedgerProfile("u-1", Money.of("50000.00"), FlagStatus.YELLOW));

        Assertions.assertThrows(BusinessRuleException.class, () -> orchestrator.selectPaymentMethod(PROJECT, OWNER,
                new SelectMethodCommand(PaymentMethod.BNPL, Money.of("12000.00"), Money.of("2000.00"), 5)));
        verifyNoInteractions(txService);
    }

    @Test
    void bnplHoldsFinancedPrincipalKeyedByReference() {
        when(projectClient.fetchProjectInfo(PROJECT)).thenReturn(Optional.of(project("u-1", "payment_pending")));
        when(paymentRepository.existsByProjectId(PROJECT)).thenReturn(false);
        when(ledgerClient.fetchProfile("u-1", "Bearer t"))
                .thenReturn(new LedgerProfile("u-1", Money.of("20000.00"), FlagStatus.GREEN));
        when(txService.createPayment(any(), eq(OWNER))).thenReturn(outcome(PaymentView.from(singlePay())));
        when(outboxDispatcher.dispatchNow(any())).thenReturn(Set.of());

        orchestrator.selectPaymentMethod(PROJECT, OWNER,
                new SelectMethodCommand(PaymentMethod.BNPL, Money.of("12000.00"), Money.of("2000.00"), 5));

        ArgumentCaptor<PaymentTxService.SelectionPlan> plan = ArgumentCaptor.forClass(PaymentTxService.SelectionPlan.class);
        verify(txService).createPayment(plan.capture(), eq(OWNER));
        PaymentTxService.SelectionPlan p = plan.getValue();
        Assertions.assertEquals(Money.of("10000.00"), p.creditHold());
        Assertions.assertEquals(5, p.schedule().installments().size());
        Assertions.assertEquals(LocalDate.of(2025, 4, 11), p.schedule().installments().get(0).dueDate());
        Assertions.assertTrue(p.reference().startsWith("BNPL-"));
        verify(ledgerClient).adjustCredit(eq("u-1"), eq(Money.of("10000.00")), eq(CreditOperation.DEDUCT), eq(PROJECT),
                anyString(), eq(p.reference()), eq("Bearer t"));
    }

    @Test
    void concurrentSelectionAfterHoldGivesCreditBack() {
        when(projectClient.fetchProjectInfo(PROJECT)).thenReturn(Optional.of(project("u-1", "payment_pending")));
        when(paymentRepository.existsByProjectId(PROJECT)).thenReturn(false);
        when(ledgerClient.fetchProfile("u-1", "Bearer t"))
                .thenReturn(new LedgerProfile("u-1", Money.of("20000.00"), FlagStatus.GREEN));
        when(txService.createPayment(any(), eq(OWNER)))
                .thenThrow(new ConflictException("Payment method already selected for this project"));

        Assertions.assertThrows(ConflictException.class, () -> orchestrator.selectPaymentMethod(PROJECT, OWNER,
                new SelectMethodCommand(PaymentMethod.BNPL, Money.of("12000.00"), Money.of("2000.00"), 5)));

        ArgumentCaptor<String> key = ArgumentCaptor.forClass(String.class);
        verify(ledgerClient).adjustCredit(eq("u-1"), eq(Money.of("10000.00")), eq(CreditOperation.ADD), eq(PROJECT),
                anyString(), key.capture(), eq("Bearer t"));
        Assertions.assertTrue(key.getValue().endsWith(":release"));
        verifyNoInteractions(outboxDispatcher);
    }

    @Test
    void fullPaymentChargesTotalWhenNoAmountGiven() {
        when(paymentRepository.findByProjectId(PROJECT)).thenReturn(Optional.of(singlePay()));
        when(paymentProcessor.charge(eq("u-1"), eq(Money.of("5000.00")), anyString()))
                .thenReturn(GatewayResult.approved("PAY-1"));
        when(txService.recordFullPayment(PROJECT, Money.of("5000.00"), "PAY-1", OWNER))
                .thenReturn(outcome(PaymentView.from(singlePay())));
        when(outboxDispatcher.dispatchNow(any())).thenReturn(Set.of());

        orchestrator.payFull(PROJECT, OWNER, null);

        verify(queryService).evictDetails(PROJECT);
    }

    @Test
    void fullPaymentOnCompletedPaymentIsRejected() {
        Payment paid = singlePay();
        paid.applyFullPayment(Money.of("5000.00"), NOW);
        when(paymentRepository.findByProjectId(PROJECT)).thenReturn(Optional.of(paid));

        Assertions.assertThrows(BusinessRuleException.class, () -> orchestrator.payFull(PROJECT, OWNER, null));
        verifyNoInteractions(paymentProcessor, txService);
    }

    @Test
    void fullPaymentBelowTotalIsInvalid() {
        when(paymentRepository.findByProjectId(PROJECT)).thenReturn(Optional.of(singlePay()));

        Assertions.assertThrows(ValidationException.class,
                () -> orchestrator.payFull(PROJECT, OWNER, Money.of("4999.99")));
        verifyNoInteractions(paymentProcessor);
    }

    @Test
    void declinedChargeRecordsNothing() {
        when(paymentRepository.findByProjectId(PROJECT)).thenReturn(Optional.of(singlePay()));
        when(paymentProcessor.charge(anyString(), any(), anyString())).thenReturn(GatewayResult.declined("card expired"));

        PaymentDeclinedException ex = Assertions.assertThrows(PaymentDeclinedException.class,
                () -> orchestrator.payFull(PROJECT, OWNER, null));
        Assertions.assertEquals("Payment failed: card expired", ex.getMessage());
        verifyNoInteractions(txService);
    }

    @Test
    void onlyPayerMayPay() {
        when(paymentRepository.findByProjectId(PROJECT)).thenReturn(Optional.of(singlePay()));

        Assertions.assertThrows(ForbiddenException.class,
                () -> orchestrator.payFull(PROJECT, new Actor("u-2", "user", null), null));
    }

    @Test
    void downpaymentOnSinglePayIsRejected() {
        when(paymentRepository.findByProjectId(PROJECT)).thenReturn(Optional.of(singlePay()));

        Assertions.assertThrows(BusinessRuleException.class,
                () -> orchestrator.payDownpayment(PROJECT, OWNER, Money.of("1000.00")));
    }

    @Test
    void overdueInstallmentRequiresLateFee() {
        InstallmentSchedule first = bnplDueOn(LocalDate.of(2025, 3, 1)).getInstallments().get(0);
        when(installmentRepository.findWithPayment(first.getId())).thenReturn(Optional.of(first));

        ValidationException ex = Assertions.assertThrows(ValidationException.class,
                () -> orchestrator.payInstallment(PROJECT, OWNER, first.getId(), Money.of("2000.00")));
        Assertions.assertTrue(ex.getMessage().contains("2040.00"), ex.getMessage());
        verifyNoInteractions(paymentProcessor);
    }

    @Test
    void overdueInstallmentWithLateFeeIsCharged() {
        InstallmentSchedule first = bnplDueOn(LocalDate.of(2025, 3, 1)).getInstallments().get(0);
        when(installmentRepository.findWithPayment(first.getId())).thenReturn(Optional.of(first));
        when(paymentProcessor.charge(eq("u-1"), eq(Money.of("2040.00")), anyString()))
                .thenReturn(GatewayResult.approved("PAY-2"));
        InstallmentView view = InstallmentView.from(first);
        when(txService.recordInstallment(PROJECT, first.getId(), Money.of("2040.00"), "PAY-2", OWNER))
                .thenReturn(outcome(view));
        when(outboxDispatcher.dispatchNow(any())).thenReturn(Set.of(OutboxCommandType.LEDGER_CREDIT));

        InstallmentView result = orchestrator.payInstallment(PROJECT, OWNER, first.getId(), Money.of("2040.00"));

        Assertions.assertSame(view, result);
    }

    @Test
    void installmentBeforeDownpaymentIsRejected() {
        InstallmentPlan plan = new InstallmentPlan(Money.of("6000.00"), Money.of("2000.00"), List.of(
                new InstallmentPlan.Item(1, Money.of("2000.00"), LocalDate.of(2025, 4, 1)),
                new InstallmentPlan.Item(2, Money.of("2000.00"), LocalDate.of(2025, 5, 1)),
                new InstallmentPlan.Item(3, Money.of("2000.00"), LocalDate.of(2025, 6, 1))));
        Payment payment = Payment.newBnpl(PROJECT, "u-1", "c-1", Money.of("8000.00"), Money.of("2000.00"), plan,
                Money.of("6000.00"), "BNPL-TEST-000002", NOW);
        InstallmentSchedule first = payment.getInstallments().get(0);
        when(installmentRepository.findWithPayment(first.getId())).thenReturn(Optional.of(first));

        BusinessRuleException ex = Assertions.assertThrows(BusinessRuleException.class,
                () -> orchestrator.payInstallment(PROJECT, OWNER, first.getId(), Money.of("2000.00")));
        Assertions.assertEquals("Downpayment must be paid before installments", ex.getMessage());
        verifyNoInteractions(paymentProcessor);
    }

    @Test
    void installmentOfAnotherProjectIsNotFound() {
        InstallmentSchedule first = bnplDueOn(LocalDate.of(2025, 4, 1)).getInstallments().get(0);
        when(installmentRepository.findWithPayment(first.getId())).thenReturn(Optional.of(first));

        Assertions.assertThrows(NotFoundException.class,
                () -> orchestrator.payInstallment("p-other", OWNER, first.getId(), Money.of("2000.00")));
    }

    @Test
    void releaseRequiresAdminRole() {
        Assertions.assertThrows(ForbiddenException.class, () -> orchestrator.releaseToContractor(PROJECT, OWNER,
                new ReleaseCommand(Money.of("4500.00"), null, null, null)));
        verifyNoInteractions(paymentRepository, txService);
    }

    @Test
    void releaseTwiceIsConflict() {
        Payment released = singlePay();
        released.markReleasedToContractor(Money.of("4500.00"), "ADM-1", null, null, "a-1", NOW);
        when(paymentRepository.findByProjectId(PROJECT)).thenReturn(Optional.of(released));

        Assertions.assertThrows(ConflictException.class, () -> orchestrator.releaseToContractor(PROJECT, ADMIN,
                new ReleaseCommand(Money.of("4500.00"), null, null, null)));
    }

    @Test
    void releaseReportsUndeliveredContractorCredit() {
        when(paymentRepository.findByProjectId(PROJECT)).thenReturn(Optional.of(singlePay()));
        when(projectClient.fetchProjectInfo(PROJECT)).thenReturn(Optional.of(project("u-1", "payment_completed")));
        when(contractorClient.fetchContractor("c-1")).thenReturn(Optional.of(new ContractorInfo("c-1", "Sun Co")));
        when(txService.recordRelease(eq(PROJECT), any(), eq("ADM-42"), eq("c-1"), eq(ADMIN)))
                .thenReturn(outcome(PaymentView.from(singlePay())));
        when(outboxDispatcher.dispatchNow(any())).thenReturn(Set.of(OutboxCommandType.CONTRACTOR_CREDIT));

        BusinessRuleException ex = Assertions.assertThrows(BusinessRuleException.class,
                () -> orchestrator.releaseToContractor(PROJECT, ADMIN,
                        new ReleaseCommand(Money.of("4500.00"), " ADM-42 ", "manual", null)));

        Assertions.assertEquals("Payment recorded but failed to update contractor balance. Please contact support.",
                ex.getMessage());
    }

    @Test
    void releaseToUnknownContractorIsNotFound() {
        when(paymentRepository.findByProjectId(PROJECT)).thenReturn(Optional.of(singlePay()));
        when(projectClient.fetchProjectInfo(PROJECT)).thenReturn(Optional.of(project("u-1", "payment_completed")));
        when(contractorClient.fetchContractor("c-1")).thenReturn(Optional.empty());

        Assertions.assertThrows(NotFoundException.class, () -> orchestrator.releaseToContractor(PROJECT, ADMIN,
                new ReleaseCommand(Money.of("4500.00"), null, null, null)));
        verifyNoInteractions(txService);
    }

    @Test
    void installmentsBeforeSelectionAreEmptyForOwner() {
        when(queryService.findInstallments(PROJECT)).thenReturn(Optional.empty());
        when(projectClient.fetchProjectInfo(PROJECT)).thenReturn(Optional.of(project("u-1", "payment_pending")));

        Assertions.assertTrue(orchestrator.getInstallments(PROJECT, OWNER).isEmpty());
    }

    @Test
    void installmentsAreHiddenFromOthers() {
        when(queryService.findInstallments(PROJECT))
                .thenReturn(Optional.of(new PaymentQueryService.PaymentInstallments("u-1", List.of())));

        Assertions.assertThrows(ForbiddenException.class,
                () -> orchestrator.getInstallments(PROJECT, new Actor("u-2", "user", null)));
    }

    @Test
    void detailsAreVisibleToContractorButNotStrangers() {
        PaymentDetailsView details = new PaymentDetailsView(PaymentView.from(singlePay()), List.of(), List.of());
        when(queryService.loadDetails(PROJECT)).thenReturn(details);

        Assertions.assertSame(details, orchestrator.getPaymentDetails(PROJECT, new Actor("c-1", "contractor", null)));
        Assertions.assertSame(details, orchestrator.getPaymentDetails(PROJECT, ADMIN));
        Assertions.assertThrows(ForbiddenException.class,
                () -> orchestrator.getPaymentDetails(PROJECT, new Actor("u-2", "user", null)));
    }
}
