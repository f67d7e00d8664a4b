package com.github.dimitryivaniuta.solar.payments.service;

import com.github.dimitryivaniuta.solar.payments.client.ContractorClient;
import com.github.dimitryivaniuta.solar.payments.client.LedgerClient;
import com.github.dimitryivaniuta.solar.payments.client.ProjectGatewayClient;
import com.github.dimitryivaniuta.solar.payments.client.dto.ContractorInfo;
import com.github.dimitryivaniuta.solar.payments.client.dto.CreditOperation;
import com.github.dimitryivaniuta.solar.payments.client.dto.LedgerProfile;
import com.github.dimitryivaniuta.solar.payments.client.dto.ProjectInfo;
import com.github.dimitryivaniuta.solar.payments.config.AppProperties;
import com.github.dimitryivaniuta.solar.payments.domain.InstallmentPlan;
import com.github.dimitryivaniuta.solar.payments.domain.InstallmentSchedule;
import com.github.dimitryivaniuta.solar.payments.domain.Money;
import com.github.dimitryivaniuta.solar.payments.domain.OutboxCommandType;
import com.github.dimitryivaniuta.solar.payments.domain.Payment;
import com.github.dimitryivaniuta.solar.payments.domain.PaymentMethod;
import com.github.dimitryivaniuta.solar.payments.domain.TransactionType;
import com.github.dimitryivaniuta.solar.payments.exception.BusinessRuleException;
import com.github.dimitryivaniuta.solar.payments.exception.ConflictException;
import com.github.dimitryivaniuta.solar.payments.exception.ForbiddenException;
import com.github.dimitryivaniuta.solar.payments.exception.NotFoundException;
import com.github.dimitryivaniuta.solar.payments.exception.PaymentDeclinedException;
import com.github.dimitryivaniuta.solar.payments.exception.RemoteServiceException;
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
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Payment use cases.
 *
 * <p>Every mutating use case runs the same way: validate (including remote preconditions), call the
 * gateway or the ledger where needed, commit one local transaction through {@link PaymentTxService},
 * then dispatch the outbox commands that transaction wrote. Only a failed contractor credit is reported
 * back to the caller after commit; every other post-commit failure is left to the outbox worker.</p>
 */
@Service
public class PaymentOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PaymentOrchestrator.class);

    static final String ADMIN_REFERENCE_PREFIX = "ADM";

    private final ProjectGatewayClient projectClient;
    private final LedgerClient ledgerClient;
    private final ContractorClient contractorClient;
    private final PaymentProcessor paymentProcessor;
    private final PaymentRepository paymentRepository;
    private final InstallmentScheduleRepository installmentRepository;
    private final PaymentTxService txService;
    private final PaymentQueryService queryService;
    private final OutboxDispatcher outboxDispatcher;
    private final AppProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public PaymentOrchestrator(
            ProjectGatewayClient projectClient,
            LedgerClient ledgerClient,
            ContractorClient contractorClient,
            PaymentProcessor paymentProcessor,
            PaymentRepository paymentRepository,
            InstallmentScheduleRepository installmentRepository,
            PaymentTxService txService,
            PaymentQueryService queryService,
            OutboxDispatcher outboxDispatcher,
            AppProperties properties,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.projectClient = projectClient;
        this.ledgerClient = ledgerClient;
        this.contractorClient = contractorClient;
        this.paymentProcessor = paymentProcessor;
        this.paymentRepository = paymentRepository;
        this.installmentRepository = installmentRepository;
        this.txService = txService;
        this.queryService = queryService;
        this.outboxDispatcher = outboxDispatcher;
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Chooses single pay or BNPL for a project and creates its payment.
     *
     * <p>For BNPL the financed principal is deducted from the payer's credit before anything is stored. If the
     * local transaction then fails (typically a concurrent selection), the deduction is added back.</p>
     *
     * @param projectId project id
     * @param actor     caller (must own the project)
     * @param command   selection
     * @return created payment
     */
    public PaymentView selectPaymentMethod(String projectId, Actor actor, SelectMethodCommand command) {
        ProjectInfo project = requireProject(projectId);
        if (!project.isOwnedBy(actor.userId())) {
            throw new ForbiddenException("Only the project owner can select the payment method");
        }
        String requiredStatus = properties.getPayments().getSelectableProjectStatus();
        if (project.status() != null && !project.status().equalsIgnoreCase(requiredStatus)) {
            throw new BusinessRuleException("Project is not awaiting payment (status: " + project.status() + ")");
        }

        Money total = effectiveTotal(command.declaredTotal(), project.cost());
        if (paymentRepository.existsByProjectId(projectId)) {
            throw new ConflictException("Payment method already selected for this project");
        }

        Money minInstallment = Money.of(properties.getPayments().getMinInstallment());
        List<String> errors = PaymentCalculator.validatePaymentSelection(total, command.method(), command.downpayment(),
                command.installments(), minInstallment);
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        String reference = PaymentCalculator.generateReference(command.method().referencePrefix(), clock.instant());
        PaymentTxService.SelectionPlan plan = command.method() == PaymentMethod.BNPL
                ? holdCreditForBnpl(projectId, project, actor, command, total, reference)
                : new PaymentTxService.SelectionPlan(projectId, actor.userId(), project.contractorId(), PaymentMethod.SINGLE_PAY,
                        total, Money.ZERO, null, Money.ZERO, reference);

        TxOutcome<PaymentView> outcome;
        try {
            outcome = txService.createPayment(plan, actor);
        } catch (ConflictException | DataIntegrityViolationException e) {
            releaseCreditHold(plan, actor, e);
            throw new ConflictException("Payment method already selected for this project", e);
        } catch (RuntimeException e) {
            releaseCreditHold(plan, actor, e);
            throw e;
        }

        meterRegistry.counter("payments.selected", "method", plan.method().wireValue()).increment();
        afterCommit(projectId, outcome);
        return outcome.view();
    }

    /**
     * Pays the BNPL downpayment.
     *
     * @param projectId project id
     * @param actor     payer
     * @param amount    amount, must equal the downpayment
     * @return updated payment
     */
    public PaymentView payDownpayment(String projectId, Actor actor, Money amount) {
        Payment payment = requirePayment(projectId);
        requirePayer(payment, actor);
        if (!payment.isBnpl()) {
            throw new BusinessRuleException("Downpayment is only available for BNPL payments");
        }
        if (payment.isCompleted()) {
            throw new BusinessRuleException("Payment already completed");
        }
        if (!payment.getDownpaymentAmount().isPositive()) {
            throw new BusinessRuleException("No downpayment is required for this payment");
        }
        if (!amount.equals(payment.getDownpaymentAmount())) {
            throw new ValidationException("Downpayment amount must be exactly " + payment.getDownpaymentAmount());
        }
        if (payment.getPaidAmount().isAtLeast(payment.getDownpaymentAmount())) {
            throw new BusinessRuleException("Downpayment already paid");
        }

        String gatewayRef = charge(payment, amount, "Downpayment " + payment.getPaymentReference());
        TxOutcome<PaymentView> outcome = recordCharged(payment, amount, gatewayRef,
                () -> txService.recordDownpayment(projectId, amount, gatewayRef, actor));
        moneyMoved(TransactionType.DOWNPAYMENT, amount);
        afterCommit(projectId, outcome);
        return outcome.view();
    }

    /**
     * Pays a single-pay project in full. Tendering more than the total is accepted and recorded as excess.
     *
     * @param projectId project id
     * @param actor     payer
     * @param amount    amount, or null for the total
     * @return completed payment
     */
    public PaymentView payFull(String projectId, Actor actor, Money amount) {
        Payment payment = requirePayment(projectId);
        requirePayer(payment, actor);
        if (payment.getPaymentMethod() != PaymentMethod.SINGLE_PAY) {
            throw new BusinessRuleException("Full payment is only available for single pay");
        }
        if (payment.isCompleted()) {
            throw new BusinessRuleException("Payment already completed");
        }
        Money tendered = amount == null ? payment.getTotalAmount() : amount;
        if (tendered.isLessThan(payment.getTotalAmount())) {
            throw new ValidationException("Amount must be at least the total amount " + payment.getTotalAmount());
        }

        String gatewayRef = charge(payment, tendered, "Full payment " + payment.getPaymentReference());
        TxOutcome<PaymentView> outcome = recordCharged(payment, tendered, gatewayRef,
                () -> txService.recordFullPayment(projectId, tendered, gatewayRef, actor));
        moneyMoved(TransactionType.FULL_PAYMENT, tendered);
        afterCommit(projectId, outcome);
        return outcome.view();
    }

    /**
     * Pays one BNPL installment plus any late fee.
     *
     * @param projectId     project id
     * @param actor         payer
     * @param installmentId installment id
     * @param amount        amount, at least installment + late fee
     * @return paid installment
     */
    public InstallmentView payInstallment(String projectId, Actor actor, String installmentId, Money amount) {
        InstallmentSchedule installment = installmentRepository.findWithPayment(installmentId)
                .filter(s -> s.getPayment().getProjectId().equals(projectId))
                .orElseThrow(() -> new NotFoundException("Installment not found"));
        Payment payment = installment.getPayment();
        requirePayer(payment, actor);
        if (installment.isPaid()) {
            throw new BusinessRuleException("Installment already paid");
        }
        if (payment.isDownpaymentOutstanding()) {
            throw new BusinessRuleException("Downpayment must be paid before installments");
        }

        int overdueDays = PaymentCalculator.overdueDays(installment.getDueDate(), LocalDate.now(clock));
        Money lateFee = PaymentCalculator.lateFee(installment.getAmount(), overdueDays);
        Money minimum = installment.getAmount().plus(lateFee);
        if (amount.isLessThan(minimum)) {
            throw new ValidationException("Amount must be at least " + minimum + " (installment " + installment.getAmount()
                    + " + late fee " + lateFee + ")");
        }

        String gatewayRef = charge(payment, amount, "Installment #" + installment.getInstallmentNumber() + " " + payment.getPaymentReference());
        TxOutcome<InstallmentView> outcome = recordCharged(payment, amount, gatewayRef,
                () -> txService.recordInstallment(projectId, installmentId, amount, gatewayRef, actor));
        moneyMoved(TransactionType.INSTALLMENT, amount);

        Set<OutboxCommandType> pending = afterCommit(projectId, outcome);
        if (pending.contains(OutboxCommandType.LEDGER_CREDIT)) {
            log.error("Installment paid but credit replenishment not delivered, left for retry; reconcile if it goes DEAD. projectId={} paymentId={} installmentId={} reference={}",
                    projectId, payment.getId(), installmentId, gatewayRef);
        }
        return outcome.view();
    }

    /**
     * Releases funds to the project's contractor (admin only, once per payment).
     *
     * @param projectId project id
     * @param admin     admin caller
     * @param command   payout
     * @return released payment
     * @throws BusinessRuleException if the payout was recorded but the contractor balance could not be credited
     */
    public PaymentView releaseToContractor(String projectId, Actor admin, ReleaseCommand command) {
        if (!admin.hasAnyRole(properties.getPayments().getAdminRoles())) {
            throw new ForbiddenException("Only admins can release payments to contractors");
        }
        if (command.amount() == null || !command.amount().isPositive()) {
            throw new ValidationException("Amount must be positive");
        }
        Payment payment = requirePayment(projectId);
        if (payment.isAdminPaidContractor()) {
            throw new ConflictException("Payment already released to contractor");
        }

        ProjectInfo project = requireProject(projectId);
        String contractorId = project.contractorId() != null ? project.contractorId() : payment.getContractorId();
        if (contractorId == null) {
            throw new BusinessRuleException("Project has no contractor assigned");
        }
        ContractorInfo contractor = contractorClient.fetchContractor(contractorId)
                .orElseThrow(() -> new NotFoundException("Contractor not found"));

        String reference = command.reference() != null && !command.reference().isBlank()
                ? command.reference().trim()
                : PaymentCalculator.generateReference(ADMIN_REFERENCE_PREFIX, clock.instant());

        TxOutcome<PaymentView> outcome = txService.recordRelease(projectId, command, reference, contractor.id(), admin);
        moneyMoved(TransactionType.ADMIN_RELEASE, command.amount());

        Set<OutboxCommandType> pending = afterCommit(projectId, outcome);
        if (pending.contains(OutboxCommandType.CONTRACTOR_CREDIT)) {
            log.error("Contractor payout recorded but balance credit failed, left for retry. projectId={} paymentId={} contractorId={} amount={} reference={}",
                    projectId, payment.getId(), contractor.id(), command.amount(), reference);
            throw new BusinessRuleException("Payment recorded but failed to update contractor balance. Please contact support.");
        }
        return outcome.view();
    }

    /**
     * Installments of the project, visible to the project owner only.
     *
     * @param projectId project id
     * @param actor     caller
     * @return installments ordered by number, empty when no payment exists yet
     */
    public List<InstallmentView> getInstallments(String projectId, Actor actor) {
        var found = queryService.findInstallments(projectId);
        if (found.isPresent()) {
            if (!Objects.equals(found.get().payerId(), actor.userId())) {
                throw new ForbiddenException("Only the project owner can view installments");
            }
            return found.get().installments();
        }
        ProjectInfo project = requireProject(projectId);
        if (!project.isOwnedBy(actor.userId())) {
            throw new ForbiddenException("Only the project owner can view installments");
        }
        return List.of();
    }

    /**
     * Payment details, visible to the owner, the project contractor and admins.
     *
     * @param projectId project id
     * @param actor     caller
     * @return details
     */
    public PaymentDetailsView getPaymentDetails(String projectId, Actor actor) {
        PaymentDetailsView details = queryService.loadDetails(projectId);
        PaymentView p = details.payment();
        boolean allowed = Objects.equals(p.payerId(), actor.userId())
                || (p.contractorId() != null && p.contractorId().equals(actor.userId()))
                || actor.hasAnyRole(properties.getPayments().getAdminRoles());
        if (!allowed) {
            throw new ForbiddenException("Not allowed to view this payment");
        }
        return details;
    }

    private PaymentTxService.SelectionPlan holdCreditForBnpl(String projectId, ProjectInfo project, Actor actor,
                                                             SelectMethodCommand command, Money total, String reference) {
        Money downpayment = command.downpayment() == null ? Money.ZERO : command.downpayment();
        LedgerProfile profile;
        try {
            profile = ledgerClient.fetchProfile(actor.userId(), actor.authToken());
        } catch (RemoteServiceException e) {
            remoteFailure(e);
            throw new BusinessRuleException("Unable to verify financing eligibility. Please try again later.", e);
        }
        if (!LedgerClient.isEligibleForBnpl(profile.flagStatus())) {
            throw new BusinessRuleException("Not eligible for Buy Now Pay Later (flag status: " + profile.flagStatus() + ")");
        }
        LedgerClient.CreditCheck check = LedgerClient.checkEligibility(profile.creditBalance(), total, downpayment);
        if (!check.eligible()) {
            throw new BusinessRuleException(check.reason());
        }

        InstallmentPlan schedule = PaymentCalculator.buildInstallmentSchedule(total, downpayment, command.installments(),
                LocalDate.now(clock));
        Money hold = profile.creditBalance().min(check.required());
        if (hold.isPositive()) {
            try {
                ledgerClient.adjustCredit(actor.userId(), hold, CreditOperation.DEDUCT, projectId,
                        "BNPL credit hold " + reference, reference, actor.authToken());
            } catch (RemoteServiceException e) {
                remoteFailure(e);
                log.warn("Credit hold failed, payment not created. projectId={} payerId={} amount={} error={}",
                        projectId, actor.userId(), hold, e.getMessage());
                throw new BusinessRuleException("Failed to reserve financing credit. Please try again later.", e);
            }
        }
        return new PaymentTxService.SelectionPlan(projectId, actor.userId(), project.contractorId(), PaymentMethod.BNPL,
                total, downpayment, schedule, hold, reference);
    }

    private void releaseCreditHold(PaymentTxService.SelectionPlan plan, Actor actor, Exception cause) {
        if (!plan.creditHold().isPositive()) {
            return;
        }
        log.warn("Payment not created after credit hold, adding credit back. projectId={} payerId={} amount={} cause={}",
                plan.projectId(), plan.payerId(), plan.creditHold(), cause.toString());
        try {
            ledgerClient.adjustCredit(plan.payerId(), plan.creditHold(), CreditOperation.ADD, plan.projectId(),
                    "BNPL credit hold released " + plan.reference(), plan.reference() + ":release", actor.authToken());
        } catch (RemoteServiceException e) {
            remoteFailure(e);
            log.error("Credit hold compensation failed, manual reconciliation required. projectId={} payerId={} amount={} reference={} error={}",
                    plan.projectId(), plan.payerId(), plan.creditHold(), plan.reference(), e.getMessage());
        }
    }

    private String charge(Payment payment, Money amount, String description) {
        GatewayResult result = paymentProcessor.charge(payment.getPayerId(), amount, description);
        if (!result.success()) {
            log.info("Gateway declined charge. projectId={} paymentId={} amount={} reason={}",
                    payment.getProjectId(), payment.getId(), amount, result.reason());
            throw new PaymentDeclinedException("Payment failed: " + result.reason());
        }
        return result.reference();
    }

    private <T> TxOutcome<T> recordCharged(Payment payment, Money amount, String gatewayRef,
                                           Supplier<TxOutcome<T>> tx) {
        try {
            return tx.get();
        } catch (RuntimeException e) {
            log.error("Gateway charge succeeded but recording failed, refund or reconciliation required. projectId={} paymentId={} amount={} gatewayReference={} error={}",
                    payment.getProjectId(), payment.getId(), amount, gatewayRef, e.toString());
            throw e;
        }
    }

    /**
     * Post-commit step: evicts the cached details and dispatches the commands of this use case.
     *
     * @return command types not delivered (left to the outbox worker)
     */
    private Set<OutboxCommandType> afterCommit(String projectId, TxOutcome<?> outcome) {
        try {
            queryService.evictDetails(projectId);
        } catch (RuntimeException e) {
            log.warn("Payment details eviction failed. projectId={} error={}", projectId, e.toString());
        }
        try {
            return outboxDispatcher.dispatchNow(outcome.commandIds());
        } catch (RuntimeException e) {
            log.warn("Immediate outbox dispatch failed, worker will retry. projectId={} commands={} error={}",
                    projectId, outcome.commandIds().size(), e.toString());
            return EnumSet.allOf(OutboxCommandType.class);
        }
    }

    private ProjectInfo requireProject(String projectId) {
        try {
            return projectClient.fetchProjectInfo(projectId)
                    .orElseThrow(() -> new NotFoundException("Project not found"));
        } catch (RemoteServiceException e) {
            remoteFailure(e);
            throw e;
        }
    }

    private Payment requirePayment(String projectId) {
        return paymentRepository.findByProjectId(projectId)
                .orElseThrow(() -> new NotFoundException("Payment not found for this project"));
    }

    private static void requirePayer(Payment payment, Actor actor) {
        if (!payment.getPayerId().equals(actor.userId())) {
            throw new ForbiddenException("Only the project owner can pay for this project");
        }
    }

    private static Money effectiveTotal(Money declared, BigDecimal projectCost) {
        if (declared != null && declared.isPositive()) {
            return declared;
        }
        Money cost = projectCost == null ? null : Money.of(projectCost);
        if (cost == null || !cost.isPositive()) {
            throw new ValidationException("Total amount is required");
        }
        return cost;
    }

    private void moneyMoved(TransactionType type, Money amount) {
        meterRegistry.counter("payments.money.moved", "type", type.name()).increment(amount.toDecimal().doubleValue());
    }

    private void remoteFailure(RemoteServiceException e) {
        meterRegistry.counter("payments.remote.failures", "service", e.getService()).increment();
    }
}
