package com.github.dimitryivaniuta.solar.payments.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.solar.payments.client.dto.TimelineEvent;
import com.github.dimitryivaniuta.solar.payments.config.AppProperties;
import com.github.dimitryivaniuta.solar.payments.domain.InstallmentPlan;
import com.github.dimitryivaniuta.solar.payments.domain.InstallmentSchedule;
import com.github.dimitryivaniuta.solar.payments.domain.InstallmentStatus;
import com.github.dimitryivaniuta.solar.payments.domain.Money;
import com.github.dimitryivaniuta.solar.payments.domain.Payment;
import com.github.dimitryivaniuta.solar.payments.domain.PaymentMethod;
import com.github.dimitryivaniuta.solar.payments.domain.PaymentTransaction;
import com.github.dimitryivaniuta.solar.payments.domain.TransactionType;
import com.github.dimitryivaniuta.solar.payments.exception.BusinessRuleException;
import com.github.dimitryivaniuta.solar.payments.exception.ConflictException;
import com.github.dimitryivaniuta.solar.payments.exception.NotFoundException;
import com.github.dimitryivaniuta.solar.payments.exception.ValidationException;
import com.github.dimitryivaniuta.solar.payments.repo.InstallmentScheduleRepository;
import com.github.dimitryivaniuta.solar.payments.repo.PaymentRepository;
import com.github.dimitryivaniuta.solar.payments.repo.PaymentTransactionRepository;
import com.github.dimitryivaniuta.solar.payments.service.dto.InstallmentView;
import com.github.dimitryivaniuta.solar.payments.service.dto.PaymentView;
import com.github.dimitryivaniuta.solar.payments.service.dto.ReleaseCommand;
import com.github.dimitryivaniuta.solar.payments.service.dto.TxOutcome;
import com.github.dimitryivaniuta.solar.payments.service.events.PaymentEvent;
import com.github.dimitryivaniuta.solar.payments.service.events.PaymentEventType;
import com.github.dimitryivaniuta.solar.payments.service.outbox.OutboxWriter;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Local, all-or-nothing part of every payment use case.
 *
 * <p>Lives in its own bean so {@code @Transactional} always goes through the Spring proxy when the
 * orchestrator calls it. Each method locks what it mutates, re-checks the preconditions the orchestrator
 * already checked without a lock, then writes the state change, the transaction row and the outbox
 * commands together.</p>
 */
@Service
public class PaymentTxService {

    private static final Logger log = LoggerFactory.getLogger(PaymentTxService.class);

    static final String SELECT_LOCK_SCOPE = "payments:select-method";

    static final String PROJECT_STATUS_PROCESSING = "payment_processing";
    static final String PROJECT_STATUS_COMPLETED = "payment_completed";

    private final PaymentRepository paymentRepository;
    private final InstallmentScheduleRepository installmentRepository;
    private final PaymentTransactionRepository transactionRepository;
    private final PostgresAdvisoryLockService advisoryLockService;
    private final OutboxWriter outboxWriter;
    private final ObjectMapper objectMapper;
    private final AppProperties properties;
    private final Clock clock;

    public PaymentTxService(
            PaymentRepository paymentRepository,
            InstallmentScheduleRepository installmentRepository,
            PaymentTransactionRepository transactionRepository,
            PostgresAdvisoryLockService advisoryLockService,
            OutboxWriter outboxWriter,
            ObjectMapper objectMapper,
            AppProperties properties,
            Clock clock
    ) {
        this.paymentRepository = paymentRepository;
        this.installmentRepository = installmentRepository;
        this.transactionRepository = transactionRepository;
        this.advisoryLockService = advisoryLockService;
        this.outboxWriter = outboxWriter;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Creates the payment (and schedule) for a project.
     *
     * @param plan  validated selection
     * @param actor payer
     * @return created payment and commands to dispatch
     * @throws ConflictException if the project already has a payment
     */
    @Transactional
    public TxOutcome<PaymentView> createPayment(SelectionPlan plan, Actor actor) {
        advisoryLockService.lock(SELECT_LOCK_SCOPE, plan.projectId());

        if (paymentRepository.existsByProjectId(plan.projectId())) {
            throw new ConflictException("Payment method already selected for this project");
        }

        Instant now = clock.instant();
        Payment payment = plan.method() == PaymentMethod.BNPL
                ? Payment.newBnpl(plan.projectId(), plan.payerId(), plan.contractorId(), plan.total(), plan.downpayment(),
                        plan.schedule(), plan.creditHold(), plan.reference(), now)
                : Payment.newSinglePay(plan.projectId(), plan.payerId(), plan.contractorId(), plan.total(), plan.reference(), now);
        paymentRepository.saveAndFlush(payment);

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("payment_method", plan.method().wireValue());
        meta.put("total_amount", plan.total().toDecimal());
        if (plan.method() == PaymentMethod.BNPL) {
            meta.put("downpayment_amount", plan.downpayment().toDecimal());
            meta.put("number_of_installments", plan.schedule().installments().size());
            meta.put("monthly_emi", plan.schedule().monthlyEmi().toDecimal());
        }

        OutboxWriter.Batch batch = outboxWriter.forPayment(payment)
                .projectStatus(PROJECT_STATUS_PROCESSING, payment.getPaymentReference() + ":status")
                .timeline(timeline("payment_method_selected", "Payment Method Selected",
                        "Customer selected " + describe(plan.method()) + " payment", actor, meta),
                        payment.getPaymentReference() + ":timeline")
                .event(PaymentEvent.of(PaymentEventType.PAYMENT_METHOD_SELECTED, payment, Money.ZERO,
                        payment.getPaymentReference(), currency(), now));

        log.info("Payment created. paymentId={} projectId={} method={} total={} downpayment={} creditHold={} reference={}",
                payment.getId(), payment.getProjectId(), payment.getPaymentMethod(), payment.getTotalAmount(),
                payment.getDownpaymentAmount(), payment.getCreditHoldAmount(), payment.getPaymentReference());
        return new TxOutcome<>(PaymentView.from(payment), batch.ids());
    }

    /**
     * Records a charged BNPL downpayment.
     *
     * @param projectId        project id
     * @param amount           amount charged
     * @param gatewayReference gateway reference
     * @param actor            payer
     * @return updated payment and commands to dispatch
     */
    @Transactional
    public TxOutcome<PaymentView> recordDownpayment(String projectId, Money amount, String gatewayReference, Actor actor) {
        Payment payment = lockPayment(projectId);
        if (payment.isCompleted()) {
            throw new BusinessRuleException("Payment already completed");
        }
        if (!payment.isDownpaymentOutstanding()) {
            throw new BusinessRuleException("Downpayment already paid");
        }

        Instant now = clock.instant();
        payment.applyDownpayment(amount, now);
        transactionRepository.save(PaymentTransaction.success(payment.getId(), TransactionType.DOWNPAYMENT, amount,
                gatewayReference, null, null, now));

        OutboxWriter.Batch batch = outboxWriter.forPayment(payment)
                .timeline(timeline("downpayment_received", "Downpayment Received",
                        "Downpayment of " + amount + " " + currency() + " received", actor,
                        Map.of("amount", amount.toDecimal(), "transaction_reference", gatewayReference)),
                        gatewayReference + ":timeline")
                .event(PaymentEvent.of(PaymentEventType.DOWNPAYMENT_RECEIVED, payment, amount, gatewayReference, currency(), now));

        log.info("Downpayment recorded. paymentId={} projectId={} amount={} paid={} remaining={} reference={}",
                payment.getId(), projectId, amount, payment.getPaidAmount(), payment.getRemainingAmount(), gatewayReference);
        return new TxOutcome<>(PaymentView.from(payment), batch.ids());
    }

    /**
     * Records a charged single full payment.
     *
     * @param projectId        project id
     * @param tendered         amount charged (at least the remaining amount)
     * @param gatewayReference gateway reference
     * @param actor            payer
     * @return completed payment and commands to dispatch
     */
    @Transactional
    public TxOutcome<PaymentView> recordFullPayment(String projectId, Money tendered, String gatewayReference, Actor actor) {
        Payment payment = lockPayment(projectId);
        if (payment.getPaymentMethod() != PaymentMethod.SINGLE_PAY) {
            throw new BusinessRuleException("Full payment is only available for single pay");
        }
        if (payment.isCompleted()) {
            throw new BusinessRuleException("Payment already completed");
        }
        if (tendered.isLessThan(payment.getRemainingAmount())) {
            throw new ValidationException("Amount must be at least " + payment.getRemainingAmount());
        }

        Instant now = clock.instant();
        Money principal = payment.getRemainingAmount();
        Money excess = payment.applyFullPayment(tendered, now);

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("principal", principal.toDecimal());
        meta.put("excess_amount", excess.toDecimal());
        transactionRepository.save(PaymentTransaction.success(payment.getId(), TransactionType.FULL_PAYMENT, tendered,
                gatewayReference, null, toJson(meta), now));

        OutboxWriter.Batch batch = outboxWriter.forPayment(payment)
                .projectStatus(PROJECT_STATUS_COMPLETED, gatewayReference + ":status")
                .timeline(timeline("payment_completed", "Payment Completed",
                        "Full payment of " + tendered + " " + currency() + " received", actor,
                        Map.of("amount", tendered.toDecimal(), "transaction_reference", gatewayReference)),
                        gatewayReference + ":timeline")
                .event(PaymentEvent.of(PaymentEventType.FULL_PAYMENT_RECEIVED, payment, tendered, gatewayReference, currency(), now));

        if (excess.isPositive()) {
            log.warn("Full payment exceeded total, excess kept. paymentId={} projectId={} total={} tendered={} excess={}",
                    payment.getId(), projectId, payment.getTotalAmount(), tendered, excess);
        }
        log.info("Full payment recorded. paymentId={} projectId={} amount={} reference={}",
                payment.getId(), projectId, tendered, gatewayReference);
        return new TxOutcome<>(PaymentView.from(payment), batch.ids());
    }

    /**
     * Records a charged installment. The unpaid count is taken after marking, in this transaction.
     *
     * @param projectId        project id
     * @param installmentId    installment id
     * @param tendered         amount charged
     * @param gatewayReference gateway reference
     * @param actor            payer
     * @return paid installment and commands to dispatch
     */
    @Transactional
    public TxOutcome<InstallmentView> recordInstallment(String projectId, String installmentId, Money tendered,
                                                        String gatewayReference, Actor actor) {
        Payment payment = lockPayment(projectId);
        InstallmentSchedule installment = installmentRepository.findById(installmentId)
                .filter(s -> s.getPayment().getId().equals(payment.getId()))
                .orElseThrow(() -> new NotFoundException("Installment not found"));
        if (installment.isPaid()) {
            throw new BusinessRuleException("Installment already paid");
        }
        if (payment.isDownpaymentOutstanding()) {
            throw new BusinessRuleException("Downpayment must be paid before installments");
        }

        Instant now = clock.instant();
        LocalDate today = LocalDate.now(clock);
        int overdueDays = PaymentCalculator.overdueDays(installment.getDueDate(), today);
        Money lateFee = PaymentCalculator.lateFee(installment.getAmount(), overdueDays);
        Money minimum = installment.getAmount().plus(lateFee);
        if (tendered.isLessThan(minimum)) {
            throw new ValidationException("Amount must be at least " + minimum + " (installment " + installment.getAmount()
                    + " + late fee " + lateFee + ")");
        }

        installment.markPaid(tendered, overdueDays, lateFee, gatewayReference, now);
        long unpaidLeft = installmentRepository.countByPaymentIdAndStatusNot(payment.getId(), InstallmentStatus.PAID);
        Money restore = payment.applyInstallment(installment, tendered, unpaidLeft, now);

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("installment_number", installment.getInstallmentNumber());
        meta.put("installment_amount", installment.getAmount().toDecimal());
        meta.put("late_fee", lateFee.toDecimal());
        meta.put("overdue_days", overdueDays);
        meta.put("excess_amount", tendered.minus(minimum).toDecimal());
        transactionRepository.save(PaymentTransaction.success(payment.getId(), TransactionType.INSTALLMENT, tendered,
                gatewayReference, installment.getId(), toJson(meta), now));

        OutboxWriter.Batch batch = outboxWriter.forPayment(payment)
                .timeline(timeline("installment_paid", "Installment #" + installment.getInstallmentNumber() + " Paid",
                        "Installment #" + installment.getInstallmentNumber() + " of " + tendered + " " + currency() + " received",
                        actor, meta), gatewayReference + ":timeline");
        if (payment.isCompleted()) {
            batch.projectStatus(PROJECT_STATUS_COMPLETED, gatewayReference + ":status");
        }
        if (restore.isPositive()) {
            batch.ledgerCredit(restore, "Installment #" + installment.getInstallmentNumber() + " paid", gatewayReference);
        }
        batch.event(PaymentEvent.of(PaymentEventType.INSTALLMENT_PAID, payment, tendered, gatewayReference, currency(), now));

        log.info("Installment recorded. paymentId={} projectId={} installment={} amount={} lateFee={} overdueDays={} unpaidLeft={} creditRestore={}",
                payment.getId(), projectId, installment.getInstallmentNumber(), tendered, lateFee, overdueDays, unpaidLeft, restore);
        return new TxOutcome<>(InstallmentView.from(installment), batch.ids());
    }

    /**
     * Records the admin payout to the contractor.
     *
     * @param projectId    project id
     * @param command      payout
     * @param reference    payout reference (supplied or generated)
     * @param contractorId contractor to credit
     * @param admin        admin
     * @return released payment and commands to dispatch
     * @throws ConflictException if already released
     */
    @Transactional
    public TxOutcome<PaymentView> recordRelease(String projectId, ReleaseCommand command, String reference,
                                                String contractorId, Actor admin) {
        Payment payment = lockPayment(projectId);
        if (payment.isAdminPaidContractor()) {
            throw new ConflictException("Payment already released to contractor");
        }

        Instant now = clock.instant();
        payment.markReleasedToContractor(command.amount(), reference, command.notes(), command.payout(), admin.userId(), now);

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("contractor_id", contractorId);
        meta.put("amount", command.amount().toDecimal());
        meta.put("payment_reference", reference);
        transactionRepository.save(PaymentTransaction.success(payment.getId(), TransactionType.ADMIN_RELEASE, command.amount(),
                reference, null, toJson(meta), now));

        OutboxWriter.Batch batch = outboxWriter.forPayment(payment)
                .contractorCredit(contractorId, command.amount(), reference)
                .timeline(timeline("admin_action", "Payment Released to Contractor",
                        "Admin released " + command.amount() + " " + currency() + " to the contractor", admin, meta),
                        reference + ":timeline")
                .event(PaymentEvent.of(PaymentEventType.CONTRACTOR_PAYMENT_RELEASED, payment, command.amount(), reference, currency(), now));

        log.info("Contractor payout recorded. paymentId={} projectId={} contractorId={} amount={} reference={} adminId={}",
                payment.getId(), projectId, contractorId, command.amount(), reference, admin.userId());
        return new TxOutcome<>(PaymentView.from(payment), batch.ids());
    }

    private Payment lockPayment(String projectId) {
        return paymentRepository.findByProjectIdForUpdate(projectId)
                .orElseThrow(() -> new NotFoundException("Payment not found for this project"));
    }

    private TimelineEvent timeline(String type, String title, String description, Actor actor, Map<String, Object> metadata) {
        return new TimelineEvent(type, title, description, actor.userId(), actor.role(), metadata);
    }

    private static String describe(PaymentMethod method) {
        return method == PaymentMethod.BNPL ? "Buy Now Pay Later" : "single";
    }

    private String currency() {
        return properties.getPayments().getCurrency();
    }

    private String toJson(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize transaction metadata", e);
        }
    }

    /**
     * Everything needed to create a payment, validated and (for BNPL) with the credit already held.
     *
     * @param projectId    project id
     * @param payerId      project owner
     * @param contractorId contractor or null
     * @param method       method
     * @param total        total
     * @param downpayment  downpayment (zero for single pay)
     * @param schedule     BNPL schedule or null
     * @param creditHold   credit deducted from the ledger (zero for single pay)
     * @param reference    payment reference (also the credit hold idempotency key)
     */
    public record SelectionPlan(
            String projectId,
            String payerId,
            String contractorId,
            PaymentMethod method,
            Money total,
            Money downpayment,
            InstallmentPlan schedule,
            Money creditHold,
            String reference
    ) {}
}
