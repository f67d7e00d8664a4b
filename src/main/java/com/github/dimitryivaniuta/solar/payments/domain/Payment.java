package com.github.dimitryivaniuta.solar.payments.domain;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Financing of one project: a single payment or a BNPL plan with its installment schedule.
 *
 * <p>Invariant kept by every mutator: {@code paidAmount + remainingAmount == totalAmount}.
 * Late fees and overpayments never touch principal; they accumulate in {@code feesPaidAmount}.</p>
 *
 * <p>State changes go through the business methods only. They throw {@link IllegalStateException} when
 * called out of order; callers validate first and report domain errors themselves.</p>
 */
@Entity
@Table(
        name = "payments",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_payments_project_id", columnNames = "project_id"),
                @UniqueConstraint(name = "uq_payments_reference", columnNames = "payment_reference")
        }
)
@Getter
@NoArgsConstructor
public class Payment {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "project_id", nullable = false, updatable = false, length = 64)
    private String projectId;

    @Column(name = "payer_id", nullable = false, updatable = false, length = 64)
    private String payerId;

    @Column(name = "contractor_id", length = 64)
    private String contractorId;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, updatable = false, length = 16)
    private PaymentMethod paymentMethod;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 16)
    private PaymentStatus paymentStatus;

    @Column(name = "total_amount", nullable = false, updatable = false)
    private Money totalAmount;

    @Column(name = "downpayment_amount", nullable = false, updatable = false)
    private Money downpaymentAmount;

    @Column(name = "paid_amount", nullable = false)
    private Money paidAmount;

    @Column(name = "remaining_amount", nullable = false)
    private Money remainingAmount;

    @Column(name = "fees_paid_amount", nullable = false)
    private Money feesPaidAmount;

    @Column(name = "number_of_installments")
    private Integer numberOfInstallments;

    @Column(name = "monthly_emi")
    private Money monthlyEmi;

    @Column(name = "credit_hold_amount", nullable = false)
    private Money creditHoldAmount;

    @Column(name = "credit_restored_amount", nullable = false)
    private Money creditRestoredAmount;

    @Column(name = "payment_reference", nullable = false, updatable = false, length = 64)
    private String paymentReference;

    @Column(name = "admin_paid_contractor", nullable = false)
    private boolean adminPaidContractor;

    @Column(name = "admin_payment_amount")
    private Money adminPaymentAmount;

    @Column(name = "admin_payment_reference", length = 64)
    private String adminPaymentReference;

    @Column(name = "admin_payment_notes", length = 500)
    private String adminPaymentNotes;

    @Column(name = "admin_paid_by", length = 64)
    private String adminPaidBy;

    @Column(name = "admin_paid_at")
    private Instant adminPaidAt;

    @Embedded
    private ContractorPayout contractorPayout;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @OneToMany(mappedBy = "payment", cascade = CascadeType.ALL)
    @OrderBy("installmentNumber ASC")
    private List<InstallmentSchedule> installments = new ArrayList<>();

    /**
     * Creates a single-pay payment.
     *
     * @param projectId    project id
     * @param payerId      project owner
     * @param contractorId contractor assigned to the project (may be null)
     * @param total        total amount
     * @param reference    payment reference
     * @param now          creation time
     * @return payment in {@link PaymentStatus#PENDING}
     */
    public static Payment newSinglePay(String projectId, String payerId, String contractorId,
                                       Money total, String reference, Instant now) {
        Payment p = base(projectId, payerId, contractorId, PaymentMethod.SINGLE_PAY, total, Money.ZERO, reference, now);
        p.creditHoldAmount = Money.ZERO;
        return p;
    }

    /**
     * Creates a BNPL payment with its installment rows.
     *
     * @param projectId    project id
     * @param payerId      project owner
     * @param contractorId contractor assigned to the project (may be null)
     * @param total        total amount
     * @param downpayment  downpayment (may be zero)
     * @param plan         computed schedule
     * @param creditHold   financing credit deducted from the payer's ledger
     * @param reference    payment reference
     * @param now          creation time
     * @return payment in {@link PaymentStatus#PENDING}
     */
    public static Payment newBnpl(String projectId, String payerId, String contractorId, Money total, Money downpayment,
                                  InstallmentPlan plan, Money creditHold, String reference, Instant now) {
        if (!plan.sum().plus(downpayment).equals(total)) {
            throw new IllegalStateException("Installments plus downpayment must equal total " + total);
        }
        Payment p = base(projectId, payerId, contractorId, PaymentMethod.BNPL, total, downpayment, reference, now);
        p.numberOfInstallments = plan.installments().size();
        p.monthlyEmi = plan.monthlyEmi();
        p.creditHoldAmount = creditHold;
        for (InstallmentPlan.Item item : plan.installments()) {
            p.installments.add(InstallmentSchedule.upcoming(p, item.number(), item.amount(), item.dueDate()));
        }
        return p;
    }

    private static Payment base(String projectId, String payerId, String contractorId, PaymentMethod method,
                                Money total, Money downpayment, String reference, Instant now) {
        Objects.requireNonNull(projectId, "projectId");
        Objects.requireNonNull(payerId, "payerId");
        if (!total.isPositive() || downpayment.isNegative() || total.isLessThan(downpayment)) {
            throw new IllegalArgumentException("Invalid amounts: total=" + total + " downpayment=" + downpayment);
        }
        Payment p = new Payment();
        p.id = UUID.randomUUID().toString();
        p.projectId = projectId;
        p.payerId = payerId;
        p.contractorId = contractorId;
        p.paymentMethod = method;
        p.paymentStatus = PaymentStatus.PENDING;
        p.totalAmount = total;
        p.downpaymentAmount = downpayment;
        p.paidAmount = Money.ZERO;
        p.remainingAmount = total;
        p.feesPaidAmount = Money.ZERO;
        p.creditRestoredAmount = Money.ZERO;
        p.paymentReference = reference;
        p.adminPaidContractor = false;
        p.createdAt = now;
        p.updatedAt = now;
        return p;
    }

    public boolean isBnpl() {
        return paymentMethod == PaymentMethod.BNPL;
    }

    public boolean isCompleted() {
        return paymentStatus == PaymentStatus.COMPLETED;
    }

    /**
     * Whether a positive downpayment is still outstanding.
     *
     * @return true if installments must wait for the downpayment
     */
    public boolean isDownpaymentOutstanding() {
        return downpaymentAmount.isPositive() && paidAmount.isLessThan(downpaymentAmount);
    }

    /**
     * Applies the BNPL downpayment.
     *
     * @param amount amount received, equal to the downpayment
     * @param now    time
     */
    public void applyDownpayment(Money amount, Instant now) {
        requireMethod(PaymentMethod.BNPL);
        requireNotCompleted();
        if (!isDownpaymentOutstanding()) {
            throw new IllegalStateException("No downpayment outstanding for payment " + id);
        }
        if (!amount.equals(downpaymentAmount)) {
            throw new IllegalStateException("Downpayment must be exactly " + downpaymentAmount);
        }
        movePrincipal(amount);
        moveTo(PaymentStatus.PARTIALLY_PAID, now);
    }

    /**
     * Applies a single full payment. Anything tendered above the remaining amount is kept as excess.
     *
     * @param tendered amount received
     * @param now      time
     * @return excess over the remaining amount
     */
    public Money applyFullPayment(Money tendered, Instant now) {
        requireMethod(PaymentMethod.SINGLE_PAY);
        requireNotCompleted();
        if (tendered.isLessThan(remainingAmount)) {
            throw new IllegalStateException("Full payment must cover " + remainingAmount);
        }
        Money excess = tendered.minus(remainingAmount);
        movePrincipal(remainingAmount);
        feesPaidAmount = feesPaidAmount.plus(excess);
        completedAt = now;
        moveTo(PaymentStatus.COMPLETED, now);
        return excess;
    }

    /**
     * Books an installment that has just been marked paid.
     *
     * @param installment  installment already marked paid
     * @param tendered     amount received (principal + late fee + any excess)
     * @param unpaidLeft   unpaid installments remaining after this one, counted in the same transaction
     * @param now          time
     * @return financing credit to give back to the payer for this installment
     */
    public Money applyInstallment(InstallmentSchedule installment, Money tendered, long unpaidLeft, Instant now) {
        requireMethod(PaymentMethod.BNPL);
        requireNotCompleted();
        if (!installment.isPaid() || !id.equals(installment.getPayment().getId())) {
            throw new IllegalStateException("Installment " + installment.getId() + " is not a paid installment of " + id);
        }
        Money principal = installment.getAmount();
        movePrincipal(principal);
        feesPaidAmount = feesPaidAmount.plus(tendered.minus(principal));
        Money restore = principal.min(outstandingCreditHold());
        creditRestoredAmount = creditRestoredAmount.plus(restore);
        if (unpaidLeft == 0) {
            completedAt = now;
            moveTo(PaymentStatus.COMPLETED, now);
        } else {
            moveTo(PaymentStatus.PARTIALLY_PAID, now);
        }
        return restore;
    }

    /**
     * Credit still to be given back to the payer once the remaining installments are paid.
     *
     * @return outstanding hold
     */
    public Money outstandingCreditHold() {
        return creditHoldAmount.minus(creditRestoredAmount);
    }

    /**
     * Records the admin payout to the contractor. May happen once, in any status.
     *
     * @param amount    amount released
     * @param reference payout reference
     * @param notes     admin notes
     * @param payout    bank details
     * @param adminId   admin who released
     * @param now       time
     */
    public void markReleasedToContractor(Money amount, String reference, String notes, ContractorPayout payout,
                                         String adminId, Instant now) {
        if (adminPaidContractor) {
            throw new IllegalStateException("Payment " + id + " already released to contractor");
        }
        adminPaidContractor = true;
        adminPaymentAmount = amount;
        adminPaymentReference = reference;
        adminPaymentNotes = notes;
        contractorPayout = payout;
        adminPaidBy = adminId;
        adminPaidAt = now;
        updatedAt = now;
    }

    private void movePrincipal(Money amount) {
        if (amount.isNegative() || remainingAmount.isLessThan(amount)) {
            throw new IllegalStateException("Cannot apply " + amount + " against remaining " + remainingAmount);
        }
        paidAmount = paidAmount.plus(amount);
        remainingAmount = remainingAmount.minus(amount);
        if (!paidAmount.plus(remainingAmount).equals(totalAmount)) {
            throw new IllegalStateException("Money not conserved for payment " + id);
        }
    }

    private void moveTo(PaymentStatus next, Instant now) {
        if (!paymentStatus.canMoveTo(next)) {
            throw new IllegalStateException("Illegal transition " + paymentStatus + " -> " + next);
        }
        paymentStatus = next;
        updatedAt = now;
    }

    private void requireMethod(PaymentMethod expected) {
        if (paymentMethod != expected) {
            throw new IllegalStateException("Payment " + id + " is " + paymentMethod + ", expected " + expected);
        }
    }

    private void requireNotCompleted() {
        if (isCompleted()) {
            throw new IllegalStateException("Payment " + id + " is already completed");
        }
    }
}
