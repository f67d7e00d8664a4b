package com.github.dimitryivaniuta.solar.payments.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * One monthly obligation of a BNPL payment. Created once with the payment, mutated only when paid.
 *
 * <p>Overdue days and the late fee are frozen at payment time.</p>
 */
@Entity
@Table(
        name = "installment_schedules",
        uniqueConstraints = @UniqueConstraint(name = "uq_installment_payment_number", columnNames = {"payment_id", "installment_number"})
)
@Getter
@NoArgsConstructor
public class InstallmentSchedule {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "payment_id", nullable = false, updatable = false)
    private Payment payment;

    @Column(name = "installment_number", nullable = false, updatable = false)
    private int installmentNumber;

    @Column(name = "amount", nullable = false, updatable = false)
    private Money amount;

    @Column(name = "due_date", nullable = false, updatable = false)
    private LocalDate dueDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private InstallmentStatus status;

    @Column(name = "paid_amount")
    private Money paidAmount;

    @Column(name = "paid_at")
    private Instant paidAt;

    @Column(name = "payment_reference", length = 64)
    private String paymentReference;

    @Column(name = "is_overdue", nullable = false)
    private boolean overdue;

    @Column(name = "overdue_days", nullable = false)
    private int overdueDays;

    @Column(name = "late_fee", nullable = false)
    private Money lateFee;

    static InstallmentSchedule upcoming(Payment payment, int number, Money amount, LocalDate dueDate) {
        InstallmentSchedule s = new InstallmentSchedule();
        s.id = UUID.randomUUID().toString();
        s.payment = payment;
        s.installmentNumber = number;
        s.amount = amount;
        s.dueDate = dueDate;
        s.status = InstallmentStatus.UPCOMING;
        s.lateFee = Money.ZERO;
        return s;
    }

    public boolean isPaid() {
        return status == InstallmentStatus.PAID;
    }

    /**
     * Marks this installment paid. Terminal: a paid installment never changes again.
     *
     * @param tendered    amount received
     * @param overdueDays days overdue at payment time
     * @param lateFee     late fee charged
     * @param reference   gateway reference
     * @param now         time
     */
    public void markPaid(Money tendered, int overdueDays, Money lateFee, String reference, Instant now) {
        if (isPaid()) {
            throw new IllegalStateException("Installment " + id + " is already paid");
        }
        if (tendered.isLessThan(amount.plus(lateFee))) {
            throw new IllegalStateException("Installment " + id + " requires " + amount.plus(lateFee));
        }
        this.status = InstallmentStatus.PAID;
        this.paidAmount = tendered;
        this.paidAt = now;
        this.paymentReference = reference;
        this.overdue = overdueDays > 0;
        this.overdueDays = overdueDays;
        this.lateFee = lateFee;
    }
}
