package com.github.dimitryivaniuta.solar.payments.service.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.github.dimitryivaniuta.solar.payments.domain.ContractorPayout;
import com.github.dimitryivaniuta.solar.payments.domain.Money;
import com.github.dimitryivaniuta.solar.payments.domain.Payment;
import com.github.dimitryivaniuta.solar.payments.domain.PaymentMethod;
import com.github.dimitryivaniuta.solar.payments.domain.PaymentStatus;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Payment as returned by the API and kept in the details cache.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PaymentView(
        String id,
        String projectId,
        String payerId,
        String contractorId,
        PaymentMethod paymentMethod,
        PaymentStatus paymentStatus,
        BigDecimal totalAmount,
        BigDecimal downpaymentAmount,
        BigDecimal paidAmount,
        BigDecimal remainingAmount,
        BigDecimal feesPaidAmount,
        Integer numberOfInstallments,
        BigDecimal monthlyEmi,
        BigDecimal creditHoldAmount,
        String paymentReference,
        boolean adminPaidContractor,
        BigDecimal adminPaymentAmount,
        String adminPaymentReference,
        String adminPaymentNotes,
        String contractorBankName,
        String contractorIban,
        String contractorAccountHolder,
        String adminPaidBy,
        Instant adminPaidAt,
        Instant completedAt,
        Instant createdAt,
        Instant updatedAt
) {

    /**
     * Maps an entity; does not touch lazy associations.
     *
     * @param p payment
     * @return view
     */
    public static PaymentView from(Payment p) {
        ContractorPayout payout = p.getContractorPayout();
        return new PaymentView(
                p.getId(),
                p.getProjectId(),
                p.getPayerId(),
                p.getContractorId(),
                p.getPaymentMethod(),
                p.getPaymentStatus(),
                decimal(p.getTotalAmount()),
                decimal(p.getDownpaymentAmount()),
                decimal(p.getPaidAmount()),
                decimal(p.getRemainingAmount()),
                decimal(p.getFeesPaidAmount()),
                p.getNumberOfInstallments(),
                decimal(p.getMonthlyEmi()),
                decimal(p.getCreditHoldAmount()),
                p.getPaymentReference(),
                p.isAdminPaidContractor(),
                decimal(p.getAdminPaymentAmount()),
                p.getAdminPaymentReference(),
                p.getAdminPaymentNotes(),
                payout == null ? null : payout.getBankName(),
                payout == null ? null : payout.getIban(),
                payout == null ? null : payout.getAccountHolder(),
                p.getAdminPaidBy(),
                p.getAdminPaidAt(),
                p.getCompletedAt(),
                p.getCreatedAt(),
                p.getUpdatedAt()
        );
    }

    static BigDecimal decimal(Money m) {
        return m == null ? null : m.toDecimal();
    }
}
