package com.github.dimitryivaniuta.solar.payments.service.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.github.dimitryivaniuta.solar.payments.domain.InstallmentSchedule;
import com.github.dimitryivaniuta.solar.payments.domain.InstallmentStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InstallmentView(
        String id,
        String paymentId,
        int installmentNumber,
        BigDecimal amount,
        LocalDate dueDate,
        InstallmentStatus status,
        BigDecimal paidAmount,
        Instant paidAt,
        String paymentReference,
        boolean isOverdue,
        int overdueDays,
        BigDecimal lateFee
) {

    public static InstallmentView from(InstallmentSchedule s) {
        return new InstallmentView(
                s.getId(),
                s.getPayment().getId(),
                s.getInstallmentNumber(),
                PaymentView.decimal(s.getAmount()),
                s.getDueDate(),
                s.getStatus(),
                PaymentView.decimal(s.getPaidAmount()),
                s.getPaidAt(),
                s.getPaymentReference(),
                s.isOverdue(),
                s.getOverdueDays(),
                PaymentView.decimal(s.getLateFee())
        );
    }
}
