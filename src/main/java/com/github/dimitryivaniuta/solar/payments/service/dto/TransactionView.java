package com.github.dimitryivaniuta.solar.payments.service.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.github.dimitryivaniuta.solar.payments.domain.PaymentTransaction;
import com.github.dimitryivaniuta.solar.payments.domain.TransactionStatus;
import com.github.dimitryivaniuta.solar.payments.domain.TransactionType;
import java.math.BigDecimal;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TransactionView(
        String id,
        String paymentId,
        TransactionType transactionType,
        BigDecimal amount,
        TransactionStatus status,
        String transactionReference,
        String installmentId,
        String metadata,
        Instant createdAt
) {

    public static TransactionView from(PaymentTransaction t) {
        return new TransactionView(
                t.getId(),
                t.getPaymentId(),
                t.getTransactionType(),
                PaymentView.decimal(t.getAmount()),
                t.getStatus(),
                t.getTransactionReference(),
                t.getInstallmentId(),
                t.getMetadata(),
                t.getCreatedAt()
        );
    }
}
