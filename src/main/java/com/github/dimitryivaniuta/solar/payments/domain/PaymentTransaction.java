package com.github.dimitryivaniuta.solar.payments.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Append-only ledger row, one per successful money movement.
 */
@Entity
@Table(
        name = "payment_transactions",
        uniqueConstraints = @UniqueConstraint(name = "uq_payment_tx_reference", columnNames = "transaction_reference"),
        indexes = @Index(name = "idx_payment_tx_payment_created", columnList = "payment_id,created_at")
)
@Getter
@NoArgsConstructor
public class PaymentTransaction {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "payment_id", nullable = false, updatable = false, length = 36)
    private String paymentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", nullable = false, updatable = false, length = 32)
    private TransactionType transactionType;

    @Column(name = "amount", nullable = false, updatable = false)
    private Money amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, updatable = false, length = 16)
    private TransactionStatus status;

    @Column(name = "transaction_reference", nullable = false, updatable = false, length = 64)
    private String transactionReference;

    @Column(name = "installment_id", updatable = false, length = 36)
    private String installmentId;

    @Column(name = "metadata", updatable = false, columnDefinition = "text")
    private String metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * Creates a successful transaction row.
     *
     * @param paymentId     owning payment
     * @param type          transaction type
     * @param amount        amount moved
     * @param reference     gateway or payout reference
     * @param installmentId installment id or null
     * @param metadataJson  JSON metadata or null
     * @param now           time
     * @return transaction
     */
    public static PaymentTransaction success(String paymentId, TransactionType type, Money amount, String reference,
                                             String installmentId, String metadataJson, Instant now) {
        PaymentTransaction t = new PaymentTransaction();
        t.id = UUID.randomUUID().toString();
        t.paymentId = paymentId;
        t.transactionType = type;
        t.amount = amount;
        t.status = TransactionStatus.SUCCESS;
        t.transactionReference = reference;
        t.installmentId = installmentId;
        t.metadata = metadataJson;
        t.createdAt = now;
        return t;
    }
}
