package com.github.dimitryivaniuta.solar.payments.service.events;

import com.github.dimitryivaniuta.solar.payments.domain.Money;
import com.github.dimitryivaniuta.solar.payments.domain.Payment;
import java.time.Instant;
import java.util.UUID;

/**
 * Payment domain event published to Kafka through the outbox.
 *
 * <p>Amounts are minor units. {@code amount} is the money moved by the operation that raised the event.</p>
 */
public record PaymentEvent(
        String schemaVersion,
        String eventId,
        PaymentEventType eventType,
        Instant occurredAt,
        String paymentId,
        String projectId,
        String payerId,
        String paymentMethod,
        String paymentStatus,
        long amount,
        long paidAmount,
        long remainingAmount,
        String currency,
        String reference
) {

    public static final String SCHEMA_VERSION = "1";

    /**
     * Builds an event from the payment state after the change.
     *
     * @param type      event type
     * @param p         payment
     * @param amount    money moved
     * @param reference transaction reference
     * @param currency  currency code
     * @param now       event time
     * @return event
     */
    public static PaymentEvent of(PaymentEventType type, Payment p, Money amount, String reference, String currency, Instant now) {
        return new PaymentEvent(
                SCHEMA_VERSION,
                UUID.randomUUID().toString(),
                type,
                now,
                p.getId(),
                p.getProjectId(),
                p.getPayerId(),
                p.getPaymentMethod().wireValue(),
                p.getPaymentStatus().wireValue(),
                amount.minorUnits(),
                p.getPaidAmount().minorUnits(),
                p.getRemainingAmount().minorUnits(),
                currency,
                reference
        );
    }
}
