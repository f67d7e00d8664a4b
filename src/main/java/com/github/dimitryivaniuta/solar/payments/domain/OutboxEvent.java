package com.github.dimitryivaniuta.solar.payments.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Remote side effect persisted in Postgres together with the payment change that caused it.
 *
 * <p>Each row is one command for another system (project status, timeline entry, ledger credit,
 * contractor credit, Kafka event). {@code eventKey} is the idempotency key the receiver dedupes on,
 * so re-sending after a crash is harmless.</p>
 */
@Entity
@Table(
        name = "outbox_events",
        indexes = {
                @Index(name = "idx_outbox_status_next_created", columnList = "status,next_attempt_at,created_at")
        }
)
@Getter
@NoArgsConstructor
public class OutboxEvent {

    /** Aggregate type of every command written by this service. */
    public static final String AGGREGATE_PAYMENT = "Payment";

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "aggregate_type", nullable = false, length = 64)
    private String aggregateType;

    @Column(name = "aggregate_id", nullable = false, length = 64)
    private String aggregateId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 64)
    private OutboxCommandType eventType;

    @Column(name = "event_key", nullable = false, length = 128)
    private String eventKey;

    @Column(name = "payload", nullable = false, columnDefinition = "text")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private OutboxStatus status;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Column(name = "last_error", columnDefinition = "text")
    private String lastError;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "sent_at")
    private Instant sentAt;

    /**
     * Creates a command with status NEW.
     *
     * @param type      command type
     * @param paymentId payment the command belongs to
     * @param eventKey  idempotency key for the receiver (Kafka key for events)
     * @param payload   JSON payload
     * @param now       creation time
     * @return command
     */
    public static OutboxEvent newCommand(OutboxCommandType type, String paymentId, String eventKey, String payload, Instant now) {
        OutboxEvent e = new OutboxEvent();
        e.id = UUID.randomUUID().toString();
        e.aggregateType = AGGREGATE_PAYMENT;
        e.aggregateId = paymentId;
        e.eventType = type;
        e.eventKey = eventKey;
        e.payload = payload;
        e.status = OutboxStatus.NEW;
        e.attemptCount = 0;
        e.createdAt = now;
        e.updatedAt = now;
        return e;
    }

    public boolean isPending() {
        return status == OutboxStatus.NEW || status == OutboxStatus.RETRY;
    }

    public void markSent(Instant now) {
        this.status = OutboxStatus.SENT;
        this.sentAt = now;
        this.updatedAt = now;
        this.nextAttemptAt = null;
        this.lastError = null;
    }

    /**
     * Marks as retryable failure.
     *
     * @param error   error string
     * @param backoff delay before the next attempt
     * @param now     time
     */
    public void markRetry(String error, Duration backoff, Instant now) {
        this.status = OutboxStatus.RETRY;
        this.attemptCount++;
        this.lastError = error;
        this.nextAttemptAt = now.plus(backoff);
        this.updatedAt = now;
    }

    public void markDead(String error, Instant now) {
        this.status = OutboxStatus.DEAD;
        this.attemptCount++;
        this.lastError = error;
        this.nextAttemptAt = null;
        this.updatedAt = now;
    }
}
