package com.github.dimitryivaniuta.solar.payments.domain;

/**
 * Outbox delivery status.
 *
 * <p>Kept as a VARCHAR in the DB (no DB-level enum constraints); values are enforced in code.</p>
 */
public enum OutboxStatus {
    /** Newly created, never attempted. */
    NEW,
    /** Failed before; retried after {@code nextAttemptAt}. */
    RETRY,
    /** Delivered to the remote service or Kafka. */
    SENT,
    /** Gave up after max attempts; needs manual reconciliation. */
    DEAD
}
