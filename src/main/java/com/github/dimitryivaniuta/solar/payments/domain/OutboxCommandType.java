package com.github.dimitryivaniuta.solar.payments.domain;

/**
 * Side effect carried by an outbox row.
 */
public enum OutboxCommandType {
    /** Update the project status in the project service. */
    PROJECT_STATUS,

    /** Append a timeline entry in the project service. */
    PROJECT_TIMELINE,

    /** Add financing credit back to the payer's ledger in the identity service. */
    LEDGER_CREDIT,

    /** Credit the contractor balance in the contractor service. */
    CONTRACTOR_CREDIT,

    /** Publish a payment domain event to Kafka. */
    PAYMENT_EVENT
}
