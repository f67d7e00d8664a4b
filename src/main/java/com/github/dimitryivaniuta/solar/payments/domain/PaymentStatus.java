package com.github.dimitryivaniuta.solar.payments.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Payment status stored as a string in the database.
 *
 * <p>Transitions only move forward: {@code PENDING -> PARTIALLY_PAID -> COMPLETED} for BNPL,
 * {@code PENDING -> COMPLETED} for single pay.</p>
 */
public enum PaymentStatus {
    /** Payment created, nothing received yet. */
    PENDING,

    /** Downpayment or at least one installment received. */
    PARTIALLY_PAID,

    /** Whole principal received. */
    COMPLETED;

    /**
     * Whether moving to {@code next} keeps the status monotonic.
     *
     * @param next target status
     * @return true if allowed
     */
    public boolean canMoveTo(PaymentStatus next) {
        return next.ordinal() >= ordinal();
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
