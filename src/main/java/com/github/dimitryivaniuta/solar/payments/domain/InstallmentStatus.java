package com.github.dimitryivaniuta.solar.payments.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Installment status. Overdue is computed at payment time, not stored as a status.
 */
public enum InstallmentStatus {
    UPCOMING,
    PAID;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
