package com.github.dimitryivaniuta.solar.payments.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Transaction status. Declined gateway calls are never persisted, so only success exists.
 */
public enum TransactionStatus {
    SUCCESS;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
