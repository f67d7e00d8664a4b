package com.github.dimitryivaniuta.solar.payments.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Kind of money movement recorded in the transaction ledger.
 */
public enum TransactionType {
    FULL_PAYMENT,
    DOWNPAYMENT,
    INSTALLMENT,
    ADMIN_RELEASE;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
