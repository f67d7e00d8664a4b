package com.github.dimitryivaniuta.solar.payments.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/**
 * Financing method of a project payment.
 *
 * <p>Stored by name in the database; exposed on the wire in lowercase ({@code single_pay}, {@code bnpl}).</p>
 */
public enum PaymentMethod {
    /** Whole amount paid in one transaction. */
    SINGLE_PAY("single_pay", "SPY"),

    /** Buy-Now-Pay-Later: optional downpayment plus monthly installments. */
    BNPL("bnpl", "BNPL");

    private final String wireValue;
    private final String referencePrefix;

    PaymentMethod(String wireValue, String referencePrefix) {
        this.wireValue = wireValue;
        this.referencePrefix = referencePrefix;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /**
     * Prefix of the payment reference generated at selection time.
     *
     * @return reference prefix
     */
    public String referencePrefix() {
        return referencePrefix;
    }

    @JsonCreator
    public static PaymentMethod fromWire(String value) {
        return Arrays.stream(values())
                .filter(m -> m.wireValue.equalsIgnoreCase(value) || m.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown payment method: " + value));
    }
}
