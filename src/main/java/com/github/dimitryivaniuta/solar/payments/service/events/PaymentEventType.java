package com.github.dimitryivaniuta.solar.payments.service.events;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Event names as they appear on the {@code payments-events} topic.
 */
public enum PaymentEventType {
    PAYMENT_METHOD_SELECTED("PaymentMethodSelected"),
    DOWNPAYMENT_RECEIVED("DownpaymentReceived"),
    FULL_PAYMENT_RECEIVED("FullPaymentReceived"),
    INSTALLMENT_PAID("InstallmentPaid"),
    CONTRACTOR_PAYMENT_RELEASED("ContractorPaymentReleased");

    private final String eventName;

    PaymentEventType(String eventName) {
        this.eventName = eventName;
    }

    @JsonValue
    public String eventName() {
        return eventName;
    }
}
