package com.github.dimitryivaniuta.solar.payments.exception;

import org.springframework.http.HttpStatus;

/**
 * The payment gateway refused the charge. Nothing was recorded.
 */
public class PaymentDeclinedException extends PaymentApiException {

    public PaymentDeclinedException(String message) {
        super(HttpStatus.PAYMENT_REQUIRED, "PAYMENT_ERROR", message);
    }
}
