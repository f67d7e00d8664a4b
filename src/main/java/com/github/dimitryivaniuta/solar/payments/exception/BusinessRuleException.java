package com.github.dimitryivaniuta.solar.payments.exception;

import org.springframework.http.HttpStatus;

/**
 * Request is well-formed but the payment state or the payer's standing does not allow it.
 */
public class BusinessRuleException extends PaymentApiException {

    public BusinessRuleException(String message) {
        super(HttpStatus.CONFLICT, "BUSINESS_RULE_VIOLATION", message);
    }

    public BusinessRuleException(String message, Throwable cause) {
        super(HttpStatus.CONFLICT, "BUSINESS_RULE_VIOLATION", message, cause);
    }
}
