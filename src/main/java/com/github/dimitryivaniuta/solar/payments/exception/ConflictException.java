package com.github.dimitryivaniuta.solar.payments.exception;

import org.springframework.http.HttpStatus;

/**
 * The operation was already done (method already selected, payout already released).
 */
public class ConflictException extends PaymentApiException {

    public ConflictException(String message) {
        super(HttpStatus.CONFLICT, "CONFLICT", message);
    }

    public ConflictException(String message, Throwable cause) {
        super(HttpStatus.CONFLICT, "CONFLICT", message, cause);
    }
}
