package com.github.dimitryivaniuta.solar.payments.exception;

import org.springframework.http.HttpStatus;

/**
 * No caller identity was forwarded by the upstream gateway.
 */
public class UnauthorizedException extends PaymentApiException {

    public UnauthorizedException(String message) {
        super(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", message);
    }
}
