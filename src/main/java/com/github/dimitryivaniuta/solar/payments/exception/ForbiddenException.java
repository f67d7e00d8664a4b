package com.github.dimitryivaniuta.solar.payments.exception;

import org.springframework.http.HttpStatus;

/**
 * The caller is identified but may not act on this project.
 */
public class ForbiddenException extends PaymentApiException {

    public ForbiddenException(String message) {
        super(HttpStatus.FORBIDDEN, "FORBIDDEN", message);
    }
}
