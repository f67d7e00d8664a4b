package com.github.dimitryivaniuta.solar.payments.exception;

import java.util.List;
import org.springframework.http.HttpStatus;

/**
 * Input failed validation. Carries every error found, not only the first.
 */
public class ValidationException extends PaymentApiException {

    private final List<String> errors;

    public ValidationException(String message) {
        this(List.of(message));
    }

    public ValidationException(List<String> errors) {
        super(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", String.join("; ", errors));
        this.errors = List.copyOf(errors);
        getBody().setProperty("errors", this.errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
