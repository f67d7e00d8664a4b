package com.github.dimitryivaniuta.solar.payments.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Base of every error the payment API reports to callers.
 *
 * <p>The body is an RFC 7807 {@link ProblemDetail} with a machine-readable {@code code} property.</p>
 */
public abstract class PaymentApiException extends ErrorResponseException {

    /** Problem property holding the machine-readable error code. */
    public static final String CODE_PROPERTY = "code";

    private final String code;

    protected PaymentApiException(HttpStatus status, String code, String message) {
        this(status, code, message, null);
    }

    protected PaymentApiException(HttpStatus status, String code, String message, Throwable cause) {
        super(status, problem(status, code, message), cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    @Override
    public String getMessage() {
        return getBody().getDetail();
    }

    private static ProblemDetail problem(HttpStatus status, String code, String message) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(status, message);
        pd.setTitle(status.getReasonPhrase());
        pd.setProperty(CODE_PROPERTY, code);
        return pd;
    }
}
