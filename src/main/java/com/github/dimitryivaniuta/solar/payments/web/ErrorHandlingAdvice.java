package com.github.dimitryivaniuta.solar.payments.web;

import com.github.dimitryivaniuta.solar.payments.exception.PaymentApiException;
import com.github.dimitryivaniuta.solar.payments.exception.RemoteServiceException;
import jakarta.validation.ConstraintViolationException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global exception mapping for HTTP APIs. Every error body is a {@link ProblemDetail} with a {@code code}.
 */
@Slf4j
@RestControllerAdvice
public class ErrorHandlingAdvice {

    private static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    private static final String CONFLICT = "CONFLICT";
    private static final String INTERNAL_ERROR = "INTERNAL_ERROR";
    private static final String REMOTE_UNAVAILABLE = "REMOTE_UNAVAILABLE";

    /**
     * Validation errors for request DTOs; reports every field error.
     *
     * @param ex exception
     * @return problem
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleInvalidBody(MethodArgumentNotValidException ex) {
        List<String> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .toList();
        return validation(errors);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ProblemDetail> handleConstraintViolation(ConstraintViolationException ex) {
        List<String> errors = ex.getConstraintViolations().stream()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .toList();
        return validation(errors);
    }

    /**
     * Unparseable JSON, unknown payment method, wrong types.
     *
     * @param ex exception
     * @return problem
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleUnreadable(HttpMessageNotReadableException ex) {
        return validation(List.of("Malformed request body"));
    }

    /**
     * Payment API errors carry their own status and code.
     *
     * @param ex exception
     * @return problem
     */
    @ExceptionHandler(PaymentApiException.class)
    public ResponseEntity<ProblemDetail> handlePaymentApiException(PaymentApiException ex) {
        return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
    }

    /**
     * Other Spring web errors (missing path variable, unsupported media type, ...).
     *
     * @param ex exception
     * @return problem
     */
    @ExceptionHandler(ErrorResponseException.class)
    public ResponseEntity<ProblemDetail> handleErrorResponseException(ErrorResponseException ex) {
        return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
    }

    /**
     * DB integrity violations (unique project id, unique references).
     *
     * @param ex exception
     * @return problem
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ProblemDetail> handleDataIntegrityViolation(DataIntegrityViolationException ex) {
        log.warn("Data integrity violation: {}", ex.getMostSpecificCause().getMessage());
        return problem(HttpStatus.CONFLICT, CONFLICT, "Conflicting payment state, please retry");
    }

    /**
     * A dependent service failed and the caller did not translate it. Retryable, unlike a 500.
     *
     * @param ex exception
     * @return problem
     */
    @ExceptionHandler(RemoteServiceException.class)
    public ResponseEntity<ProblemDetail> handleRemoteServiceException(RemoteServiceException ex) {
        log.warn("Remote call failed. service={} status={} message={}", ex.getService(), ex.getStatus(), ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, REMOTE_UNAVAILABLE, "Dependent service unavailable, please retry");
    }

    /**
     * Fallback. Details stay in the log.
     *
     * @param ex exception
     * @return problem
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleFallback(Exception ex) {
        log.error("Unhandled error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR, "Internal server error");
    }

    private ResponseEntity<ProblemDetail> validation(List<String> errors) {
        ResponseEntity<ProblemDetail> response = problem(HttpStatus.BAD_REQUEST, VALIDATION_ERROR, String.join("; ", errors));
        response.getBody().setProperty("errors", errors);
        return response;
    }

    private static ResponseEntity<ProblemDetail> problem(HttpStatus status, String code, String detail) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(status, detail);
        pd.setTitle(status.getReasonPhrase());
        pd.setProperty(PaymentApiException.CODE_PROPERTY, code);
        return ResponseEntity.status(status).body(pd);
    }

}
