package com.github.dimitryivaniuta.solar.payments.client;

import com.github.dimitryivaniuta.solar.payments.client.dto.ApiEnvelope;
import com.github.dimitryivaniuta.solar.payments.client.dto.CreditAdjustmentRequest;
import com.github.dimitryivaniuta.solar.payments.client.dto.CreditOperation;
import com.github.dimitryivaniuta.solar.payments.client.dto.FlagStatus;
import com.github.dimitryivaniuta.solar.payments.client.dto.LedgerProfile;
import com.github.dimitryivaniuta.solar.payments.client.dto.UserResponse;
import com.github.dimitryivaniuta.solar.payments.domain.Money;
import com.github.dimitryivaniuta.solar.payments.exception.RemoteServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * Client of the identity service, which keeps each payer's financing credit ("SAMA credit") and risk flag.
 *
 * <p>Every failure is a {@link RemoteServiceException}; nothing here decides to proceed without the ledger.</p>
 */
@Component
public class LedgerClient {

    private static final Logger log = LoggerFactory.getLogger(LedgerClient.class);

    static final String SERVICE = "user-service";

    /** Header the identity service dedupes credit adjustments on. */
    public static final String IDEMPOTENCY_KEY_HEADER = "X-Idempotency-Key";

    private static final ParameterizedTypeReference<ApiEnvelope<UserResponse>> USER_RESPONSE =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<ApiEnvelope<Object>> ANY_RESPONSE =
            new ParameterizedTypeReference<>() {};

    private final RestTemplate restTemplate;

    public LedgerClient(@Qualifier("userServiceRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    /**
     * Reads the payer's credit balance and flag.
     *
     * @param userId    payer id
     * @param authToken caller's Authorization header, forwarded when present
     * @return profile
     * @throws RemoteServiceException on any failure
     */
    public LedgerProfile fetchProfile(String userId, String authToken) {
        HttpHeaders headers = new HttpHeaders();
        if (authToken != null && !authToken.isBlank()) {
            headers.set(HttpHeaders.AUTHORIZATION, authToken);
        }
        UserResponse user = RemoteCalls.call(SERVICE, "fetchProfile", () -> RemoteCalls.unwrap(SERVICE, "fetchProfile",
                restTemplate.exchange("/api/users/{id}", HttpMethod.GET, new HttpEntity<>(headers), USER_RESPONSE, userId),
                true));
        Money balance;
        try {
            balance = user.samaCreditAmount() == null ? Money.ZERO : Money.of(user.samaCreditAmount());
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw new RemoteServiceException(SERVICE,
                    "fetchProfile returned an invalid credit amount: " + user.samaCreditAmount().toPlainString(), e);
        }
        log.info("Ledger profile fetched. userId={} flagStatus={} creditBalance={}", userId, user.flagStatus(), balance);
        return new LedgerProfile(userId, balance, user.flagStatus());
    }

    /**
     * Deducts or adds financing credit.
     *
     * @param userId         payer id
     * @param amount         positive amount
     * @param operation      deduct or add
     * @param projectId      project id
     * @param reason         audit text
     * @param idempotencyKey key the identity service dedupes on
     * @param authToken      caller's Authorization header or null
     * @throws RemoteServiceException on any failure
     */
    public void adjustCredit(String userId, Money amount, CreditOperation operation, String projectId, String reason,
                             String idempotencyKey, String authToken) {
        if (!amount.isPositive()) {
            throw new IllegalArgumentException("Credit adjustment must be positive: " + amount);
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(IDEMPOTENCY_KEY_HEADER, idempotencyKey);
        if (authToken != null && !authToken.isBlank()) {
            headers.set(HttpHeaders.AUTHORIZATION, authToken);
        }
        CreditAdjustmentRequest body = new CreditAdjustmentRequest(amount.toDecimal(), operation, projectId, reason);
        RemoteCalls.call(SERVICE, "adjustCredit", () -> RemoteCalls.unwrap(SERVICE, "adjustCredit",
                restTemplate.exchange("/api/users/{id}/sama-credit", HttpMethod.PATCH, new HttpEntity<>(body, headers), ANY_RESPONSE, userId),
                false));
        log.info("Ledger credit adjusted. userId={} operation={} amount={} projectId={} key={}",
                userId, operation, amount, projectId, idempotencyKey);
    }

    /**
     * Only GREEN-flagged payers may finance.
     *
     * @param flag flag, may be null
     * @return eligibility
     */
    public static boolean isEligibleForBnpl(FlagStatus flag) {
        return flag == FlagStatus.GREEN;
    }

    /**
     * Checks that the available credit covers the financed principal.
     *
     * @param creditBalance available credit
     * @param total         total amount
     * @param downpayment   downpayment
     * @return result with a reason when not eligible
     */
    public static CreditCheck checkEligibility(Money creditBalance, Money total, Money downpayment) {
        Money required = total.minus(downpayment);
        if (creditBalance.isAtLeast(required)) {
            return new CreditCheck(true, required, null);
        }
        return new CreditCheck(false, required,
                "Insufficient credit. Required: " + required + ", available: " + creditBalance);
    }

    /**
     * Outcome of {@link #checkEligibility}.
     *
     * @param eligible whether the credit covers the principal
     * @param required principal that must be covered
     * @param reason   why not, or null
     */
    public record CreditCheck(boolean eligible, Money required, String reason) {}
}
