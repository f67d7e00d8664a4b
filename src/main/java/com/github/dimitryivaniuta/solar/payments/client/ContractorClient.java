package com.github.dimitryivaniuta.solar.payments.client;

import com.github.dimitryivaniuta.solar.payments.client.dto.ApiEnvelope;
import com.github.dimitryivaniuta.solar.payments.client.dto.ContractorCreditRequest;
import com.github.dimitryivaniuta.solar.payments.client.dto.ContractorInfo;
import com.github.dimitryivaniuta.solar.payments.domain.Money;
import com.github.dimitryivaniuta.solar.payments.exception.RemoteServiceException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * Client of the contractor service.
 *
 * <p>The balance is credited by the contractor service itself in one atomic, reference-keyed increment;
 * this service never reads and rewrites a contractor balance.</p>
 */
@Component
public class ContractorClient {

    private static final Logger log = LoggerFactory.getLogger(ContractorClient.class);

    static final String SERVICE = "contractor-service";

    private static final ParameterizedTypeReference<ApiEnvelope<ContractorInfo>> CONTRACTOR_RESPONSE =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<ApiEnvelope<Object>> ANY_RESPONSE =
            new ParameterizedTypeReference<>() {};

    private final RestTemplate restTemplate;

    public ContractorClient(@Qualifier("contractorServiceRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    /**
     * Looks up a contractor.
     *
     * @param contractorId contractor id
     * @return contractor, or empty on 404
     */
    public Optional<ContractorInfo> fetchContractor(String contractorId) {
        try {
            return Optional.of(RemoteCalls.call(SERVICE, "fetchContractor", () -> RemoteCalls.unwrap(SERVICE, "fetchContractor",
                    restTemplate.exchange("/api/internal/contractors/{id}", HttpMethod.GET, HttpEntity.EMPTY, CONTRACTOR_RESPONSE, contractorId),
                    true)));
        } catch (RemoteServiceException e) {
            if (e.getStatus() == HttpStatus.NOT_FOUND.value()) {
                return Optional.empty();
            }
            throw e;
        }
    }

    /**
     * Adds {@code amount} to the contractor balance. Replaying the same reference is a no-op remotely.
     *
     * @param contractorId contractor id
     * @param amount       positive amount
     * @param reference    payout reference
     * @param projectId    project id
     */
    public void creditBalance(String contractorId, Money amount, String reference, String projectId) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(LedgerClient.IDEMPOTENCY_KEY_HEADER, reference);
        ContractorCreditRequest body = new ContractorCreditRequest(amount.toDecimal(), reference, projectId);
        RemoteCalls.call(SERVICE, "creditBalance", () -> RemoteCalls.unwrap(SERVICE, "creditBalance",
                restTemplate.exchange("/api/internal/contractors/{id}/balance/credit", HttpMethod.POST,
                        new HttpEntity<>(body, headers), ANY_RESPONSE, contractorId),
                false));
        log.info("Contractor balance credited. contractorId={} amount={} reference={} projectId={}",
                contractorId, amount, reference, projectId);
    }
}
