package com.github.dimitryivaniuta.solar.payments.client;

import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withResourceNotFound;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.github.dimitryivaniuta.solar.payments.client.dto.ContractorInfo;
import com.github.dimitryivaniuta.solar.payments.domain.Money;
import com.github.dimitryivaniuta.solar.payments.exception.RemoteServiceException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class ContractorClientTest {

    private MockRestServiceServer server;
    private ContractorClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplateBuilder().rootUri("http://contractors").build();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new ContractorClient(restTemplate);
    }

    @Test
    void fetchContractorReadsBusinessName() {
        server.expect(requestTo("http://contractors/api/internal/contractors/c-1"))
                .andRespond(withSuccess("{\"success\":true,\"data\":{\"id\":\"c-1\",\"business_name\":\"Sun Co\"}}",
                        MediaType.APPLICATION_JSON));

        ContractorInfo info = client.fetchContractor("c-1").orElseThrow();

        Assertions.assertEquals("Sun Co", info.name());
    }

    @Test
    void unknownContractorIsEmpty() {
        server.expect(requestTo("http://contractors/api/internal/contractors/c-9"))
                .andRespond(withResourceNotFound());

        Assertions.assertTrue(client.fetchContractor("c-9").isEmpty());
    }

    @Test
    void creditBalanceIsKeyedByReference() {
        server.expect(requestTo("http://contractors/api/internal/contractors/c-1/balance/credit"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(LedgerClient.IDEMPOTENCY_KEY_HEADER, "ADM-1"))
                .andExpect(jsonPath("$.amount").value(4500.00))
                .andExpect(jsonPath("$.reference").value("ADM-1"))
                .andRespond(withSuccess("{\"success\":true}", MediaType.APPLICATION_JSON));

        client.creditBalance("c-1", Money.of("4500.00"), "ADM-1", "p-1");

        server.verify();
    }

    @Test
    void creditBalanceConflictIsRemoteError() {
        server.expect(requestTo("http://contractors/api/internal/contractors/c-1/balance/credit"))
                .andRespond(withStatus(HttpStatus.CONFLICT));

        RemoteServiceException ex = Assertions.assertThrows(RemoteServiceException.class,
                () -> client.creditBalance("c-1", Money.of("1.00"), "ADM-1", "p-1"));
        Assertions.assertEquals(409, ex.getStatus());
    }
}
