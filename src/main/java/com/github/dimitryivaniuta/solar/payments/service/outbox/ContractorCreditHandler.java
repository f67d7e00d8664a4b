package com.github.dimitryivaniuta.solar.payments.service.outbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.solar.payments.client.ContractorClient;
import com.github.dimitryivaniuta.solar.payments.domain.Money;
import com.github.dimitryivaniuta.solar.payments.domain.OutboxCommandType;
import com.github.dimitryivaniuta.solar.payments.domain.OutboxEvent;
import org.springframework.stereotype.Component;

@Component
public class ContractorCreditHandler implements OutboxHandler {

    private final ContractorClient contractorClient;
    private final ObjectMapper objectMapper;

    public ContractorCreditHandler(ContractorClient contractorClient, ObjectMapper objectMapper) {
        this.contractorClient = contractorClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public OutboxCommandType type() {
        return OutboxCommandType.CONTRACTOR_CREDIT;
    }

    @Override
    public void handle(OutboxEvent command) throws Exception {
        OutboxCommands.ContractorCredit cmd = objectMapper.readValue(command.getPayload(), OutboxCommands.ContractorCredit.class);
        contractorClient.creditBalance(cmd.contractorId(), Money.ofMinor(cmd.amountMinor()), cmd.reference(), cmd.projectId());
    }
}
