package com.github.dimitryivaniuta.solar.payments.service.outbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.solar.payments.client.LedgerClient;
import com.github.dimitryivaniuta.solar.payments.domain.Money;
import com.github.dimitryivaniuta.solar.payments.domain.OutboxCommandType;
import com.github.dimitryivaniuta.solar.payments.domain.OutboxEvent;
import org.springframework.stereotype.Component;

/**
 * Gives financing credit back to the payer as installments are paid.
 *
 * <p>Runs without the payer's token: the identity service trusts internal callers keyed by idempotency key.</p>
 */
@Component
public class LedgerCreditHandler implements OutboxHandler {

    private final LedgerClient ledgerClient;
    private final ObjectMapper objectMapper;

    public LedgerCreditHandler(LedgerClient ledgerClient, ObjectMapper objectMapper) {
        this.ledgerClient = ledgerClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public OutboxCommandType type() {
        return OutboxCommandType.LEDGER_CREDIT;
    }

    @Override
    public void handle(OutboxEvent command) throws Exception {
        OutboxCommands.LedgerCredit cmd = objectMapper.readValue(command.getPayload(), OutboxCommands.LedgerCredit.class);
        ledgerClient.adjustCredit(cmd.userId(), Money.ofMinor(cmd.amountMinor()), cmd.operation(), cmd.projectId(),
                cmd.reason(), command.getEventKey(), null);
    }
}
