package com.github.dimitryivaniuta.solar.payments.service.outbox;

import com.github.dimitryivaniuta.solar.payments.client.dto.CreditOperation;
import com.github.dimitryivaniuta.solar.payments.client.dto.TimelineEvent;

/**
 * JSON payloads stored in {@code outbox_events.payload}, one record per remote command.
 */
public final class OutboxCommands {

    private OutboxCommands() {
    }

    public record ProjectStatus(String projectId, String status) {}

    public record ProjectTimeline(String projectId, TimelineEvent event) {}

    /**
     * Ledger credit adjustment; amount in minor units.
     */
    public record LedgerCredit(String userId, long amountMinor, CreditOperation operation, String projectId, String reason) {}

    /**
     * Contractor balance credit; amount in minor units.
     */
    public record ContractorCredit(String contractorId, long amountMinor, String reference, String projectId) {}
}
