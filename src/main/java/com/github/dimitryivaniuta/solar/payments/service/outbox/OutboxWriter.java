package com.github.dimitryivaniuta.solar.payments.service.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.solar.payments.client.dto.CreditOperation;
import com.github.dimitryivaniuta.solar.payments.client.dto.TimelineEvent;
import com.github.dimitryivaniuta.solar.payments.domain.Money;
import com.github.dimitryivaniuta.solar.payments.domain.OutboxCommandType;
import com.github.dimitryivaniuta.solar.payments.domain.OutboxEvent;
import com.github.dimitryivaniuta.solar.payments.domain.Payment;
import com.github.dimitryivaniuta.solar.payments.repo.OutboxEventRepository;
import com.github.dimitryivaniuta.solar.payments.service.events.PaymentEvent;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Writes outbox commands into the caller's transaction. Must be called inside one.
 *
 * <p>Collects the ids of what it wrote so the caller can dispatch them right after commit.</p>
 */
@Component
public class OutboxWriter {

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public OutboxWriter(OutboxEventRepository outboxEventRepository, ObjectMapper objectMapper, Clock clock) {
        this.outboxEventRepository = outboxEventRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Starts a batch of commands for one payment.
     *
     * @param payment payment the commands belong to
     * @return batch
     */
    public Batch forPayment(Payment payment) {
        return new Batch(payment);
    }

    /**
     * Commands written for one payment inside one transaction.
     */
    public final class Batch {

        private final Payment payment;
        private final List<String> ids = new ArrayList<>();

        private Batch(Payment payment) {
            this.payment = payment;
        }

        public Batch projectStatus(String status, String key) {
            return add(OutboxCommandType.PROJECT_STATUS, key,
                    new OutboxCommands.ProjectStatus(payment.getProjectId(), status));
        }

        public Batch timeline(TimelineEvent event, String key) {
            return add(OutboxCommandType.PROJECT_TIMELINE, key,
                    new OutboxCommands.ProjectTimeline(payment.getProjectId(), event));
        }

        public Batch ledgerCredit(Money amount, String reason, String key) {
            return add(OutboxCommandType.LEDGER_CREDIT, key, new OutboxCommands.LedgerCredit(
                    payment.getPayerId(), amount.minorUnits(), CreditOperation.ADD, payment.getProjectId(), reason));
        }

        public Batch contractorCredit(String contractorId, Money amount, String reference) {
            return add(OutboxCommandType.CONTRACTOR_CREDIT, reference, new OutboxCommands.ContractorCredit(
                    contractorId, amount.minorUnits(), reference, payment.getProjectId()));
        }

        public Batch event(PaymentEvent event) {
            // Kafka key is the payment id so events of one payment keep their order
            return add(OutboxCommandType.PAYMENT_EVENT, payment.getId(), event);
        }

        /**
         * Ids of the commands written so far.
         *
         * @return ids in write order
         */
        public List<String> ids() {
            return List.copyOf(ids);
        }

        private Batch add(OutboxCommandType type, String key, Object payload) {
            OutboxEvent e = OutboxEvent.newCommand(type, payment.getId(), key, toJson(payload), clock.instant());
            outboxEventRepository.save(e);
            ids.add(e.getId());
            return this;
        }
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize outbox payload " + payload.getClass().getSimpleName(), e);
        }
    }
}
