package com.github.dimitryivaniuta.solar.payments.service.outbox;

import com.github.dimitryivaniuta.solar.payments.config.AppProperties;
import com.github.dimitryivaniuta.solar.payments.domain.OutboxCommandType;
import com.github.dimitryivaniuta.solar.payments.domain.OutboxEvent;
import java.util.concurrent.TimeUnit;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes payment domain events to Kafka and waits for the broker ack.
 */
@Component
public class PaymentEventPublisher implements OutboxHandler {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final AppProperties properties;

    public PaymentEventPublisher(KafkaTemplate<String, String> kafkaTemplate, AppProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.properties = properties;
    }

    @Override
    public OutboxCommandType type() {
        return OutboxCommandType.PAYMENT_EVENT;
    }

    @Override
    public void handle(OutboxEvent command) throws Exception {
        AppProperties.Outbox outbox = properties.getOutbox();
        kafkaTemplate.send(outbox.getPaymentsEventsTopic(), command.getEventKey(), command.getPayload())
                .get(outbox.getSendTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }
}
