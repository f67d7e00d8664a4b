package com.github.dimitryivaniuta.solar.payments.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic configuration.
 */
@Configuration
public class KafkaConfig {

    /**
     * Payment domain events, keyed by payment id so events of one payment stay ordered.
     *
     * <p>Environments that provision topics elsewhere disable admin auto-creation.</p>
     *
     * @param props application properties
     * @return topic definition
     */
    @Bean
    public NewTopic paymentsEventsTopic(AppProperties props) {
        return TopicBuilder.name(props.getOutbox().getPaymentsEventsTopic())
                .partitions(6)
                .replicas(1)
                .build();
    }
}
