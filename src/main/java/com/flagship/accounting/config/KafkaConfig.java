package com.flagship.accounting.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the topic that carries accounting events relayed from the outbox.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.accounting-events:accounting-events}")
    private String accountingEventsTopic;

    /**
     * Partitioned by aggregate id, so events of one journal entry or voucher stay ordered.
     */
    @Bean
    public NewTopic accountingEventsTopic() {
        return TopicBuilder.name(accountingEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
