package com.flagship.budget_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the topic ledger events are published to.
 */
@Configuration
public class KafkaConfig {

    @Bean
    public NewTopic ledgerEventsTopic(LedgerProperties properties) {
        return TopicBuilder.name(properties.getKafka().getTopic())
                .partitions(properties.getKafka().getPartitions())
                .replicas(1)
                .build();
    }
}
