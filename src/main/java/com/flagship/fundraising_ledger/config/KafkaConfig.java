package com.flagship.fundraising_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the topic financial change notifications are published to.
 * Messages are keyed by club id, so partitions split the load by club.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.financials:fundraising.financials}")
    private String financialsTopic;

    @Value("${kafka.topic.financials-partitions:3}")
    private int partitions;

    @Bean
    public NewTopic financialsTopic() {
        return TopicBuilder.name(financialsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
