package com.flagship.escrow_engine.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the agreement lifecycle topic. Records are keyed by agreement ID,
 * so each agreement's events stay ordered within one partition.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.agreements:escrow-agreements}")
    private String agreementsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic agreementsTopic() {
        return TopicBuilder.name(agreementsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
