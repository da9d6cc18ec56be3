package com.flagship.custody_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
public class KafkaConfig {

    @Value("${custody.topic:custody-events}")
    private String custodyTopic;

    @Value("${custody.topic-partitions:3}")
    private int partitions;

    /**
     * Events are keyed by ledger id, so one ledger's events stay ordered within a partition.
     */
    @Bean
    public NewTopic custodyTopic() {
        return TopicBuilder.name(custodyTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
