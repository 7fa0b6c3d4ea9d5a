package com.volunteersinc.payment_settlement.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.settlement-events:settlement-events}")
    private String settlementEventsTopic;

    /**
     * Fulfillment retry events, keyed by transaction or subscription id.
     */
    @Bean
    public NewTopic settlementEventsTopic() {
        return TopicBuilder.name(settlementEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
