package com.flagship.settlement_engine.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.config.TopicConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

import java.time.Duration;

/**
 * Declares the topic the outbox publishes to. Records are keyed by order id,
 * so every event of one order lands on the same partition in commit order.
 */
@Configuration
public class KafkaConfig {

    @Bean
    public NewTopic settlementEventsTopic(@Value("${settlement.kafka.topic:settlement-events}") String topic,
                                          @Value("${settlement.kafka.partitions:3}") int partitions,
                                          @Value("${settlement.kafka.replicas:1}") int replicas,
                                          @Value("${settlement.kafka.retention:P14D}") Duration retention) {
        return TopicBuilder.name(topic)
                .partitions(partitions)
                .replicas(replicas)
                .config(TopicConfig.RETENTION_MS_CONFIG, String.valueOf(retention.toMillis()))
                .build();
    }
}
