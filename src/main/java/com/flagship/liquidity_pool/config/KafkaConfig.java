package com.flagship.liquidity_pool.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka configuration, active only when pool events go to Kafka.
 */
@Configuration
@ConditionalOnProperty(name = "pool.events.kafka.enabled", havingValue = "true")
public class KafkaConfig {

    @Value("${kafka.topic.pool-events:pool-events}")
    private String poolEventsTopic;

    /**
     * Creates the pool events topic if it doesn't exist.
     * Events are keyed by pair, so partitions keep per-pair order.
     */
    @Bean
    public NewTopic poolEventsTopic() {
        return TopicBuilder.name(poolEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
