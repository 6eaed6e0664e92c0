package com.flagship.liquidity_pool.observability;

import com.flagship.liquidity_pool.pool.PairStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Custom health indicators for the pool service.
 */
public class HealthIndicators {

    /**
     * Reports the size of the pair store.
     */
    @Component("poolStoreHealth")
    public static class PoolStoreHealthIndicator implements HealthIndicator {

        private final PairStore pairStore;

        public PoolStoreHealthIndicator(PairStore pairStore) {
            this.pairStore = pairStore;
        }

        @Override
        public Health health() {
            return Health.up()
                    .withDetail("pairs", pairStore.pairCount())
                    .withDetail("assets", pairStore.assetCount())
                    .build();
        }
    }

    /**
     * Health indicator for Kafka connectivity, present when events go to Kafka.
     */
    @Component("kafkaHealth")
    @ConditionalOnProperty(name = "pool.events.kafka.enabled", havingValue = "true")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka connections established")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
