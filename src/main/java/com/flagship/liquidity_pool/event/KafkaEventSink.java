package com.flagship.liquidity_pool.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.liquidity_pool.asset.Asset;
import com.flagship.liquidity_pool.observability.PoolMetrics;
import com.flagship.liquidity_pool.pool.PairKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Publishes pool events to Kafka as JSON.
 *
 * The partition key is the pair (or the asset for registrations), so events
 * of one pool stay in order on one partition.
 *
 * Sends are asynchronous. A failed send is logged and counted; it never
 * reaches the engine, whose state change is already committed.
 */
@Component
@ConditionalOnProperty(name = "pool.events.kafka.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class KafkaEventSink implements EventSink {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final PoolMetrics poolMetrics;

    @Value("${kafka.topic.pool-events:pool-events}")
    private String poolEventsTopic;

    @Override
    public void assetRegistered(Asset asset) {
        publish(AssetRegisteredEvent.of(asset));
    }

    @Override
    public void pairCreated(Asset assetLow, Asset assetHigh) {
        publish(PairCreatedEvent.of(assetLow, assetHigh));
    }

    @Override
    public void swapExecuted(PairKey pair, String caller,
                             BigInteger amountLowIn, BigInteger amountHighIn,
                             BigInteger amountLowOut, BigInteger amountHighOut) {
        publish(SwapExecutedEvent.of(pair, caller, amountLowIn, amountHighIn, amountLowOut, amountHighOut));
    }

    void publish(PoolEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize event: eventId={}, eventType={}", event.getEventId(), event.getEventType(), e);
            poolMetrics.recordEventPublishFailure(event.getEventType());
            return;
        }

        try {
            kafkaTemplate.send(poolEventsTopic, event.getPartitionKey(), payload)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                                    event.getEventId(), event.getEventType(), ex.getMessage());
                            poolMetrics.recordEventPublishFailure(event.getEventType());
                        } else {
                            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                                    event.getEventId(),
                                    result.getRecordMetadata().topic(),
                                    result.getRecordMetadata().partition(),
                                    result.getRecordMetadata().offset(),
                                    event.getEventType());
                            poolMetrics.recordEventPublished(event.getEventType());
                        }
                    });
        } catch (RuntimeException e) {
            // send() throws synchronously when metadata for the topic cannot be fetched
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getEventId(), event.getEventType(), e.getMessage());
            poolMetrics.recordEventPublishFailure(event.getEventType());
        }
    }
}
