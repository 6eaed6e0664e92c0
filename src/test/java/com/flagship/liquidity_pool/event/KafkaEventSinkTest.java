package com.flagship.liquidity_pool.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.liquidity_pool.asset.Asset;
import com.flagship.liquidity_pool.config.JacksonConfig;
import com.flagship.liquidity_pool.observability.PoolMetrics;
import com.flagship.liquidity_pool.pool.PairKey;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigInteger;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for publishing pool events to Kafka.
 *
 * These tests verify that:
 * - Events are keyed by pair so one pool stays on one partition
 * - Amounts are serialized as decimal strings
 * - A failed send is counted and never thrown back to the caller
 */
@DisplayName("Kafka Event Sink Tests")
class KafkaEventSinkTest {

    private static final String TOPIC = "pool-events-test";
    private static final Asset X = Asset.of("X");
    private static final Asset Y = Asset.of("Y");

    @SuppressWarnings("unchecked")
    private final KafkaTemplate<String, String> kafkaTemplate = mock(KafkaTemplate.class);
    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();
    private SimpleMeterRegistry meterRegistry;
    private KafkaEventSink sink;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        sink = new KafkaEventSink(kafkaTemplate, objectMapper, new PoolMetrics(meterRegistry));
        ReflectionTestUtils.setField(sink, "poolEventsTopic", TOPIC);
    }

    private static CompletableFuture<SendResult<String, String>> acked(String key, String value) {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 1), 7L, 0, 0L, 0, 0);
        return CompletableFuture.completedFuture(new SendResult<>(new ProducerRecord<>(TOPIC, key, value), metadata));
    }

    @Test
    @DisplayName("Swap events are keyed by pair with amounts as strings")
    void testSwapEventPayload() throws Exception {
        when(kafkaTemplate.send(eq(TOPIC), anyString(), anyString())).thenReturn(acked("X/Y", "{}"));
        // 10^30 would lose precision as a JSON number
        BigInteger large = BigInteger.TEN.pow(30);

        sink.swapExecuted(PairKey.canonicalize(Y, X), "alice",
                large, BigInteger.ZERO, BigInteger.ZERO, BigInteger.valueOf(181));

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq(TOPIC), eq("X/Y"), payload.capture());

        JsonNode json = objectMapper.readTree(payload.getValue());
        assertEquals("SwapExecuted", json.get("eventType").asText());
        assertEquals("X", json.get("assetLow").asText());
        assertEquals("Y", json.get("assetHigh").asText());
        assertEquals("alice", json.get("caller").asText());
        assertTrue(json.get("amountLowIn").isTextual());
        assertEquals(large.toString(), json.get("amountLowIn").asText());
        assertEquals("181", json.get("amountHighOut").asText());
        assertEquals("0", json.get("amountHighIn").asText());
        assertEquals(1.0, meterRegistry.counter("pool.events.published", "event_type", "SwapExecuted").count());
    }

    @Test
    @DisplayName("Pair and asset events use their own partition keys")
    void testPartitionKeys() {
        when(kafkaTemplate.send(eq(TOPIC), anyString(), anyString())).thenReturn(acked("k", "{}"));

        sink.pairCreated(X, Y);
        sink.assetRegistered(X);

        verify(kafkaTemplate).send(eq(TOPIC), eq("X/Y"), anyString());
        verify(kafkaTemplate).send(eq(TOPIC), eq("X"), anyString());
    }

    @Test
    @DisplayName("A failed asynchronous send is counted, not thrown")
    void testAsyncFailureCounted() {
        when(kafkaTemplate.send(eq(TOPIC), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        assertDoesNotThrow(() -> sink.pairCreated(X, Y));

        assertEquals(1.0, meterRegistry.counter("pool.events.publish.failure", "event_type", "PairCreated").count());
    }

    @Test
    @DisplayName("A send that throws synchronously is counted, not thrown")
    void testSyncFailureCounted() {
        when(kafkaTemplate.send(eq(TOPIC), anyString(), anyString()))
                .thenThrow(new IllegalStateException("no metadata"));

        assertDoesNotThrow(() -> sink.assetRegistered(X));

        assertEquals(1.0, meterRegistry.counter("pool.events.publish.failure", "event_type", "AssetRegistered").count());
    }
}
