package com.flagship.liquidity_pool.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for pool events.
 *
 * All pool events share these common properties:
 * - Event ID for deduplication
 * - Partition key (pair or asset) for ordering
 * - Timestamp of when the event occurred
 */
public interface PoolEvent {

    UUID getEventId();

    /**
     * Key that keeps events of one pair (or one asset) in order.
     */
    String getPartitionKey();

    Instant getOccurredAt();

    String getEventType();
}
