package com.flagship.liquidity_pool.event;

import com.flagship.liquidity_pool.asset.Asset;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Event published when a pool is created and seeded.
 */
@Value
public class PairCreatedEvent implements PoolEvent {
    UUID eventId;
    String assetLow;
    String assetHigh;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PairCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getPartitionKey() {
        return assetLow + "/" + assetHigh;
    }

    public static PairCreatedEvent of(Asset assetLow, Asset assetHigh) {
        return new PairCreatedEvent(UUID.randomUUID(), assetLow.getId(), assetHigh.getId(), Instant.now());
    }
}
