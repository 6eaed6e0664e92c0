package com.flagship.liquidity_pool.event;

import com.flagship.liquidity_pool.asset.Asset;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Event published when an asset joins the registered set.
 */
@Value
public class AssetRegisteredEvent implements PoolEvent {
    UUID eventId;
    String asset;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AssetRegistered";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getPartitionKey() {
        return asset;
    }

    public static AssetRegisteredEvent of(Asset asset) {
        return new AssetRegisteredEvent(UUID.randomUUID(), asset.getId(), Instant.now());
    }
}
