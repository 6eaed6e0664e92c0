package com.flagship.liquidity_pool.event;

import com.flagship.liquidity_pool.pool.PairKey;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published after a swap has been committed.
 *
 * Amounts are reported per canonical side; the two directions the swap did
 * not use are zero.
 */
@Value
public class SwapExecutedEvent implements PoolEvent {
    UUID eventId;
    String assetLow;
    String assetHigh;
    String caller;
    BigInteger amountLowIn;
    BigInteger amountHighIn;
    BigInteger amountLowOut;
    BigInteger amountHighOut;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SwapExecuted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getPartitionKey() {
        return assetLow + "/" + assetHigh;
    }

    public static SwapExecutedEvent of(PairKey pair, String caller,
                                       BigInteger amountLowIn, BigInteger amountHighIn,
                                       BigInteger amountLowOut, BigInteger amountHighOut) {
        return new SwapExecutedEvent(
            UUID.randomUUID(),
            pair.getLow().getId(),
            pair.getHigh().getId(),
            caller,
            amountLowIn,
            amountHighIn,
            amountLowOut,
            amountHighOut,
            Instant.now()
        );
    }
}
