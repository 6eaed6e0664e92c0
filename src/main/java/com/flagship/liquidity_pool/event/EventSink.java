package com.flagship.liquidity_pool.event;

import com.flagship.liquidity_pool.asset.Asset;
import com.flagship.liquidity_pool.pool.PairKey;

import java.math.BigInteger;

/**
 * Receives notifications of committed pool changes.
 *
 * Fire-and-forget: implementations must not throw back into the engine,
 * because the change they report has already been committed.
 */
public interface EventSink {

    void assetRegistered(Asset asset);

    void pairCreated(Asset assetLow, Asset assetHigh);

    /**
     * Reports a swap in canonical directions. Of the four amounts exactly one
     * "in" and one "out" are nonzero.
     */
    void swapExecuted(PairKey pair, String caller,
                      BigInteger amountLowIn, BigInteger amountHighIn,
                      BigInteger amountLowOut, BigInteger amountHighOut);
}
