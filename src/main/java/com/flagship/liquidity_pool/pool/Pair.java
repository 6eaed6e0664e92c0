package com.flagship.liquidity_pool.pool;

import com.flagship.liquidity_pool.asset.Asset;
import com.flagship.liquidity_pool.pool.exception.PoolError;
import com.flagship.liquidity_pool.pool.exception.PoolException;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * A two-asset liquidity pool.
 *
 * Key principles:
 * - Asset identities are fixed by the {@link PairKey} at creation
 * - Reserves are never negative and never zero once created
 * - State changes are immutable (a swap yields a new Pair)
 * - The invariant product reserveLow * reserveHigh never decreases across a swap
 */
@Value
public class Pair {
    PairKey key;
    BigInteger reserveLow;
    BigInteger reserveHigh;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Seeds a new pair. Amounts are given in the caller's order and are
     * reassigned to the canonical sides here.
     */
    public static Pair create(PairKey key, Asset assetA, BigInteger amountA, BigInteger amountB) {
        if (!key.contains(assetA)) {
            throw new IllegalArgumentException("Asset " + assetA + " is not part of pair " + key);
        }
        if (amountA == null || amountB == null || amountA.signum() <= 0 || amountB.signum() <= 0) {
            throw PoolException.of(PoolError.INSUFFICIENT_LIQUIDITY,
                    "Initial deposit must be positive on both sides: %s=%s, other=%s", assetA, amountA, amountB);
        }
        Instant now = Instant.now();
        return key.isLow(assetA)
                ? new Pair(key, amountA, amountB, now, now)
                : new Pair(key, amountB, amountA, now, now);
    }

    public Asset getAssetLow() {
        return key.getLow();
    }

    public Asset getAssetHigh() {
        return key.getHigh();
    }

    public BigInteger reserveOf(Asset asset) {
        if (key.isLow(asset)) {
            return reserveLow;
        }
        if (key.getHigh().equals(asset)) {
            return reserveHigh;
        }
        throw new IllegalArgumentException("Asset " + asset + " is not part of pair " + key);
    }

    public BigInteger invariantProduct() {
        return reserveLow.multiply(reserveHigh);
    }

    /**
     * Returns the pair after amountIn of assetIn enters and amountOut of the
     * other asset leaves.
     *
     * @throws PoolException INVARIANT_VIOLATION if the product would shrink
     *         or a reserve would go negative
     */
    public Pair afterSwap(Asset assetIn, BigInteger amountIn, BigInteger amountOut) {
        boolean inIsLow = key.isLow(assetIn);
        if (!inIsLow && !key.getHigh().equals(assetIn)) {
            throw new IllegalArgumentException("Asset " + assetIn + " is not part of pair " + key);
        }
        BigInteger newLow = inIsLow ? reserveLow.add(amountIn) : reserveLow.subtract(amountOut);
        BigInteger newHigh = inIsLow ? reserveHigh.subtract(amountOut) : reserveHigh.add(amountIn);

        Pair next = new Pair(key, newLow, newHigh, createdAt, Instant.now());
        if (newLow.signum() <= 0 || newHigh.signum() <= 0
                || next.invariantProduct().compareTo(invariantProduct()) < 0) {
            throw PoolException.of(PoolError.INVARIANT_VIOLATION,
                    "Swap on %s would move reserves from (%s, %s) to (%s, %s)",
                    key, reserveLow, reserveHigh, newLow, newHigh);
        }
        return next;
    }
}
