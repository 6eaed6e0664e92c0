package com.flagship.liquidity_pool.pool;

import com.flagship.liquidity_pool.asset.Asset;
import com.flagship.liquidity_pool.pool.exception.PoolError;
import com.flagship.liquidity_pool.pool.exception.PoolException;
import lombok.Value;

import java.util.Comparator;

/**
 * Canonical identity of a pair: the two assets in ascending order.
 *
 * Both call orders of the same two assets produce an equal key, so a pool is
 * stored once and found from either side.
 */
@Value
public class PairKey implements Comparable<PairKey> {

    private static final Comparator<PairKey> ORDER =
            Comparator.comparing(PairKey::getLow).thenComparing(PairKey::getHigh);

    Asset low;
    Asset high;

    private PairKey(Asset low, Asset high) {
        this.low = low;
        this.high = high;
    }

    /**
     * Orders two distinct assets into (low, high).
     *
     * @throws PoolException IDENTICAL_ASSETS if both are the same asset
     */
    public static PairKey canonicalize(Asset a, Asset b) {
        if (a == null || b == null) {
            throw new IllegalArgumentException("Both assets are required");
        }
        int cmp = a.compareTo(b);
        if (cmp == 0) {
            throw PoolException.of(PoolError.IDENTICAL_ASSETS,
                    "A pair needs two different assets, got %s twice", a);
        }
        return cmp < 0 ? new PairKey(a, b) : new PairKey(b, a);
    }

    public boolean contains(Asset asset) {
        return low.equals(asset) || high.equals(asset);
    }

    public boolean isLow(Asset asset) {
        return low.equals(asset);
    }

    @Override
    public int compareTo(PairKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return low + "/" + high;
    }
}
