package com.flagship.liquidity_pool.pool;

import com.flagship.liquidity_pool.asset.Asset;
import com.flagship.liquidity_pool.pool.exception.PoolError;
import com.flagship.liquidity_pool.pool.exception.PoolException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;

/**
 * Single source of truth for registered assets and pool reserves.
 *
 * Exactly one record exists per unordered asset pair: every lookup and write
 * goes through {@link PairKey#canonicalize}. Records are immutable values, so
 * readers always see a committed pair.
 *
 * Mutators are only called by {@link SwapExecutor} while it holds its
 * {@link ReentrancyGuard}.
 */
@Component
@Slf4j
public class PairStore {

    private final NavigableSet<Asset> registeredAssets = new ConcurrentSkipListSet<>();
    private final Map<PairKey, Pair> pairs = new ConcurrentHashMap<>();

    public boolean isRegistered(Asset asset) {
        return registeredAssets.contains(asset);
    }

    public List<Asset> registeredAssets() {
        return List.copyOf(registeredAssets);
    }

    /**
     * Adds an asset to the registered set.
     *
     * @throws PoolException DUPLICATE_ASSET if it is already registered
     */
    void registerAsset(Asset asset) {
        if (!registeredAssets.add(asset)) {
            throw PoolException.of(PoolError.DUPLICATE_ASSET, "Asset already registered: %s", asset);
        }
        log.debug("Registered asset {}", asset);
    }

    /**
     * Checks that a pair could be created for these assets and amounts.
     *
     * Order of checks: identical assets, registration, existing pair, amounts.
     */
    PairKey validateNewPair(Asset a, Asset b, BigInteger amountA, BigInteger amountB) {
        PairKey key = canonicalize(a, b);
        if (!isRegistered(a)) {
            throw PoolException.of(PoolError.ASSET_NOT_REGISTERED, "Asset not registered: %s", a);
        }
        if (!isRegistered(b)) {
            throw PoolException.of(PoolError.ASSET_NOT_REGISTERED, "Asset not registered: %s", b);
        }
        if (pairs.containsKey(key)) {
            throw PoolException.of(PoolError.PAIR_ALREADY_EXISTS, "Pair already exists: %s", key);
        }
        if (amountA == null || amountB == null || amountA.signum() <= 0 || amountB.signum() <= 0) {
            throw PoolException.of(PoolError.INSUFFICIENT_LIQUIDITY,
                    "Initial deposit must be positive on both sides: %s=%s, %s=%s", a, amountA, b, amountB);
        }
        return key;
    }

    public PairKey canonicalize(Asset a, Asset b) {
        return PairKey.canonicalize(a, b);
    }

    public Optional<Pair> find(Asset a, Asset b) {
        return Optional.ofNullable(pairs.get(canonicalize(a, b)));
    }

    /**
     * Returns the pair for two assets in either order.
     *
     * @throws PoolException PAIR_NOT_FOUND if no pool exists for them
     */
    public Pair lookup(Asset a, Asset b) {
        PairKey key = canonicalize(a, b);
        Pair pair = pairs.get(key);
        if (pair == null) {
            throw PoolException.of(PoolError.PAIR_NOT_FOUND, "No pair for %s", key);
        }
        return pair;
    }

    public List<Pair> pairs() {
        return pairs.values().stream()
                .sorted((p1, p2) -> p1.getKey().compareTo(p2.getKey()))
                .toList();
    }

    public int pairCount() {
        return pairs.size();
    }

    public int assetCount() {
        return registeredAssets.size();
    }

    void insert(Pair pair) {
        Pair previous = pairs.putIfAbsent(pair.getKey(), pair);
        if (previous != null) {
            throw PoolException.of(PoolError.PAIR_ALREADY_EXISTS, "Pair already exists: %s", pair.getKey());
        }
    }

    /**
     * Replaces the reserves of an existing pair.
     */
    void commit(Pair pair) {
        Pair replaced = pairs.replace(pair.getKey(), pair);
        if (replaced == null) {
            throw PoolException.of(PoolError.PAIR_NOT_FOUND, "No pair for %s", pair.getKey());
        }
    }
}
