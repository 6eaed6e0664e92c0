package com.flagship.liquidity_pool.pool;

import com.flagship.liquidity_pool.asset.Asset;
import com.flagship.liquidity_pool.event.EventSink;
import com.flagship.liquidity_pool.ledger.LedgerException;
import com.flagship.liquidity_pool.ledger.TokenLedger;
import com.flagship.liquidity_pool.observability.CorrelationContext;
import com.flagship.liquidity_pool.observability.PoolMetrics;
import com.flagship.liquidity_pool.pool.exception.PoolError;
import com.flagship.liquidity_pool.pool.exception.PoolException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * Applies asset registrations, pair creations and swaps as all-or-nothing
 * state transitions.
 *
 * Every state-changing call:
 * 1. Enters the {@link ReentrancyGuard} (re-entry from a ledger callback fails)
 * 2. Validates and quotes against the state observed at entry
 * 3. Performs the ledger transfers, reversing earlier pulls if a later transfer fails
 * 4. Commits to the {@link PairStore} only after every transfer returned
 * 5. Notifies the {@link EventSink}
 *
 * A failure at any step leaves the store unchanged and propagates to the
 * caller. Ledger failures propagate as the ledger raised them.
 */
@Service
@Slf4j
public class SwapExecutor {

    private final PairStore pairStore;
    private final TokenLedger tokenLedger;
    private final EventSink eventSink;
    private final PoolMetrics poolMetrics;
    private final long feeNumerator;
    private final long feeDenominator;
    private final ReentrancyGuard guard = new ReentrancyGuard();

    public SwapExecutor(PairStore pairStore,
                        TokenLedger tokenLedger,
                        EventSink eventSink,
                        PoolMetrics poolMetrics,
                        @Value("${pool.fee.numerator:3}") long feeNumerator,
                        @Value("${pool.fee.denominator:1000}") long feeDenominator) {
        PricingEngine.validateFee(feeNumerator, feeDenominator);
        this.pairStore = pairStore;
        this.tokenLedger = tokenLedger;
        this.eventSink = eventSink;
        this.poolMetrics = poolMetrics;
        this.feeNumerator = feeNumerator;
        this.feeDenominator = feeDenominator;
    }

    /**
     * Registers an asset after checking it has a nonzero total supply.
     *
     * @throws PoolException DUPLICATE_ASSET, INVALID_ASSET or REENTRANCY_VIOLATION
     */
    public void registerAsset(Asset asset) {
        guarded("registerAsset", () -> {
            if (pairStore.isRegistered(asset)) {
                throw PoolException.of(PoolError.DUPLICATE_ASSET, "Asset already registered: %s", asset);
            }

            BigInteger supply;
            try {
                supply = tokenLedger.totalSupply(asset);
            } catch (PoolException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new PoolException(PoolError.INVALID_ASSET,
                        "Supply query failed for asset " + asset + ": " + e.getMessage(), e);
            }
            if (supply == null || supply.signum() <= 0) {
                throw PoolException.of(PoolError.INVALID_ASSET, "Asset %s has no issued supply", asset);
            }

            pairStore.registerAsset(asset);
            poolMetrics.incrementAssetsRegistered();
            log.info("Asset registered: asset={}, totalSupply={}", asset, supply);

            eventSink.assetRegistered(asset);
            return null;
        });
    }

    /**
     * Creates a pair and seeds it with the caller's initial deposit.
     *
     * @param caller account the deposit is pulled from
     * @param assetA first asset, in the caller's order
     * @param assetB second asset, in the caller's order
     * @param amountA deposit of assetA
     * @param amountB deposit of assetB
     * @return the stored pair, reserves in canonical order
     * @throws PoolException INVALID_CALLER, IDENTICAL_ASSETS, ASSET_NOT_REGISTERED,
     *         PAIR_ALREADY_EXISTS, INSUFFICIENT_LIQUIDITY or REENTRANCY_VIOLATION
     * @throws LedgerException if a deposit cannot be pulled
     */
    public Pair createPair(String caller, Asset assetA, Asset assetB, BigInteger amountA, BigInteger amountB) {
        requireCaller(caller);
        return guarded("createPair", () -> {
            rejectPoolAccount(caller);
            PairKey key = pairStore.validateNewPair(assetA, assetB, amountA, amountB);
            Pair pair = Pair.create(key, assetA, amountA, amountB);

            String pool = tokenLedger.poolAccount();
            tokenLedger.transferFrom(assetA, caller, pool, amountA);
            try {
                tokenLedger.transferFrom(assetB, caller, pool, amountB);
            } catch (RuntimeException e) {
                refund(assetA, caller, amountA, e);
                throw e;
            }

            pairStore.insert(pair);
            poolMetrics.incrementPairsCreated();
            log.info("Pair created: pair={}, reserveLow={}, reserveHigh={}, caller={}",
                    key, pair.getReserveLow(), pair.getReserveHigh(), caller);

            eventSink.pairCreated(key.getLow(), key.getHigh());
            return pair;
        });
    }

    /**
     * Exchanges amountIn of assetIn for as much assetOut as the
     * constant-product formula yields after the fee.
     *
     * @return the amounts moved and the pair after the swap
     * @throws PoolException INVALID_CALLER, INSUFFICIENT_INPUT, INVALID_ASSET_PAIR, PAIR_NOT_FOUND,
     *         INSUFFICIENT_OUTPUT, INSUFFICIENT_LIQUIDITY or REENTRANCY_VIOLATION
     * @throws LedgerException if the input cannot be pulled or the output cannot be paid
     */
    public SwapResult swap(String caller, Asset assetIn, Asset assetOut, BigInteger amountIn) {
        requireCaller(caller);
        long startTime = System.nanoTime();
        try {
            SwapResult result = guarded("swap", () -> doSwap(caller, assetIn, assetOut, amountIn));
            poolMetrics.recordSwap("success");
            return result;
        } catch (RuntimeException e) {
            poolMetrics.recordSwap("rejected");
            throw e;
        } finally {
            poolMetrics.recordSwapDuration(Duration.ofNanos(System.nanoTime() - startTime));
        }
    }

    private SwapResult doSwap(String caller, Asset assetIn, Asset assetOut, BigInteger amountIn) {
        // Checks: everything below reads the state observed at entry
        rejectPoolAccount(caller);
        Pair pair = preview(assetIn, assetOut, amountIn);
        CorrelationContext.bindPair(pair.getKey().toString());
        try {
            BigInteger amountOut = quoteAgainst(pair, assetIn, assetOut, amountIn);
            Pair next = pair.afterSwap(assetIn, amountIn, amountOut);

            // Interactions
            tokenLedger.transferFrom(assetIn, caller, tokenLedger.poolAccount(), amountIn);
            try {
                tokenLedger.transfer(assetOut, caller, amountOut);
            } catch (RuntimeException e) {
                refund(assetIn, caller, amountIn, e);
                throw e;
            }

            // Effects, only once every transfer has returned
            pairStore.commit(next);
            log.info("Swap executed: caller={}, assetIn={}, amountIn={}, assetOut={}, amountOut={}, reserves=({}, {})",
                    caller, assetIn, amountIn, assetOut, amountOut, next.getReserveLow(), next.getReserveHigh());

            boolean inIsLow = pair.getKey().isLow(assetIn);
            eventSink.swapExecuted(pair.getKey(), caller,
                    inIsLow ? amountIn : BigInteger.ZERO,
                    inIsLow ? BigInteger.ZERO : amountIn,
                    inIsLow ? BigInteger.ZERO : amountOut,
                    inIsLow ? amountOut : BigInteger.ZERO);

            return new SwapResult(assetIn, assetOut, amountIn, amountOut, next);
        } finally {
            CorrelationContext.unbindPair();
        }
    }

    /**
     * Prices a swap against the committed reserves without executing it.
     *
     * @return the amount of assetOut a swap of amountIn would pay out now
     */
    public BigInteger quote(Asset assetIn, Asset assetOut, BigInteger amountIn) {
        Pair pair = preview(assetIn, assetOut, amountIn);
        return quoteAgainst(pair, assetIn, assetOut, amountIn);
    }

    public long getFeeNumerator() {
        return feeNumerator;
    }

    public long getFeeDenominator() {
        return feeDenominator;
    }

    private Pair preview(Asset assetIn, Asset assetOut, BigInteger amountIn) {
        if (amountIn == null || amountIn.signum() <= 0) {
            throw PoolException.of(PoolError.INSUFFICIENT_INPUT, "Input amount must be positive: %s", amountIn);
        }
        if (assetIn.equals(assetOut)) {
            throw PoolException.of(PoolError.INVALID_ASSET_PAIR, "Cannot swap %s for itself", assetIn);
        }
        return pairStore.lookup(assetIn, assetOut);
    }

    private BigInteger quoteAgainst(Pair pair, Asset assetIn, Asset assetOut, BigInteger amountIn) {
        return PricingEngine.quoteOutput(amountIn, pair.reserveOf(assetIn), pair.reserveOf(assetOut),
                feeNumerator, feeDenominator);
    }

    /**
     * Reverses a pull after a later step of the same call failed, restoring
     * both the caller's balance and the allowance it spent.
     * A failed refund is attached to the original failure, which still propagates.
     */
    private void refund(Asset asset, String to, BigInteger amount, RuntimeException cause) {
        try {
            tokenLedger.reverseTransferFrom(asset, to, tokenLedger.poolAccount(), amount);
            log.warn("Refunded {} {} to {} after failed transfer: {}", amount, asset, to, cause.getMessage());
        } catch (RuntimeException refundFailure) {
            cause.addSuppressed(refundFailure);
            log.error("Refund of {} {} to {} failed, manual reconciliation required", amount, asset, to, refundFailure);
        }
    }

    private <T> T guarded(String operation, Supplier<T> body) {
        try {
            guard.enter();
        } catch (PoolException e) {
            recordRejection(operation, e);
            throw e;
        }
        try {
            return body.get();
        } catch (RuntimeException e) {
            recordRejection(operation, e);
            throw e;
        } finally {
            guard.exit();
        }
    }

    private void recordRejection(String operation, RuntimeException e) {
        String code;
        if (e instanceof PoolException poolException) {
            code = poolException.getError().name();
        } else if (e instanceof LedgerException ledgerException) {
            code = ledgerException.getError().name();
        } else {
            code = e.getClass().getSimpleName();
        }
        poolMetrics.recordError(operation, code);
        log.warn("{} rejected: code={}, message={}", operation, code, e.getMessage());
    }

    // Transfers from the reserve account to itself move nothing
    private void rejectPoolAccount(String caller) {
        if (caller.equals(tokenLedger.poolAccount())) {
            throw PoolException.of(PoolError.INVALID_CALLER,
                    "The pool account %s cannot trade against its own reserves", caller);
        }
    }

    private static void requireCaller(String caller) {
        if (caller == null || caller.isBlank()) {
            throw new IllegalArgumentException("Caller account is required");
        }
    }
}
