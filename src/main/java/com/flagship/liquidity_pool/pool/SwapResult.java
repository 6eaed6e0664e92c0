package com.flagship.liquidity_pool.pool;

import com.flagship.liquidity_pool.asset.Asset;
import lombok.Value;

import java.math.BigInteger;

/**
 * Outcome of a committed swap.
 */
@Value
public class SwapResult {
    Asset assetIn;
    Asset assetOut;
    BigInteger amountIn;
    BigInteger amountOut;
    Pair pair;
}
