package com.flagship.liquidity_pool.pool;

import com.flagship.liquidity_pool.pool.exception.PoolError;
import com.flagship.liquidity_pool.pool.exception.PoolException;

import java.math.BigInteger;

/**
 * Constant-product pricing with the fee taken from the input side.
 *
 * <pre>
 * effectiveIn = amountIn * (feeDenominator - feeNumerator)
 * amountOut   = floor(effectiveIn * reserveOut / (reserveIn * feeDenominator + effectiveIn))
 * </pre>
 *
 * Integer arithmetic only. Division truncates, so the pool never pays out
 * more than the formula entitles the trader to and the reserve product cannot
 * shrink.
 */
public final class PricingEngine {

    public static final long DEFAULT_FEE_NUMERATOR = 3;
    public static final long DEFAULT_FEE_DENOMINATOR = 1000;

    private PricingEngine() {
    }

    /**
     * Computes the output amount of a swap.
     *
     * @param amountIn amount the trader sends in, must be positive
     * @param reserveIn pool reserve of the input asset
     * @param reserveOut pool reserve of the output asset
     * @param feeNumerator fee share of the input, numerator
     * @param feeDenominator fee share of the input, denominator
     * @return amount of the output asset the trader receives, always in (0, reserveOut)
     * @throws PoolException INSUFFICIENT_INPUT, INSUFFICIENT_LIQUIDITY or INSUFFICIENT_OUTPUT
     * @throws IllegalArgumentException if the fee fraction is not in [0, 1)
     */
    public static BigInteger quoteOutput(BigInteger amountIn, BigInteger reserveIn, BigInteger reserveOut,
                                         long feeNumerator, long feeDenominator) {
        validateFee(feeNumerator, feeDenominator);
        if (amountIn == null || amountIn.signum() <= 0) {
            throw PoolException.of(PoolError.INSUFFICIENT_INPUT, "Input amount must be positive: %s", amountIn);
        }
        if (reserveIn == null || reserveOut == null || reserveIn.signum() <= 0 || reserveOut.signum() <= 0) {
            throw PoolException.of(PoolError.INSUFFICIENT_LIQUIDITY,
                    "Pool has no liquidity: reserveIn=%s, reserveOut=%s", reserveIn, reserveOut);
        }

        BigInteger effectiveIn = amountIn.multiply(BigInteger.valueOf(feeDenominator - feeNumerator));
        BigInteger numerator = effectiveIn.multiply(reserveOut);
        BigInteger denominator = reserveIn.multiply(BigInteger.valueOf(feeDenominator)).add(effectiveIn);
        BigInteger amountOut = numerator.divide(denominator);

        if (amountOut.signum() == 0) {
            throw PoolException.of(PoolError.INSUFFICIENT_OUTPUT,
                    "Input %s is too small to buy anything against reserves (%s, %s)",
                    amountIn, reserveIn, reserveOut);
        }
        if (amountOut.compareTo(reserveOut) >= 0) {
            throw PoolException.of(PoolError.INSUFFICIENT_LIQUIDITY,
                    "Output %s would drain reserve %s", amountOut, reserveOut);
        }
        return amountOut;
    }

    public static BigInteger quoteOutput(BigInteger amountIn, BigInteger reserveIn, BigInteger reserveOut) {
        return quoteOutput(amountIn, reserveIn, reserveOut, DEFAULT_FEE_NUMERATOR, DEFAULT_FEE_DENOMINATOR);
    }

    static void validateFee(long feeNumerator, long feeDenominator) {
        if (feeDenominator <= 0 || feeNumerator < 0 || feeNumerator >= feeDenominator) {
            throw new IllegalArgumentException(String.format(
                    "Fee must satisfy 0 <= numerator < denominator: %d/%d", feeNumerator, feeDenominator));
        }
    }
}
