package com.flagship.liquidity_pool.pool;

import com.flagship.liquidity_pool.pool.exception.PoolError;
import com.flagship.liquidity_pool.pool.exception.PoolException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the constant-product quote.
 *
 * amountOut = floor(amountIn * 997 * reserveOut / (reserveIn * 1000 + amountIn * 997))
 */
@DisplayName("Pricing Engine Tests")
class PricingEngineTest {

    private static BigInteger big(long value) {
        return BigInteger.valueOf(value);
    }

    @Test
    @DisplayName("Quote matches the worked example: 100 in against (1000, 2000) pays 181")
    void testWorkedExample() {
        BigInteger amountOut = PricingEngine.quoteOutput(big(100), big(1000), big(2000));

        assertEquals(big(181), amountOut);
    }

    @ParameterizedTest(name = "{0} in against ({1}, {2}) pays {3}")
    @CsvSource({
        "100, 1000, 2000, 181",
        "100, 2000, 1000, 47",
        "1000, 1000, 1000, 499",
        "1, 1000, 2000, 1",
        "1000000, 1000000, 1000000, 499248"
    })
    @DisplayName("Quote is the floor of the fee-adjusted constant-product output")
    void testQuoteTable(long amountIn, long reserveIn, long reserveOut, long expected) {
        assertEquals(big(expected), PricingEngine.quoteOutput(big(amountIn), big(reserveIn), big(reserveOut)));
    }

    @Test
    @DisplayName("Output that rounds down to zero is rejected")
    void testZeroOutputRejected() {
        PoolException e = assertThrows(PoolException.class,
                () -> PricingEngine.quoteOutput(big(1), big(2000), big(1000)));

        assertEquals(PoolError.INSUFFICIENT_OUTPUT, e.getError());
    }

    @Test
    @DisplayName("Zero and negative input are rejected")
    void testNonPositiveInputRejected() {
        PoolException zero = assertThrows(PoolException.class,
                () -> PricingEngine.quoteOutput(BigInteger.ZERO, big(1000), big(2000)));
        PoolException negative = assertThrows(PoolException.class,
                () -> PricingEngine.quoteOutput(big(-5), big(1000), big(2000)));

        assertEquals(PoolError.INSUFFICIENT_INPUT, zero.getError());
        assertEquals(PoolError.INSUFFICIENT_INPUT, negative.getError());
    }

    @Test
    @DisplayName("Empty reserves are rejected")
    void testEmptyReservesRejected() {
        PoolException e = assertThrows(PoolException.class,
                () -> PricingEngine.quoteOutput(big(100), BigInteger.ZERO, big(2000)));

        assertEquals(PoolError.INSUFFICIENT_LIQUIDITY, e.getError());
    }

    @Test
    @DisplayName("Output never reaches the output reserve, however large the input")
    void testOutputBelowReserve() {
        BigInteger huge = BigInteger.TEN.pow(30);

        BigInteger amountOut = PricingEngine.quoteOutput(huge, big(1000), big(2000));

        assertEquals(big(1999), amountOut);
        assertTrue(amountOut.compareTo(big(2000)) < 0);
    }

    @Test
    @DisplayName("Quote is non-decreasing in the input amount")
    void testMonotonicInAmountIn() {
        BigInteger reserveIn = big(1000);
        BigInteger reserveOut = big(2000);
        BigInteger previous = BigInteger.ZERO;

        for (long amountIn = 1; amountIn <= 20_000; amountIn++) {
            BigInteger current = quoteOrZero(big(amountIn), reserveIn, reserveOut);
            assertTrue(current.compareTo(previous) >= 0,
                    "Quote decreased at amountIn=" + amountIn + ": " + previous + " -> " + current);
            previous = current;
        }
    }

    @Test
    @DisplayName("Reserve product never decreases after applying a quote")
    void testProductNeverDecreases() {
        BigInteger reserveIn = big(1000);
        BigInteger reserveOut = big(2000);
        BigInteger before = reserveIn.multiply(reserveOut);

        for (long amountIn = 1; amountIn <= 5_000; amountIn += 7) {
            BigInteger amountOut = quoteOrZero(big(amountIn), reserveIn, reserveOut);
            BigInteger after = reserveIn.add(big(amountIn)).multiply(reserveOut.subtract(amountOut));
            assertTrue(after.compareTo(before) >= 0, "Product shrank for amountIn=" + amountIn);
        }
    }

    @Test
    @DisplayName("Zero fee still rounds in the pool's favour")
    void testZeroFee() {
        BigInteger amountOut = PricingEngine.quoteOutput(big(100), big(1000), big(2000), 0, 1000);

        assertEquals(big(181), amountOut);
        assertTrue(big(1100).multiply(big(2000).subtract(amountOut)).compareTo(big(2_000_000)) >= 0);
    }

    @Test
    @DisplayName("Fee fraction outside [0, 1) is a configuration error")
    void testInvalidFee() {
        assertThrows(IllegalArgumentException.class,
                () -> PricingEngine.quoteOutput(big(100), big(1000), big(2000), 1000, 1000));
        assertThrows(IllegalArgumentException.class,
                () -> PricingEngine.quoteOutput(big(100), big(1000), big(2000), -1, 1000));
        assertThrows(IllegalArgumentException.class,
                () -> PricingEngine.quoteOutput(big(100), big(1000), big(2000), 3, 0));
    }

    private static BigInteger quoteOrZero(BigInteger amountIn, BigInteger reserveIn, BigInteger reserveOut) {
        try {
            return PricingEngine.quoteOutput(amountIn, reserveIn, reserveOut);
        } catch (PoolException e) {
            assertEquals(PoolError.INSUFFICIENT_OUTPUT, e.getError());
            return BigInteger.ZERO;
        }
    }
}
