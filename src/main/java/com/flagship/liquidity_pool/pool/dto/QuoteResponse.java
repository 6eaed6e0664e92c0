package com.flagship.liquidity_pool.pool.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Response DTO for a swap preview.
 */
@Value
@Builder
public class QuoteResponse {

    @JsonProperty("asset_in")
    String assetIn;

    @JsonProperty("asset_out")
    String assetOut;

    @JsonProperty("amount_in")
    BigInteger amountIn;

    @JsonProperty("amount_out")
    BigInteger amountOut;

    @JsonProperty("fee_numerator")
    long feeNumerator;

    @JsonProperty("fee_denominator")
    long feeDenominator;
}
