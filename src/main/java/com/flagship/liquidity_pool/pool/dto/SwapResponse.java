package com.flagship.liquidity_pool.pool.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.liquidity_pool.pool.SwapResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Response DTO for an executed swap.
 */
@Value
@Builder
public class SwapResponse {

    @JsonProperty("asset_in")
    String assetIn;

    @JsonProperty("asset_out")
    String assetOut;

    @JsonProperty("amount_in")
    BigInteger amountIn;

    @JsonProperty("amount_out")
    BigInteger amountOut;

    @JsonProperty("pair")
    PairResponse pair;

    public static SwapResponse from(SwapResult result) {
        return SwapResponse.builder()
            .assetIn(result.getAssetIn().getId())
            .assetOut(result.getAssetOut().getId())
            .amountIn(result.getAmountIn())
            .amountOut(result.getAmountOut())
            .pair(PairResponse.from(result.getPair()))
            .build();
    }
}
