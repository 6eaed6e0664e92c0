package com.flagship.liquidity_pool.pool.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigInteger;

/**
 * Request DTO for a swap.
 */
@Value
public class SwapRequest {

    @NotBlank(message = "Input asset is required")
    @JsonProperty("asset_in")
    String assetIn;

    @NotBlank(message = "Output asset is required")
    @JsonProperty("asset_out")
    String assetOut;

    @NotNull(message = "Input amount is required")
    @JsonProperty("amount_in")
    BigInteger amountIn;
}
