package com.flagship.liquidity_pool.pool.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigInteger;

/**
 * Request DTO for creating a pair with its initial deposit.
 *
 * Amount sign and size are checked by the pool, not here, so that a zero
 * deposit is reported as INSUFFICIENT_LIQUIDITY.
 */
@Value
public class CreatePairRequest {

    @NotBlank(message = "Asset A is required")
    @JsonProperty("asset_a")
    String assetA;

    @NotBlank(message = "Asset B is required")
    @JsonProperty("asset_b")
    String assetB;

    @NotNull(message = "Amount A is required")
    @JsonProperty("amount_a")
    BigInteger amountA;

    @NotNull(message = "Amount B is required")
    @JsonProperty("amount_b")
    BigInteger amountB;
}
