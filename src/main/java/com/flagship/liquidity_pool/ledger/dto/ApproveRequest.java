package com.flagship.liquidity_pool.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

import java.math.BigInteger;

/**
 * Request DTO for granting the pool account an allowance.
 */
@Value
public class ApproveRequest {

    @NotBlank(message = "Asset is required")
    @JsonProperty("asset")
    String asset;

    @NotBlank(message = "Holder is required")
    @JsonProperty("holder")
    String holder;

    @NotNull(message = "Amount is required")
    @PositiveOrZero(message = "Amount must not be negative")
    @JsonProperty("amount")
    BigInteger amount;
}
