package com.flagship.liquidity_pool.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

import java.math.BigInteger;

/**
 * Request DTO for issuing test balances on the in-memory ledger.
 */
@Value
public class MintRequest {

    @NotBlank(message = "Asset is required")
    @JsonProperty("asset")
    String asset;

    @NotBlank(message = "Account is required")
    @JsonProperty("account")
    String account;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigInteger amount;
}
