package com.flagship.liquidity_pool.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class BalanceResponse {

    @JsonProperty("asset")
    String asset;

    @JsonProperty("account")
    String account;

    @JsonProperty("balance")
    BigInteger balance;

    @JsonProperty("allowance")
    BigInteger allowance;
}
