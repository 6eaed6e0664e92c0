package com.flagship.liquidity_pool.pool.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

/**
 * Request DTO for registering an asset.
 */
@Value
public class RegisterAssetRequest {

    @NotBlank(message = "Asset is required")
    @JsonProperty("asset")
    String asset;
}
