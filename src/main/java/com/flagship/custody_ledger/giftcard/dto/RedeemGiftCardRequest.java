package com.flagship.custody_ledger.giftcard.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class RedeemGiftCardRequest {

    @NotBlank(message = "Secret is required")
    @JsonProperty("secret")
    String secret;

    @JsonProperty("message")
    String message;
}
