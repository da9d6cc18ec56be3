package com.flagship.custody_ledger.giftcard.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class IssueGiftCardRequest {

    @NotBlank(message = "Commitment is required")
    @JsonProperty("commitment")
    String commitment;

    @JsonProperty("beneficiary")
    String beneficiary;

    @Positive(message = "Lifetime must be positive")
    @JsonProperty("expires_in_seconds")
    Long expiresInSeconds;

    @Size(max = 500, message = "Message must be at most 500 characters")
    @JsonProperty("message")
    String message;
}
