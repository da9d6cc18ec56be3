package com.flagship.custody_ledger.treasury.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class DepositRequest {

    @Size(max = 500, message = "Note must be at most 500 characters")
    @JsonProperty("note")
    String note;
}
