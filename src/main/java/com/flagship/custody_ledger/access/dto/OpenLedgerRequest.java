package com.flagship.custody_ledger.access.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.custody_ledger.access.LedgerKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class OpenLedgerRequest {

    @NotNull(message = "Ledger kind is required")
    @JsonProperty("kind")
    LedgerKind kind;

    @NotBlank(message = "Ledger name is required")
    @Size(max = 200, message = "Ledger name must be at most 200 characters")
    @JsonProperty("name")
    String name;
}
