package com.flagship.custody_ledger.record.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class TransferRecordRequest {

    @NotBlank(message = "New beneficiary is required")
    @JsonProperty("new_beneficiary")
    String newBeneficiary;
}
