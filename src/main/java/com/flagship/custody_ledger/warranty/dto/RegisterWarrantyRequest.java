package com.flagship.custody_ledger.warranty.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Registers a product warranty under its serial number.
 */
@Value
@Builder
@Jacksonized
public class RegisterWarrantyRequest {

    @NotBlank(message = "Serial number is required")
    @JsonProperty("serial_number")
    String serialNumber;

    @NotBlank(message = "Holder is required")
    @JsonProperty("holder")
    String holder;

    @NotNull(message = "Duration is required")
    @Positive(message = "Duration must be positive")
    @JsonProperty("duration_days")
    Long durationDays;

    @JsonProperty("product_details")
    String productDetails;
}
