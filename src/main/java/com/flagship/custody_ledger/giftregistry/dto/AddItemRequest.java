package com.flagship.custody_ledger.giftregistry.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class AddItemRequest {

    @NotBlank(message = "Item id is required")
    @JsonProperty("item_id")
    String itemId;

    @NotBlank(message = "Description is required")
    @JsonProperty("description")
    String description;

    @NotNull(message = "Price is required")
    @DecimalMin(value = "0.01", message = "Price must be greater than 0")
    @Digits(integer = 15, fraction = 4, message = "Price must have at most 4 decimal places")
    @JsonProperty("price")
    BigDecimal price;
}
