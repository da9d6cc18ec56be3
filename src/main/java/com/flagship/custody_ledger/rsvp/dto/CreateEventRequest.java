package com.flagship.custody_ledger.rsvp.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
@Jacksonized
public class CreateEventRequest {

    @NotBlank(message = "Event id is required")
    @JsonProperty("event_id")
    String eventId;

    @NotBlank(message = "Event name is required")
    @JsonProperty("name")
    String name;

    @NotNull(message = "Deposit is required")
    @DecimalMin(value = "0.01", message = "Deposit must be greater than 0")
    @Digits(integer = 15, fraction = 4, message = "Deposit must have at most 4 decimal places")
    @JsonProperty("deposit")
    BigDecimal deposit;

    @NotNull(message = "Capacity is required")
    @Positive(message = "Capacity must be positive")
    @JsonProperty("capacity")
    Integer capacity;

    @NotNull(message = "Start time is required")
    @JsonProperty("starts_at")
    Instant startsAt;
}
