package com.flagship.custody_ledger.rsvp.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class CheckInRequest {

    @NotBlank(message = "Attendee is required")
    @JsonProperty("attendee")
    String attendee;
}
