package com.flagship.custody_ledger.access.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Names a principal to add as a member or hand ownership to.
 */
@Value
@Builder
@Jacksonized
public class PrincipalRequest {

    @NotBlank(message = "Principal is required")
    @JsonProperty("principal")
    String principal;
}
