package com.flagship.custody_ledger.treasury.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class TreasuryBalanceResponse {

    @JsonProperty("ledger_id")
    UUID ledgerId;

    @JsonProperty("owner")
    String owner;

    @JsonProperty("members")
    List<String> members;

    @JsonProperty("balance")
    BigDecimal balance;
}
