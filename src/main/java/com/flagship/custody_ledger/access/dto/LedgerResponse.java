package com.flagship.custody_ledger.access.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.custody_ledger.access.LedgerInstance;
import com.flagship.custody_ledger.access.LedgerKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class LedgerResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("kind")
    LedgerKind kind;

    @JsonProperty("name")
    String name;

    @JsonProperty("owner")
    String owner;

    @JsonProperty("members")
    List<String> members;

    @JsonProperty("created_at")
    Instant createdAt;

    public static LedgerResponse from(LedgerInstance ledger, List<String> members) {
        return LedgerResponse.builder()
                .id(ledger.getId())
                .kind(ledger.getKind())
                .name(ledger.getName())
                .owner(ledger.getOwner())
                .members(members)
                .createdAt(ledger.getCreatedAt())
                .build();
    }
}
