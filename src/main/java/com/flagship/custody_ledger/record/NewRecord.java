package com.flagship.custody_ledger.record;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * What a caller asks for when creating a record. Validated by the lifecycle
 * before anything is written.
 */
@Value
@Builder
public class NewRecord {
    String key;
    RecordKind kind;
    String beneficiary;
    BigDecimal value;
    BigDecimal unitAmount;
    Integer capacity;
    String parentKey;
    String payload;
    Instant expiresAt;
}
