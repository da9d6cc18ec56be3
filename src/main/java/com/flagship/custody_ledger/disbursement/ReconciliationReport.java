package com.flagship.custody_ledger.disbursement;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Custodied value according to the records versus according to the substrate.
 */
@Value
public class ReconciliationReport {

    @JsonProperty("ledger_id")
    UUID ledgerId;

    @JsonProperty("recorded_value")
    BigDecimal recordedValue;

    @JsonProperty("custody_balance")
    BigDecimal custodyBalance;

    @JsonProperty("checked_at")
    Instant checkedAt;

    @JsonProperty("balanced")
    public boolean isBalanced() {
        return recordedValue.compareTo(custodyBalance) == 0;
    }

    @JsonProperty("discrepancy")
    public BigDecimal getDiscrepancy() {
        return custodyBalance.subtract(recordedValue);
    }
}
