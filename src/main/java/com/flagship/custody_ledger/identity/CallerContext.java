package com.flagship.custody_ledger.identity;

import com.flagship.custody_ledger.error.CustodyRejectedException;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Identity of the principal making a call, plus the value attached to the call.
 *
 * Authentication happens upstream; the principal arrives already trusted.
 * Attached value is zero when the call carries no funds.
 */
@Value
public class CallerContext {

    public static final String CALLER_HEADER = "X-Caller-Id";
    public static final String ATTACHED_VALUE_HEADER = "X-Attached-Value";

    /** Fraction digits an amount may carry; custody columns are NUMERIC(19,4). */
    public static final int MAX_AMOUNT_SCALE = 4;

    String principal;
    BigDecimal attachedValue;

    public static CallerContext of(String principal) {
        return of(principal, BigDecimal.ZERO);
    }

    public static CallerContext of(String principal, BigDecimal attachedValue) {
        if (principal == null || principal.isBlank()) {
            throw CustodyRejectedException.invalidInput("Caller principal is required");
        }
        BigDecimal value = attachedValue != null ? attachedValue : BigDecimal.ZERO;
        if (value.signum() < 0) {
            throw CustodyRejectedException.invalidInput("Attached value cannot be negative");
        }
        requireStorableScale(value, "Attached value");
        return new CallerContext(principal.trim(), value);
    }

    public boolean is(String other) {
        return principal.equals(other);
    }

    public boolean carriesValue() {
        return attachedValue.signum() > 0;
    }

    /**
     * Rejects amounts that storage would round. Trailing zeros do not count.
     */
    public static void requireStorableScale(BigDecimal amount, String label) {
        if (amount != null && amount.stripTrailingZeros().scale() > MAX_AMOUNT_SCALE) {
            throw CustodyRejectedException.invalidInput(String.format(
                    "%s %s has more than %d decimal places", label, amount.toPlainString(), MAX_AMOUNT_SCALE));
        }
    }
}
