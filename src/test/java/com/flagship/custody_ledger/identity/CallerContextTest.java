package com.flagship.custody_ledger.identity;

import com.flagship.custody_ledger.error.CustodyError;
import com.flagship.custody_ledger.error.CustodyRejectedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class CallerContextTest {

    @Test
    @DisplayName("Principal is trimmed and a missing value reads as zero")
    void defaults() {
        CallerContext caller = CallerContext.of("  alice ", null);

        assertEquals("alice", caller.getPrincipal());
        assertEquals(0, BigDecimal.ZERO.compareTo(caller.getAttachedValue()));
        assertFalse(caller.carriesValue());
    }

    @Test
    @DisplayName("Blank principals and negative values are invalid input")
    void rejectsBadInput() {
        assertEquals(CustodyError.INVALID_INPUT,
                assertThrows(CustodyRejectedException.class, () -> CallerContext.of(" ")).getError());
        assertEquals(CustodyError.INVALID_INPUT, assertThrows(CustodyRejectedException.class,
                () -> CallerContext.of("alice", new BigDecimal("-1"))).getError());
    }

    @Test
    @DisplayName("Attached values finer than four decimal places are refused instead of rounded")
    void attachedValueScale() {
        CustodyRejectedException e = assertThrows(CustodyRejectedException.class,
                () -> CallerContext.of("alice", new BigDecimal("10.00005")));
        assertEquals(CustodyError.INVALID_INPUT, e.getError());
        assertTrue(e.getMessage().contains("10.00005"));

        assertTrue(CallerContext.of("alice", new BigDecimal("10.00000")).carriesValue());
        assertTrue(CallerContext.of("alice", new BigDecimal("10.0001")).carriesValue());
        assertTrue(CallerContext.of("alice", new BigDecimal("1E+3")).carriesValue());
    }
}
