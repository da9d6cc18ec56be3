package com.flagship.custody_ledger.treasury;

import com.flagship.custody_ledger.identity.CallerContext;
import com.flagship.custody_ledger.record.CustodyEngine;
import com.flagship.custody_ledger.record.RecordKind;
import com.flagship.custody_ledger.record.RecordStatus;
import com.flagship.custody_ledger.record.RecordView;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TreasuryController.class)
class TreasuryControllerTest {

    private static final UUID LEDGER = UUID.fromString("7f3a2c10-5b8e-4d61-9a0f-2e6c4b1d8a53");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TreasuryService treasuryService;

    @Test
    @DisplayName("Withdrawal amounts with more than four decimal places never reach the service")
    void withdrawalScale() throws Exception {
        mockMvc.perform(post("/api/ledgers/{ledgerId}/treasury/withdrawals", LEDGER)
                        .header(CallerContext.CALLER_HEADER, "M")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"recipient\": \"R\", \"amount\": 10.00005, \"reason\": \"supplies\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_INPUT"))
                .andExpect(jsonPath("$.details.amount").value("Amount must have at most 4 decimal places"));

        verifyNoInteractions(treasuryService);
    }

    @Test
    @DisplayName("Trailing zeros do not count against the amount's scale")
    void trailingZeros() throws Exception {
        when(treasuryService.withdraw(eq(LEDGER), any(CallerContext.class), eq("R"), any(BigDecimal.class),
                eq("supplies")))
                .thenReturn(RecordView.builder()
                        .key(CustodyEngine.POOL_KEY)
                        .kind(RecordKind.TREASURY_POOL)
                        .status(RecordStatus.ACTIVE)
                        .valid(true)
                        .value(new BigDecimal("89.5"))
                        .build());

        mockMvc.perform(post("/api/ledgers/{ledgerId}/treasury/withdrawals", LEDGER)
                        .header(CallerContext.CALLER_HEADER, "M")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"recipient\": \"R\", \"amount\": 10.500000, \"reason\": \"supplies\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.value").value(89.5));

        verify(treasuryService).withdraw(eq(LEDGER), eq(CallerContext.of("M")), eq("R"),
                argThat(amount -> amount.compareTo(new BigDecimal("10.5")) == 0), eq("supplies"));
    }
}
