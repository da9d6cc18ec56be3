package com.flagship.custody_ledger.access;

import com.flagship.custody_ledger.disbursement.DisbursementService;
import com.flagship.custody_ledger.disbursement.ReconciliationReport;
import com.flagship.custody_ledger.error.CustodyRejectedException;
import com.flagship.custody_ledger.event.EventKind;
import com.flagship.custody_ledger.identity.CallerContext;
import com.flagship.custody_ledger.record.CustodyEngine;
import com.flagship.custody_ledger.store.HistoryEntry;
import com.flagship.custody_ledger.store.HistoryPage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(LedgerController.class)
class LedgerControllerTest {

    private static final Instant CREATED = Instant.parse("2024-03-01T12:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AccessControlService accessControl;

    @MockBean
    private CustodyEngine engine;

    @MockBean
    private DisbursementService disbursement;

    @Test
    @DisplayName("POST opens a ledger owned by the caller")
    void openLedger() throws Exception {
        UUID id = UUID.randomUUID();
        when(accessControl.openLedger(CallerContext.of("O"), LedgerKind.SHARED_TREASURY, "club funds"))
                .thenReturn(new LedgerInstance(id, LedgerKind.SHARED_TREASURY, "club funds", "O", CREATED));

        mockMvc.perform(post("/api/ledgers")
                        .header(CallerContext.CALLER_HEADER, "O")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\": \"SHARED_TREASURY\", \"name\": \"club funds\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(id.toString()))
                .andExpect(jsonPath("$.owner").value("O"))
                .andExpect(jsonPath("$.kind").value("SHARED_TREASURY"));
    }

    @Test
    @DisplayName("Unknown ledger kind is a malformed body")
    void unknownKind() throws Exception {
        mockMvc.perform(post("/api/ledgers")
                        .header(CallerContext.CALLER_HEADER, "O")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\": \"PIGGY_BANK\", \"name\": \"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_INPUT"));
    }

    @Test
    @DisplayName("Duplicate member is reported as invalid state")
    void duplicateMember() throws Exception {
        UUID id = UUID.randomUUID();
        doThrow(CustodyRejectedException.invalidState("M is already a member"))
                .when(accessControl).addMember(eq(id), any(CallerContext.class), eq("M"));

        mockMvc.perform(post("/api/ledgers/{id}/members", id)
                        .header(CallerContext.CALLER_HEADER, "O")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"principal\": \"M\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("INVALID_STATE"));
    }

    @Test
    @DisplayName("Membership lookup answers for any principal")
    void membership() throws Exception {
        UUID id = UUID.randomUUID();
        when(accessControl.isMember(id, "M")).thenReturn(true);
        when(accessControl.isMember(id, "X")).thenReturn(false);

        mockMvc.perform(get("/api/ledgers/{ledgerId}/members/{principal}", id, "M"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.principal").value("M"))
                .andExpect(jsonPath("$.member").value(true));

        mockMvc.perform(get("/api/ledgers/{ledgerId}/members/{principal}", id, "X"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.member").value(false));
    }

    @Test
    @DisplayName("PUT owner hands the ledger over")
    void transferOwnership() throws Exception {
        UUID id = UUID.randomUUID();
        when(accessControl.transferOwnership(id, CallerContext.of("O"), "N"))
                .thenReturn(new LedgerInstance(id, LedgerKind.GIFT_REGISTRY, "wedding", "N", CREATED));
        when(accessControl.members(id)).thenReturn(List.of("M"));

        mockMvc.perform(put("/api/ledgers/{id}/owner", id)
                        .header(CallerContext.CALLER_HEADER, "O")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"principal\": \"N\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.owner").value("N"))
                .andExpect(jsonPath("$.members[0]").value("M"));
    }

    @Test
    @DisplayName("History returns entries newest first with the next cursor")
    void history() throws Exception {
        UUID id = UUID.randomUUID();
        HistoryEntry entry = HistoryEntry.builder()
                .sequence(7L)
                .ledgerId(id)
                .recordKey("K1")
                .action(EventKind.RECORD_VOIDED)
                .actor("O")
                .reason("tamper")
                .occurredAt(CREATED)
                .build();
        when(engine.historyPage(id, 8L, 1)).thenReturn(new HistoryPage(List.of(entry), 7L));

        mockMvc.perform(get("/api/ledgers/{id}/history", id).param("limit", "1").param("before", "8"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entries[0].action").value("RECORD_VOIDED"))
                .andExpect(jsonPath("$.entries[0].reason").value("tamper"))
                .andExpect(jsonPath("$.next_cursor").value(7));
    }

    @Test
    @DisplayName("Reconciliation reports both sides and whether they agree")
    void reconciliation() throws Exception {
        UUID id = UUID.randomUUID();
        when(disbursement.reconcile(id)).thenReturn(
                new ReconciliationReport(id, new BigDecimal("120"), new BigDecimal("120"), CREATED));

        mockMvc.perform(get("/api/ledgers/{id}/reconciliation", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balanced").value(true))
                .andExpect(jsonPath("$.recorded_value").value(120));
    }
}
