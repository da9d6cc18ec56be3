package com.flagship.custody_ledger.giftcard;

import com.flagship.custody_ledger.error.CustodyRejectedException;
import com.flagship.custody_ledger.error.TransferFailedException;
import com.flagship.custody_ledger.identity.CallerContext;
import com.flagship.custody_ledger.record.RecordKind;
import com.flagship.custody_ledger.record.RecordStatus;
import com.flagship.custody_ledger.record.RecordView;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(GiftCardController.class)
class GiftCardControllerTest {

    private static final UUID LEDGER = UUID.fromString("1b6e0c52-93d4-4f7a-8e21-5c0d9a7f3e84");
    private static final String COMMITMENT = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private GiftCardService giftCardService;

    private static RecordView card(RecordStatus status, String value) {
        return RecordView.builder()
                .key(COMMITMENT)
                .kind(RecordKind.GIFT_CARD)
                .valid(status.isActiveState())
                .status(status)
                .depositor("S")
                .value(new BigDecimal(value))
                .build();
    }

    @Test
    @DisplayName("Issuing reads the attached value from its header")
    void issueWithAttachedValue() throws Exception {
        when(giftCardService.issue(eq(LEDGER), any(CallerContext.class), eq(COMMITMENT), isNull(), eq(86400L),
                eq("happy birthday")))
                .thenReturn(card(RecordStatus.ACTIVE, "25.00"));

        mockMvc.perform(post("/api/ledgers/{ledgerId}/gift-cards", LEDGER)
                        .header(CallerContext.CALLER_HEADER, "S")
                        .header(CallerContext.ATTACHED_VALUE_HEADER, "25.00")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"commitment": "%s", "expires_in_seconds": 86400, "message": "happy birthday"}
                                """.formatted(COMMITMENT)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.kind").value("GIFT_CARD"))
                .andExpect(jsonPath("$.value").value(25.00));

        ArgumentCaptor<CallerContext> caller = ArgumentCaptor.forClass(CallerContext.class);
        verify(giftCardService).issue(eq(LEDGER), caller.capture(), eq(COMMITMENT), isNull(), eq(86400L),
                eq("happy birthday"));
        assertEquals("S", caller.getValue().getPrincipal());
        assertEquals(0, new BigDecimal("25").compareTo(caller.getValue().getAttachedValue()));
    }

    @Test
    @DisplayName("A non-numeric attached value is invalid input")
    void malformedAttachedValue() throws Exception {
        mockMvc.perform(post("/api/ledgers/{ledgerId}/gift-cards", LEDGER)
                        .header(CallerContext.CALLER_HEADER, "S")
                        .header(CallerContext.ATTACHED_VALUE_HEADER, "lots")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"commitment\": \"" + COMMITMENT + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_INPUT"));

        verifyNoInteractions(giftCardService);
    }

    @Test
    @DisplayName("An attached value finer than four decimal places is invalid input")
    void attachedValueScale() throws Exception {
        mockMvc.perform(post("/api/ledgers/{ledgerId}/gift-cards", LEDGER)
                        .header(CallerContext.CALLER_HEADER, "S")
                        .header(CallerContext.ATTACHED_VALUE_HEADER, "25.00005")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"commitment\": \"" + COMMITMENT + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_INPUT"));

        verifyNoInteractions(giftCardService);
    }

    @Test
    @DisplayName("Redeeming with the secret answers with the settled card")
    void redeemWithSecret() throws Exception {
        when(giftCardService.redeemWithSecret(LEDGER, CallerContext.of("R"), "abc", "thanks"))
                .thenReturn(card(RecordStatus.REDEEMED, "0"));

        mockMvc.perform(post("/api/ledgers/{ledgerId}/gift-cards/redeem", LEDGER)
                        .header(CallerContext.CALLER_HEADER, "R")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"secret\": \"abc\", \"message\": \"thanks\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("REDEEMED"))
                .andExpect(jsonPath("$.valid").value(false));
    }

    @Test
    @DisplayName("A blank secret never reaches the service")
    void blankSecret() throws Exception {
        mockMvc.perform(post("/api/ledgers/{ledgerId}/gift-cards/redeem", LEDGER)
                        .header(CallerContext.CALLER_HEADER, "R")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"secret\": \"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.secret").value("Secret is required"));

        verifyNoInteractions(giftCardService);
    }

    @Test
    @DisplayName("Unknown secret maps to 404 and a failed payout to 502")
    void failures() throws Exception {
        when(giftCardService.redeemWithSecret(eq(LEDGER), any(CallerContext.class), eq("wrong"), any()))
                .thenThrow(CustodyRejectedException.notFound("No gift card matches the secret"));
        when(giftCardService.redeemWithSecret(eq(LEDGER), any(CallerContext.class), eq("abc"), any()))
                .thenThrow(new TransferFailedException("R", new BigDecimal("25"), "recipient endpoint unreachable"));

        mockMvc.perform(post("/api/ledgers/{ledgerId}/gift-cards/redeem", LEDGER)
                        .header(CallerContext.CALLER_HEADER, "R")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"secret\": \"wrong\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));

        mockMvc.perform(post("/api/ledgers/{ledgerId}/gift-cards/redeem", LEDGER)
                        .header(CallerContext.CALLER_HEADER, "R")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"secret\": \"abc\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("TRANSFER_FAILED"));
    }

    @Test
    @DisplayName("Cancel is routed with the caller and the commitment")
    void cancel() throws Exception {
        when(giftCardService.cancel(eq(LEDGER), any(CallerContext.class), anyString()))
                .thenReturn(card(RecordStatus.CANCELLED, "0"));

        mockMvc.perform(post("/api/ledgers/{ledgerId}/gift-cards/{commitment}/cancel", LEDGER, COMMITMENT)
                        .header(CallerContext.CALLER_HEADER, "S"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"));

        verify(giftCardService).cancel(eq(LEDGER), eq(CallerContext.of("S")), eq(COMMITMENT));
    }

    @Test
    @DisplayName("Void is routed with the owner, the commitment and the reason")
    void voidCard() throws Exception {
        when(giftCardService.voidCard(LEDGER, CallerContext.of("O"), COMMITMENT, "tamper"))
                .thenReturn(card(RecordStatus.VOIDED, "100"));

        mockMvc.perform(post("/api/ledgers/{ledgerId}/gift-cards/{commitment}/void", LEDGER, COMMITMENT)
                        .header(CallerContext.CALLER_HEADER, "O")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\": \"tamper\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("VOIDED"))
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.value").value(100));
    }

    @Test
    @DisplayName("Transfer hands the card to the named beneficiary")
    void transfer() throws Exception {
        when(giftCardService.transfer(LEDGER, CallerContext.of("B"), COMMITMENT, "C"))
                .thenReturn(card(RecordStatus.TRANSFERRED, "100"));

        mockMvc.perform(post("/api/ledgers/{ledgerId}/gift-cards/{commitment}/transfer", LEDGER, COMMITMENT)
                        .header(CallerContext.CALLER_HEADER, "B")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"new_beneficiary\": \"C\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("TRANSFERRED"));

        verify(giftCardService).transfer(LEDGER, CallerContext.of("B"), COMMITMENT, "C");
    }
}
