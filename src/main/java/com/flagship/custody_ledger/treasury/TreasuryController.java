package com.flagship.custody_ledger.treasury;

import com.flagship.custody_ledger.identity.CallerContext;
import com.flagship.custody_ledger.record.RecordView;
import com.flagship.custody_ledger.treasury.dto.DepositRequest;
import com.flagship.custody_ledger.treasury.dto.TreasuryBalanceResponse;
import com.flagship.custody_ledger.treasury.dto.WithdrawRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.UUID;

@RestController
@RequestMapping("/api/ledgers/{ledgerId}/treasury")
@RequiredArgsConstructor
public class TreasuryController {

    private final TreasuryService treasuryService;

    @GetMapping
    public ResponseEntity<TreasuryBalanceResponse> balance(@PathVariable("ledgerId") UUID ledgerId) {
        return ResponseEntity.ok(treasuryService.balance(ledgerId));
    }

    @PostMapping("/deposits")
    public ResponseEntity<RecordView> deposit(
            @PathVariable("ledgerId") UUID ledgerId,
            @RequestHeader(CallerContext.CALLER_HEADER) String callerId,
            @RequestHeader(value = CallerContext.ATTACHED_VALUE_HEADER, required = false) BigDecimal attachedValue,
            @Valid @RequestBody(required = false) DepositRequest request) {
        String note = request != null ? request.getNote() : null;
        return ResponseEntity.ok(treasuryService.deposit(ledgerId, CallerContext.of(callerId, attachedValue), note));
    }

    @PostMapping("/withdrawals")
    public ResponseEntity<RecordView> withdraw(
            @PathVariable("ledgerId") UUID ledgerId,
            @RequestHeader(CallerContext.CALLER_HEADER) String callerId,
            @Valid @RequestBody WithdrawRequest request) {
        return ResponseEntity.ok(treasuryService.withdraw(ledgerId, CallerContext.of(callerId),
                request.getRecipient(), request.getAmount(), request.getReason()));
    }
}
