package com.flagship.custody_ledger.giftcard;

import com.flagship.custody_ledger.giftcard.dto.IssueGiftCardRequest;
import com.flagship.custody_ledger.giftcard.dto.RedeemGiftCardRequest;
import com.flagship.custody_ledger.identity.CallerContext;
import com.flagship.custody_ledger.record.RecordView;
import com.flagship.custody_ledger.record.dto.TransferRecordRequest;
import com.flagship.custody_ledger.record.dto.VoidRecordRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
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
@RequestMapping("/api/ledgers/{ledgerId}/gift-cards")
@RequiredArgsConstructor
public class GiftCardController {

    private final GiftCardService giftCardService;

    @PostMapping
    public ResponseEntity<RecordView> issue(
            @PathVariable("ledgerId") UUID ledgerId,
            @RequestHeader(CallerContext.CALLER_HEADER) String callerId,
            @RequestHeader(value = CallerContext.ATTACHED_VALUE_HEADER, required = false) BigDecimal attachedValue,
            @Valid @RequestBody IssueGiftCardRequest request) {
        RecordView view = giftCardService.issue(ledgerId, CallerContext.of(callerId, attachedValue),
                request.getCommitment(), request.getBeneficiary(), request.getExpiresInSeconds(),
                request.getMessage());
        return ResponseEntity.status(HttpStatus.CREATED).body(view);
    }

    @GetMapping("/{commitment}")
    public ResponseEntity<RecordView> inspect(@PathVariable("ledgerId") UUID ledgerId,
                                              @PathVariable("commitment") String commitment) {
        return ResponseEntity.ok(giftCardService.inspect(ledgerId, commitment));
    }

    @PostMapping("/redeem")
    public ResponseEntity<RecordView> redeem(
            @PathVariable("ledgerId") UUID ledgerId,
            @RequestHeader(CallerContext.CALLER_HEADER) String callerId,
            @Valid @RequestBody RedeemGiftCardRequest request) {
        return ResponseEntity.ok(giftCardService.redeemWithSecret(ledgerId, CallerContext.of(callerId),
                request.getSecret(), request.getMessage()));
    }

    @PostMapping("/{commitment}/redeem")
    public ResponseEntity<RecordView> claim(
            @PathVariable("ledgerId") UUID ledgerId,
            @PathVariable("commitment") String commitment,
            @RequestHeader(CallerContext.CALLER_HEADER) String callerId) {
        return ResponseEntity.ok(giftCardService.redeemAsBeneficiary(ledgerId, CallerContext.of(callerId),
                commitment, null));
    }

    @PostMapping("/{commitment}/cancel")
    public ResponseEntity<RecordView> cancel(
            @PathVariable("ledgerId") UUID ledgerId,
            @PathVariable("commitment") String commitment,
            @RequestHeader(CallerContext.CALLER_HEADER) String callerId) {
        return ResponseEntity.ok(giftCardService.cancel(ledgerId, CallerContext.of(callerId), commitment));
    }

    @PostMapping("/{commitment}/transfer")
    public ResponseEntity<RecordView> transfer(
            @PathVariable("ledgerId") UUID ledgerId,
            @PathVariable("commitment") String commitment,
            @RequestHeader(CallerContext.CALLER_HEADER) String callerId,
            @Valid @RequestBody TransferRecordRequest request) {
        return ResponseEntity.ok(giftCardService.transfer(ledgerId, CallerContext.of(callerId), commitment,
                request.getNewBeneficiary()));
    }

    @PostMapping("/{commitment}/void")
    public ResponseEntity<RecordView> voidCard(
            @PathVariable("ledgerId") UUID ledgerId,
            @PathVariable("commitment") String commitment,
            @RequestHeader(CallerContext.CALLER_HEADER) String callerId,
            @Valid @RequestBody VoidRecordRequest request) {
        return ResponseEntity.ok(giftCardService.voidCard(ledgerId, CallerContext.of(callerId), commitment,
                request.getReason()));
    }
}
