package com.flagship.custody_ledger.warranty;

import com.flagship.custody_ledger.identity.CallerContext;
import com.flagship.custody_ledger.record.RecordView;
import com.flagship.custody_ledger.record.dto.TransferRecordRequest;
import com.flagship.custody_ledger.record.dto.VoidRecordRequest;
import com.flagship.custody_ledger.warranty.dto.RegisterWarrantyRequest;
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
@RequestMapping("/api/ledgers/{ledgerId}/warranties")
@RequiredArgsConstructor
public class WarrantyController {

    private final WarrantyService warrantyService;

    @PostMapping
    public ResponseEntity<RecordView> register(
            @PathVariable("ledgerId") UUID ledgerId,
            @RequestHeader(CallerContext.CALLER_HEADER) String callerId,
            @RequestHeader(value = CallerContext.ATTACHED_VALUE_HEADER, required = false) BigDecimal attachedValue,
            @Valid @RequestBody RegisterWarrantyRequest request) {
        RecordView view = warrantyService.register(ledgerId, CallerContext.of(callerId, attachedValue),
                request.getSerialNumber(), request.getHolder(), request.getDurationDays(), request.getProductDetails());
        return ResponseEntity.status(HttpStatus.CREATED).body(view);
    }

    @GetMapping("/{serial}")
    public ResponseEntity<RecordView> inspect(@PathVariable("ledgerId") UUID ledgerId,
                                              @PathVariable("serial") String serial) {
        return ResponseEntity.ok(warrantyService.inspect(ledgerId, serial));
    }

    @PostMapping("/{serial}/transfer")
    public ResponseEntity<RecordView> transfer(
            @PathVariable("ledgerId") UUID ledgerId,
            @PathVariable("serial") String serial,
            @RequestHeader(CallerContext.CALLER_HEADER) String callerId,
            @Valid @RequestBody TransferRecordRequest request) {
        return ResponseEntity.ok(warrantyService.transfer(ledgerId, CallerContext.of(callerId), serial,
                request.getNewBeneficiary()));
    }

    @PostMapping("/{serial}/void")
    public ResponseEntity<RecordView> voidWarranty(
            @PathVariable("ledgerId") UUID ledgerId,
            @PathVariable("serial") String serial,
            @RequestHeader(CallerContext.CALLER_HEADER) String callerId,
            @Valid @RequestBody VoidRecordRequest request) {
        return ResponseEntity.ok(warrantyService.voidWarranty(ledgerId, CallerContext.of(callerId), serial,
                request.getReason()));
    }
}
