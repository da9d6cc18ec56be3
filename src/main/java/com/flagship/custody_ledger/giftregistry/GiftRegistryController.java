package com.flagship.custody_ledger.giftregistry;

import com.flagship.custody_ledger.giftregistry.dto.AddItemRequest;
import com.flagship.custody_ledger.identity.CallerContext;
import com.flagship.custody_ledger.record.RecordView;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/ledgers/{ledgerId}/items")
@RequiredArgsConstructor
public class GiftRegistryController {

    private final GiftRegistryService giftRegistryService;

    @PostMapping
    public ResponseEntity<RecordView> addItem(
            @PathVariable("ledgerId") UUID ledgerId,
            @RequestHeader(CallerContext.CALLER_HEADER) String callerId,
            @Valid @RequestBody AddItemRequest request) {
        RecordView view = giftRegistryService.addItem(ledgerId, CallerContext.of(callerId),
                request.getItemId(), request.getDescription(), request.getPrice());
        return ResponseEntity.status(HttpStatus.CREATED).body(view);
    }

    @GetMapping
    public ResponseEntity<List<RecordView>> items(
            @PathVariable("ledgerId") UUID ledgerId,
            @RequestParam(value = "offset", defaultValue = "0") int offset,
            @RequestParam(value = "limit", defaultValue = "20") int limit) {
        return ResponseEntity.ok(giftRegistryService.items(ledgerId, offset, limit));
    }

    @GetMapping("/{itemId}")
    public ResponseEntity<RecordView> inspect(@PathVariable("ledgerId") UUID ledgerId,
                                              @PathVariable("itemId") String itemId) {
        return ResponseEntity.ok(giftRegistryService.inspect(ledgerId, itemId));
    }

    @PostMapping("/{itemId}/purchase")
    public ResponseEntity<RecordView> purchase(
            @PathVariable("ledgerId") UUID ledgerId,
            @PathVariable("itemId") String itemId,
            @RequestHeader(CallerContext.CALLER_HEADER) String callerId,
            @RequestHeader(value = CallerContext.ATTACHED_VALUE_HEADER, required = false) BigDecimal attachedValue) {
        return ResponseEntity.ok(giftRegistryService.purchase(ledgerId, CallerContext.of(callerId, attachedValue), itemId));
    }

    @PostMapping("/{itemId}/void")
    public ResponseEntity<RecordView> removeItem(
            @PathVariable("ledgerId") UUID ledgerId,
            @PathVariable("itemId") String itemId,
            @RequestHeader(CallerContext.CALLER_HEADER) String callerId,
            @Valid @RequestBody VoidRecordRequest request) {
        return ResponseEntity.ok(giftRegistryService.removeItem(ledgerId, CallerContext.of(callerId), itemId,
                request.getReason()));
    }
}
