package com.flagship.custody_ledger.giftregistry;

import com.flagship.custody_ledger.access.AccessControlService;
import com.flagship.custody_ledger.identity.CallerContext;
import com.flagship.custody_ledger.observability.OperationObserver;
import com.flagship.custody_ledger.record.CustodyEngine;
import com.flagship.custody_ledger.record.NewRecord;
import com.flagship.custody_ledger.record.RecordKind;
import com.flagship.custody_ledger.record.RecordView;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Gift registry: the owner lists items with a price, anyone buys one by paying
 * the exact price, which goes straight to the owner.
 */
@Service
@RequiredArgsConstructor
public class GiftRegistryService {

    private final CustodyEngine engine;
    private final AccessControlService accessControl;
    private final OperationObserver observer;
    private final Clock clock;

    public RecordView addItem(UUID ledgerId, CallerContext caller, String itemId,
                              String description, BigDecimal price) {
        return observer.observe("registry.add_item", ledgerId, itemId, () -> {
            NewRecord request = NewRecord.builder()
                    .key(itemId)
                    .kind(RecordKind.REGISTRY_ITEM)
                    .beneficiary(accessControl.getLedger(ledgerId).getOwner())
                    .unitAmount(price)
                    .payload(description)
                    .build();
            return RecordView.of(engine.create(ledgerId, caller, request), clock.instant());
        });
    }

    public RecordView inspect(UUID ledgerId, String itemId) {
        return engine.inspect(ledgerId, itemId);
    }

    public List<RecordView> items(UUID ledgerId, int offset, int limit) {
        return engine.list(ledgerId, RecordKind.REGISTRY_ITEM, null, offset, limit);
    }

    public RecordView purchase(UUID ledgerId, CallerContext caller, String itemId) {
        return observer.observe("registry.purchase", ledgerId, itemId,
                () -> RecordView.of(engine.purchase(ledgerId, caller, itemId), clock.instant()));
    }

    public RecordView removeItem(UUID ledgerId, CallerContext caller, String itemId, String reason) {
        return observer.observe("registry.void_item", ledgerId, itemId,
                () -> RecordView.of(engine.voidRecord(ledgerId, caller, itemId, reason), clock.instant()));
    }
}
